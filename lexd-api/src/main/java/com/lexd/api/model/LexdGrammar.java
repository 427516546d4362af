package com.lexd.api.model;

import com.lexd.api.CompilationException;
import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.TransitionSymbol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An already-parsed lexd grammar: lexicons, patterns and the names they use.
 *
 * <p>Built once through {@link Builder}, which enforces column counts and name kinds
 * as entries arrive, then frozen. Cross references are checked by the compiler.
 */
public final class LexdGrammar {

    /** Reserved name of the unnamed root pattern. */
    public static final String ROOT_PATTERN = " ";
    /** Reserved element name of a left sieve. */
    public static final String LEFT_SIEVE = "<";
    /** Reserved element name of a right sieve. */
    public static final String RIGHT_SIEVE = ">";

    private final SymbolInterner interner;
    private final Alphabet alphabet;
    private final Map<SymbolHandle, Lexicon> lexicons;
    private final Map<SymbolHandle, List<Pattern>> patterns;
    private final SymbolHandle rootHandle;
    private final SymbolHandle leftSieveHandle;
    private final SymbolHandle rightSieveHandle;

    private LexdGrammar(Builder builder, Map<SymbolHandle, Lexicon> lexicons,
                        Map<SymbolHandle, List<Pattern>> patterns) {
        this.interner = builder.interner;
        this.alphabet = builder.alphabet;
        this.lexicons = Collections.unmodifiableMap(lexicons);
        this.patterns = Collections.unmodifiableMap(patterns);
        this.rootHandle = builder.rootHandle;
        this.leftSieveHandle = builder.leftSieveHandle;
        this.rightSieveHandle = builder.rightSieveHandle;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SymbolInterner interner() {
        return interner;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public Map<SymbolHandle, Lexicon> lexicons() {
        return lexicons;
    }

    public Map<SymbolHandle, List<Pattern>> patterns() {
        return patterns;
    }

    public boolean isLexicon(SymbolHandle name) {
        return lexicons.containsKey(name);
    }

    public boolean isPattern(SymbolHandle name) {
        return patterns.containsKey(name);
    }

    public Lexicon lexicon(SymbolHandle name) {
        return lexicons.get(name);
    }

    /**
     * Alternative bodies of a pattern, in declaration order; empty if undeclared.
     */
    public List<Pattern> patternBodies(SymbolHandle name) {
        return patterns.getOrDefault(name, List.of());
    }

    /**
     * Number of entries an element can select from. Both sides of a collated
     * element are checked to have equal counts before building.
     */
    public int entryCount(PatternElement element) {
        int count = Integer.MAX_VALUE;
        if (!element.left().isEmpty()) {
            count = lexicon(element.left().name()).size();
        }
        if (!element.right().isEmpty()) {
            count = Math.min(count, lexicon(element.right().name()).size());
        }
        return count;
    }

    /**
     * The segment an element selects from entry {@code entryIndex}: the left side of
     * the left token's column, the right side of the right token's column, and the
     * tags of both columns.
     */
    public LexiconSegment effectiveSegment(PatternElement element, int entryIndex) {
        List<TransitionSymbol> left = List.of();
        List<TransitionSymbol> right = List.of();
        SortedSet<SymbolHandle> tags = new TreeSet<>();
        if (!element.left().isEmpty()) {
            LexiconSegment segment = lexicon(element.left().name()).entry(entryIndex)
                    .segment(element.left().column());
            left = segment.left();
            tags.addAll(segment.tags());
        }
        if (!element.right().isEmpty()) {
            LexiconSegment segment = lexicon(element.right().name()).entry(entryIndex)
                    .segment(element.right().column());
            right = segment.right();
            tags.addAll(segment.tags());
        }
        return new LexiconSegment(left, right, tags);
    }

    public SymbolHandle rootHandle() {
        return rootHandle;
    }

    public boolean isLeftSieve(PatternElement element) {
        return element.name().equals(leftSieveHandle);
    }

    public boolean isRightSieve(PatternElement element) {
        return element.name().equals(rightSieveHandle);
    }

    public boolean isSieve(PatternElement element) {
        return isLeftSieve(element) || isRightSieve(element);
    }

    /**
     * Display name of a handle; the root pattern shows as {@code <root>}.
     */
    public String name(SymbolHandle handle) {
        if (handle.equals(rootHandle)) {
            return "<root>";
        }
        return interner.resolve(handle).trim();
    }

    /**
     * Source-like rendering of an element for diagnostics, e.g. {@code Noun(2)[adj,-pl]*}.
     */
    public String describe(PatternElement element) {
        StringBuilder sb = new StringBuilder();
        if (element.isSymmetric()) {
            sb.append(describe(element.left()));
        } else {
            if (!element.left().isEmpty()) {
                sb.append(describe(element.left()));
            }
            sb.append(':');
            if (!element.right().isEmpty()) {
                sb.append(describe(element.right()));
            }
        }
        if (!element.isUntagged()) {
            List<String> parts = new ArrayList<>();
            element.tags().forEach(t -> parts.add(name(t)));
            element.negatedTags().forEach(t -> parts.add("-" + name(t)));
            sb.append('[').append(String.join(",", parts)).append(']');
        }
        return sb.append(element.mode().symbol()).toString();
    }

    private String describe(Token token) {
        String name = name(token.name());
        return token.column() == 1 ? name : name + "(" + token.column() + ")";
    }

    // ==================== Builder ====================

    /**
     * Collects lexicon entries and pattern bodies.
     *
     * <p>Lexicon columns are fixed by {@link #declareLexicon} or by the first entry;
     * every later entry must match. A name is either a lexicon or a pattern.
     */
    public static final class Builder {
        private final SymbolInterner interner = new SymbolInterner();
        private final Alphabet alphabet = new Alphabet();
        private final SymbolHandle rootHandle;
        private final SymbolHandle leftSieveHandle;
        private final SymbolHandle rightSieveHandle;

        private final Map<SymbolHandle, List<LexiconEntry>> lexiconEntries = new LinkedHashMap<>();
        private final Map<SymbolHandle, Integer> lexiconColumns = new LinkedHashMap<>();
        private final Map<SymbolHandle, Integer> lexiconLines = new LinkedHashMap<>();
        private final Map<SymbolHandle, List<Pattern>> patterns = new LinkedHashMap<>();

        private Builder() {
            rootHandle = interner.intern(ROOT_PATTERN);
            leftSieveHandle = interner.intern(LEFT_SIEVE);
            rightSieveHandle = interner.intern(RIGHT_SIEVE);
        }

        public SymbolInterner interner() {
            return interner;
        }

        public Alphabet alphabet() {
            return alphabet;
        }

        // ---------- lexicons ----------

        public LexiconSegment segment(String left, String right, Collection<String> tags) {
            List<TransitionSymbol> l = alphabet.tokenize(left);
            List<TransitionSymbol> r = alphabet.tokenize(right);
            return new LexiconSegment(l, r, tags(tags));
        }

        public LexiconSegment segment(String left, String right, String... tags) {
            return segment(left, right, Arrays.asList(tags));
        }

        /**
         * A segment with the same text on both sides.
         */
        public LexiconSegment identity(String text, String... tags) {
            return segment(text, text, tags);
        }

        /**
         * Fixes a lexicon's column count before (or without) any entries.
         */
        public Builder declareLexicon(String name, int line, int columns) {
            if (columns < 1) {
                throw CompilationException.shape(line, "Lexicon " + name + " must have at least one column");
            }
            SymbolHandle handle = lexiconHandle(name, line);
            Integer existing = lexiconColumns.get(handle);
            if (existing != null && existing != columns) {
                throw CompilationException.shape(line, "Lexicon " + name + " has " + existing
                        + " columns, cannot redeclare with " + columns);
            }
            lexiconColumns.put(handle, columns);
            lexiconLines.putIfAbsent(handle, line);
            lexiconEntries.computeIfAbsent(handle, h -> new ArrayList<>());
            return this;
        }

        public Builder addEntry(String lexicon, int line, LexiconSegment... segments) {
            return addEntry(lexicon, line, Arrays.asList(segments));
        }

        /**
         * Appends an entry; repeated declarations of a lexicon merge.
         *
         * @throws CompilationException of kind SHAPE if the column count differs
         */
        public Builder addEntry(String lexicon, int line, List<LexiconSegment> segments) {
            SymbolHandle handle = lexiconHandle(lexicon, line);
            addEntry(handle, lexicon, line, segments);
            return this;
        }

        private void addEntry(SymbolHandle handle, String lexicon, int line, List<LexiconSegment> segments) {
            if (segments.isEmpty()) {
                throw CompilationException.shape(line, "Entry of lexicon " + lexicon.trim() + " has no columns");
            }
            Integer columns = lexiconColumns.putIfAbsent(handle, segments.size());
            if (columns != null && columns != segments.size()) {
                throw CompilationException.shape(line, "Lexicon " + lexicon.trim() + " has " + columns
                        + " columns but entry has " + segments.size());
            }
            lexiconLines.putIfAbsent(handle, line);
            lexiconEntries.computeIfAbsent(handle, h -> new ArrayList<>()).add(new LexiconEntry(segments));
        }

        /**
         * Declares an inline lexicon and returns its synthesized name.
         */
        public String anonymousLexicon(int line, List<List<LexiconSegment>> entries) {
            SymbolHandle handle = interner.internAnonymous("lexicon");
            String name = interner.resolve(handle);
            if (entries.isEmpty()) {
                throw CompilationException.shape(line, "Inline lexicon has no entries");
            }
            for (List<LexiconSegment> entry : entries) {
                addEntry(handle, name, line, entry);
            }
            return name;
        }

        private SymbolHandle lexiconHandle(String name, int line) {
            checkUserName(name, line);
            SymbolHandle handle = interner.intern(name);
            if (patterns.containsKey(handle)) {
                throw CompilationException.shape(line, "Name " + name + " is already a pattern");
            }
            return handle;
        }

        // ---------- pattern elements ----------

        public SortedSet<SymbolHandle> tags(Collection<String> names) {
            SortedSet<SymbolHandle> handles = new TreeSet<>();
            for (String name : names) {
                handles.add(interner.intern(name));
            }
            return handles;
        }

        public Token token(String name, int column) {
            return new Token(interner.intern(name), column);
        }

        public PatternElement ref(String name) {
            return ref(name, 1);
        }

        public PatternElement ref(String name, int column) {
            return PatternElement.of(token(name, column));
        }

        public PatternElement ref(String name, int column, RepeatMode mode,
                                  Collection<String> tags, Collection<String> negatedTags) {
            Token token = token(name, column);
            return new PatternElement(token, token, mode, tags(tags), tags(negatedTags));
        }

        /** {@code name(column):} - the left side only. */
        public PatternElement leftOnly(String name, int column) {
            return new PatternElement(token(name, column), Token.EMPTY, RepeatMode.NORMAL,
                    new TreeSet<>(), new TreeSet<>());
        }

        /** {@code :name(column)} - the right side only. */
        public PatternElement rightOnly(String name, int column) {
            return new PatternElement(Token.EMPTY, token(name, column), RepeatMode.NORMAL,
                    new TreeSet<>(), new TreeSet<>());
        }

        /** {@code left(leftColumn):right(rightColumn)} - entries paired by index. */
        public PatternElement collate(String leftName, int leftColumn, String rightName, int rightColumn) {
            return new PatternElement(token(leftName, leftColumn), token(rightName, rightColumn),
                    RepeatMode.NORMAL, new TreeSet<>(), new TreeSet<>());
        }

        public PatternElement leftSieve() {
            return PatternElement.of(new Token(leftSieveHandle, 1));
        }

        public PatternElement rightSieve() {
            return PatternElement.of(new Token(rightSieveHandle, 1));
        }

        // ---------- patterns ----------

        public Builder addPattern(String name, int line, PatternElement... elements) {
            return addPattern(name, line, Arrays.asList(elements));
        }

        /**
         * Adds one alternative body. A {@code null} name adds a body of the root pattern.
         */
        public Builder addPattern(String name, int line, List<PatternElement> elements) {
            SymbolHandle handle;
            if (name == null || name.equals(ROOT_PATTERN)) {
                handle = rootHandle;
            } else {
                checkUserName(name, line);
                handle = interner.intern(name);
            }
            addBody(handle, name == null ? ROOT_PATTERN : name, line, elements);
            return this;
        }

        public Builder addRootPattern(int line, PatternElement... elements) {
            return addPattern(null, line, Arrays.asList(elements));
        }

        /**
         * Declares an inline pattern with the given alternative bodies and returns its name.
         */
        public String anonymousPattern(int line, List<List<PatternElement>> bodies) {
            if (bodies.isEmpty()) {
                throw CompilationException.shape(line, "Inline pattern has no alternatives");
            }
            SymbolHandle handle = interner.internAnonymous("pattern");
            String name = interner.resolve(handle);
            for (List<PatternElement> body : bodies) {
                addBody(handle, name, line, body);
            }
            return name;
        }

        private void addBody(SymbolHandle handle, String name, int line, List<PatternElement> elements) {
            if (lexiconEntries.containsKey(handle)) {
                throw CompilationException.shape(line, "Name " + name.trim() + " is already a lexicon");
            }
            patterns.computeIfAbsent(handle, h -> new ArrayList<>()).add(new Pattern(handle, line, elements));
        }

        private void checkUserName(String name, int line) {
            if (name == null || name.isBlank()) {
                throw CompilationException.shape(line, "Missing name");
            }
            if (name.equals(LEFT_SIEVE) || name.equals(RIGHT_SIEVE)) {
                throw CompilationException.shape(line, "Name " + name + " is reserved");
            }
        }

        public LexdGrammar build() {
            Map<SymbolHandle, Lexicon> lexicons = new LinkedHashMap<>();
            lexiconEntries.forEach((handle, entries) -> lexicons.put(handle, new Lexicon(
                    handle, lexiconLines.get(handle), lexiconColumns.get(handle), entries)));
            Map<SymbolHandle, List<Pattern>> frozen = new LinkedHashMap<>();
            patterns.forEach((handle, bodies) -> frozen.put(handle, List.copyOf(bodies)));
            return new LexdGrammar(this, lexicons, frozen);
        }
    }
}
