package com.lexd.compiler.tags;

import com.lexd.api.CompilerOptions.TagEncoding;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.Pattern;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.RepeatMode;
import com.lexd.api.model.SymbolHandle;
import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.FlagDiacritic;
import com.lexd.runtime.automaton.Transducer;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Emits the flag diacritics for row correlation and flag-encoded tag filters.
 *
 * <p>Row flags: entry <i>i</i> of a bound lexicon {@code L} starts with
 * {@code @U.L.i+1@}. Repetitions that must not correlate clear the row with
 * {@code @C.L@} before each iteration.
 *
 * <p>Tag flags use one feature {@code [t]} per required tag and one feature
 * {@code -[t]n} per forbidding reference <i>n</i>:
 * <ul>
 *   <li>before a filtered reference, {@code @P.[t].1@} marks a required tag as
 *       pending and {@code @P.-[t]n.1@} forbids the tag</li>
 *   <li>an entry carrying {@code t} emits {@code @D.-[t]n.1@} for every forbidding
 *       reference, then {@code @C.[t]@}, satisfying any pending requirement</li>
 *   <li>after the reference, {@code @D.[t].1@} fails when a requirement is still
 *       pending and {@code @C.-[t]n@} lifts the reference's own prohibition</li>
 * </ul>
 * A forbidding reference never encloses itself, so nested filters keep separate
 * prohibitions. Feature names carry the handle id, so lexicons, tags and
 * synthesized names never share a feature.
 */
public class FlagSynthesizer {

    private static final int SET = 1;

    private final LexdGrammar grammar;
    private final Alphabet alphabet;
    private final TagEncoding encoding;
    private final SortedSet<SymbolHandle> requiredTags = new TreeSet<>();
    private final Map<PatternElement, Integer> forbiddingSites = new LinkedHashMap<>();
    private final Map<SymbolHandle, List<String>> forbiddenFeatures = new HashMap<>();
    private final SortedSet<SymbolHandle> flaggedTags;

    public FlagSynthesizer(LexdGrammar grammar, Alphabet alphabet, TagEncoding encoding) {
        this.grammar = grammar;
        this.alphabet = alphabet;
        this.encoding = encoding;
        this.flaggedTags = Collections.unmodifiableSortedSet(collectFlaggedTags());
    }

    /**
     * Tags that some flag-encoded filter mentions; entries emit flags only for these.
     */
    public SortedSet<SymbolHandle> flaggedTags() {
        return flaggedTags;
    }

    private SortedSet<SymbolHandle> collectFlaggedTags() {
        SortedSet<SymbolHandle> tags = new TreeSet<>();
        if (encoding == TagEncoding.STATIC) {
            return tags;
        }
        for (List<Pattern> bodies : grammar.patterns().values()) {
            for (Pattern body : bodies) {
                for (PatternElement element : body.elements()) {
                    if (usesFlags(element)) {
                        register(element.withMode(RepeatMode.NORMAL));
                        tags.addAll(element.tags());
                        tags.addAll(element.negatedTags());
                    }
                }
            }
        }
        return tags;
    }

    private void register(PatternElement element) {
        requiredTags.addAll(element.tags());
        if (element.negatedTags().isEmpty() || forbiddingSites.containsKey(element)) {
            return;
        }
        int site = forbiddingSites.size() + 1;
        forbiddingSites.put(element, site);
        for (SymbolHandle tag : element.negatedTags()) {
            forbiddenFeatures.computeIfAbsent(tag, t -> new ArrayList<>()).add(forbiddenFeature(tag, site));
        }
    }

    /**
     * Whether the element's own tags are checked by flags instead of statically.
     */
    public boolean usesFlags(PatternElement element) {
        if (element.isUntagged() || grammar.isSieve(element)) {
            return false;
        }
        return switch (encoding) {
            case STATIC -> false;
            case FLAGS -> true;
            case MINIMAL_FLAGS -> grammar.isPattern(element.name());
        };
    }

    // ==================== Row correlation ====================

    public int rowLabel(SymbolHandle lexicon, int entryIndex) {
        return alphabet.flagLabel(FlagDiacritic.unify(feature(lexicon), entryIndex + 1));
    }

    public IntList clearLabels(Collection<SymbolHandle> lexicons) {
        IntList labels = new IntArrayList(lexicons.size());
        for (SymbolHandle lexicon : lexicons) {
            labels.add(alphabet.flagLabel(FlagDiacritic.clear(feature(lexicon))));
        }
        return labels;
    }

    // ==================== Tags ====================

    /**
     * Flags an entry with the given tags emits, in tag order.
     */
    public IntList entryTagLabels(Set<SymbolHandle> segmentTags) {
        IntList labels = new IntArrayList();
        for (SymbolHandle tag : flaggedTags) {
            if (!segmentTags.contains(tag)) {
                continue;
            }
            for (String forbidden : forbiddenFeatures.getOrDefault(tag, List.of())) {
                labels.add(alphabet.flagLabel(FlagDiacritic.disallow(forbidden, SET)));
            }
            if (requiredTags.contains(tag)) {
                labels.add(alphabet.flagLabel(FlagDiacritic.clear(tagFeature(tag))));
            }
        }
        return labels;
    }

    public IntList preTagLabels(PatternElement element) {
        IntList labels = new IntArrayList();
        for (SymbolHandle tag : element.tags()) {
            labels.add(alphabet.flagLabel(FlagDiacritic.positive(tagFeature(tag), SET)));
        }
        for (SymbolHandle tag : element.negatedTags()) {
            labels.add(alphabet.flagLabel(FlagDiacritic.positive(forbiddenFeature(tag, site(element)), SET)));
        }
        return labels;
    }

    public IntList postTagLabels(PatternElement element) {
        IntList labels = new IntArrayList();
        for (SymbolHandle tag : element.tags()) {
            labels.add(alphabet.flagLabel(FlagDiacritic.disallow(tagFeature(tag), SET)));
        }
        for (SymbolHandle tag : element.negatedTags()) {
            labels.add(alphabet.flagLabel(FlagDiacritic.clear(forbiddenFeature(tag, site(element)))));
        }
        return labels;
    }

    private int site(PatternElement element) {
        Integer site = forbiddingSites.get(element.withMode(RepeatMode.NORMAL));
        if (site == null) {
            throw new IllegalStateException("Element " + grammar.describe(element)
                    + " does not appear in any pattern body");
        }
        return site;
    }

    /**
     * Surrounds the fragment of the untagged element with the element's tag flags.
     */
    public Transducer wrapWithTags(PatternElement element, Transducer untagged) {
        Transducer wrapped = new Transducer();
        int state = wrapped.insertPath(wrapped.initial(), preTagLabels(element));
        state = wrapped.insertTransducer(state, untagged);
        state = wrapped.insertPath(state, postTagLabels(element));
        wrapped.setFinal(state);
        return wrapped;
    }

    /**
     * Prefixes a fragment with a fixed label sequence.
     */
    public static Transducer prefixed(IntList labels, Transducer fragment) {
        Transducer result = new Transducer();
        int state = result.insertPath(result.initial(), labels);
        result.setFinal(result.insertTransducer(state, fragment));
        return result;
    }

    /**
     * Feature of a lexicon's row flags, e.g. {@code Noun#5}.
     */
    public String feature(SymbolHandle lexicon) {
        return displayName(lexicon);
    }

    /**
     * Feature of a required tag, e.g. {@code [adj#9]}.
     */
    public String tagFeature(SymbolHandle tag) {
        return "[" + displayName(tag) + "]";
    }

    private String forbiddenFeature(SymbolHandle tag, int site) {
        return "-" + tagFeature(tag) + site;
    }

    private String displayName(SymbolHandle handle) {
        return grammar.name(handle).replace('@', '_') + "#" + handle.id();
    }
}
