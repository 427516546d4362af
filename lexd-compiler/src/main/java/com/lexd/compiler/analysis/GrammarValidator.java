package com.lexd.compiler.analysis;

import com.lexd.api.CompilationException;
import com.lexd.api.CompilerOptions;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.Lexicon;
import com.lexd.api.model.Pattern;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.SymbolHandle;
import com.lexd.api.model.Token;
import com.lexd.compiler.tags.TagDistributor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks a grammar before anything is built.
 *
 * <p>Validation runs in this order:
 * <ol>
 *   <li>Resolve the root patterns (REFERENCE).</li>
 *   <li>Check every element of every pattern: names resolve (REFERENCE); pattern
 *       references are symmetric and use column 1, lexicon columns exist, collated
 *       lexicons have equal sizes, tags do not conflict (SHAPE).</li>
 *   <li>Reject patterns that refer to themselves (SHAPE).</li>
 *   <li>Every element of a reachable pattern can match something (EMPTINESS).</li>
 * </ol>
 * Unreachable patterns and sieves that have no effect are only logged.
 */
public class GrammarValidator {
    private static final Logger logger = Logger.getLogger(GrammarValidator.class.getName());

    private final LexdGrammar grammar;
    private final CompilerOptions options;
    private final TagDistributor tagDistributor;
    private final FreedomAnalyzer freedomAnalyzer;

    public GrammarValidator(LexdGrammar grammar, CompilerOptions options,
                            TagDistributor tagDistributor, FreedomAnalyzer freedomAnalyzer) {
        this.grammar = grammar;
        this.options = options;
        this.tagDistributor = tagDistributor;
        this.freedomAnalyzer = freedomAnalyzer;
    }

    /**
     * Validates the grammar.
     *
     * @return the root patterns
     * @throws CompilationException on the first problem found
     */
    public List<SymbolHandle> validate() {
        List<SymbolHandle> roots = resolveRoots();
        for (Map.Entry<SymbolHandle, List<Pattern>> entry : grammar.patterns().entrySet()) {
            for (Pattern body : entry.getValue()) {
                checkBody(body);
            }
        }
        checkCycles();

        Set<SymbolHandle> reachable = freedomAnalyzer.reachablePatterns(roots);
        for (SymbolHandle pattern : reachable) {
            for (Pattern body : grammar.patternBodies(pattern)) {
                checkEmptiness(body);
            }
        }
        for (SymbolHandle pattern : grammar.patterns().keySet()) {
            if (!reachable.contains(pattern)) {
                logger.warning("Pattern " + grammar.name(pattern) + " is not reachable from the root patterns");
            }
        }
        return roots;
    }

    /**
     * The explicit root patterns from the options, or the unnamed root pattern.
     */
    public List<SymbolHandle> resolveRoots() {
        List<SymbolHandle> roots = new ArrayList<>();
        if (options.rootPatterns().isEmpty()) {
            if (!grammar.isPattern(grammar.rootHandle())) {
                throw CompilationException.reference(-1, "No root pattern defined");
            }
            roots.add(grammar.rootHandle());
            return roots;
        }
        for (String name : options.rootPatterns()) {
            SymbolHandle handle = grammar.interner().lookup(name);
            if (!grammar.isPattern(handle)) {
                throw CompilationException.reference(-1, "Root pattern " + name + " is not defined");
            }
            roots.add(handle);
        }
        return roots;
    }

    private void checkBody(Pattern body) {
        List<PatternElement> elements = body.elements();
        for (int i = 0; i < elements.size(); i++) {
            PatternElement element = elements.get(i);
            if (grammar.isSieve(element)) {
                checkSieve(body, element, i);
                continue;
            }
            checkResolved(body, element.left());
            checkResolved(body, element.right());

            if (grammar.isPattern(element.name())) {
                if (!element.isSymmetric()) {
                    throw CompilationException.shape(body.lineNumber(),
                            "Pattern " + grammar.name(element.name()) + " cannot be referenced by one side");
                }
                if (element.left().column() != 1) {
                    throw CompilationException.shape(body.lineNumber(),
                            "Pattern " + grammar.name(element.name()) + " has no column "
                                    + element.left().column());
                }
            } else {
                checkColumn(body, element.left());
                checkColumn(body, element.right());
                if (element.isCollated()) {
                    checkCollation(body, element);
                }
            }
            if (element.hasTagConflict()) {
                throw CompilationException.shape(body.lineNumber(),
                        "Element " + grammar.describe(element) + " both requires and forbids a tag");
            }
        }
    }

    private void checkSieve(Pattern body, PatternElement element, int position) {
        boolean atStart = position == 0;
        boolean atEnd = position == body.elements().size() - 1;
        if ((grammar.isLeftSieve(element) && atStart) || (grammar.isRightSieve(element) && atEnd)) {
            logger.warning("Line " + body.lineNumber() + ": sieve " + grammar.describe(element)
                    + " at the edge of a pattern has no effect");
        }
    }

    private void checkResolved(Pattern body, Token token) {
        if (token.isEmpty()) {
            return;
        }
        if (!grammar.isLexicon(token.name()) && !grammar.isPattern(token.name())) {
            throw CompilationException.reference(body.lineNumber(),
                    "Lexicon or pattern " + grammar.name(token.name()) + " is not defined");
        }
        if (grammar.isPattern(token.name()) && token.name().equals(grammar.rootHandle())) {
            throw CompilationException.shape(body.lineNumber(), "The root pattern cannot be referenced");
        }
    }

    private void checkColumn(Pattern body, Token token) {
        if (token.isEmpty()) {
            return;
        }
        if (grammar.isPattern(token.name())) {
            throw CompilationException.shape(body.lineNumber(),
                    "Pattern " + grammar.name(token.name()) + " cannot be collated with a lexicon");
        }
        Lexicon lexicon = grammar.lexicon(token.name());
        if (token.column() < 1 || token.column() > lexicon.columnCount()) {
            throw CompilationException.shape(body.lineNumber(), "Lexicon " + grammar.name(token.name())
                    + " has " + lexicon.columnCount() + " columns, cannot use column " + token.column());
        }
    }

    private void checkCollation(Pattern body, PatternElement element) {
        Lexicon left = grammar.lexicon(element.left().name());
        Lexicon right = grammar.lexicon(element.right().name());
        if (left.size() != right.size()) {
            throw CompilationException.shape(body.lineNumber(), "Cannot collate "
                    + grammar.name(left.name()) + " (" + left.size() + " entries) with "
                    + grammar.name(right.name()) + " (" + right.size() + " entries)");
        }
    }

    private void checkCycles() {
        Set<SymbolHandle> done = new HashSet<>();
        for (SymbolHandle pattern : grammar.patterns().keySet()) {
            visit(pattern, new HashSet<>(), done);
        }
    }

    private void visit(SymbolHandle pattern, Set<SymbolHandle> path, Set<SymbolHandle> done) {
        if (done.contains(pattern)) {
            return;
        }
        path.add(pattern);
        for (Pattern body : grammar.patternBodies(pattern)) {
            for (PatternElement element : body.elements()) {
                SymbolHandle name = element.name();
                if (!grammar.isPattern(name)) {
                    continue;
                }
                if (path.contains(name)) {
                    throw CompilationException.shape(body.lineNumber(),
                            "Pattern " + grammar.name(name) + " refers to itself");
                }
                visit(name, path, done);
            }
        }
        path.remove(pattern);
        done.add(pattern);
    }

    private void checkEmptiness(Pattern body) {
        for (PatternElement element : body.elements()) {
            if (grammar.isSieve(element)) {
                continue;
            }
            if (grammar.isLexicon(element.name()) && grammar.entryCount(element) == 0) {
                throw CompilationException.emptiness(body.lineNumber(),
                        "Lexicon " + grammar.name(element.name()) + " is empty");
            }
            if (!tagDistributor.canMatch(element)) {
                throw CompilationException.emptiness(body.lineNumber(),
                        grammar.describe(element) + " cannot match anything");
            }
        }
    }
}
