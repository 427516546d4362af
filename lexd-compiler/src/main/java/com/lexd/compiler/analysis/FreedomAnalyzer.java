package com.lexd.compiler.analysis;

import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.Pattern;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.SymbolHandle;
import com.lexd.api.model.Token;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Classifies lexicons as free or bound.
 *
 * <p>A lexicon is bound when some pattern body reachable from the roots has two or
 * more elements that reach it, directly or through nested pattern references. Every
 * reference to a bound lexicon must then select the same entry, which the builders
 * enforce with row flags. Free lexicons need no flags at all.
 */
public class FreedomAnalyzer {
    private static final Logger logger = Logger.getLogger(FreedomAnalyzer.class.getName());

    private final LexdGrammar grammar;
    private final Map<SymbolHandle, Set<SymbolHandle>> patternReach = new HashMap<>();

    public FreedomAnalyzer(LexdGrammar grammar) {
        this.grammar = grammar;
    }

    /**
     * Patterns reachable from the roots, roots included, in discovery order.
     */
    public Set<SymbolHandle> reachablePatterns(Collection<SymbolHandle> roots) {
        Set<SymbolHandle> reached = new LinkedHashSet<>();
        Deque<SymbolHandle> stack = new ArrayDeque<>();
        for (SymbolHandle root : roots) {
            if (grammar.isPattern(root) && reached.add(root)) {
                stack.push(root);
            }
        }
        while (!stack.isEmpty()) {
            SymbolHandle current = stack.pop();
            for (Pattern body : grammar.patternBodies(current)) {
                for (PatternElement element : body.elements()) {
                    SymbolHandle name = element.name();
                    if (grammar.isPattern(name) && reached.add(name)) {
                        stack.push(name);
                    }
                }
            }
        }
        return reached;
    }

    /**
     * Lexicons an element can select entries from, including through nested patterns.
     */
    public Set<SymbolHandle> reach(PatternElement element) {
        if (grammar.isSieve(element)) {
            return Set.of();
        }
        Set<SymbolHandle> lexicons = new TreeSet<>();
        addReach(element.left(), lexicons);
        addReach(element.right(), lexicons);
        return lexicons;
    }

    private void addReach(Token token, Set<SymbolHandle> into) {
        if (token.isEmpty()) {
            return;
        }
        if (grammar.isLexicon(token.name())) {
            into.add(token.name());
        } else if (grammar.isPattern(token.name())) {
            into.addAll(patternReach(token.name()));
        }
    }

    private Set<SymbolHandle> patternReach(SymbolHandle pattern) {
        Set<SymbolHandle> cached = patternReach.get(pattern);
        if (cached != null) {
            return cached;
        }
        // Placeholder stops recursion on cyclic grammars; cycles are reported by validation.
        patternReach.put(pattern, Set.of());
        Set<SymbolHandle> lexicons = new TreeSet<>();
        for (Pattern body : grammar.patternBodies(pattern)) {
            for (PatternElement element : body.elements()) {
                lexicons.addAll(reach(element));
            }
        }
        Set<SymbolHandle> result = Collections.unmodifiableSet(lexicons);
        patternReach.put(pattern, result);
        return result;
    }

    /**
     * Computes the freedom of every lexicon reachable from the roots.
     *
     * @return lexicon to {@code true} (free) or {@code false} (bound)
     */
    public Map<SymbolHandle, Boolean> analyze(Collection<SymbolHandle> roots) {
        Map<SymbolHandle, Boolean> freedom = new LinkedHashMap<>();
        for (SymbolHandle pattern : reachablePatterns(roots)) {
            for (Pattern body : grammar.patternBodies(pattern)) {
                Map<SymbolHandle, Integer> mentions = new HashMap<>();
                for (PatternElement element : body.elements()) {
                    for (SymbolHandle lexicon : reach(element)) {
                        mentions.merge(lexicon, 1, Integer::sum);
                    }
                }
                mentions.forEach((lexicon, count) -> {
                    if (count > 1) {
                        freedom.put(lexicon, false);
                    } else {
                        freedom.putIfAbsent(lexicon, true);
                    }
                });
            }
        }
        long bound = freedom.values().stream().filter(free -> !free).count();
        logger.fine(() -> String.format("Freedom analysis: %d lexicons, %d bound", freedom.size(), bound));
        return freedom;
    }

    /**
     * For each reachable pattern, the lexicons that an enclosing body mentions beside
     * the reference leading to the pattern. Rows of these lexicons are bound around
     * the pattern, so repetitions inside it must keep them.
     */
    public Map<SymbolHandle, Set<SymbolHandle>> heldAround(Collection<SymbolHandle> roots) {
        Map<SymbolHandle, Set<SymbolHandle>> held = new HashMap<>();
        for (SymbolHandle pattern : reachablePatterns(roots)) {
            for (Pattern body : grammar.patternBodies(pattern)) {
                List<PatternElement> elements = body.elements();
                for (int i = 0; i < elements.size(); i++) {
                    SymbolHandle name = elements.get(i).name();
                    if (!grammar.isPattern(name)) {
                        continue;
                    }
                    Set<SymbolHandle> around = new TreeSet<>();
                    for (int j = 0; j < elements.size(); j++) {
                        if (j != i) {
                            around.addAll(reach(elements.get(j)));
                        }
                    }
                    if (around.isEmpty()) {
                        continue;
                    }
                    for (SymbolHandle inner : reachablePatterns(List.of(name))) {
                        held.computeIfAbsent(inner, p -> new TreeSet<>()).addAll(around);
                    }
                }
            }
        }
        return held;
    }
}
