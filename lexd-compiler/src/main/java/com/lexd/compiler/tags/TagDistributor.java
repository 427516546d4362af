package com.lexd.compiler.tags;

import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.Pattern;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.RepeatMode;
import com.lexd.api.model.SymbolHandle;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static tag filtering.
 *
 * <p>A tag filter on a pattern reference holds when no selected segment carries a
 * forbidden tag and, for each required tag, some selected segment carries it. The
 * filter is pushed into the body: forbidden tags go to every element, and each
 * required tag goes to one element, trying every choice. Derived bodies that cannot
 * match are dropped.
 *
 * <p>An optional element given required tags must be present, so {@code X?[t]}
 * becomes {@code X[t]}. A repeated element needs the tags on some iteration only:
 * {@code X*} and {@code X+} given {@code t} become {@code X* X[t] X*}. Several
 * tags on one repeated element may sit on one iteration or on different ones, so
 * every ordered grouping of them is derived.
 */
public class TagDistributor {

    private final LexdGrammar grammar;
    private final Map<PatternElement, Boolean> matchable = new HashMap<>();

    public TagDistributor(LexdGrammar grammar) {
        this.grammar = grammar;
    }

    /**
     * Whether some entry (or, for a pattern reference, some derived body) satisfies
     * the element's tags. Repetition is ignored: the element is checked as if it had
     * to match once. Sieves always match.
     */
    public boolean canMatch(PatternElement element) {
        if (grammar.isSieve(element)) {
            return true;
        }
        PatternElement key = element.withMode(RepeatMode.NORMAL);
        Boolean cached = matchable.get(key);
        if (cached != null) {
            return cached;
        }
        // Optimistic placeholder so cyclic references terminate; cycles are reported elsewhere.
        matchable.put(key, Boolean.TRUE);
        boolean result = computeCanMatch(key);
        matchable.put(key, result);
        return result;
    }

    private boolean computeCanMatch(PatternElement element) {
        if (element.hasTagConflict()) {
            return false;
        }
        SymbolHandle name = element.name();
        if (grammar.isLexicon(name)) {
            int count = grammar.entryCount(element);
            for (int i = 0; i < count; i++) {
                if (element.compatible(grammar.effectiveSegment(element, i))) {
                    return true;
                }
            }
            return false;
        }
        if (grammar.isPattern(name)) {
            for (Pattern body : grammar.patternBodies(name)) {
                if (!distribute(element, body).isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Derives the bodies to build for one body of a referenced pattern.
     *
     * @param reference the pattern reference, whose tags are pushed down
     * @param body      one alternative body of the referenced pattern
     * @return derived element lists, empty if the body cannot satisfy the tags
     */
    public List<List<PatternElement>> distribute(PatternElement reference, Pattern body) {
        List<PatternElement> elements = body.elements();
        IntList positions = new IntArrayList();
        List<PatternElement> base = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            PatternElement element = elements.get(i);
            if (grammar.isSieve(element)) {
                base.add(element);
            } else {
                base.add(element.addNegatedTags(reference.negatedTags()));
                positions.add(i);
            }
        }

        List<SymbolHandle> required = new ArrayList<>(reference.tags());
        Set<List<PatternElement>> derived = new LinkedHashSet<>();
        assign(base, positions, required, new int[required.size()], 0, derived);

        List<List<PatternElement>> result = new ArrayList<>();
        for (List<PatternElement> candidate : derived) {
            List<PatternElement> pruned = prune(candidate);
            if (pruned != null) {
                result.add(pruned);
            }
        }
        return result;
    }

    private void assign(List<PatternElement> base, IntList positions, List<SymbolHandle> required,
                        int[] chosen, int next, Set<List<PatternElement>> out) {
        if (next == required.size()) {
            expand(base, assignedTags(positions, required, chosen), 0, new ArrayList<>(), out);
            return;
        }
        for (int i = 0; i < positions.size(); i++) {
            chosen[next] = positions.getInt(i);
            assign(base, positions, required, chosen, next + 1, out);
        }
    }

    private static Map<Integer, List<SymbolHandle>> assignedTags(IntList positions, List<SymbolHandle> required,
                                                                 int[] chosen) {
        Map<Integer, List<SymbolHandle>> byPosition = new HashMap<>();
        for (int i = 0; i < required.size(); i++) {
            byPosition.computeIfAbsent(chosen[i], p -> new ArrayList<>()).add(required.get(i));
        }
        return byPosition;
    }

    private void expand(List<PatternElement> base, Map<Integer, List<SymbolHandle>> byPosition, int position,
                        List<PatternElement> current, Set<List<PatternElement>> out) {
        if (position == base.size()) {
            out.add(List.copyOf(current));
            return;
        }
        PatternElement element = base.get(position);
        List<SymbolHandle> tags = byPosition.get(position);
        for (List<PatternElement> replacement : replacements(element, tags)) {
            int size = current.size();
            current.addAll(replacement);
            expand(base, byPosition, position + 1, current, out);
            current.subList(size, current.size()).clear();
        }
    }

    /**
     * Element sequences that select a segment carrying every given tag.
     */
    private List<List<PatternElement>> replacements(PatternElement element, List<SymbolHandle> tags) {
        if (tags == null) {
            return List.of(List.of(element));
        }
        if (!element.mode().mayRepeat()) {
            return List.of(List.of(element.addTags(tags).withMode(RepeatMode.NORMAL)));
        }
        PatternElement any = element.withMode(RepeatMode.STAR);
        List<List<PatternElement>> result = new ArrayList<>();
        for (List<List<SymbolHandle>> grouping : orderedGroupings(tags)) {
            List<PatternElement> sequence = new ArrayList<>();
            sequence.add(any);
            for (List<SymbolHandle> group : grouping) {
                sequence.add(element.addTags(group).withMode(RepeatMode.NORMAL));
                sequence.add(any);
            }
            result.add(sequence);
        }
        return result;
    }

    /**
     * Every split of the tags into an ordered list of non-empty groups.
     */
    static List<List<List<SymbolHandle>>> orderedGroupings(List<SymbolHandle> tags) {
        List<List<List<SymbolHandle>>> result = new ArrayList<>();
        if (tags.isEmpty()) {
            result.add(List.of());
            return result;
        }
        int all = (1 << tags.size()) - 1;
        for (int first = all; first > 0; first = (first - 1) & all) {
            List<SymbolHandle> group = new ArrayList<>();
            List<SymbolHandle> rest = new ArrayList<>();
            for (int i = 0; i < tags.size(); i++) {
                ((first & (1 << i)) != 0 ? group : rest).add(tags.get(i));
            }
            for (List<List<SymbolHandle>> tail : orderedGroupings(rest)) {
                List<List<SymbolHandle>> grouping = new ArrayList<>();
                grouping.add(group);
                grouping.addAll(tail);
                result.add(grouping);
            }
        }
        return result;
    }

    /**
     * Drops elements that cannot match but may be absent.
     *
     * @return the pruned body, or {@code null} if a required element cannot match
     */
    private List<PatternElement> prune(List<PatternElement> body) {
        List<PatternElement> kept = new ArrayList<>(body.size());
        for (PatternElement element : body) {
            if (canMatch(element)) {
                kept.add(element);
            } else if (!element.mode().mayBeAbsent()) {
                return null;
            }
        }
        return kept;
    }
}
