package com.lexd.runtime.evaluation;

import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.FlagDiacritic;
import com.lexd.runtime.automaton.FlagDiacriticType;
import com.lexd.runtime.automaton.TransitionSymbol;
import com.lexd.runtime.automaton.Transducer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reference interpreter for compiled transducers.
 *
 * <p>Walks a transducer the way a downstream processor does: flag diacritic
 * transitions consume no input and update or check feature values, every other
 * transition consumes its left symbol from the left string and its right symbol
 * from the right string. Works on nondeterministic transducers with epsilon moves.
 */
public class FlagAwareMatcher {

    private final Transducer transducer;
    private final Alphabet alphabet;

    public FlagAwareMatcher(Transducer transducer, Alphabet alphabet) {
        this.transducer = transducer;
        this.alphabet = alphabet;
    }

    private record Configuration(int state, int leftPos, int rightPos, Map<String, Integer> flags) {
    }

    private record Path(int state, String left, String right, int length, Map<String, Integer> flags) {
        Path key() {
            return new Path(state, left, right, 0, flags);
        }
    }

    /**
     * Whether some accepting path maps {@code left} to {@code right} with all flags satisfied.
     */
    public boolean accepts(String left, String right) {
        List<TransitionSymbol> leftSymbols = alphabet.tokenizeExisting(left);
        List<TransitionSymbol> rightSymbols = alphabet.tokenizeExisting(right);
        if (leftSymbols == null || rightSymbols == null) {
            return false;
        }

        Deque<Configuration> queue = new ArrayDeque<>();
        Set<Configuration> visited = new HashSet<>();
        Configuration start = new Configuration(transducer.initial(), 0, 0, Map.of());
        queue.add(start);
        visited.add(start);

        while (!queue.isEmpty()) {
            Configuration current = queue.poll();
            if (transducer.isFinal(current.state())
                    && current.leftPos() == leftSymbols.size()
                    && current.rightPos() == rightSymbols.size()) {
                return true;
            }
            List<Configuration> next = new ArrayList<>();
            transducer.forEachTransition(current.state(), (label, target) -> {
                int leftId = alphabet.left(label);
                int rightId = alphabet.right(label);
                FlagDiacritic flag = alphabet.flagOf(leftId);
                if (flag != null) {
                    Map<String, Integer> flags = applyFlag(current.flags(), flag);
                    if (flags != null) {
                        next.add(new Configuration(target, current.leftPos(), current.rightPos(), flags));
                    }
                    return;
                }
                int leftPos = advance(leftSymbols, current.leftPos(), leftId);
                int rightPos = advance(rightSymbols, current.rightPos(), rightId);
                if (leftPos >= 0 && rightPos >= 0) {
                    next.add(new Configuration(target, leftPos, rightPos, current.flags()));
                }
            });
            for (Configuration configuration : next) {
                if (visited.add(configuration)) {
                    queue.add(configuration);
                }
            }
        }
        return false;
    }

    /**
     * Enumerates accepted pairs as {@code left:right} strings, following paths that
     * consume at most {@code maxSymbols} non-epsilon symbols in total.
     */
    public SortedSet<String> acceptedPairs(int maxSymbols) {
        SortedSet<String> pairs = new TreeSet<>();
        Deque<Path> queue = new ArrayDeque<>();
        Set<Path> visited = new HashSet<>();
        Path start = new Path(transducer.initial(), "", "", 0, Map.of());
        queue.add(start);
        visited.add(start.key());

        while (!queue.isEmpty()) {
            Path current = queue.poll();
            if (transducer.isFinal(current.state())) {
                pairs.add(current.left() + ":" + current.right());
            }
            List<Path> next = new ArrayList<>();
            transducer.forEachTransition(current.state(), (label, target) -> {
                int leftId = alphabet.left(label);
                int rightId = alphabet.right(label);
                FlagDiacritic flag = alphabet.flagOf(leftId);
                if (flag != null) {
                    Map<String, Integer> flags = applyFlag(current.flags(), flag);
                    if (flags != null) {
                        next.add(new Path(target, current.left(), current.right(), current.length(), flags));
                    }
                    return;
                }
                int consumed = (leftId != 0 ? 1 : 0) + (rightId != 0 ? 1 : 0);
                if (current.length() + consumed > maxSymbols) {
                    return;
                }
                next.add(new Path(target, current.left() + alphabet.render(leftId),
                        current.right() + alphabet.render(rightId), current.length() + consumed, current.flags()));
            });
            for (Path path : next) {
                if (visited.add(path.key())) {
                    queue.add(path);
                }
            }
        }
        return pairs;
    }

    private static int advance(List<TransitionSymbol> symbols, int position, int symbolId) {
        if (symbolId == 0) {
            return position;
        }
        if (position < symbols.size() && symbols.get(position).id() == symbolId) {
            return position + 1;
        }
        return -1;
    }

    /**
     * @return the updated feature values, or {@code null} when the flag blocks the path
     */
    static Map<String, Integer> applyFlag(Map<String, Integer> flags, FlagDiacritic flag) {
        int current = flags.getOrDefault(flag.feature(), 0);
        int updated = flag.type().apply(current, flag.value());
        if (updated == FlagDiacriticType.REJECT) {
            return null;
        }
        if (updated == current) {
            return flags;
        }
        Map<String, Integer> copy = new HashMap<>(flags);
        if (updated == 0) {
            copy.remove(flag.feature());
        } else {
            copy.put(flag.feature(), updated);
        }
        return Map.copyOf(copy);
    }
}
