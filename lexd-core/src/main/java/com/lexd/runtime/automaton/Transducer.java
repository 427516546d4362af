package com.lexd.runtime.automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongLinkedOpenHashSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable nondeterministic transducer over the pair labels of an {@link Alphabet}.
 *
 * <p>State {@code 0} is always the initial state. Label {@link Alphabet#EPSILON_LABEL}
 * is an epsilon move. Fragments are combined by copying: inserting, unioning or
 * concatenating another transducer never aliases its states, so cached fragments
 * stay unchanged.
 */
public class Transducer {

    /**
     * Receives the outgoing transitions of a state.
     */
    @FunctionalInterface
    public interface TransitionConsumer {
        void accept(int label, int target);
    }

    private final List<LongLinkedOpenHashSet> transitions = new ArrayList<>();
    private final IntSortedSet finals = new IntRBTreeSet();

    public Transducer() {
        newState();
    }

    public int initial() {
        return 0;
    }

    public int newState() {
        transitions.add(new LongLinkedOpenHashSet());
        return transitions.size() - 1;
    }

    public int stateCount() {
        return transitions.size();
    }

    public long transitionCount() {
        long count = 0;
        for (LongLinkedOpenHashSet set : transitions) {
            count += set.size();
        }
        return count;
    }

    // ==================== Construction ====================

    /**
     * Adds a transition; duplicates are ignored.
     *
     * @return true if the transition was new
     */
    public boolean addTransition(int source, int label, int target) {
        checkState(source);
        checkState(target);
        return transitions.get(source).add(pack(label, target));
    }

    public void addEpsilon(int source, int target) {
        addTransition(source, Alphabet.EPSILON_LABEL, target);
    }

    /**
     * Adds a transition from {@code source} to a fresh state.
     *
     * @return the new state
     */
    public int insertSingleTransduction(int label, int source) {
        int target = newState();
        addTransition(source, label, target);
        return target;
    }

    /**
     * Appends a chain of labels starting at {@code source}.
     *
     * @return the state at the end of the chain ({@code source} if the list is empty)
     */
    public int insertPath(int source, IntList labels) {
        int state = source;
        for (int i = 0; i < labels.size(); i++) {
            state = insertSingleTransduction(labels.getInt(i), state);
        }
        return state;
    }

    /**
     * Copies {@code other} into this transducer, links {@code source} to the copy's
     * initial state and links every copied final state to a single new end state.
     * Copied final states are not final here.
     *
     * @return the new end state
     */
    public int insertTransducer(int source, Transducer other) {
        checkState(source);
        int offset = copyStates(other);
        addEpsilon(source, offset + other.initial());
        int end = newState();
        for (int f : other.finals) {
            addEpsilon(offset + f, end);
        }
        return end;
    }

    /**
     * Adds the language of {@code other} to this one.
     */
    public void union(Transducer other) {
        int offset = copyStates(other);
        addEpsilon(initial(), offset + other.initial());
        for (int f : other.finals) {
            finals.add(offset + f);
        }
    }

    /**
     * Appends {@code other} after every accepted path of this transducer.
     */
    public void concatenate(Transducer other) {
        int offset = copyStates(other);
        for (int f : finals) {
            addEpsilon(f, offset + other.initial());
        }
        finals.clear();
        for (int f : other.finals) {
            finals.add(offset + f);
        }
    }

    /**
     * Returns a normalized copy with a fresh initial and a single final state, with
     * the repetition edges added over that one copy: an entry-to-exit bypass when
     * the fragment may be absent and an exit-to-entry back edge when it may repeat.
     */
    public Transducer repeated(boolean mayBeAbsent, boolean mayRepeat) {
        Transducer result = new Transducer();
        int end = result.insertTransducer(result.initial(), this);
        result.setFinal(end);
        if (mayBeAbsent) {
            result.addEpsilon(result.initial(), end);
        }
        if (mayRepeat) {
            result.addEpsilon(end, result.initial());
        }
        return result;
    }

    public Transducer copy() {
        Transducer copy = new Transducer();
        copy.transitions.clear();
        for (LongLinkedOpenHashSet set : transitions) {
            copy.transitions.add(set.clone());
        }
        copy.finals.addAll(finals);
        return copy;
    }

    private int copyStates(Transducer other) {
        int offset = transitions.size();
        for (LongLinkedOpenHashSet set : other.transitions) {
            LongLinkedOpenHashSet shifted = new LongLinkedOpenHashSet(set.size());
            LongIterator it = set.iterator();
            while (it.hasNext()) {
                long packed = it.nextLong();
                shifted.add(pack(label(packed), target(packed) + offset));
            }
            transitions.add(shifted);
        }
        return offset;
    }

    // ==================== Final states ====================

    public void setFinal(int state) {
        checkState(state);
        finals.add(state);
    }

    public void setFinal(int state, boolean isFinal) {
        if (isFinal) {
            setFinal(state);
        } else {
            finals.remove(state);
        }
    }

    public boolean isFinal(int state) {
        return finals.contains(state);
    }

    public IntSortedSet finals() {
        return IntSortedSets.unmodifiable(finals);
    }

    // ==================== Inspection ====================

    public void forEachTransition(int state, TransitionConsumer consumer) {
        LongIterator it = transitions.get(state).iterator();
        while (it.hasNext()) {
            long packed = it.nextLong();
            consumer.accept(label(packed), target(packed));
        }
    }

    public int transitionCount(int state) {
        return transitions.get(state).size();
    }

    /**
     * States reachable from {@code state} through epsilon moves only, including itself.
     */
    public IntSet epsilonClosure(int state) {
        IntSet closure = new IntOpenHashSet();
        IntArrayList stack = new IntArrayList();
        closure.add(state);
        stack.push(state);
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            LongIterator it = transitions.get(current).iterator();
            while (it.hasNext()) {
                long packed = it.nextLong();
                if (label(packed) == Alphabet.EPSILON_LABEL && closure.add(target(packed))) {
                    stack.push(target(packed));
                }
            }
        }
        return closure;
    }

    /**
     * True when there are no epsilon moves and no state has two transitions on one label.
     */
    public boolean isDeterministic() {
        for (LongLinkedOpenHashSet set : transitions) {
            IntSet seen = new IntOpenHashSet();
            LongIterator it = set.iterator();
            while (it.hasNext()) {
                int label = label(it.nextLong());
                if (label == Alphabet.EPSILON_LABEL || !seen.add(label)) {
                    return false;
                }
            }
        }
        return true;
    }

    private void checkState(int state) {
        if (state < 0 || state >= transitions.size()) {
            throw new IllegalStateException("No such state: " + state);
        }
    }

    private static long pack(int label, int target) {
        return ((long) label << 32) | (target & 0xFFFFFFFFL);
    }

    private static int label(long packed) {
        return (int) (packed >>> 32);
    }

    private static int target(long packed) {
        return (int) packed;
    }

    @Override
    public String toString() {
        return "Transducer[states=" + stateCount() + ", transitions=" + transitionCount()
                + ", finals=" + finals.size() + "]";
    }
}
