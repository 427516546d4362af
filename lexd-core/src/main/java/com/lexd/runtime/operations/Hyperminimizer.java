package com.lexd.runtime.operations;

import com.lexd.runtime.automaton.Transducer;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Lossy size reduction of a deterministic transducer.
 *
 * <p>Implements hyper-minimization after Badr, Geffert and Shipman with the
 * almost-equivalence procedure of Holzer and Maletti: states whose right languages
 * differ on finitely many strings are almost-equivalent, and every preamble state
 * (reachable by finitely many strings) is merged into an almost-equivalent kernel
 * state when one exists. The result accepts the same pairs as the input except for
 * finitely many, and no smaller automaton has that property.
 */
public class Hyperminimizer {
    private static final Logger logger = Logger.getLogger(Hyperminimizer.class.getName());

    private final int workLimit;

    public Hyperminimizer(int workLimit) {
        this.workLimit = workLimit;
    }

    public Transducer hyperminimize(Transducer transducer) {
        Transducer minimal = AutomatonOperations.minimize(transducer, workLimit);

        int[] labels = collectLabels(minimal);
        int stateCount = minimal.stateCount();
        int sink = stateCount;
        int[][] delta = completeTable(minimal, labels, sink);

        int[] block = almostEquivalenceBlocks(delta);
        boolean[] reachable = reachableFrom(delta, minimal.initial());
        boolean[] kernel = kernelStates(delta, reachable);

        int[] representative = chooseRepresentatives(block, reachable, kernel);

        Transducer merged = rebuild(minimal, delta, labels, representative, sink);
        Transducer result = AutomatonOperations.minimize(merged, workLimit);
        logger.info(String.format("Hyperminimized %d states to %d", stateCount, result.stateCount()));
        return result;
    }

    private static int[] collectLabels(Transducer dfa) {
        IntSortedSet labels = new IntRBTreeSet();
        for (int state = 0; state < dfa.stateCount(); state++) {
            dfa.forEachTransition(state, (label, target) -> labels.add(label));
        }
        return labels.toIntArray();
    }

    private static int[][] completeTable(Transducer dfa, int[] labels, int sink) {
        int[][] delta = new int[sink + 1][labels.length];
        for (int[] row : delta) {
            Arrays.fill(row, sink);
        }
        for (int state = 0; state < sink; state++) {
            final int[] row = delta[state];
            dfa.forEachTransition(state, (label, target) -> row[Arrays.binarySearch(labels, label)] = target);
        }
        return delta;
    }

    /**
     * Repeatedly merges states with identical successor vectors, ignoring finality.
     * Two states end up in the same block iff they are almost-equivalent.
     */
    static int[] almostEquivalenceBlocks(int[][] original) {
        int n = original.length;
        int[][] delta = new int[n][];
        for (int i = 0; i < n; i++) {
            delta[i] = original[i].clone();
        }
        int[] parent = new int[n];
        IntSet[] predecessors = new IntSet[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
            predecessors[i] = new IntOpenHashSet();
        }
        for (int state = 0; state < n; state++) {
            for (int target : delta[state]) {
                predecessors[target].add(state);
            }
        }

        boolean[] active = new boolean[n];
        Arrays.fill(active, true);
        Object2IntMap<IntArrayList> signatures = new Object2IntOpenHashMap<>();
        signatures.defaultReturnValue(-1);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int i = 0; i < n; i++) {
            queue.enqueue(i);
        }

        while (!queue.isEmpty()) {
            int q = queue.dequeueInt();
            if (!active[q]) {
                continue;
            }
            IntArrayList key = IntArrayList.wrap(delta[q].clone());
            int p = signatures.getInt(key);
            if (p < 0 || p == q || !active[p]) {
                signatures.put(key, q);
                continue;
            }

            active[q] = false;
            parent[q] = p;
            for (int r : predecessors[q].toIntArray()) {
                if (!active[r]) {
                    continue;
                }
                IntArrayList oldKey = IntArrayList.wrap(delta[r].clone());
                if (signatures.getInt(oldKey) == r) {
                    signatures.removeInt(oldKey);
                }
                for (int a = 0; a < delta[r].length; a++) {
                    if (delta[r][a] == q) {
                        delta[r][a] = p;
                    }
                }
                predecessors[p].add(r);
                queue.enqueue(r);
            }
            predecessors[q].clear();
        }

        int[] block = new int[n];
        for (int i = 0; i < n; i++) {
            block[i] = find(parent, i);
        }
        return block;
    }

    private static int find(int[] parent, int state) {
        while (parent[state] != state) {
            state = parent[state];
        }
        return state;
    }

    private static boolean[] reachableFrom(int[][] delta, int initial) {
        boolean[] seen = new boolean[delta.length];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        seen[initial] = true;
        queue.enqueue(initial);
        while (!queue.isEmpty()) {
            int state = queue.dequeueInt();
            for (int target : delta[state]) {
                if (!seen[target]) {
                    seen[target] = true;
                    queue.enqueue(target);
                }
            }
        }
        return seen;
    }

    /**
     * Kernel states: reachable states that can be reached from a reachable cycle.
     */
    static boolean[] kernelStates(int[][] delta, boolean[] reachable) {
        int n = delta.length;
        int[] component = StronglyConnectedComponents.compute(delta);
        int[] componentSize = new int[n];
        for (int state = 0; state < n; state++) {
            componentSize[component[state]]++;
        }

        boolean[] kernel = new boolean[n];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int state = 0; state < n; state++) {
            if (!reachable[state]) {
                continue;
            }
            boolean cyclic = componentSize[component[state]] > 1;
            for (int target : delta[state]) {
                if (target == state) {
                    cyclic = true;
                    break;
                }
            }
            if (cyclic) {
                kernel[state] = true;
                queue.enqueue(state);
            }
        }
        while (!queue.isEmpty()) {
            int state = queue.dequeueInt();
            for (int target : delta[state]) {
                if (!kernel[target]) {
                    kernel[target] = true;
                    queue.enqueue(target);
                }
            }
        }
        return kernel;
    }

    private static int[] chooseRepresentatives(int[] block, boolean[] reachable, boolean[] kernel) {
        int n = block.length;
        Int2IntOpenHashMap kernelOfBlock = new Int2IntOpenHashMap();
        Int2IntOpenHashMap anyOfBlock = new Int2IntOpenHashMap();
        kernelOfBlock.defaultReturnValue(-1);
        anyOfBlock.defaultReturnValue(-1);
        for (int state = 0; state < n; state++) {
            if (!reachable[state]) {
                continue;
            }
            if (kernel[state] && kernelOfBlock.get(block[state]) < 0) {
                kernelOfBlock.put(block[state], state);
            }
            if (anyOfBlock.get(block[state]) < 0) {
                anyOfBlock.put(block[state], state);
            }
        }

        int[] representative = new int[n];
        for (int state = 0; state < n; state++) {
            if (!reachable[state] || kernel[state]) {
                representative[state] = state;
                continue;
            }
            int target = kernelOfBlock.get(block[state]);
            representative[state] = target >= 0 ? target : anyOfBlock.get(block[state]);
        }
        return representative;
    }

    private static Transducer rebuild(Transducer minimal, int[][] delta, int[] labels,
                                      int[] representative, int sink) {
        Transducer result = new Transducer();
        Int2IntOpenHashMap mapped = new Int2IntOpenHashMap();
        mapped.defaultReturnValue(-1);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        int start = representative[minimal.initial()];
        mapped.put(start, result.initial());
        queue.enqueue(start);
        while (!queue.isEmpty()) {
            int state = queue.dequeueInt();
            int source = mapped.get(state);
            if (state != sink && minimal.isFinal(state)) {
                result.setFinal(source);
            }
            for (int a = 0; a < labels.length; a++) {
                int target = representative[delta[state][a]];
                if (target == sink) {
                    continue;
                }
                int mappedTarget = mapped.get(target);
                if (mappedTarget < 0) {
                    mappedTarget = result.newState();
                    mapped.put(target, mappedTarget);
                    queue.enqueue(target);
                }
                result.addTransition(source, labels[a], mappedTarget);
            }
        }
        return result;
    }
}
