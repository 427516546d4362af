package com.lexd.runtime.operations;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;

/**
 * Iterative Tarjan decomposition of a dense transition table.
 */
final class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
    }

    /**
     * @return component id per state
     */
    static int[] compute(int[][] delta) {
        int n = delta.length;
        int[] index = new int[n];
        int[] lowLink = new int[n];
        int[] component = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);

        IntArrayList stack = new IntArrayList();
        IntArrayList callStack = new IntArrayList();
        IntArrayList edgeCursor = new IntArrayList();
        int nextIndex = 0;
        int nextComponent = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] >= 0) {
                continue;
            }
            callStack.push(root);
            edgeCursor.push(0);
            index[root] = lowLink[root] = nextIndex++;
            stack.push(root);
            onStack[root] = true;

            while (!callStack.isEmpty()) {
                int top = callStack.size() - 1;
                int state = callStack.getInt(top);
                int cursor = edgeCursor.getInt(top);
                if (cursor < delta[state].length) {
                    edgeCursor.set(top, cursor + 1);
                    int target = delta[state][cursor];
                    if (index[target] < 0) {
                        index[target] = lowLink[target] = nextIndex++;
                        stack.push(target);
                        onStack[target] = true;
                        callStack.push(target);
                        edgeCursor.push(0);
                    } else if (onStack[target]) {
                        lowLink[state] = Math.min(lowLink[state], index[target]);
                    }
                    continue;
                }

                if (lowLink[state] == index[state]) {
                    int member;
                    do {
                        member = stack.popInt();
                        onStack[member] = false;
                        component[member] = nextComponent;
                    } while (member != state);
                    nextComponent++;
                }
                callStack.popInt();
                edgeCursor.popInt();
                if (!callStack.isEmpty()) {
                    int parent = callStack.getInt(callStack.size() - 1);
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[state]);
                }
            }
        }
        return component;
    }
}
