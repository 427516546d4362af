package com.lexd.compiler.build;

import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.TransitionSymbol;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

/**
 * Turns the two sides of a segment into a sequence of pair labels.
 *
 * <p>Without alignment the sides are zipped and the shorter one is padded with
 * epsilon at the end. With alignment a minimum edit distance alignment is used:
 * a match costs 0, an insertion or deletion 1 and a substitution 3, or 1 when
 * compressing. Ties prefer substitution, then deletion, then insertion.
 */
public class EntryAligner {

    private static final int INDEL_COST = 1;
    private static final int SUBSTITUTION_COST = 3;
    private static final int COMPRESSED_SUBSTITUTION_COST = 1;

    private final Alphabet alphabet;
    private final boolean align;
    private final int substitutionCost;

    public EntryAligner(Alphabet alphabet, boolean align, boolean compress) {
        this.alphabet = alphabet;
        this.align = align || compress;
        this.substitutionCost = compress ? COMPRESSED_SUBSTITUTION_COST : SUBSTITUTION_COST;
    }

    public IntList labels(List<TransitionSymbol> left, List<TransitionSymbol> right) {
        return align ? aligned(left, right) : zipped(left, right);
    }

    private IntList zipped(List<TransitionSymbol> left, List<TransitionSymbol> right) {
        int length = Math.max(left.size(), right.size());
        IntList labels = new IntArrayList(length);
        for (int i = 0; i < length; i++) {
            int l = i < left.size() ? left.get(i).id() : TransitionSymbol.EPSILON.id();
            int r = i < right.size() ? right.get(i).id() : TransitionSymbol.EPSILON.id();
            labels.add(alphabet.label(l, r));
        }
        return labels;
    }

    private IntList aligned(List<TransitionSymbol> left, List<TransitionSymbol> right) {
        int n = left.size();
        int m = right.size();
        int[][] cost = new int[n + 1][m + 1];
        for (int i = 1; i <= n; i++) {
            cost[i][0] = i * INDEL_COST;
        }
        for (int j = 1; j <= m; j++) {
            cost[0][j] = j * INDEL_COST;
        }
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                int diagonal = cost[i - 1][j - 1] + substitution(left.get(i - 1), right.get(j - 1));
                int deletion = cost[i - 1][j] + INDEL_COST;
                int insertion = cost[i][j - 1] + INDEL_COST;
                cost[i][j] = Math.min(diagonal, Math.min(deletion, insertion));
            }
        }

        IntArrayList reversed = new IntArrayList(n + m);
        int i = n;
        int j = m;
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0
                    && cost[i][j] == cost[i - 1][j - 1] + substitution(left.get(i - 1), right.get(j - 1))) {
                reversed.add(alphabet.label(left.get(i - 1), right.get(j - 1)));
                i--;
                j--;
            } else if (i > 0 && cost[i][j] == cost[i - 1][j] + INDEL_COST) {
                reversed.add(alphabet.label(left.get(i - 1), TransitionSymbol.EPSILON));
                i--;
            } else {
                reversed.add(alphabet.label(TransitionSymbol.EPSILON, right.get(j - 1)));
                j--;
            }
        }

        IntList labels = new IntArrayList(reversed.size());
        for (int k = reversed.size() - 1; k >= 0; k--) {
            labels.add(reversed.getInt(k));
        }
        return labels;
    }

    private int substitution(TransitionSymbol a, TransitionSymbol b) {
        return a.equals(b) ? 0 : substitutionCost;
    }
}
