package com.lexd.runtime.automaton;

import java.io.Serializable;

/**
 * An interned atomic automaton symbol.
 *
 * <p>Positive ids are Unicode code points, {@code 0} is epsilon and negative ids
 * are multi-character symbols registered in an {@link Alphabet} (tags such as
 * {@code <n>} and synthetic flag diacritics).
 */
public record TransitionSymbol(int id) implements Comparable<TransitionSymbol>, Serializable {

    public static final TransitionSymbol EPSILON = new TransitionSymbol(0);

    public static TransitionSymbol ofCodePoint(int codePoint) {
        if (codePoint <= 0) {
            throw new IllegalArgumentException("Code point must be positive: " + codePoint);
        }
        return new TransitionSymbol(codePoint);
    }

    public boolean isEpsilon() {
        return id == 0;
    }

    public boolean isCodePoint() {
        return id > 0;
    }

    public boolean isMultichar() {
        return id < 0;
    }

    @Override
    public int compareTo(TransitionSymbol other) {
        return Integer.compare(id, other.id);
    }
}
