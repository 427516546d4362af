package com.lexd.api.model;

import java.util.Comparator;

/**
 * A reference to one column (1-based) of a lexicon, or to a pattern (column 1).
 */
public record Token(SymbolHandle name, int column) implements Comparable<Token> {

    public static final Token EMPTY = new Token(SymbolHandle.EMPTY, 0);

    private static final Comparator<Token> ORDER = Comparator
            .comparing(Token::name)
            .thenComparingInt(Token::column);

    public boolean isEmpty() {
        return name.isEmpty();
    }

    @Override
    public int compareTo(Token other) {
        return ORDER.compare(this, other);
    }
}
