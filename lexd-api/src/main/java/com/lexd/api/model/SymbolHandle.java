package com.lexd.api.model;

import java.io.Serializable;

/**
 * Interned reference to a lexicon, pattern or tag name. Compared by id.
 *
 * @see SymbolInterner
 */
public record SymbolHandle(int id) implements Comparable<SymbolHandle>, Serializable {

    /** The reserved "unset" handle. */
    public static final SymbolHandle EMPTY = new SymbolHandle(0);

    public boolean isEmpty() {
        return id == 0;
    }

    @Override
    public int compareTo(SymbolHandle other) {
        return Integer.compare(id, other.id);
    }
}
