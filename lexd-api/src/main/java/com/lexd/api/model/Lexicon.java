package com.lexd.api.model;

import java.util.List;

/**
 * A named table of entries sharing one column count.
 *
 * @param lineNumber line of the first declaration
 */
public record Lexicon(SymbolHandle name, int lineNumber, int columnCount, List<LexiconEntry> entries) {

    public Lexicon {
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public LexiconEntry entry(int index) {
        return entries.get(index);
    }
}
