package com.lexd.api.model;

import java.util.List;

/**
 * One row of a lexicon, one segment per column.
 */
public record LexiconEntry(List<LexiconSegment> segments) {

    public LexiconEntry {
        segments = List.copyOf(segments);
    }

    public int columnCount() {
        return segments.size();
    }

    /**
     * @param column 1-based column index
     */
    public LexiconSegment segment(int column) {
        return segments.get(column - 1);
    }
}
