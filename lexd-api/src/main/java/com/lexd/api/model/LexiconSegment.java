package com.lexd.api.model;

import com.lexd.runtime.automaton.TransitionSymbol;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One column of a lexicon entry: a left and a right symbol sequence plus tags.
 */
public record LexiconSegment(
        List<TransitionSymbol> left,
        List<TransitionSymbol> right,
        SortedSet<SymbolHandle> tags
) {
    public LexiconSegment {
        left = List.copyOf(left);
        right = List.copyOf(right);
        tags = Collections.unmodifiableSortedSet(new TreeSet<>(tags));
    }

    public boolean hasTag(SymbolHandle tag) {
        return tags.contains(tag);
    }
}
