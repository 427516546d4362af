package com.lexd.api.model;

import java.util.List;

/**
 * One body of a named pattern. A name with several bodies means alternation.
 */
public record Pattern(SymbolHandle name, int lineNumber, List<PatternElement> elements) {

    public Pattern {
        elements = List.copyOf(elements);
    }
}
