package com.lexd.api.model;

import java.io.Serializable;
import java.util.Map;

public record CompilationStats(
        int lexiconCount,
        int patternCount,
        int patternCacheSize,
        int lexiconCacheSize,
        int entryCacheSize,
        int boundLexiconCount,
        int flagCount,
        int stateCount,
        long transitionCount,
        long compilationTimeNanos,
        Map<String, Object> metadata
) implements Serializable {
}
