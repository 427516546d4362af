/*
 * Copyright (c) 2025 lexd
 * Licensed under the Apache License, Version 2.0
 */
package com.lexd.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>A full build runs these stages in order:
 * <ol>
 *   <li>VALIDATION - resolve references, check shapes and emptiness</li>
 *   <li>FREEDOM_ANALYSIS - classify lexicons as free or bound</li>
 *   <li>PATTERN_BUILDING - build and cache lexicon and pattern fragments</li>
 *   <li>MINIMIZATION - determinize and minimize the union of the roots</li>
 *   <li>HYPERMINIMIZATION - optional lossy companion automaton</li>
 * </ol>
 *
 * <p>A single-lexicon build reports only PATTERN_BUILDING and MINIMIZATION.
 */
public interface CompilationListener {

    /**
     * Called when a stage starts.
     *
     * @param stageName   name of the stage
     * @param stageNumber current stage number (1-based)
     * @param totalStages total number of stages in this build
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a stage completes successfully.
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails; the exception is rethrown afterwards.
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName     name of the stage
     * @param durationNanos duration in nanoseconds
     * @param metrics       stage-specific metrics (e.g. "boundLexicons", "states")
     */
    record StageResult(
            String stageName,
            long durationNanos,
            Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
