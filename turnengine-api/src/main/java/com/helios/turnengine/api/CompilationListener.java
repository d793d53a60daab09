/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.api;

import java.util.Map;

/**
 * Observes a bundle load stage by stage, for example to show progress in an
 * authoring tool or to log reload timings.
 *
 * <p>A bundle passes through PARSING, VALIDATION, NORMALIZATION and
 * INDEXING in that order. Each started stage ends in exactly one of
 * {@link #onStageComplete} or {@link #onError}; after an error no later
 * stage starts.
 *
 * <pre>{@code
 * compiler.setCompilationListener((stage, number, total) ->
 *         logger.info("bundle load " + number + "/" + total + ": " + stage));
 * }</pre>
 */
@FunctionalInterface
public interface CompilationListener {

    /**
     * @param stageNumber 1-based position of the stage
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    default void onStageComplete(String stageName, StageResult result) {
    }

    /**
     * The error is rethrown to the caller of {@code compile} after this returns.
     */
    default void onError(String stageName, Exception error) {
    }

    /**
     * Timing and counts of a finished stage, such as {@code triggerCount}
     * after PARSING or {@code conditionNodesAfter} after NORMALIZATION.
     */
    record StageResult(String stageName, long durationNanos, Map<String, Object> metrics) {

        public StageResult {
            metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        }

        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        public Object metric(String key) {
            return metrics.get(key);
        }
    }
}
