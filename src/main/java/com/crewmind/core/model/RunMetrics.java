package com.crewmind.core.model;

/**
 * Aggregate counters collected over one pipeline run.
 */
public record RunMetrics(
    long durationMs,
    int tasksSucceeded,
    int tasksFailed,
    int tasksSkipped,
    int toolCalls,
    long cacheHits,
    long cacheMisses,
    int modelCalls
) {

    public static final RunMetrics EMPTY = new RunMetrics(0, 0, 0, 0, 0, 0, 0, 0);
}
