package com.crewmind.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Terminal result produced by a worker for one task, before it is committed
 * to the run's result ledger.
 */
public record TaskOutcome(
    String taskId,
    TaskStatus status,
    String rawOutput,
    Map<String, Object> structuredOutput,
    String error,
    List<String> warnings,
    int toolCalls,
    int cacheHits,
    int modelCalls,
    int attempts,
    Instant startedAt,
    Instant finishedAt
) {

    public TaskOutcome {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Task outcome must carry a terminal status, got " + status);
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (status != TaskStatus.SUCCEEDED && structuredOutput != null) {
            throw new IllegalArgumentException("Only succeeded tasks carry structured output");
        }
    }
}
