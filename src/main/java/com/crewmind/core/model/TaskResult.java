package com.crewmind.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution record of one task within a run.
 * <p>
 * Owned by the orchestrator. Moves PENDING → RUNNING → terminal, or PENDING → SKIPPED.
 * A terminal state is written exactly once; any further transition is rejected.
 */
public class TaskResult {

    private final String taskId;
    private final String agentId;
    private TaskStatus status = TaskStatus.PENDING;
    private String rawOutput;
    private Map<String, Object> structuredOutput;
    private String error;
    private final List<String> warnings = new ArrayList<>();
    private Instant startedAt;
    private Instant finishedAt;
    private int toolCalls;
    private int cacheHits;
    private int modelCalls;
    private int attempts;

    public TaskResult(String taskId, String agentId) {
        this.taskId = taskId;
        this.agentId = agentId;
    }

    public synchronized void markRunning(Instant at) {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("Task " + taskId + " cannot start from " + status);
        }
        status = TaskStatus.RUNNING;
        startedAt = at;
    }

    /** Commits a worker's outcome. Only valid while RUNNING. */
    public synchronized void complete(TaskOutcome outcome) {
        if (status != TaskStatus.RUNNING) {
            throw new IllegalStateException("Task " + taskId + " cannot complete from " + status);
        }
        status = outcome.status();
        rawOutput = outcome.rawOutput();
        structuredOutput = outcome.structuredOutput() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(outcome.structuredOutput()))
                : null;
        error = outcome.error();
        warnings.addAll(outcome.warnings());
        toolCalls = outcome.toolCalls();
        cacheHits = outcome.cacheHits();
        modelCalls = outcome.modelCalls();
        attempts = outcome.attempts();
        if (outcome.startedAt() != null) startedAt = outcome.startedAt();
        finishedAt = outcome.finishedAt();
    }

    /** Marks a task that never ran. Only valid while PENDING. */
    public synchronized void skip(String reason, Instant at) {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("Task " + taskId + " cannot be skipped from " + status);
        }
        status = TaskStatus.SKIPPED;
        error = reason;
        finishedAt = at;
    }

    public String getTaskId() { return taskId; }
    public String getAgentId() { return agentId; }
    public synchronized TaskStatus getStatus() { return status; }
    public synchronized String getRawOutput() { return rawOutput; }
    public synchronized Map<String, Object> getStructuredOutput() { return structuredOutput; }
    public synchronized String getError() { return error; }
    public synchronized List<String> getWarnings() { return List.copyOf(warnings); }
    public synchronized Instant getStartedAt() { return startedAt; }
    public synchronized Instant getFinishedAt() { return finishedAt; }
    public synchronized int getToolCalls() { return toolCalls; }
    public synchronized int getCacheHits() { return cacheHits; }
    public synchronized int getModelCalls() { return modelCalls; }
    public synchronized int getAttempts() { return attempts; }

    public synchronized Long getElapsedMs() {
        if (startedAt == null || finishedAt == null) return null;
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
