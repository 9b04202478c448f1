package com.crewmind.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one pipeline invocation: every task's result plus run-level metadata.
 * Result entries are created up front in declaration order.
 */
public class PipelineRun {

    private final String runId;
    private final String pipelineName;
    private final List<TaskSpec> tasks;
    private final RunConfig config;
    private final Instant startedAt;
    private final Map<String, TaskResult> results = new LinkedHashMap<>();
    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile Instant finishedAt;
    private volatile String abortReason;
    private volatile RunMetrics metrics = RunMetrics.EMPTY;

    public PipelineRun(String runId, PipelineDefinition definition, RunConfig config, Instant startedAt) {
        this.runId = runId;
        this.pipelineName = definition.name();
        this.tasks = definition.tasks();
        this.config = config;
        this.startedAt = startedAt;
        for (var task : tasks) {
            results.put(task.id(), new TaskResult(task.id(), task.agentId()));
        }
    }

    public TaskResult result(String taskId) {
        var result = results.get(taskId);
        if (result == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return result;
    }

    public void finish(RunStatus finalStatus, Instant at, RunMetrics runMetrics) {
        this.status = finalStatus;
        this.finishedAt = at;
        this.metrics = runMetrics;
    }

    public void setAbortReason(String reason) { this.abortReason = reason; }

    public String getRunId() { return runId; }
    public String getPipelineName() { return pipelineName; }
    public List<TaskSpec> getTasks() { return tasks; }
    public RunConfig getConfig() { return config; }
    public Instant getStartedAt() { return startedAt; }
    public Map<String, TaskResult> getResults() { return Collections.unmodifiableMap(results); }
    public RunStatus getStatus() { return status; }
    public Instant getFinishedAt() { return finishedAt; }
    public String getAbortReason() { return abortReason; }
    public RunMetrics getMetrics() { return metrics; }
}
