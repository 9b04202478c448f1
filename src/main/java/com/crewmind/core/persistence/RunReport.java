package com.crewmind.core.persistence;

import com.crewmind.core.model.PipelineRun;
import com.crewmind.core.model.RunConfig;
import com.crewmind.core.model.RunMetrics;
import com.crewmind.core.model.RunStatus;
import com.crewmind.core.model.TaskResult;
import com.crewmind.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Machine-readable record of a finished run, as written to {@code <runId>.json}.
 */
public record RunReport(
    String runId,
    String pipeline,
    RunStatus status,
    Instant startedAt,
    Instant finishedAt,
    String abortReason,
    RunConfig config,
    RunMetrics metrics,
    List<TaskReport> tasks
) {

    public record TaskReport(
        String taskId,
        String agentId,
        TaskStatus status,
        Instant startedAt,
        Instant finishedAt,
        Long elapsedMs,
        String rawOutput,
        Map<String, Object> structuredOutput,
        String error,
        List<String> warnings,
        int toolCalls,
        int cacheHits,
        int modelCalls,
        int attempts
    ) {

        static TaskReport from(TaskResult r) {
            return new TaskReport(r.getTaskId(), r.getAgentId(), r.getStatus(), r.getStartedAt(),
                    r.getFinishedAt(), r.getElapsedMs(), r.getRawOutput(), r.getStructuredOutput(),
                    r.getError(), r.getWarnings(), r.getToolCalls(), r.getCacheHits(), r.getModelCalls(),
                    r.getAttempts());
        }
    }

    public static RunReport from(PipelineRun run) {
        var tasks = run.getResults().values().stream().map(TaskReport::from).toList();
        return new RunReport(run.getRunId(), run.getPipelineName(), run.getStatus(), run.getStartedAt(),
                run.getFinishedAt(), run.getAbortReason(), run.getConfig(), run.getMetrics(), tasks);
    }
}
