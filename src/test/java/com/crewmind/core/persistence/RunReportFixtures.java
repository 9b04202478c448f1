package com.crewmind.core.persistence;

import com.crewmind.core.model.AgentSpec;
import com.crewmind.core.model.ModelConfig;
import com.crewmind.core.model.OutputSchema;
import com.crewmind.core.model.PipelineDefinition;
import com.crewmind.core.model.PipelineRun;
import com.crewmind.core.model.RunConfig;
import com.crewmind.core.model.RunMetrics;
import com.crewmind.core.model.RunStatus;
import com.crewmind.core.model.TaskOutcome;
import com.crewmind.core.model.TaskSpec;
import com.crewmind.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Finished runs built by hand for report tests. */
final class RunReportFixtures {

    private RunReportFixtures() {}

    static PipelineRun partiallyFailedRun(String runId, Instant startedAt) {
        var agent = new AgentSpec("researcher", "Researcher", "Find gaps", null, Set.of(),
                new ModelConfig("openai", "gpt-4o-mini", null, null), 3);
        var definition = new PipelineDefinition("market-research", Map.of("researcher", agent), List.of(
                new TaskSpec("research", "researcher", null, "Research", null, List.of(), OutputSchema.EMPTY, false),
                new TaskSpec("analysis", "researcher", null, "Analyze", null, List.of("research"),
                        OutputSchema.EMPTY, false),
                new TaskSpec("strategy", "researcher", null, "Plan", null, List.of("analysis"),
                        OutputSchema.EMPTY, false)));
        var run = new PipelineRun(runId, definition, RunConfig.defaults(), startedAt);

        run.result("research").markRunning(startedAt);
        run.result("research").complete(new TaskOutcome("research", TaskStatus.SUCCEEDED, "Gap found",
                Map.of("output", "Gap found"), null, List.of("IterationBudgetExceeded: used all 3 tool round(s)"),
                2, 1, 4, 1, startedAt, startedAt.plusMillis(1500)));
        run.result("analysis").markRunning(startedAt.plusMillis(1500));
        run.result("analysis").complete(new TaskOutcome("analysis", TaskStatus.FAILED, null, null,
                "Tool 'web_search' failed after 3 attempt(s)", List.of(), 0, 0, 1, 1,
                startedAt.plusMillis(1500), startedAt.plusMillis(2000)));
        run.result("strategy").skip("dependency 'analysis' failed", startedAt.plusMillis(2000));
        run.finish(RunStatus.PARTIALLY_FAILED, startedAt.plusMillis(2000),
                new RunMetrics(2000, 1, 1, 1, 2, 1, 2, 5));
        return run;
    }
}
