package com.crewmind.dispatch.cli;

import com.crewmind.core.persistence.RunHistoryService;
import com.crewmind.core.persistence.RunReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: crewmind inspect &lt;run-id&gt; [task-id]
 * <p>
 * Without a task id, shows the run overview. With one, shows the task's status,
 * timings, counters, warnings and structured output.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a run or one of its tasks")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Parameters(index = "1", arity = "0..1", description = "Task ID")
    private String taskId;

    private final RunHistoryService historyService;
    private final ObjectMapper objectMapper;

    public InspectCommand(RunHistoryService historyService, ObjectMapper objectMapper) {
        this.historyService = historyService;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var reportOpt = historyService.find(runId);
        if (reportOpt.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return 1;
        }
        RunReport report = reportOpt.get();

        if (taskId == null) {
            printRun(report);
            return 0;
        }

        var task = report.tasks().stream().filter(t -> t.taskId().equals(taskId)).findFirst();
        if (task.isEmpty()) {
            ConsoleOutput.error("Task " + taskId + " not found in run " + runId);
            return 1;
        }
        printTask(task.get());
        return 0;
    }

    private void printRun(RunReport report) {
        System.out.println();
        ConsoleOutput.runStatus(report.runId(), report.status());
        System.out.println("  Pipeline:    " + report.pipeline());
        System.out.println("  Started:     " + report.startedAt());
        System.out.println("  Finished:    " + (report.finishedAt() != null ? report.finishedAt() : "-"));
        if (report.config() != null) {
            System.out.println("  Policy:      " + report.config().failurePolicy()
                    + " (" + report.config().maxWorkers() + " worker(s))");
        }
        if (report.abortReason() != null) {
            System.out.println("  Abort:       " + report.abortReason());
        }
        System.out.println();
        for (var t : report.tasks()) {
            ConsoleOutput.taskLine(t.taskId(), t.status(), t.error());
        }
        ConsoleOutput.metrics(report.metrics());
    }

    private void printTask(RunReport.TaskReport t) {
        System.out.println();
        System.out.println("TASK " + t.taskId());
        System.out.println(ConsoleOutput.RULE);
        System.out.println("  Agent:       " + t.agentId());
        System.out.println("  Status:      " + t.status());
        System.out.println("  Elapsed:     " + ConsoleOutput.formatDuration(t.elapsedMs()));
        System.out.println("  Attempts:    " + t.attempts());
        System.out.println("  Tool calls:  " + t.toolCalls() + " (cache hits: " + t.cacheHits() + ")");
        System.out.println("  Model calls: " + t.modelCalls());
        if (t.error() != null) {
            System.out.println("  Error:       " + t.error());
        }
        if (t.warnings() != null && !t.warnings().isEmpty()) {
            System.out.println();
            System.out.println("  WARNINGS:");
            t.warnings().forEach(ConsoleOutput::warn);
        }
        System.out.println();
        if (t.structuredOutput() != null) {
            System.out.println("  STRUCTURED OUTPUT:");
            System.out.println(indent(toPrettyJson(t.structuredOutput())));
        } else if (t.rawOutput() != null) {
            System.out.println("  RAW OUTPUT:");
            System.out.println(indent(t.rawOutput()));
        }
    }

    private String toPrettyJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String indent(String text) {
        return text.lines().map(l -> "    " + l).reduce((a, b) -> a + System.lineSeparator() + b).orElse("");
    }
}
