package com.crewmind.dispatch.cli;

import com.crewmind.core.persistence.RunHistoryService;
import com.crewmind.core.persistence.RunReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: crewmind history
 * <p>
 * Lists run reports found in the output directory, newest first:
 * Run ID | Status | Pipeline | Tasks (succeeded/failed/skipped).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List previous runs")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final RunHistoryService historyService;

    public HistoryCommand(RunHistoryService historyService) {
        this.historyService = historyService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<RunReport> reports = historyService.list(limit);
        if (reports.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        ConsoleOutput.info("Runs (" + reports.size() + "):");
        System.out.println();
        System.out.printf("  %-30s %-17s %-10s %s%n", "RUN ID", "STATUS", "TASKS", "PIPELINE");
        System.out.println("  " + "-".repeat(76));

        for (RunReport report : reports) {
            var m = report.metrics();
            String tasks = m == null ? "-" : m.tasksSucceeded() + "/" + m.tasksFailed() + "/" + m.tasksSkipped();
            System.out.printf("  %-30s %-17s %-10s %s%n", report.runId(), report.status(), tasks,
                    ConsoleOutput.truncate(report.pipeline(), 30));
        }
    }
}
