package com.crewmind.dispatch.cli;

import com.crewmind.core.events.CrewmindEvent;
import com.crewmind.core.model.RunMetrics;
import com.crewmind.core.model.RunStatus;
import com.crewmind.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Crewmind CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CREWMIND v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CREWMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void taskLine(String taskId, TaskStatus status, String detail) {
        String color = switch (status) {
            case SUCCEEDED -> "fg(green)";
            case FAILED -> "fg(red)";
            case SKIPPED -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-9s", status) + "|@ " + taskId
                        + (detail == null || detail.isBlank() ? "" : "  " + detail)));
    }

    public static void runStatus(String runId, RunStatus status) {
        String style = switch (status) {
            case COMPLETED -> "bold,fg(green)";
            case PARTIALLY_FAILED, CANCELLED -> "bold,fg(yellow)";
            default -> "bold,fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + style + " " + status + "|@ " + runId));
    }

    public static void metrics(RunMetrics m) {
        if (m == null) {
            return;
        }
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + m.tasksSucceeded() + " succeeded|@, @|fg(red) "
                        + m.tasksFailed() + " failed|@, @|fg(yellow) " + m.tasksSkipped() + " skipped|@"));
        System.out.println("  Tool calls: " + m.toolCalls() + " (cache hits: " + m.cacheHits() + ")");
        System.out.println("  Model calls: " + m.modelCalls());
        System.out.println("  Duration: " + formatDuration(m.durationMs()));
    }

    public static void watchEvent(CrewmindEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "task.started" -> "@|fg(blue) [TASK]|@";
            case "task.succeeded" -> "@|fg(green) [DONE]|@";
            case "task.failed" -> "@|fg(red) [FAILED]|@";
            case "task.skipped" -> "@|fg(yellow) [SKIPPED]|@";
            case "run.completed" -> "@|bold,fg(green) [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() : event.runId();
        String data = event.payload().isEmpty() ? "" : " " + event.payload();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + data));
    }

    static String formatDuration(Long ms) {
        if (ms == null) return "-";
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
