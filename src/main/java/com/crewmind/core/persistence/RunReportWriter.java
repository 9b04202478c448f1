package com.crewmind.core.persistence;

import com.crewmind.core.model.PipelineRun;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Writes a finished run as {@code <runId>.json} plus a readable {@code <runId>.txt} summary.
 * Write errors are logged and never reach the caller.
 */
public class RunReportWriter {

    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);
    private static final String RULE = "=".repeat(80);

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public RunReportWriter(Path outputDir, ObjectMapper objectMapper) {
        this.outputDir = outputDir;
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the JSON report path, or empty when writing failed
     */
    public Optional<Path> write(PipelineRun run) {
        var report = RunReport.from(run);
        Path json = outputDir.resolve(run.getRunId() + ".json");
        Path txt = outputDir.resolve(run.getRunId() + ".txt");
        try {
            Files.createDirectories(outputDir);
            objectMapper.writeValue(json.toFile(), report);
            Files.writeString(txt, summary(report), StandardCharsets.UTF_8);
            log.info("Run report written to {} and {}", json, txt);
            return Optional.of(json);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write run report for {}: {}", run.getRunId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    String summary(RunReport report) throws IOException {
        var sb = new StringBuilder();
        sb.append("Pipeline: ").append(report.pipeline()).append('\n')
          .append("Run: ").append(report.runId()).append('\n')
          .append("Status: ").append(report.status()).append('\n')
          .append("Started: ").append(report.startedAt()).append('\n')
          .append("Finished: ").append(report.finishedAt()).append('\n');
        if (report.abortReason() != null) {
            sb.append("Abort reason: ").append(report.abortReason()).append('\n');
        }
        var m = report.metrics();
        sb.append("Duration: ").append(m.durationMs()).append("ms, tool calls: ").append(m.toolCalls())
          .append(", cache hits: ").append(m.cacheHits()).append(", model calls: ").append(m.modelCalls())
          .append('\n').append(RULE).append("\n\n");

        for (var task : report.tasks()) {
            sb.append("## ").append(task.taskId()).append(" (").append(task.agentId()).append(") [")
              .append(task.status()).append("]\n");
            if (task.error() != null) {
                sb.append("Error: ").append(task.error()).append('\n');
            }
            for (var warning : task.warnings()) {
                sb.append("Warning: ").append(warning).append('\n');
            }
            if (task.structuredOutput() != null) {
                sb.append(objectMapper.writeValueAsString(task.structuredOutput())).append('\n');
            } else if (task.rawOutput() != null) {
                sb.append(task.rawOutput().trim()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public Path getOutputDir() {
        return outputDir;
    }
}
