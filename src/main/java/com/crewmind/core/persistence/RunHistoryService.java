package com.crewmind.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads run reports back from the output directory.
 */
public class RunHistoryService {

    private static final Logger log = LoggerFactory.getLogger(RunHistoryService.class);

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public RunHistoryService(Path outputDir, ObjectMapper objectMapper) {
        this.outputDir = outputDir;
        this.objectMapper = objectMapper;
    }

    /** Most recent runs first. Unreadable reports are skipped. */
    public List<RunReport> list(int limit) {
        if (!Files.isDirectory(outputDir)) {
            return List.of();
        }
        var reports = new ArrayList<RunReport>();
        try (Stream<Path> files = Files.list(outputDir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                 .forEach(p -> read(p).ifPresent(reports::add));
        } catch (IOException e) {
            log.warn("Could not list {}: {}", outputDir, e.getMessage());
            return List.of();
        }
        reports.sort(Comparator.comparing(RunReport::startedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return reports.size() > limit ? reports.subList(0, limit) : reports;
    }

    public Optional<RunReport> find(String runId) {
        Path file = outputDir.resolve(runId + ".json");
        return Files.isRegularFile(file) ? read(file) : Optional.empty();
    }

    private Optional<RunReport> read(Path file) {
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), RunReport.class));
        } catch (IOException e) {
            log.debug("Skipping unreadable report {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
