package com.crewmind.core.persistence;

import com.crewmind.core.model.RunStatus;
import com.crewmind.core.model.TaskStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunHistoryServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @TempDir
    Path dir;

    private RunHistoryService history;

    @BeforeEach
    void setUp() {
        var writer = new RunReportWriter(dir, objectMapper);
        writer.write(RunReportFixtures.partiallyFailedRun("run-old", Instant.parse("2026-01-01T00:00:00Z")));
        writer.write(RunReportFixtures.partiallyFailedRun("run-new", Instant.parse("2026-02-01T00:00:00Z")));
        writer.write(RunReportFixtures.partiallyFailedRun("run-mid", Instant.parse("2026-01-15T00:00:00Z")));
        history = new RunHistoryService(dir, objectMapper);
    }

    @Test
    @DisplayName("lists most recent runs first, up to the limit")
    void listsNewestFirst() {
        var reports = history.list(2);
        assertEquals(2, reports.size());
        assertEquals("run-new", reports.get(0).runId());
        assertEquals("run-mid", reports.get(1).runId());
    }

    @Test
    @DisplayName("reads a report back with its task details")
    void findsReport() {
        var report = history.find("run-old").orElseThrow();
        assertEquals(RunStatus.PARTIALLY_FAILED, report.status());
        assertEquals(3, report.tasks().size());
        assertEquals(TaskStatus.SKIPPED, report.tasks().get(2).status());
        assertEquals("Gap found", report.tasks().get(0).structuredOutput().get("output"));
        assertEquals(5, report.metrics().modelCalls());
    }

    @Test
    @DisplayName("unknown run id and unreadable files are ignored")
    void ignoresGarbage() throws IOException {
        Files.writeString(dir.resolve("broken.json"), "{not json");
        assertTrue(history.find("run-missing").isEmpty());
        assertEquals(3, history.list(10).size());
    }

    @Test
    @DisplayName("missing output directory yields no history")
    void missingDirectory() {
        assertTrue(new RunHistoryService(dir.resolve("absent"), objectMapper).list(5).isEmpty());
    }
}
