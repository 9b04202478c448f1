package com.crewmind.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunReportWriterTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:15:30Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @TempDir
    Path dir;

    @Test
    @DisplayName("writes JSON report with every task, including skipped ones")
    void writesJson() throws IOException {
        var run = RunReportFixtures.partiallyFailedRun("run-1", STARTED);

        var written = new RunReportWriter(dir.resolve("runs"), objectMapper).write(run);

        assertTrue(written.isPresent());
        assertEquals(dir.resolve("runs").resolve("run-1.json"), written.get());
        JsonNode json = objectMapper.readTree(written.get().toFile());
        assertEquals("PARTIALLY_FAILED", json.get("status").asText());
        assertEquals("market-research", json.get("pipeline").asText());
        assertEquals("2026-03-01T10:15:30Z", json.get("startedAt").asText());
        assertEquals(3, json.get("tasks").size());
        JsonNode strategy = json.get("tasks").get(2);
        assertEquals("SKIPPED", strategy.get("status").asText());
        assertEquals("dependency 'analysis' failed", strategy.get("error").asText());
        assertEquals(1500, json.get("tasks").get(0).get("elapsedMs").asLong());
        assertEquals(1, json.get("metrics").get("cacheHits").asInt());
    }

    @Test
    @DisplayName("writes a readable summary next to the JSON")
    void writesSummary() throws IOException {
        new RunReportWriter(dir, objectMapper).write(RunReportFixtures.partiallyFailedRun("run-2", STARTED));

        String txt = Files.readString(dir.resolve("run-2.txt"));
        assertTrue(txt.startsWith("Pipeline: market-research\nRun: run-2\nStatus: PARTIALLY_FAILED\n"));
        assertTrue(txt.contains("## research (researcher) [SUCCEEDED]"));
        assertTrue(txt.contains("Warning: IterationBudgetExceeded"));
        assertTrue(txt.contains("## analysis (researcher) [FAILED]\nError: Tool 'web_search' failed"));
        assertTrue(txt.contains("## strategy (researcher) [SKIPPED]\nError: dependency 'analysis' failed"));
    }

    @Test
    @DisplayName("write failure is reported as empty, not thrown")
    void writeFailureIsContained() throws IOException {
        Path notADirectory = Files.writeString(dir.resolve("blocker"), "x");

        var written = assertDoesNotThrow(() -> new RunReportWriter(notADirectory, objectMapper)
                .write(RunReportFixtures.partiallyFailedRun("run-3", STARTED)));

        assertTrue(written.isEmpty());
    }
}
