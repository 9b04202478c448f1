package com.crewmind.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskResultTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static TaskOutcome succeeded() {
        return new TaskOutcome("a", TaskStatus.SUCCEEDED, "raw", Map.of("output", "raw"), null, List.of(),
                1, 0, 2, 1, T0, T0.plusSeconds(2));
    }

    @Test
    @DisplayName("terminal state is written once")
    void terminalOnce() {
        var result = new TaskResult("a", "agent");
        result.markRunning(T0);
        result.complete(succeeded());

        assertEquals(TaskStatus.SUCCEEDED, result.getStatus());
        assertEquals(2000L, result.getElapsedMs());
        assertThrows(IllegalStateException.class, () -> result.complete(succeeded()));
        assertThrows(IllegalStateException.class, () -> result.skip("late", T0));
    }

    @Test
    @DisplayName("a task must be running before it completes")
    void completeRequiresRunning() {
        var result = new TaskResult("a", "agent");
        assertThrows(IllegalStateException.class, () -> result.complete(succeeded()));
    }

    @Test
    @DisplayName("skipped task keeps its reason and never started")
    void skip() {
        var result = new TaskResult("a", "agent");
        result.skip("dependency 'x' failed", T0);
        assertEquals(TaskStatus.SKIPPED, result.getStatus());
        assertEquals("dependency 'x' failed", result.getError());
        assertNull(result.getStartedAt());
        assertNull(result.getElapsedMs());
    }

    @Test
    @DisplayName("outcome rejects structured output on failure and non-terminal statuses")
    void outcomeInvariants() {
        assertThrows(IllegalArgumentException.class, () -> new TaskOutcome("a", TaskStatus.FAILED, "raw",
                Map.of("x", 1), "boom", List.of(), 0, 0, 0, 1, T0, T0));
        assertThrows(IllegalArgumentException.class, () -> new TaskOutcome("a", TaskStatus.RUNNING, null,
                null, null, List.of(), 0, 0, 0, 0, T0, T0));
    }
}
