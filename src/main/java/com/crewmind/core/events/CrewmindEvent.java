package com.crewmind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a pipeline run executes, consumed by the CLI progress view.
 *
 * @param eventType event type (e.g. "run.started", "task.started", "task.skipped", "run.completed")
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record CrewmindEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static CrewmindEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new CrewmindEvent(eventType, runId, taskId, payload == null ? Map.of() : payload, Instant.now());
    }
}
