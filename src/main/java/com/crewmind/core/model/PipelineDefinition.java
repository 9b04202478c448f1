package com.crewmind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agents and tasks that make up one pipeline, as loaded from a definition file.
 */
public record PipelineDefinition(
    String name,
    Map<String, AgentSpec> agents,
    List<TaskSpec> tasks
) implements Serializable {

    public PipelineDefinition {
        if (name == null || name.isBlank()) name = "pipeline";
        agents = agents == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(agents));
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
