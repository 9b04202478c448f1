package com.crewmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A unit of pipeline work bound to one agent.
 *
 * @param id                      unique identifier (e.g. "research")
 * @param agentId                 agent that performs the task
 * @param description             human-readable summary
 * @param instruction             instruction template; {@code {{taskId}}} and {@code {{taskId.field}}}
 *                                placeholders are resolved from dependency outputs
 * @param expectedOutput          free-text description of the deliverable shown to the agent
 * @param dependencies            ids of tasks whose outputs this task consumes, in order
 * @param outputSchema            structured output contract
 * @param allowSkippedDependencies whether a SKIPPED dependency still lets this task start
 */
public record TaskSpec(
    String id,
    String agentId,
    String description,
    String instruction,
    String expectedOutput,
    List<String> dependencies,
    OutputSchema outputSchema,
    boolean allowSkippedDependencies
) implements Serializable {

    public TaskSpec {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (outputSchema == null) outputSchema = OutputSchema.EMPTY;
        if (description == null) description = "";
        if (expectedOutput == null) expectedOutput = "";
    }

    /** Instruction template, falling back to the description when no template was given. */
    public String instructionTemplate() {
        return instruction != null && !instruction.isBlank() ? instruction : description;
    }
}
