package com.crewmind.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * A configured persona that performs tasks.
 *
 * @param id            identifier referenced by tasks
 * @param role          short role name shown to the model (e.g. "Market Research Specialist")
 * @param goal          what the agent is trying to achieve
 * @param backstory     background context that shapes the agent's answers
 * @param allowedTools  tool ids this agent may invoke
 * @param model         bound language model configuration
 * @param maxIterations maximum tool-call rounds per task; 0 means "use the run default"
 */
public record AgentSpec(
    String id,
    String role,
    String goal,
    String backstory,
    Set<String> allowedTools,
    ModelConfig model,
    int maxIterations
) implements Serializable {

    public AgentSpec {
        allowedTools = allowedTools == null ? Set.of() : Set.copyOf(allowedTools);
    }

    public boolean mayUse(String toolId) {
        return toolId != null && allowedTools.contains(toolId);
    }

    public int effectiveMaxIterations(int runDefault) {
        return maxIterations > 0 ? maxIterations : runDefault;
    }
}
