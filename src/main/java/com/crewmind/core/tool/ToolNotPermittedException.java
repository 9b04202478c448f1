package com.crewmind.core.tool;

import java.util.Set;
import java.util.TreeSet;

/**
 * Raised inside the agent loop when the model requests a tool outside the agent's
 * allowed set, or one the catalog does not know. The message goes back into the
 * transcript; the task continues.
 */
public class ToolNotPermittedException extends RuntimeException {

    private final String toolId;

    public ToolNotPermittedException(String toolId, Set<String> allowed) {
        super("Tool '" + toolId + "' is not permitted. Allowed tools: "
                + (allowed.isEmpty() ? "(none)" : String.join(", ", new TreeSet<>(allowed))));
        this.toolId = toolId;
    }

    public String getToolId() {
        return toolId;
    }
}
