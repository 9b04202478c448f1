package com.crewmind.core.tool;

/**
 * Thrown when an external tool call fails after retries, times out, or cannot
 * obtain a rate-limit slot. Fails the task that issued the call.
 */
public class ToolInvocationException extends RuntimeException {

    private final String toolId;

    public ToolInvocationException(String toolId, String message) {
        super(message);
        this.toolId = toolId;
    }

    public ToolInvocationException(String toolId, String message, Throwable cause) {
        super(message, cause);
        this.toolId = toolId;
    }

    public String getToolId() {
        return toolId;
    }
}
