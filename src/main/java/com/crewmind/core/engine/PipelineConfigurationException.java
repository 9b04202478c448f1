package com.crewmind.core.engine;

/**
 * Thrown when a pipeline definition cannot be executed as configured
 * (bad dependency graph, unknown agent, tool or model provider).
 * Raised before any task runs.
 */
public class PipelineConfigurationException extends RuntimeException {
    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
