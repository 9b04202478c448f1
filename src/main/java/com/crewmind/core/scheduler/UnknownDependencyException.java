package com.crewmind.core.scheduler;

import com.crewmind.core.engine.PipelineConfigurationException;

/**
 * Thrown when a task depends on a task id that is not part of the pipeline.
 */
public class UnknownDependencyException extends PipelineConfigurationException {

    private final String taskId;
    private final String dependencyId;

    public UnknownDependencyException(String taskId, String dependencyId) {
        super("Task '" + taskId + "' depends on unknown task '" + dependencyId + "'");
        this.taskId = taskId;
        this.dependencyId = dependencyId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
