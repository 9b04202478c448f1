package com.crewmind.core.scheduler;

import com.crewmind.core.engine.PipelineConfigurationException;

import java.util.List;

/**
 * Thrown when the task dependency graph contains a cycle.
 */
public class CyclicDependencyException extends PipelineConfigurationException {

    private final List<String> tasksInCycle;

    public CyclicDependencyException(List<String> tasksInCycle) {
        super("Dependency cycle among tasks: " + tasksInCycle);
        this.tasksInCycle = List.copyOf(tasksInCycle);
    }

    public List<String> getTasksInCycle() {
        return tasksInCycle;
    }
}
