package com.crewmind.core.engine;

/**
 * Terminal failure of a single task. Recorded on the task's result; dependents are
 * skipped according to the run's failure policy.
 */
public class TaskFailureException extends RuntimeException {

    private final String taskId;

    public TaskFailureException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public TaskFailureException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
