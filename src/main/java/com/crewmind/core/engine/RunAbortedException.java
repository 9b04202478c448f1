package com.crewmind.core.engine;

/**
 * Stops dispatching under the ABORT failure policy after a task fails.
 */
public class RunAbortedException extends RuntimeException {

    private final String failedTaskId;

    public RunAbortedException(String failedTaskId, String reason) {
        super("Run aborted: task '" + failedTaskId + "' failed: " + reason);
        this.failedTaskId = failedTaskId;
    }

    public String getFailedTaskId() {
        return failedTaskId;
    }
}
