package com.crewmind.core.model;

/**
 * Overall status of a pipeline run.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    PARTIALLY_FAILED,  // at least one task failed, independent branches still ran
    FAILED,            // aborted under the ABORT policy, or nothing succeeded
    CANCELLED
}
