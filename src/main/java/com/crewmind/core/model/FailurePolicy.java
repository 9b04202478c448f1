package com.crewmind.core.model;

/**
 * What the orchestrator does when a task fails.
 * <p>
 * SKIP_DOWNSTREAM: dependents of the failed task are skipped, independent branches continue.
 * ABORT: no further tasks are dispatched and the run ends FAILED.
 */
public enum FailurePolicy {
    SKIP_DOWNSTREAM,
    ABORT
}
