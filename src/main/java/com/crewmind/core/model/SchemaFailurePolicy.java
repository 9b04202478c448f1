package com.crewmind.core.model;

/**
 * What happens when an agent's output does not satisfy the task's output schema.
 */
public enum SchemaFailurePolicy {
    /** Re-prompt the agent with the violations, then accept raw-only output. */
    REPROMPT_THEN_DEGRADE,
    /** Accept raw-only output immediately. */
    DEGRADE,
    /** Re-prompt the agent with the violations, then fail the task. */
    FAIL
}
