package com.crewmind.core.model;

import java.io.Serializable;

/**
 * Per-run execution settings.
 *
 * @param failurePolicy        behaviour on task failure
 * @param maxWorkers           maximum tasks executing concurrently
 * @param maxIterations        default tool-call round budget for agents that do not set one
 * @param schemaFailurePolicy  behaviour on schema violations
 * @param maxSchemaRetries     corrective re-prompts before the schema policy's fallback applies
 */
public record RunConfig(
    FailurePolicy failurePolicy,
    int maxWorkers,
    int maxIterations,
    SchemaFailurePolicy schemaFailurePolicy,
    int maxSchemaRetries
) implements Serializable {

    public RunConfig {
        if (failurePolicy == null) failurePolicy = FailurePolicy.SKIP_DOWNSTREAM;
        if (schemaFailurePolicy == null) schemaFailurePolicy = SchemaFailurePolicy.REPROMPT_THEN_DEGRADE;
        if (maxWorkers < 1) maxWorkers = 1;
        if (maxIterations < 1) maxIterations = 5;
        if (maxSchemaRetries < 0) maxSchemaRetries = 0;
    }

    public static RunConfig defaults() {
        return new RunConfig(FailurePolicy.SKIP_DOWNSTREAM, 1, 5, SchemaFailurePolicy.REPROMPT_THEN_DEGRADE, 1);
    }

    public RunConfig withFailurePolicy(FailurePolicy policy) {
        return new RunConfig(policy, maxWorkers, maxIterations, schemaFailurePolicy, maxSchemaRetries);
    }

    public RunConfig withMaxWorkers(int workers) {
        return new RunConfig(failurePolicy, workers, maxIterations, schemaFailurePolicy, maxSchemaRetries);
    }
}
