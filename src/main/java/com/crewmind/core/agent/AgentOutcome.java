package com.crewmind.core.agent;

import java.util.List;

/**
 * Result of one agent execution.
 *
 * @param rawOutput      final (or best partial) answer text
 * @param toolCalls      tool invocations that reached the tool invoker
 * @param cacheHits      tool requests served from the response cache
 * @param modelCalls     completions requested from the model
 * @param rounds         tool rounds consumed, including refused requests
 * @param budgetExceeded true when the loop stopped because the round budget ran out
 * @param warnings       non-fatal issues, e.g. the iteration budget warning
 */
public record AgentOutcome(
    String rawOutput,
    int toolCalls,
    int cacheHits,
    int modelCalls,
    int rounds,
    boolean budgetExceeded,
    List<String> warnings
) {

    public static final String ITERATION_BUDGET_EXCEEDED = "IterationBudgetExceeded";

    public AgentOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
