package com.crewmind.core.agent;

import com.crewmind.core.engine.PipelineConfigurationException;
import com.crewmind.core.llm.ChatTurn;
import com.crewmind.core.llm.LanguageModel;
import com.crewmind.core.llm.LanguageModelRegistry;
import com.crewmind.core.llm.ModelRequest;
import com.crewmind.core.metrics.CrewmindMetrics;
import com.crewmind.core.model.AgentSpec;
import com.crewmind.core.ratelimit.RateLimiter;
import com.crewmind.core.tool.ToolGateway;
import com.crewmind.core.tool.ToolInvoker;
import com.crewmind.core.tool.ToolNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the bounded tool loop for one agent.
 * <p>
 * Each round the model sees the system prompt and the transcript and either
 * answers or requests one tool. Requests outside the agent's allowed set are
 * refused in the transcript and still consume a round. When the round budget is
 * spent the model is asked once more for a final answer; the result is returned
 * with an {@value AgentOutcome#ITERATION_BUDGET_EXCEEDED} warning rather than failing.
 * <p>
 * {@link com.crewmind.core.tool.ToolInvocationException} from a tool or model call is not caught here.
 */
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    private final LanguageModelRegistry models;
    private final ToolGateway toolGateway;
    private final RateLimiter rateLimiter;
    private final ToolInvoker callInvoker;
    private final AgentPromptBuilder promptBuilder;
    private final AgentResponseParser responseParser;
    private final CrewmindMetrics metrics;

    public AgentExecutor(LanguageModelRegistry models, ToolGateway toolGateway, RateLimiter rateLimiter,
                         ToolInvoker callInvoker, AgentPromptBuilder promptBuilder,
                         AgentResponseParser responseParser, CrewmindMetrics metrics) {
        this.models = models;
        this.toolGateway = toolGateway;
        this.rateLimiter = rateLimiter;
        this.callInvoker = callInvoker;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.metrics = metrics;
    }

    public AgentOutcome execute(AgentSpec agent, String taskMessage, int defaultMaxIterations) {
        return execute(agent, List.of(ChatTurn.user(taskMessage)), defaultMaxIterations);
    }

    /**
     * Continues a conversation that starts with {@code transcript}.
     */
    public AgentOutcome execute(AgentSpec agent, List<ChatTurn> initialTranscript, int defaultMaxIterations) {
        LanguageModel model = models.find(agent.model().provider())
                .orElseThrow(() -> new PipelineConfigurationException(
                        "No language model registered for provider '" + agent.model().provider() + "'"));
        int maxRounds = agent.effectiveMaxIterations(defaultMaxIterations);
        String systemPrompt = promptBuilder.systemPrompt(agent);
        var transcript = new ArrayList<>(initialTranscript);

        int rounds = 0;
        int toolCalls = 0;
        int cacheHits = 0;
        int modelCalls = 0;
        String lastToolOutput = null;

        while (true) {
            String reply = callModel(model, systemPrompt, transcript, agent);
            modelCalls++;
            AgentAction action = responseParser.parse(reply);

            if (!action.isToolCall()) {
                metrics.recordAgentIterations(rounds);
                return new AgentOutcome(action.content(), toolCalls, cacheHits, modelCalls, rounds, false, List.of());
            }

            transcript.add(ChatTurn.assistant(reply));

            if (rounds >= maxRounds) {
                log.warn("Agent '{}' exhausted its {} tool round(s)", agent.id(), maxRounds);
                transcript.add(ChatTurn.user(promptBuilder.budgetExhaustedMessage()));
                String last = callModel(model, systemPrompt, transcript, agent);
                modelCalls++;
                AgentAction finalAction = responseParser.parse(last);
                String partial = finalAction.isToolCall()
                        ? (lastToolOutput != null ? lastToolOutput : last)
                        : finalAction.content();
                metrics.recordAgentIterations(rounds);
                return new AgentOutcome(partial, toolCalls, cacheHits, modelCalls, rounds, true,
                        List.of(AgentOutcome.ITERATION_BUDGET_EXCEEDED + ": agent '" + agent.id()
                                + "' used all " + maxRounds + " tool round(s)"));
            }
            rounds++;

            if (!agent.mayUse(action.toolId()) || !toolGateway.getCatalog().contains(action.toolId())) {
                var refused = new ToolNotPermittedException(action.toolId(), agent.allowedTools());
                log.info("Agent '{}' requested refused tool '{}'", agent.id(), action.toolId());
                transcript.add(ChatTurn.user(promptBuilder.toolErrorMessage(refused.getMessage())));
                continue;
            }

            log.info("Agent '{}' round {}/{} → tool '{}'", agent.id(), rounds, maxRounds, action.toolId());
            var result = toolGateway.call(action.toolId(), action.parameters());
            if (result.cached()) {
                cacheHits++;
            } else {
                toolCalls++;
            }
            lastToolOutput = result.output();
            transcript.add(ChatTurn.user(promptBuilder.toolResultMessage(result.toolId(), result.output())));
        }
    }

    private String callModel(LanguageModel model, String systemPrompt, List<ChatTurn> transcript, AgentSpec agent) {
        String caller = "model:" + model.provider();
        var waited = callInvoker.awaitSlot(rateLimiter, caller);
        metrics.recordRateLimitWait(waited.toMillis());
        metrics.recordModelCall(model.provider());
        var request = new ModelRequest(systemPrompt, transcript, agent.model());
        return callInvoker.execute(caller, () -> model.complete(request));
    }
}
