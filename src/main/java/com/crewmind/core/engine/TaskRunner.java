package com.crewmind.core.engine;

import com.crewmind.core.agent.AgentExecutor;
import com.crewmind.core.agent.AgentOutcome;
import com.crewmind.core.agent.AgentPromptBuilder;
import com.crewmind.core.llm.ChatTurn;
import com.crewmind.core.metrics.CrewmindMetrics;
import com.crewmind.core.model.AgentSpec;
import com.crewmind.core.model.RunConfig;
import com.crewmind.core.model.SchemaFailurePolicy;
import com.crewmind.core.model.TaskOutcome;
import com.crewmind.core.model.TaskSpec;
import com.crewmind.core.model.TaskStatus;
import com.crewmind.core.schema.SchemaValidator;
import com.crewmind.core.schema.SchemaViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes one task on a worker thread: render the instruction, run the agent, validate
 * the answer. Never throws; every failure becomes a FAILED {@link TaskOutcome}.
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final AgentExecutor agentExecutor;
    private final AgentPromptBuilder promptBuilder;
    private final InstructionRenderer renderer;
    private final SchemaValidator schemaValidator;
    private final CrewmindMetrics metrics;
    private final Clock clock;

    public TaskRunner(AgentExecutor agentExecutor, AgentPromptBuilder promptBuilder, InstructionRenderer renderer,
                      SchemaValidator schemaValidator, CrewmindMetrics metrics, Clock clock) {
        this.agentExecutor = agentExecutor;
        this.promptBuilder = promptBuilder;
        this.renderer = renderer;
        this.schemaValidator = schemaValidator;
        this.metrics = metrics;
        this.clock = clock;
    }

    public TaskOutcome run(TaskSpec task, AgentSpec agent, Map<String, Map<String, Object>> context, RunConfig config) {
        Instant startedAt = clock.instant();
        var tally = new Tally();
        try {
            String taskMessage = promptBuilder.taskMessage(task, renderer.render(task, context));
            AgentOutcome outcome = tally.add(agentExecutor.execute(agent, taskMessage, config.maxIterations()));
            return validate(task, agent, config, taskMessage, outcome, tally, startedAt);
        } catch (TaskFailureException e) {
            return failed(task, e.getMessage(), e.getCause(), tally, startedAt);
        } catch (RuntimeException e) {
            return failed(task, rootMessage(e), e, tally, startedAt);
        }
    }

    private TaskOutcome validate(TaskSpec task, AgentSpec agent, RunConfig config, String taskMessage,
                                 AgentOutcome outcome, Tally tally, Instant startedAt) {
        String raw = outcome.rawOutput();
        int retriesLeft = config.schemaFailurePolicy() == SchemaFailurePolicy.REPROMPT_THEN_DEGRADE
                ? config.maxSchemaRetries() : 0;

        while (true) {
            try {
                Map<String, Object> structured = schemaValidator.validate(raw, task.outputSchema());
                return new TaskOutcome(task.id(), TaskStatus.SUCCEEDED, raw, structured, null, tally.warnings,
                        tally.toolCalls, tally.cacheHits, tally.modelCalls, tally.attempts, startedAt, clock.instant());
            } catch (SchemaViolationException violation) {
                metrics.recordSchemaViolation(task.id());
                log.warn("Task '{}' output violates schema: {}", task.id(), violation.getFieldNames());

                if (retriesLeft > 0) {
                    retriesLeft--;
                    var transcript = List.of(
                            ChatTurn.user(taskMessage),
                            ChatTurn.assistant(raw),
                            ChatTurn.user(promptBuilder.schemaCorrectionMessage(violation)));
                    raw = tally.add(agentExecutor.execute(agent, transcript, config.maxIterations())).rawOutput();
                    continue;
                }

                if (config.schemaFailurePolicy() == SchemaFailurePolicy.FAIL) {
                    throw new TaskFailureException(task.id(), violation.getMessage());
                }
                tally.warnings.add("DegradedOutput: " + violation.getMessage());
                return new TaskOutcome(task.id(), TaskStatus.SUCCEEDED, raw, null, null, tally.warnings,
                        tally.toolCalls, tally.cacheHits, tally.modelCalls, tally.attempts, startedAt, clock.instant());
            }
        }
    }

    private TaskOutcome failed(TaskSpec task, String message, Throwable cause, Tally tally, Instant startedAt) {
        if (cause != null) {
            log.warn("Task '{}' failed: {}", task.id(), message, cause);
        } else {
            log.warn("Task '{}' failed: {}", task.id(), message);
        }
        return new TaskOutcome(task.id(), TaskStatus.FAILED, tally.lastRaw, null, message, tally.warnings,
                tally.toolCalls, tally.cacheHits, tally.modelCalls, Math.max(1, tally.attempts), startedAt,
                clock.instant());
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (root != e && root.getMessage() != null && !msg.contains(root.getMessage())) {
            msg = msg + " (" + root.getMessage() + ")";
        }
        return msg;
    }

    /** Counters summed over every agent execution of the task. */
    private static final class Tally {
        int toolCalls;
        int cacheHits;
        int modelCalls;
        int attempts;
        String lastRaw;
        final List<String> warnings = new ArrayList<>();

        AgentOutcome add(AgentOutcome outcome) {
            toolCalls += outcome.toolCalls();
            cacheHits += outcome.cacheHits();
            modelCalls += outcome.modelCalls();
            attempts++;
            lastRaw = outcome.rawOutput();
            warnings.addAll(outcome.warnings());
            return outcome;
        }
    }
}
