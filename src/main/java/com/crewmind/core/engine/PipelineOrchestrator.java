package com.crewmind.core.engine;

import com.crewmind.core.events.CrewmindEvent;
import com.crewmind.core.events.EventBus;
import com.crewmind.core.logging.MdcContext;
import com.crewmind.core.metrics.CrewmindMetrics;
import com.crewmind.core.model.FailurePolicy;
import com.crewmind.core.model.PipelineDefinition;
import com.crewmind.core.model.PipelineRun;
import com.crewmind.core.model.RunConfig;
import com.crewmind.core.model.RunMetrics;
import com.crewmind.core.model.RunStatus;
import com.crewmind.core.model.TaskOutcome;
import com.crewmind.core.model.TaskResult;
import com.crewmind.core.model.TaskSpec;
import com.crewmind.core.model.TaskStatus;
import com.crewmind.core.persistence.RunReportWriter;
import com.crewmind.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a pipeline run end to end.
 * <p>
 * The definition is validated before any task starts. Runnable tasks are dispatched to
 * a fixed pool of {@code maxWorkers} threads as soon as their dependencies are terminal;
 * a plain chain therefore runs sequentially in declaration order. Workers only compute
 * {@link TaskOutcome}s: all results and context entries are committed on the calling
 * thread, which is the single writer of the run's state.
 * <p>
 * On failure, {@link FailurePolicy#SKIP_DOWNSTREAM} skips transitive dependents and keeps
 * independent branches going; {@link FailurePolicy#ABORT} stops dispatching and ends the
 * run FAILED. Cancellation stops dispatching and ends the run CANCELLED. In both cases
 * tasks already running finish and keep their results.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    private static final DateTimeFormatter RUN_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final PipelineValidator validator;
    private final TaskScheduler scheduler;
    private final TaskRunner taskRunner;
    private final RunReportWriter reportWriter;
    private final EventBus eventBus;
    private final CrewmindMetrics metrics;
    private final Clock clock;

    public PipelineOrchestrator(PipelineValidator validator, TaskScheduler scheduler, TaskRunner taskRunner,
                                RunReportWriter reportWriter, EventBus eventBus, CrewmindMetrics metrics,
                                Clock clock) {
        this.validator = validator;
        this.scheduler = scheduler;
        this.taskRunner = taskRunner;
        this.reportWriter = reportWriter;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public PipelineRun run(PipelineDefinition definition, RunConfig config) {
        return run(definition, config, RunCancellation.none());
    }

    /**
     * @throws PipelineConfigurationException when the definition is invalid; no task runs in that case
     */
    public PipelineRun run(PipelineDefinition definition, RunConfig config, RunCancellation cancellation) {
        validator.validate(definition);
        return run(newRunId(), definition, config, cancellation);
    }

    PipelineRun run(String runId, PipelineDefinition definition, RunConfig config, RunCancellation cancellation) {
        var run = new PipelineRun(runId, definition, config, clock.instant());
        MdcContext.setRun(runId);
        log.info("Run {} started: pipeline '{}', {} task(s), policy {}, {} worker(s)",
                runId, definition.name(), definition.tasks().size(), config.failurePolicy(), config.maxWorkers());
        publish("run.started", runId, null, Map.of("pipeline", definition.name(), "tasks", definition.tasks().size()));

        var execution = new Execution(run, definition, config, cancellation);
        try {
            execution.drive();
        } finally {
            execution.shutdown();
        }

        RunStatus status = execution.finalStatus();
        var runMetrics = aggregate(run);
        run.finish(status, clock.instant(), runMetrics);
        log.info("Run {} finished {} in {}ms: {} succeeded, {} failed, {} skipped, {} tool call(s), {} cache hit(s)",
                runId, status, runMetrics.durationMs(), runMetrics.tasksSucceeded(), runMetrics.tasksFailed(),
                runMetrics.tasksSkipped(), runMetrics.toolCalls(), runMetrics.cacheHits());
        metrics.recordRunResult(status.name());
        reportWriter.write(run);
        publish("run.completed", runId, null, Map.of("status", status.name()));
        MdcContext.clear();
        return run;
    }

    private RunMetrics aggregate(PipelineRun run) {
        int succeeded = 0, failed = 0, skipped = 0, toolCalls = 0, modelCalls = 0;
        long cacheHits = 0;
        for (TaskResult r : run.getResults().values()) {
            switch (r.getStatus()) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                default -> { }
            }
            toolCalls += r.getToolCalls();
            cacheHits += r.getCacheHits();
            modelCalls += r.getModelCalls();
        }
        long duration = Duration.between(run.getStartedAt(), clock.instant()).toMillis();
        return new RunMetrics(duration, succeeded, failed, skipped, toolCalls, cacheHits, toolCalls, modelCalls);
    }

    private String newRunId() {
        return "run-" + RUN_ID_TIME.format(clock.instant()) + "-" + UUID.randomUUID().toString().substring(0, 6);
    }

    private void publish(String type, String runId, String taskId, Map<String, Object> payload) {
        eventBus.publish(CrewmindEvent.of(type, runId, taskId, payload));
    }

    /** Mutable state of one run, confined to the orchestrating thread. */
    private final class Execution {

        private final PipelineRun run;
        private final PipelineDefinition definition;
        private final RunConfig config;
        private final RunCancellation cancellation;
        private final Map<String, TaskStatus> statuses = new HashMap<>();
        private final Map<String, TaskSpec> tasksById = new LinkedHashMap<>();
        private final RunContextStore context = new RunContextStore();
        private final ExecutorService pool;
        private final CompletionService<TaskOutcome> completions;
        private int inFlight;
        private String abortReason;

        Execution(PipelineRun run, PipelineDefinition definition, RunConfig config, RunCancellation cancellation) {
            this.run = run;
            this.definition = definition;
            this.config = config;
            this.cancellation = cancellation;
            for (var task : definition.tasks()) {
                statuses.put(task.id(), TaskStatus.PENDING);
                tasksById.put(task.id(), task);
            }
            var counter = new AtomicInteger();
            this.pool = Executors.newFixedThreadPool(config.maxWorkers(), r -> {
                var t = new Thread(r, "crewmind-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            this.completions = new ExecutorCompletionService<>(pool);
        }

        void drive() {
            while (true) {
                if (!stopDispatching()) {
                    if (config.failurePolicy() == FailurePolicy.SKIP_DOWNSTREAM) {
                        skipBlocked();
                    }
                    dispatch();
                }
                if (inFlight == 0) break;
                collectOne();
            }
            String reason = cancellation.isCancelled() ? "run cancelled"
                    : abortReason != null ? "run aborted" : "dependencies never satisfied";
            for (var task : definition.tasks()) {
                if (statuses.get(task.id()) == TaskStatus.PENDING) {
                    skip(task, reason);
                }
            }
        }

        private boolean stopDispatching() {
            return abortReason != null || cancellation.isCancelled();
        }

        private void skipBlocked() {
            Map<String, String> blocked;
            while (!(blocked = scheduler.findBlocked(definition.tasks(), statuses)).isEmpty()) {
                blocked.forEach((taskId, reason) -> skip(tasksById.get(taskId), reason));
            }
        }

        private void dispatch() {
            int free = config.maxWorkers() - inFlight;
            if (free <= 0) return;
            List<String> wave = scheduler.computeNextWave(definition.tasks(), statuses, free);
            for (var taskId : wave) {
                var task = tasksById.get(taskId);
                var agent = definition.agents().get(task.agentId());
                var view = context.viewFor(task);
                run.result(taskId).markRunning(clock.instant());
                statuses.put(taskId, TaskStatus.RUNNING);
                inFlight++;
                log.info("Dispatching task '{}' to agent '{}'", taskId, agent.id());
                publish("task.started", run.getRunId(), taskId, Map.of("agent", agent.id()));

                String runId = run.getRunId();
                completions.submit(() -> {
                    MdcContext.setTask(runId, taskId, agent.role());
                    try {
                        return taskRunner.run(task, agent, view, config);
                    } finally {
                        MdcContext.clear();
                    }
                });
            }
        }

        private void collectOne() {
            TaskOutcome outcome;
            try {
                Future<TaskOutcome> done = completions.take();
                outcome = done.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel();
                throw new IllegalStateException("Interrupted while waiting for tasks", e);
            } catch (ExecutionException e) {
                // TaskRunner never throws; anything here is a programming error
                throw new IllegalStateException("Task worker crashed", e.getCause());
            }
            inFlight--;
            try {
                commit(outcome);
            } catch (RunAbortedException e) {
                // later failures of tasks already in flight do not replace the trigger
                if (abortReason == null) {
                    abortReason = e.getMessage();
                    run.setAbortReason(abortReason);
                }
                log.error(e.getMessage());
            }
        }

        private void commit(TaskOutcome outcome) {
            var result = run.result(outcome.taskId());
            result.complete(outcome);
            statuses.put(outcome.taskId(), outcome.status());
            var task = tasksById.get(outcome.taskId());
            metrics.recordTaskExecution(task.agentId(), outcome.status().name(),
                    result.getElapsedMs() == null ? 0 : result.getElapsedMs());

            if (outcome.status() == TaskStatus.SUCCEEDED) {
                context.commit(outcome.taskId(), outcome.structuredOutput() != null
                        ? outcome.structuredOutput()
                        : Map.of("raw_output", outcome.rawOutput() == null ? "" : outcome.rawOutput()));
                log.info("Task '{}' succeeded ({} tool call(s), {} cache hit(s))",
                        outcome.taskId(), outcome.toolCalls(), outcome.cacheHits());
                publish("task.succeeded", run.getRunId(), outcome.taskId(),
                        Map.of("toolCalls", outcome.toolCalls(), "cacheHits", outcome.cacheHits()));
                return;
            }

            log.warn("Task '{}' failed: {}", outcome.taskId(), outcome.error());
            publish("task.failed", run.getRunId(), outcome.taskId(),
                    Map.of("error", outcome.error() == null ? "" : outcome.error()));
            if (config.failurePolicy() == FailurePolicy.ABORT) {
                throw new RunAbortedException(outcome.taskId(), String.valueOf(outcome.error()));
            }
        }

        private void skip(TaskSpec task, String reason) {
            run.result(task.id()).skip(reason, clock.instant());
            statuses.put(task.id(), TaskStatus.SKIPPED);
            log.info("Task '{}' skipped: {}", task.id(), reason);
            publish("task.skipped", run.getRunId(), task.id(), Map.of("reason", reason));
        }

        RunStatus finalStatus() {
            if (cancellation.isCancelled()) return RunStatus.CANCELLED;
            if (abortReason != null) return RunStatus.FAILED;
            boolean allSucceeded = statuses.values().stream().allMatch(s -> s == TaskStatus.SUCCEEDED);
            return allSucceeded ? RunStatus.COMPLETED : RunStatus.PARTIALLY_FAILED;
        }

        void shutdown() {
            pool.shutdownNow();
        }
    }
}
