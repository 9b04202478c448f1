package com.crewmind.dispatch.cli;

import com.crewmind.config.CrewmindProperties;
import com.crewmind.core.cache.CacheSnapshotStore;
import com.crewmind.core.cache.ResponseCache;
import com.crewmind.core.definition.LoadedPipeline;
import com.crewmind.core.definition.PipelineDefinitionLoader;
import com.crewmind.core.engine.PipelineConfigurationException;
import com.crewmind.core.engine.PipelineOrchestrator;
import com.crewmind.core.engine.RunCancellation;
import com.crewmind.core.events.EventBus;
import com.crewmind.core.model.FailurePolicy;
import com.crewmind.core.model.PipelineDefinition;
import com.crewmind.core.model.PipelineRun;
import com.crewmind.core.model.RunConfig;
import com.crewmind.core.model.RunStatus;
import com.crewmind.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: crewmind run &lt;pipeline-file&gt;
 * <p>
 * Loads a pipeline definition, executes it and prints per-task results.
 * Ctrl-C cancels the run: in-flight tasks finish, the rest are skipped.
 * Exit code is 0 when every task succeeded, 1 when any task failed or was skipped,
 * 2 for an invalid pipeline and 130 for a cancelled run.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a pipeline definition")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_TASKS_FAILED = 1;
    static final int EXIT_INVALID = 2;
    static final int EXIT_CANCELLED = 130;

    @Parameters(index = "0", description = "Pipeline definition file (YAML or JSON)")
    private Path pipelineFile;

    @Option(names = {"--policy", "-p"},
            description = "Failure policy: ${COMPLETION-CANDIDATES} (overrides the file and config)")
    private FailurePolicy policy;

    @Option(names = {"--workers", "-w"}, description = "Maximum tasks running at once")
    private Integer workers;

    @Option(names = {"--watch"}, description = "Print lifecycle events as they happen")
    private boolean watch;

    private final PipelineDefinitionLoader loader;
    private final PipelineOrchestrator orchestrator;
    private final EventBus eventBus;
    private final ResponseCache cache;
    private final CacheSnapshotStore snapshotStore;
    private final CrewmindProperties props;

    public RunCommand(PipelineDefinitionLoader loader, PipelineOrchestrator orchestrator, EventBus eventBus,
                      ResponseCache cache, CacheSnapshotStore snapshotStore, CrewmindProperties props) {
        this.loader = loader;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.cache = cache;
        this.snapshotStore = snapshotStore;
        this.props = props;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RunConfig config;
        LoadedPipeline loaded;
        try {
            loaded = loader.load(pipelineFile, props.toRunConfig());
            config = loaded.runConfig();
            if (policy != null) config = config.withFailurePolicy(policy);
            if (workers != null) config = config.withMaxWorkers(workers);
        } catch (PipelineConfigurationException e) {
            ConsoleOutput.error("Invalid pipeline: " + e.getMessage());
            return EXIT_INVALID;
        }

        var definition = loaded.definition();
        ConsoleOutput.info("Pipeline '" + definition.name() + "': " + definition.tasks().size()
                + " task(s), policy " + config.failurePolicy() + ", " + config.maxWorkers() + " worker(s)");

        var cancellation = new RunCancellation();
        var finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancellation.cancel();
            try {
                finished.await(2, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "crewmind-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            return execute(definition, config, cancellation);
        } finally {
            // the cancel hook holds JVM exit until the report and snapshot are written
            finished.countDown();
            removeHook(hook);
        }
    }

    private int execute(PipelineDefinition definition, RunConfig config, RunCancellation cancellation) {
        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::watchEvent) : null;
        PipelineRun run;
        try {
            run = orchestrator.run(definition, config, cancellation);
        } catch (PipelineConfigurationException e) {
            ConsoleOutput.error("Invalid pipeline: " + e.getMessage());
            return EXIT_INVALID;
        } catch (RuntimeException e) {
            log.error("Run of '{}' crashed", definition.name(), e);
            ConsoleOutput.error("Run failed: " + ConsoleOutput.rootCauseMessage(e));
            return EXIT_TASKS_FAILED;
        } finally {
            if (subscription != null) subscription.unsubscribe();
        }

        exportCacheSnapshot();
        printRun(run);
        return exitCodeFor(run.getStatus());
    }

    static int exitCodeFor(RunStatus status) {
        return switch (status) {
            case COMPLETED -> EXIT_OK;
            case CANCELLED -> EXIT_CANCELLED;
            default -> EXIT_TASKS_FAILED;
        };
    }

    private void printRun(PipelineRun run) {
        System.out.println();
        for (var task : run.getTasks()) {
            TaskResult r = run.result(task.id());
            String detail = r.getError() != null
                    ? r.getError()
                    : r.getWarnings().isEmpty() ? "" : "warnings: " + String.join("; ", r.getWarnings());
            ConsoleOutput.taskLine(task.id(), r.getStatus(), detail.isEmpty() ? null : ConsoleOutput.truncate(detail, 100));
        }
        ConsoleOutput.metrics(run.getMetrics());
        System.out.println(ConsoleOutput.RULE);
        ConsoleOutput.runStatus(run.getRunId(), run.getStatus());
        if (run.getAbortReason() != null) {
            ConsoleOutput.error("Aborted: " + run.getAbortReason());
        }
        ConsoleOutput.info("Report: " + Path.of(props.getOutput().getDirectory()).resolve(run.getRunId() + ".json"));
    }

    private void exportCacheSnapshot() {
        var cacheProps = props.getCache();
        if (cacheProps.isEnabled() && cacheProps.hasSnapshotFile()) {
            snapshotStore.export(cache, Path.of(cacheProps.getSnapshotFile()));
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            log.debug("Shutdown in progress, cancel hook left in place");
        }
    }
}
