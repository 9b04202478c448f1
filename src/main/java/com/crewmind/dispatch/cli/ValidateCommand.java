package com.crewmind.dispatch.cli;

import com.crewmind.config.CrewmindProperties;
import com.crewmind.core.definition.PipelineDefinitionLoader;
import com.crewmind.core.engine.PipelineConfigurationException;
import com.crewmind.core.engine.PipelineValidator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: crewmind validate &lt;pipeline-file&gt;
 * <p>
 * Checks a definition without running it and prints the execution order.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a pipeline definition")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Pipeline definition file (YAML or JSON)")
    private Path pipelineFile;

    private final PipelineDefinitionLoader loader;
    private final PipelineValidator validator;
    private final CrewmindProperties props;

    public ValidateCommand(PipelineDefinitionLoader loader, PipelineValidator validator, CrewmindProperties props) {
        this.loader = loader;
        this.validator = validator;
        this.props = props;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var loaded = loader.load(pipelineFile, props.toRunConfig());
            List<String> order = validator.validate(loaded.definition());
            var definition = loaded.definition();
            ConsoleOutput.success("Pipeline '" + definition.name() + "' is valid: "
                    + definition.agents().size() + " agent(s), " + definition.tasks().size() + " task(s)");
            System.out.println();
            System.out.println("EXECUTION ORDER:");
            for (int i = 0; i < order.size(); i++) {
                String id = order.get(i);
                var task = definition.tasks().stream().filter(t -> t.id().equals(id)).findFirst();
                String deps = task.map(t -> t.dependencies().isEmpty() ? "" : "  <- " + String.join(", ", t.dependencies()))
                        .orElse("");
                System.out.printf("  %2d. %s%s%n", i + 1, id, deps);
            }
            return RunCommand.EXIT_OK;
        } catch (PipelineConfigurationException e) {
            ConsoleOutput.error("Invalid pipeline: " + e.getMessage());
            return RunCommand.EXIT_INVALID;
        }
    }
}
