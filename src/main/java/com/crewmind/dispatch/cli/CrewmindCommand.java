package com.crewmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Crewmind.
 * Routes to subcommands: run, validate, history, inspect, health.
 */
@Command(
        name = "crewmind",
        mixinStandardHelpOptions = true,
        version = "Crewmind 0.1.0",
        description = "Runs pipelines of tool-using LLM agents",
        subcommands = {
                RunCommand.class,
                ValidateCommand.class,
                HistoryCommand.class,
                InspectCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CrewmindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
