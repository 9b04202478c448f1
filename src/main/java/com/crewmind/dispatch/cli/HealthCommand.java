package com.crewmind.dispatch.cli;

import com.crewmind.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: crewmind health
 * <p>
 * Runs every health check and prints the results. Exits 1 when any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        boolean allUp = true;
        boolean anyDown = false;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                    anyDown = true;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
        return anyDown ? 1 : 0;
    }
}
