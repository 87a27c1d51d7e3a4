package com.taskrunner.dispatch.cli;

import com.taskrunner.core.health.HealthCheckService;
import com.taskrunner.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: taskrunner health
 * <p>
 * Runs every health check; exits non-zero unless all components are up. A degraded
 * component is reported as such but still fails the check.
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
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            if (!check.metadata().isEmpty()) {
                label += " " + check.metadata();
            }
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        switch (HealthStatus.overall(checks)) {
            case UP -> {
                ConsoleOutput.success("Overall: all systems operational");
                return 0;
            }
            case DEGRADED -> ConsoleOutput.info("Overall: degraded, see the components above");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return 1;
    }
}
