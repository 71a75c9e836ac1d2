package com.roundpilot.dispatch.cli;

import com.roundpilot.core.health.HealthCheckService;
import com.roundpilot.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: roundpilot health
 * <p>
 * Pre-flight check before {@code run}: database, phase model, layout and input device.
 * Exits with 1 when any of them is down, since {@code run} would fail on it.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check that everything a run needs is in place")
@Component
public class HealthCommand implements Callable<Integer> {

    static final int EXIT_NOT_READY = 1;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return EXIT_NOT_READY;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String line = check.component() + ": " + check.detail() + formatMetadata(check.metadata());
            switch (check.status()) {
                case UP -> ConsoleOutput.success(line);
                case DEGRADED -> ConsoleOutput.info("(degraded) " + line);
                case DOWN -> ConsoleOutput.error(line);
            }
        }

        List<String> down = componentsWith(checks, HealthStatus.Status.DOWN);
        List<String> degraded = componentsWith(checks, HealthStatus.Status.DEGRADED);
        if (!down.isEmpty()) {
            ConsoleOutput.error("Not ready to run, down: " + String.join(", ", down));
            return EXIT_NOT_READY;
        }
        String sources = checks.stream()
                .map(c -> c.metadata().get("sources"))
                .filter(s -> s != null)
                .findFirst()
                .map(s -> " " + s + " sources")
                .orElse("");
        if (!degraded.isEmpty()) {
            ConsoleOutput.info("Ready to run" + sources + " with warnings: " + String.join(", ", degraded));
        } else {
            ConsoleOutput.success("Ready to run" + sources);
        }
        return 0;
    }

    private static List<String> componentsWith(List<HealthStatus> checks, HealthStatus.Status status) {
        return checks.stream()
                .filter(c -> c.status() == status)
                .map(HealthStatus::component)
                .collect(Collectors.toList());
    }

    static String formatMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        return metadata.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" ", " [", "]"));
    }
}
