package com.newsroom.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.newsroom.core.health.HealthMonitor;
import com.newsroom.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: newsroom health
 * <p>
 * Takes a health sample and prints per-component status, or the raw snapshot with --json.
 * Exits with 1 when the system is not admitting work.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthMonitor healthMonitor;

    @Option(names = "--json", description = "Print the health snapshot as JSON")
    boolean json;

    public HealthCommand(@Autowired(required = false) HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @Override
    public Integer call() throws JsonProcessingException {
        if (healthMonitor == null) {
            ConsoleOutput.error("Health monitor not available");
            return 1;
        }
        var snapshot = healthMonitor.sample();

        if (json) {
            var mapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .enable(SerializationFeature.INDENT_OUTPUT);
            System.out.println(mapper.writeValueAsString(snapshot));
            return snapshot.health().isAdmitting() ? 0 : 1;
        }

        ConsoleOutput.printBanner();
        var checks = healthMonitor.componentStatuses();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }
        snapshot.issues().forEach(ConsoleOutput::error);
        snapshot.warnings().forEach(ConsoleOutput::warn);

        System.out.println("──────────────────────────────────");
        long up = checks.stream().filter(HealthStatus::isUp).count();
        ConsoleOutput.info(up + "/" + checks.size() + " components up");
        if (snapshot.health().isAdmitting()) {
            ConsoleOutput.success("Overall: " + snapshot.health() + ", admitting work");
            return 0;
        }
        ConsoleOutput.error("Overall: " + snapshot.health() + ", admission paused");
        return 1;
    }
}
