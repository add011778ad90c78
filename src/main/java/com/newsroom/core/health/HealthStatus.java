package com.newsroom.core.health;

import java.util.Map;

/**
 * Status of one monitored component, as listed by the {@code health} command.
 *
 * @param component scheduler, workers, cost or system
 * @param status    coarse status of the component
 * @param detail    one-line human readable summary
 * @param metadata  extra figures behind the summary
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
