package com.newsroom.core.model;

import java.time.Duration;

/**
 * Resource hint attached to a task.
 *
 * @param workerType        worker pool the task needs, or null when any executor will do
 * @param estimatedDuration expected run time
 * @param estimatedCost     expected spend in USD
 * @param slots             concurrency slots the task occupies
 */
public record TaskResource(
    String workerType,
    Duration estimatedDuration,
    double estimatedCost,
    int slots
) {

    public static TaskResource defaults() {
        return new TaskResource(null, Duration.ofMinutes(5), 0.01, 1);
    }

    public TaskResource {
        if (estimatedDuration == null) estimatedDuration = Duration.ofMinutes(5);
        if (slots < 1) slots = 1;
    }
}
