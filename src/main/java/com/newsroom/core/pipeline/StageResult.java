package com.newsroom.core.pipeline;

import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskStatus;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one stage attempt, as seen by its quality gate.
 *
 * @param stageId   the stage
 * @param attempt   1-based attempt number
 * @param tasks     the attempt's tasks in their final state
 * @param artifacts results of the attempt's completed tasks, in submission order
 * @param cost      spend of the attempt's tasks
 * @param duration  wall time of the attempt
 * @param aborted   why the attempt was cut short (budget or timeout), or null
 */
public record StageResult(
    String stageId,
    int attempt,
    List<Task> tasks,
    List<Object> artifacts,
    double cost,
    Duration duration,
    String aborted
) {

    public StageResult {
        tasks = List.copyOf(tasks);
        artifacts = List.copyOf(artifacts);
    }

    public long completedCount() {
        return tasks.stream().filter(t -> t.status() == TaskStatus.COMPLETED).count();
    }

    public long failedCount() {
        return tasks.stream().filter(t -> t.status() == TaskStatus.FAILED).count();
    }

    public long cancelledCount() {
        return tasks.stream().filter(t -> t.status() == TaskStatus.CANCELLED).count();
    }

    public double successRate() {
        return tasks.isEmpty() ? 0.0 : (double) completedCount() / tasks.size();
    }

    /**
     * Average of a numeric field across map-shaped artifacts; artifacts without it are skipped.
     *
     * @return the average, or NaN when no artifact carries the field
     */
    public double averageOf(String key) {
        return artifacts.stream()
                .filter(a -> a instanceof Map<?, ?> m && m.get(key) instanceof Number)
                .mapToDouble(a -> ((Number) ((Map<?, ?>) a).get(key)).doubleValue())
                .average()
                .orElse(Double.NaN);
    }
}
