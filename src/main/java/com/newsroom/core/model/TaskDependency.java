package com.newsroom.core.model;

import java.time.Duration;

/**
 * Dependency of one task on another task reaching a terminal status.
 *
 * @param taskId         id of the task depended upon
 * @param requiredStatus terminal status the dependency must finish in (usually COMPLETED)
 * @param dependencyType free-form kind, "completion" by default
 * @param timeout        how long the dependent is willing to wait; informational
 */
public record TaskDependency(
    String taskId,
    TaskStatus requiredStatus,
    String dependencyType,
    Duration timeout
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(60);

    public static TaskDependency onCompletion(String taskId) {
        return new TaskDependency(taskId, TaskStatus.COMPLETED, "completion", DEFAULT_TIMEOUT);
    }

    public TaskDependency {
        if (requiredStatus == null) requiredStatus = TaskStatus.COMPLETED;
        if (dependencyType == null || dependencyType.isBlank()) dependencyType = "completion";
        if (timeout == null) timeout = DEFAULT_TIMEOUT;
    }
}
