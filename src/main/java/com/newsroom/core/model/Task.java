package com.newsroom.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A single unit of schedulable, retryable work.
 * <p>
 * Tasks are immutable: every lifecycle transition made by the scheduler produces a new
 * version through {@link #toBuilder()}. The scheduler never looks inside {@link #parameters}
 * or {@link #result}; only the router does.
 *
 * @param id                 unique identifier (e.g. "TASK-000001")
 * @param taskType           opaque routing tag (e.g. "news_discovery")
 * @param name               human-readable name
 * @param parameters         opaque handler parameters
 * @param priority           ordering priority
 * @param scheduledFor       earliest execution time, or null to run as soon as ready
 * @param deadline           time by which a dispatched run must return, or null
 * @param dependencies       tasks that must reach a terminal status first
 * @param resources          resource hint
 * @param status             current lifecycle status
 * @param createdAt          submission time
 * @param startedAt          start of the latest run
 * @param completedAt        time the task became terminal
 * @param lastRetryAt        time of the latest retry decision
 * @param retryCount         retries consumed so far
 * @param maxRetries         retries allowed before the task fails terminally
 * @param retryDelay         base delay between retries
 * @param exponentialBackoff whether the delay doubles with every retry
 * @param result             handler result on success
 * @param errorMessage       latest error message
 * @param actualDuration     duration of the successful run
 * @param actualCost         spend reported by the handler
 * @param sequence           submission order, assigned by the scheduler
 */
public record Task(
    String id,
    String taskType,
    String name,
    Map<String, Object> parameters,
    TaskPriority priority,
    Instant scheduledFor,
    Instant deadline,
    List<TaskDependency> dependencies,
    TaskResource resources,
    TaskStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant lastRetryAt,
    int retryCount,
    int maxRetries,
    Duration retryDelay,
    boolean exponentialBackoff,
    Object result,
    String errorMessage,
    Duration actualDuration,
    double actualCost,
    long sequence
) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(60);

    public Task {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (resources == null) resources = TaskResource.defaults();
        if (retryDelay == null) retryDelay = DEFAULT_RETRY_DELAY;
        if (status == null) status = TaskStatus.PENDING;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * A task is overdue when its deadline has passed and it has not completed or been cancelled.
     */
    public boolean isOverdue(Instant now) {
        if (deadline == null) {
            return false;
        }
        return now.isAfter(deadline) && status != TaskStatus.COMPLETED && status != TaskStatus.CANCELLED;
    }

    /**
     * Best estimate of when this task will be done, or null when nothing is known yet.
     */
    public Instant estimatedCompletionTime() {
        if (status == TaskStatus.COMPLETED) {
            return completedAt;
        }
        if (status == TaskStatus.RUNNING && startedAt != null) {
            return startedAt.plus(resources.estimatedDuration());
        }
        if (scheduledFor != null) {
            return scheduledFor.plus(resources.estimatedDuration());
        }
        return null;
    }

    public static Builder builder(String taskType) {
        return new Builder().taskType(taskType);
    }

    public Builder toBuilder() {
        var b = new Builder();
        b.id = id;
        b.taskType = taskType;
        b.name = name;
        b.parameters = parameters;
        b.priority = priority;
        b.scheduledFor = scheduledFor;
        b.deadline = deadline;
        b.dependencies = new ArrayList<>(dependencies);
        b.resources = resources;
        b.status = status;
        b.createdAt = createdAt;
        b.startedAt = startedAt;
        b.completedAt = completedAt;
        b.lastRetryAt = lastRetryAt;
        b.retryCount = retryCount;
        b.maxRetries = maxRetries;
        b.retryDelay = retryDelay;
        b.exponentialBackoff = exponentialBackoff;
        b.result = result;
        b.errorMessage = errorMessage;
        b.actualDuration = actualDuration;
        b.actualCost = actualCost;
        b.sequence = sequence;
        return b;
    }

    public static final class Builder {
        private String id;
        private String taskType;
        private String name;
        private Map<String, Object> parameters = Map.of();
        private TaskPriority priority = TaskPriority.NORMAL;
        private Instant scheduledFor;
        private Instant deadline;
        private List<TaskDependency> dependencies = new ArrayList<>();
        private TaskResource resources = TaskResource.defaults();
        private TaskStatus status = TaskStatus.PENDING;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant lastRetryAt;
        private int retryCount;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private boolean exponentialBackoff = true;
        private Object result;
        private String errorMessage;
        private Duration actualDuration;
        private double actualCost;
        private long sequence;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder taskType(String taskType) { this.taskType = taskType; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder parameters(Map<String, Object> parameters) { this.parameters = parameters; return this; }
        public Builder priority(TaskPriority priority) { this.priority = priority; return this; }
        public Builder scheduledFor(Instant scheduledFor) { this.scheduledFor = scheduledFor; return this; }
        public Builder deadline(Instant deadline) { this.deadline = deadline; return this; }
        public Builder dependencies(List<TaskDependency> dependencies) {
            this.dependencies = new ArrayList<>(dependencies);
            return this;
        }
        public Builder dependsOn(String taskId) {
            this.dependencies.add(TaskDependency.onCompletion(taskId));
            return this;
        }
        public Builder dependsOn(TaskDependency dependency) {
            this.dependencies.add(dependency);
            return this;
        }
        public Builder resources(TaskResource resources) { this.resources = resources; return this; }
        public Builder status(TaskStatus status) { this.status = status; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder lastRetryAt(Instant lastRetryAt) { this.lastRetryAt = lastRetryAt; return this; }
        public Builder retryCount(int retryCount) { this.retryCount = retryCount; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder retryDelay(Duration retryDelay) { this.retryDelay = retryDelay; return this; }
        public Builder exponentialBackoff(boolean exponentialBackoff) { this.exponentialBackoff = exponentialBackoff; return this; }
        public Builder result(Object result) { this.result = result; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder actualDuration(Duration actualDuration) { this.actualDuration = actualDuration; return this; }
        public Builder actualCost(double actualCost) { this.actualCost = actualCost; return this; }
        public Builder sequence(long sequence) { this.sequence = sequence; return this; }

        public Task build() {
            return new Task(id, taskType, name != null ? name : taskType, parameters, priority,
                    scheduledFor, deadline, dependencies, resources, status, createdAt, startedAt,
                    completedAt, lastRetryAt, retryCount, maxRetries, retryDelay, exponentialBackoff,
                    result, errorMessage, actualDuration, actualCost, sequence);
        }
    }
}
