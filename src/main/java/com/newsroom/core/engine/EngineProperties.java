package com.newsroom.core.engine;

import java.time.Duration;

/**
 * Settings for {@link ExecutionEngine}, bound from {@code newsroom.engine.*}.
 */
public class EngineProperties {

    private int maxConcurrentTasks = 5;
    private Duration pollInterval = Duration.ofMillis(500);
    private Duration defaultTaskTimeout = Duration.ofMinutes(10);
    private Duration cancellationGrace = Duration.ofSeconds(30);
    /** Worker pool size; 0 means one thread per concurrency slot. */
    private int workerThreads = 0;

    public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
    public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public Duration getDefaultTaskTimeout() { return defaultTaskTimeout; }
    public void setDefaultTaskTimeout(Duration defaultTaskTimeout) { this.defaultTaskTimeout = defaultTaskTimeout; }
    public Duration getCancellationGrace() { return cancellationGrace; }
    public void setCancellationGrace(Duration cancellationGrace) { this.cancellationGrace = cancellationGrace; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Math.max(1, maxConcurrentTasks);
    }
}
