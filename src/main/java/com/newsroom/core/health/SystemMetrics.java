package com.newsroom.core.health;

import java.time.Duration;
import java.time.Instant;

/**
 * Raw figures gathered by one health sample.
 */
public record SystemMetrics(
    Instant timestamp,
    int pendingTasks,
    int runningTasks,
    int failedTasks,
    long failuresLastHour,
    double errorRate,
    Duration averageQueueWait,
    Duration maxQueueWait,
    int overdueTasks,
    int workersRegistered,
    int workersOnline,
    int workersBusy,
    int workersError,
    int workersUnhealthy,
    double hourlyCost,
    double dailyCost,
    double monthlyProjection
) {}
