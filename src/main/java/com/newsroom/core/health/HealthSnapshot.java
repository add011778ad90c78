package com.newsroom.core.health;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Published result of a health sample.
 *
 * @param timestamp        sample time
 * @param health           overall classification
 * @param pending          pending tasks
 * @param running          admitted tasks
 * @param failed           terminally failed tasks
 * @param workers          per-worker status and load, keyed by worker id
 * @param cost             hourly and daily spend
 * @param queueWaitSeconds average queue wait over the last hour
 * @param issues           reasons for a CRITICAL or DOWN classification
 * @param warnings         reasons for a WARNING classification
 */
public record HealthSnapshot(
    Instant timestamp,
    SystemHealth health,
    int pending,
    int running,
    int failed,
    Map<String, WorkerLoad> workers,
    CostSummary cost,
    double queueWaitSeconds,
    List<String> issues,
    List<String> warnings
) {

    public HealthSnapshot {
        workers = Map.copyOf(workers);
        issues = List.copyOf(issues);
        warnings = List.copyOf(warnings);
    }

    public record WorkerLoad(String status, double load) {}

    public record CostSummary(double hourly, double daily) {}
}
