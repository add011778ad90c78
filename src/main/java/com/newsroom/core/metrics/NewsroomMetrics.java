package com.newsroom.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task execution and pipeline runs.
 */
public class NewsroomMetrics {

    private final MeterRegistry registry;

    public NewsroomMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(String taskType) {
        Counter.builder("newsroom.tasks.dispatched")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success", "failure", "timeout" or "unroutable"
     */
    public void recordTaskDuration(String taskType, String outcome, Duration duration) {
        Timer.builder("newsroom.task.duration")
                .tag("type", taskType)
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    public void recordRetry(String taskType) {
        Counter.builder("newsroom.tasks.retries")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    public void recordTimeout(String taskType) {
        Counter.builder("newsroom.tasks.timeouts")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    /**
     * Records an engine iteration that skipped admission because the health gate was closed.
     */
    public void recordAdmissionPaused() {
        Counter.builder("newsroom.admission.paused")
                .description("Engine iterations that admitted nothing because health was CRITICAL or DOWN")
                .register(registry)
                .increment();
    }

    public void recordQueueWait(Duration wait) {
        Timer.builder("newsroom.queue.wait")
                .register(registry)
                .record(wait);
    }

    public void recordGateDecision(String stageId, String outcome) {
        Counter.builder("newsroom.gate.decisions")
                .tag("stage", stageId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String template, boolean success) {
        Counter.builder("newsroom.runs.total")
                .tag("template", template)
                .tag("result", success ? "finalized" : "failed")
                .register(registry)
                .increment();
    }

    public void recordRunCost(String template, double cost) {
        DistributionSummary.builder("newsroom.run.cost")
                .description("Cost per pipeline run in USD")
                .tag("template", template)
                .register(registry)
                .record(cost);
    }
}
