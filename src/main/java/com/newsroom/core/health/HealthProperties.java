package com.newsroom.core.health;

import java.time.Duration;

/**
 * Sampling interval and classification thresholds, bound from {@code newsroom.health.*}.
 */
public class HealthProperties {

    private Duration sampleInterval = Duration.ofSeconds(60);
    private double criticalErrorRate = 0.5;
    private Duration criticalQueueWait = Duration.ofMinutes(15);
    private double warningErrorRate = 0.1;
    private Duration warningQueueWait = Duration.ofMinutes(5);
    /** Share of online workers that may be in ERROR before the system is degraded. */
    private double workerErrorRatio = 0.2;
    private int warningBacklog = 50;
    private double dailyCostBudget = 3.0;

    public Duration getSampleInterval() { return sampleInterval; }
    public void setSampleInterval(Duration sampleInterval) { this.sampleInterval = sampleInterval; }
    public double getCriticalErrorRate() { return criticalErrorRate; }
    public void setCriticalErrorRate(double criticalErrorRate) { this.criticalErrorRate = criticalErrorRate; }
    public Duration getCriticalQueueWait() { return criticalQueueWait; }
    public void setCriticalQueueWait(Duration criticalQueueWait) { this.criticalQueueWait = criticalQueueWait; }
    public double getWarningErrorRate() { return warningErrorRate; }
    public void setWarningErrorRate(double warningErrorRate) { this.warningErrorRate = warningErrorRate; }
    public Duration getWarningQueueWait() { return warningQueueWait; }
    public void setWarningQueueWait(Duration warningQueueWait) { this.warningQueueWait = warningQueueWait; }
    public double getWorkerErrorRatio() { return workerErrorRatio; }
    public void setWorkerErrorRatio(double workerErrorRatio) { this.workerErrorRatio = workerErrorRatio; }
    public int getWarningBacklog() { return warningBacklog; }
    public void setWarningBacklog(int warningBacklog) { this.warningBacklog = warningBacklog; }
    public double getDailyCostBudget() { return dailyCostBudget; }
    public void setDailyCostBudget(double dailyCostBudget) { this.dailyCostBudget = dailyCostBudget; }
}
