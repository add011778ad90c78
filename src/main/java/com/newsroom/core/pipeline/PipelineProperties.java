package com.newsroom.core.pipeline;

import java.time.Duration;

/**
 * Run-level limits, bound from {@code newsroom.pipeline.*}.
 */
public class PipelineProperties {

    /** Stage recoveries allowed per run, across all stages. */
    private int maxRetries = 3;
    private double maxCostPerRun = 2.0;
    private Duration stageTimeout = Duration.ofMinutes(30);

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public double getMaxCostPerRun() { return maxCostPerRun; }
    public void setMaxCostPerRun(double maxCostPerRun) { this.maxCostPerRun = maxCostPerRun; }
    public Duration getStageTimeout() { return stageTimeout; }
    public void setStageTimeout(Duration stageTimeout) { this.stageTimeout = stageTimeout; }
}
