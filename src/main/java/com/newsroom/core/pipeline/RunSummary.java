package com.newsroom.core.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a pipeline run, produced for finalized and failed runs alike.
 */
public record RunSummary(
    String runId,
    String template,
    boolean success,
    int stagesCompleted,
    double totalCost,
    Duration totalDuration,
    Map<String, Duration> stageDurations,
    Map<String, Integer> artifactCounts,
    int tasksCompleted,
    int tasksFailed,
    String failedStage,
    List<String> errors,
    List<String> warnings,
    List<String> recoveries
) {

    public RunSummary {
        stageDurations = Map.copyOf(stageDurations);
        artifactCounts = Map.copyOf(artifactCounts);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        recoveries = List.copyOf(recoveries);
    }

    public static RunSummary of(WorkflowRun run) {
        Duration total = run.finishedAt() != null
                ? Duration.between(run.startedAt(), run.finishedAt())
                : Duration.ZERO;
        return new RunSummary(
                run.runId(),
                run.template().name(),
                run.state() == PipelineState.FINALIZED,
                run.stagesCompleted(),
                run.totalCost(),
                total,
                run.stageDurations(),
                run.artifactCounts(),
                run.tasksCompleted(),
                run.tasksFailed(),
                run.failedStage(),
                run.errors(),
                run.warnings(),
                run.recoveries().stream().map(RecoveryAction::toString).toList());
    }
}
