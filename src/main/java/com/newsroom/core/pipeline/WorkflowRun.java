package com.newsroom.core.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one pipeline execution. Only the owning {@link PipelineStateMachine} writes
 * to it; everyone else reads.
 */
public class WorkflowRun {

    private final String runId;
    private final WorkflowTemplate template;
    private final Map<String, Object> parameters;
    private final int maxRetries;
    private final double maxCost;
    private final Instant startedAt;

    private PipelineState state = PipelineState.INITIALIZED;
    private int currentStage;
    private final Map<String, List<Object>> artifacts = new LinkedHashMap<>();
    private final Map<String, List<String>> stageTaskIds = new LinkedHashMap<>();
    private final Map<String, Boolean> qualityPassed = new LinkedHashMap<>();
    private final Map<String, Integer> stageAttempts = new LinkedHashMap<>();
    private final Map<String, Duration> stageDurations = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<RecoveryAction> recoveries = new ArrayList<>();
    private double totalCost;
    private int tasksCompleted;
    private int tasksFailed;
    private int totalRetries;
    private String failedStage;
    private Instant finishedAt;

    public WorkflowRun(String runId, WorkflowTemplate template, Map<String, Object> parameters,
                       int maxRetries, double maxCost, Instant startedAt) {
        this.runId = runId;
        this.template = template;
        var merged = new LinkedHashMap<String, Object>(template.defaultParameters());
        if (parameters != null) {
            merged.putAll(parameters);
        }
        this.parameters = Collections.unmodifiableMap(merged);
        this.maxRetries = maxRetries;
        this.maxCost = maxCost;
        this.startedAt = startedAt;
    }

    public String runId() { return runId; }
    public WorkflowTemplate template() { return template; }
    public Map<String, Object> parameters() { return parameters; }
    public int maxRetries() { return maxRetries; }
    public double maxCost() { return maxCost; }
    public Instant startedAt() { return startedAt; }
    public Instant finishedAt() { return finishedAt; }
    public PipelineState state() { return state; }
    public int currentStageIndex() { return currentStage; }
    public double totalCost() { return totalCost; }
    public int tasksCompleted() { return tasksCompleted; }
    public int tasksFailed() { return tasksFailed; }
    public int totalRetries() { return totalRetries; }
    public String failedStage() { return failedStage; }
    public List<String> errors() { return List.copyOf(errors); }
    public List<String> warnings() { return List.copyOf(warnings); }
    public List<RecoveryAction> recoveries() { return List.copyOf(recoveries); }
    public Map<String, Duration> stageDurations() { return Map.copyOf(stageDurations); }

    public StageDescriptor currentStage() {
        return currentStage < template.stages().size() ? template.stages().get(currentStage) : null;
    }

    /** Artifacts kept for a stage whose gate passed, or an empty list. */
    public List<Object> artifacts(String stageId) {
        return List.copyOf(artifacts.getOrDefault(stageId, List.of()));
    }

    public Map<String, Integer> artifactCounts() {
        var counts = new LinkedHashMap<String, Integer>();
        artifacts.forEach((stage, list) -> counts.put(stage, list.size()));
        return counts;
    }

    /** Ids of the completed tasks of the attempt that passed the stage's gate. */
    public List<String> completedTaskIds(String stageId) {
        return List.copyOf(stageTaskIds.getOrDefault(stageId, List.of()));
    }

    public boolean qualityPassed(String stageId) {
        return qualityPassed.getOrDefault(stageId, false);
    }

    public int attempts(String stageId) {
        return stageAttempts.getOrDefault(stageId, 0);
    }

    public int stagesCompleted() {
        return (int) qualityPassed.values().stream().filter(Boolean::booleanValue).count();
    }

    // -- Mutators, state machine only -------------------------------------------------------

    void transition(PipelineState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already " + state);
        }
        state = next;
    }

    int beginAttempt(String stageId) {
        return stageAttempts.merge(stageId, 1, Integer::sum);
    }

    void recordAttempt(StageResult result) {
        totalCost += result.cost();
        tasksCompleted += (int) result.completedCount();
        tasksFailed += (int) (result.failedCount() + result.cancelledCount());
        stageDurations.merge(result.stageId(), result.duration(), Duration::plus);
        qualityPassed.put(result.stageId(), false);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    void acceptStage(StageResult result, List<String> completedTaskIds) {
        artifacts.put(result.stageId(), new ArrayList<>(result.artifacts()));
        stageTaskIds.put(result.stageId(), List.copyOf(completedTaskIds));
        qualityPassed.put(result.stageId(), true);
        currentStage++;
    }

    void recordRecovery(RecoveryAction action) {
        recoveries.add(action);
        totalRetries++;
        artifacts.remove(action.stageId());
        stageTaskIds.remove(action.stageId());
    }

    void fail(String stageId, String error, Instant at) {
        errors.add(error);
        failedStage = stageId;
        state = PipelineState.FAILED;
        finishedAt = at;
    }

    void finalizeRun(Instant at) {
        state = PipelineState.FINALIZED;
        finishedAt = at;
    }
}
