package com.newsroom.core.pipeline;

import com.newsroom.core.engine.ExecutionEngine;
import com.newsroom.core.events.EventBus;
import com.newsroom.core.events.NewsroomEvent;
import com.newsroom.core.logging.MdcContext;
import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskResource;
import com.newsroom.core.model.TaskStatus;
import com.newsroom.core.scheduler.InvalidTaskException;
import com.newsroom.core.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link WorkflowRun} stage by stage on a run-owned scheduler and engine.
 * <p>
 * Each stage attempt submits the stage's tasks, drives the engine until they are all terminal,
 * then asks the {@link QualityGateEvaluationService} whether to advance, re-enter the same
 * stage, or fail the run. A re-entered stage discards its own previous artifacts and keeps
 * every earlier stage's. Each failed or cancelled task becomes one run warning.
 */
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private final WorkflowRun run;
    private final Scheduler scheduler;
    private final ExecutionEngine engine;
    private final QualityGateEvaluationService gates;
    private final PipelineProperties properties;
    private final EventBus eventBus;
    private final Clock clock;

    public PipelineStateMachine(WorkflowRun run, Scheduler scheduler, ExecutionEngine engine,
                                QualityGateEvaluationService gates, PipelineProperties properties,
                                EventBus eventBus, Clock clock) {
        this.run = run;
        this.scheduler = scheduler;
        this.engine = engine;
        this.gates = gates;
        this.properties = properties;
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.clock = clock;
    }

    /**
     * Runs every stage to completion or failure.
     *
     * @return the run summary, also on failure
     */
    public RunSummary execute() {
        MdcContext.setRun(run.runId());
        try {
            log.info("Starting run {} [{}] with {} stage(s), budget ${}, max retries {}",
                    run.runId(), run.template().name(), run.template().stages().size(),
                    run.maxCost(), run.maxRetries());
            publish("run.started", null, Map.of("template", run.template().name()));

            while (!run.state().isTerminal()) {
                StageDescriptor stage = run.currentStage();
                if (stage == null) {
                    run.finalizeRun(clock.instant());
                    break;
                }
                step(stage);
            }

            RunSummary summary = RunSummary.of(run);
            if (summary.success()) {
                log.info("Run {} finalized: {} stage(s), cost ${}, {} recovery(ies)",
                        run.runId(), summary.stagesCompleted(), String.format("%.4f", summary.totalCost()),
                        summary.recoveries().size());
                publish("run.finalized", null, Map.of("stagesCompleted", summary.stagesCompleted(),
                        "totalCost", summary.totalCost()));
            } else {
                log.error("Run {} failed at stage {}: {}", run.runId(), summary.failedStage(), summary.errors());
                publish("run.failed", summary.failedStage(), Map.of("errors", summary.errors()));
            }
            return summary;
        } finally {
            MdcContext.clear();
        }
    }

    private void step(StageDescriptor stage) {
        int attempt = run.beginAttempt(stage.stageId());
        MdcContext.setStage(run.runId(), stage.stageId());
        try {
            run.transition(PipelineState.STAGE_RUNNING);
            publish("stage.started", stage.stageId(), Map.of("attempt", attempt));

            StageAttempt outcome;
            try {
                outcome = runStage(stage, attempt);
            } catch (InvalidTaskException e) {
                log.error("Stage {} produced invalid tasks: {}", stage.stageId(), e.getMessage());
                run.fail(stage.stageId(), "Stage " + stage.stageId() + " could not submit tasks: " + e.getMessage(),
                        clock.instant());
                return;
            }
            run.recordAttempt(outcome.result());

            run.transition(PipelineState.STAGE_GATE);
            QualityGateDecision decision = gates.evaluate(run, stage, outcome.result());
            publish("stage.gate", stage.stageId(), Map.of("attempt", attempt,
                    "outcome", decision.outcome().name(), "reason", decision.reason()));

            switch (decision.outcome()) {
                case CONTINUE -> run.acceptStage(outcome.result(), outcome.completedIds());
                case RETRY -> {
                    run.transition(PipelineState.STAGE_RETRY);
                    var recovery = new RecoveryAction(stage.stageId(), attempt, decision.reason(), clock.instant());
                    run.recordRecovery(recovery);
                    log.warn("{}", recovery);
                    publish("stage.retry", stage.stageId(), Map.of("attempt", attempt, "reason", decision.reason()));
                }
                case ERROR -> run.fail(stage.stageId(), decision.reason(), clock.instant());
            }
        } finally {
            MdcContext.clearStage();
        }
    }

    private record StageAttempt(StageResult result, List<String> completedIds) {}

    private StageAttempt runStage(StageDescriptor stage, int attempt) {
        Instant started = clock.instant();
        List<Task> submitted = scheduler.submitAll(buildTasks(stage, attempt));
        List<String> ids = submitted.stream().map(Task::id).toList();
        log.info("Stage {} attempt {}: submitted {} task(s)", stage.stageId(), attempt, ids.size());

        Instant stageDeadline = started.plus(properties.getStageTimeout());
        engine.runUntil(
                () -> scheduler.isSettled(ids) || stageCost(ids) + run.totalCost() > run.maxCost()
                        || !clock.instant().isBefore(stageDeadline),
                properties.getStageTimeout());

        String aborted = null;
        if (!scheduler.isSettled(ids)) {
            aborted = stageCost(ids) + run.totalCost() > run.maxCost()
                    ? String.format("Run budget $%.2f exceeded, outstanding tasks cancelled", run.maxCost())
                    : "Stage timed out after " + properties.getStageTimeout().toSeconds() + "s";
            log.warn("Stage {} attempt {} aborted: {}", stage.stageId(), attempt, aborted);
            for (String id : ids) {
                scheduler.cancel(id, aborted);
            }
            engine.runOnce();
        }

        var tasks = new ArrayList<Task>(ids.size());
        var artifacts = new ArrayList<Object>();
        var completedIds = new ArrayList<String>();
        double cost = 0.0;
        for (String id : ids) {
            Task task = scheduler.find(id).orElseThrow();
            tasks.add(task);
            cost += task.actualCost();
            if (task.status() == TaskStatus.COMPLETED) {
                completedIds.add(id);
                if (task.result() != null) {
                    artifacts.add(task.result());
                }
            } else {
                String warning = String.format("Stage %s attempt %d: task %s failed: %s",
                        stage.stageId(), attempt, task.name(), task.errorMessage());
                run.addWarning(warning);
                log.warn("{}", warning);
            }
        }
        Duration elapsed = Duration.between(started, clock.instant());
        return new StageAttempt(
                new StageResult(stage.stageId(), attempt, tasks, artifacts, cost, elapsed, aborted),
                completedIds);
    }

    private double stageCost(List<String> ids) {
        double cost = 0.0;
        for (String id : ids) {
            cost += scheduler.find(id).map(Task::actualCost).orElse(0.0);
        }
        return cost;
    }

    private List<Task> buildTasks(StageDescriptor stage, int attempt) {
        List<Map<String, Object>> plans = stage.planner().plan(run, stage);
        List<String> upstream = stage.dependsOnPrevious() ? previousStageTaskIds() : List.of();
        var tasks = new ArrayList<Task>(plans.size());
        for (int i = 0; i < plans.size(); i++) {
            var builder = Task.builder(stage.taskType())
                    .name(plans.size() == 1
                            ? stage.name()
                            : stage.name() + " #" + (i + 1))
                    .parameters(withRunContext(plans.get(i), stage, attempt))
                    .priority(stage.priority())
                    .maxRetries(stage.taskMaxRetries())
                    .retryDelay(stage.retryDelay())
                    .resources(new TaskResource(null, stage.estimatedDuration(), stage.estimatedCost(), 1));
            upstream.forEach(builder::dependsOn);
            tasks.add(builder.build());
        }
        return tasks;
    }

    private Map<String, Object> withRunContext(Map<String, Object> plan, StageDescriptor stage, int attempt) {
        var params = new HashMap<String, Object>(plan);
        params.put("runId", run.runId());
        params.put("stageId", stage.stageId());
        params.put("attempt", attempt);
        return params;
    }

    private List<String> previousStageTaskIds() {
        int index = run.currentStageIndex();
        if (index == 0) {
            return List.of();
        }
        return run.completedTaskIds(run.template().stages().get(index - 1).stageId());
    }

    private void publish(String eventType, String stageId, Map<String, Object> extra) {
        var payload = new HashMap<String, Object>(extra);
        if (stageId != null) {
            payload.put("stageId", stageId);
        }
        eventBus.publish(new NewsroomEvent(eventType, run.runId(), null, payload, clock.instant()));
    }

    public WorkflowRun run() {
        return run;
    }
}
