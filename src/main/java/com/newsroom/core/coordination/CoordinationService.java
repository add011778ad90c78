package com.newsroom.core.coordination;

import com.newsroom.core.engine.TaskRouter;
import com.newsroom.core.health.HealthMonitor;
import com.newsroom.core.health.HealthSnapshot;
import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskResource;
import com.newsroom.core.pipeline.StageDescriptor;
import com.newsroom.core.pipeline.StandardWorkflowTemplates;
import com.newsroom.core.pipeline.WorkflowTemplate;
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
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Puts single tasks and template workflows onto the shared scheduler.
 * <p>
 * A workflow becomes one task per template stage, chained so that each waits for the previous
 * one to complete. Requests the scheduler would reject come back as unsuccessful responses.
 */
public class CoordinationService {

    private static final Logger log = LoggerFactory.getLogger(CoordinationService.class);

    private final AtomicInteger workflowCounter = new AtomicInteger();

    private final Scheduler scheduler;
    private final TaskRouter router;
    private final HealthMonitor healthMonitor;
    private final Clock clock;

    public CoordinationService(Scheduler scheduler, TaskRouter router, HealthMonitor healthMonitor, Clock clock) {
        this.scheduler = scheduler;
        this.router = router;
        this.healthMonitor = healthMonitor;
        this.clock = clock;
    }

    public CoordinationResponse coordinate(CoordinationRequest request) {
        if (request == null || request.type() == null) {
            return CoordinationResponse.failure("Missing request type");
        }
        log.info("Processing coordination request: {}", request.type());
        try {
            return switch (request.type()) {
                case SINGLE_TASK -> coordinateSingleTask(request);
                case WORKFLOW, SCHEDULED_WORKFLOW -> coordinateWorkflow(request);
            };
        } catch (InvalidTaskException e) {
            log.warn("Coordination rejected: {}", e.getMessage());
            return CoordinationResponse.failure("Invalid task: " + e.getMessage());
        }
    }

    private CoordinationResponse coordinateSingleTask(CoordinationRequest request) {
        if (request.task() == null) {
            return CoordinationResponse.failure("No task provided for single task coordination");
        }
        if (router != null && !router.canRoute(request.task().taskType())) {
            return CoordinationResponse.failure("No handler registered for task type: " + request.task().taskType());
        }
        var builder = request.task().toBuilder();
        if (request.priorityOverride() != null) {
            builder.priority(request.priorityOverride());
        }
        if (request.immediate()) {
            builder.scheduledFor(null);
        } else if (request.scheduleTime() != null) {
            builder.scheduledFor(request.scheduleTime());
        }
        Task task = scheduler.submit(builder.build());

        var warnings = new ArrayList<String>();
        addCostWarning(warnings, task.resources().estimatedCost(), request.maxCost());
        addHealthWarning(warnings);

        return new CoordinationResponse(true, "Single task scheduled successfully",
                List.of(task.id()), null, 1, request.immediate() ? 1 : 0,
                estimateCompletion(task.scheduledFor(), task.resources().estimatedDuration()),
                task.resources().estimatedCost(), task.id(), task.dependencies().size(), warnings);
    }

    private CoordinationResponse coordinateWorkflow(CoordinationRequest request) {
        if (request.templateName() == null || request.templateName().isBlank()) {
            return CoordinationResponse.failure("No workflow template provided");
        }
        var found = StandardWorkflowTemplates.find(request.templateName());
        if (found.isEmpty()) {
            return CoordinationResponse.failure("Workflow template not found: " + request.templateName());
        }
        WorkflowTemplate template = found.get();
        if (router != null) {
            for (String type : template.taskTypes()) {
                if (!router.canRoute(type)) {
                    return CoordinationResponse.failure("No handler registered for task type: " + type);
                }
            }
        }
        boolean scheduled = request.type() == CoordinationRequest.Type.SCHEDULED_WORKFLOW
                && !request.immediate() && request.scheduleTime() != null;
        Instant startAt = scheduled ? request.scheduleTime() : null;

        String workflowId = String.format("WF-%04d", workflowCounter.incrementAndGet());
        var tasks = new ArrayList<Task>();
        String previousId = null;
        for (StageDescriptor stage : template.stages()) {
            var params = new HashMap<String, Object>(template.defaultParameters());
            params.putAll(stage.parameters());
            params.putAll(request.parameters());
            params.put("workflowId", workflowId);

            String id = workflowId + "-" + stage.stageId();
            var builder = Task.builder(stage.taskType())
                    .id(id)
                    .name(stage.name())
                    .priority(request.priorityOverride() != null ? request.priorityOverride() : stage.priority())
                    .parameters(params)
                    .scheduledFor(startAt)
                    .maxRetries(stage.taskMaxRetries())
                    .retryDelay(stage.retryDelay())
                    .resources(new TaskResource(stage.taskType(), stage.estimatedDuration(), stage.estimatedCost(), 1));
            if (previousId != null) {
                builder.dependsOn(previousId);
            }
            tasks.add(builder.build());
            previousId = id;
        }
        List<Task> accepted = scheduler.submitAll(tasks);

        double estimatedCost = accepted.stream().mapToDouble(t -> t.resources().estimatedCost()).sum();
        var warnings = new ArrayList<String>();
        addCostWarning(warnings, estimatedCost, request.maxCost());
        addHealthWarning(warnings);

        String message = "Workflow '" + template.name() + "' scheduled successfully"
                + (scheduled ? " (scheduled for " + startAt + ")" : "");
        log.info("{}: {} task(s) as {}", message, accepted.size(), workflowId);
        return new CoordinationResponse(true, message,
                accepted.stream().map(Task::id).toList(), workflowId,
                accepted.size(), scheduled ? 0 : accepted.size(),
                estimateCompletion(startAt, template.estimatedTotalDuration()),
                estimatedCost, accepted.get(0).id(), accepted.size() - 1, warnings);
    }

    private Instant estimateCompletion(Instant startAt, Duration duration) {
        Instant now = clock.instant();
        Instant start = startAt != null && startAt.isAfter(now) ? startAt : now;
        return start.plus(duration);
    }

    private static void addCostWarning(List<String> warnings, double estimated, double maxCost) {
        if (estimated > maxCost) {
            warnings.add(String.format("Estimated cost $%.2f exceeds requested maximum $%.2f", estimated, maxCost));
        }
    }

    private void addHealthWarning(List<String> warnings) {
        if (healthMonitor == null) {
            return;
        }
        HealthSnapshot snapshot = healthMonitor.latest();
        if (snapshot != null && !snapshot.health().isAdmitting()) {
            warnings.add("System health is " + snapshot.health() + ", execution is paused until it recovers");
        }
    }
}
