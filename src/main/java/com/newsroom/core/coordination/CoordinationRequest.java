package com.newsroom.core.coordination;

import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskPriority;

import java.time.Instant;
import java.util.Map;

/**
 * Request to put a single task or a template workflow onto the shared scheduler.
 *
 * @param type               what is requested
 * @param task               the task, for {@link Type#SINGLE_TASK}
 * @param templateName       workflow template name, for the workflow types
 * @param parameters         workflow parameters, overlaid on the template's
 * @param immediate          run as soon as ready, ignoring {@code scheduleTime}
 * @param scheduleTime       earliest start when not immediate
 * @param priorityOverride   priority applied to every created task, or null
 * @param maxCost            spend the caller expects to stay under, in USD
 */
public record CoordinationRequest(
    Type type,
    Task task,
    String templateName,
    Map<String, Object> parameters,
    boolean immediate,
    Instant scheduleTime,
    TaskPriority priorityOverride,
    double maxCost
) {

    public static final double DEFAULT_MAX_COST = 1.0;

    public enum Type { SINGLE_TASK, WORKFLOW, SCHEDULED_WORKFLOW }

    public CoordinationRequest {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        if (maxCost <= 0) maxCost = DEFAULT_MAX_COST;
    }

    public static CoordinationRequest singleTask(Task task) {
        return new CoordinationRequest(Type.SINGLE_TASK, task, null, Map.of(), true, null, null, DEFAULT_MAX_COST);
    }

    public static CoordinationRequest workflow(String templateName, Map<String, Object> parameters) {
        return new CoordinationRequest(Type.WORKFLOW, null, templateName, parameters, true, null, null, DEFAULT_MAX_COST);
    }

    public static CoordinationRequest scheduledWorkflow(String templateName, Map<String, Object> parameters,
                                                        Instant scheduleTime) {
        return new CoordinationRequest(Type.SCHEDULED_WORKFLOW, null, templateName, parameters, false,
                scheduleTime, null, DEFAULT_MAX_COST);
    }

    public CoordinationRequest withPriority(TaskPriority priority) {
        return new CoordinationRequest(type, task, templateName, parameters, immediate, scheduleTime, priority, maxCost);
    }
}
