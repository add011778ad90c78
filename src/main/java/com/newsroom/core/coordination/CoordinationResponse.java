package com.newsroom.core.coordination;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a {@link CoordinationRequest}. Invalid requests come back with
 * {@code success = false} and a message; they are never thrown.
 */
public record CoordinationResponse(
    boolean success,
    String message,
    List<String> taskIds,
    String workflowId,
    int scheduledTasks,
    int immediateTasks,
    Instant estimatedCompletion,
    double estimatedCost,
    String nextTaskId,
    int dependenciesPending,
    List<String> warnings
) {

    public CoordinationResponse {
        taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static CoordinationResponse failure(String message) {
        return new CoordinationResponse(false, message, List.of(), null, 0, 0, null, 0.0, null, 0, List.of());
    }
}
