package com.newsroom.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during orchestration, consumed by log tailers and the CLI.
 *
 * @param eventType event type (e.g. "run.started", "task.started", "stage.gate")
 * @param runId     the pipeline run this event belongs to (nullable for standalone tasks)
 * @param taskId    the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record NewsroomEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public NewsroomEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
