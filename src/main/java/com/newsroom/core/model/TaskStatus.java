package com.newsroom.core.model;

/**
 * Lifecycle status of a scheduled task.
 */
public enum TaskStatus {
    PENDING,
    SCHEDULED,  // admitted by the scheduler, waiting for an engine slot
    RUNNING,
    COMPLETED,
    FAILED,
    RETRYING,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
