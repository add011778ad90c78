package com.newsroom.core.model;

/**
 * Classification of a failed task outcome.
 */
public enum ErrorKind {
    /** The handler reported a failure or threw. Retryable. */
    HANDLER,
    /** The handler did not return before the task deadline. Retryable. */
    TIMEOUT,
    /** No handler is registered for the task type. Never retried. */
    UNROUTABLE,
    /** The run was cancelled before the handler returned. */
    CANCELLED
}
