package com.newsroom.core.scheduler;

/**
 * Thrown when a lifecycle call names a task id the scheduler does not hold.
 */
public class UnknownTaskException extends RuntimeException {
    public UnknownTaskException(String message) {
        super(message);
    }

    public UnknownTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
