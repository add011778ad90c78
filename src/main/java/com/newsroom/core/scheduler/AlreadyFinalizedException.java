package com.newsroom.core.scheduler;

/**
 * Thrown when a task that already reached a terminal status is completed or failed again.
 */
public class AlreadyFinalizedException extends RuntimeException {
    public AlreadyFinalizedException(String message) {
        super(message);
    }

    public AlreadyFinalizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
