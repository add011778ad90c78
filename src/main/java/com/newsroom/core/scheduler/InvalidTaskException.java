package com.newsroom.core.scheduler;

/**
 * Thrown when a submitted task is malformed: bad priority, negative retry budget, unknown dependency
 * or dependency cycle. Nothing from the offending batch is enqueued.
 */
public class InvalidTaskException extends RuntimeException {
    public InvalidTaskException(String message) {
        super(message);
    }

    public InvalidTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
