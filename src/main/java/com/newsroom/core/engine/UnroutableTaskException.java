package com.newsroom.core.engine;

public class UnroutableTaskException extends RuntimeException {

    public UnroutableTaskException(String message) {
        super(message);
    }

    public UnroutableTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
