package com.newsroom.core.model;

/**
 * Result of routing a task to its handler: either a success carrying an opaque result, or a
 * failure carrying an error kind and message.
 *
 * @param success whether the handler succeeded
 * @param result  opaque payload on success, null otherwise
 * @param error   error message on failure, null otherwise
 * @param kind    failure classification, null on success
 * @param cost    spend reported by the handler in USD
 */
public record TaskOutcome(
    boolean success,
    Object result,
    String error,
    ErrorKind kind,
    double cost
) {

    public static TaskOutcome success(Object result) {
        return new TaskOutcome(true, result, null, null, 0.0);
    }

    public static TaskOutcome success(Object result, double cost) {
        return new TaskOutcome(true, result, null, null, cost);
    }

    public static TaskOutcome failure(String error) {
        return new TaskOutcome(false, null, error, ErrorKind.HANDLER, 0.0);
    }

    public static TaskOutcome failure(ErrorKind kind, String error) {
        return new TaskOutcome(false, null, error, kind, 0.0);
    }

    public static TaskOutcome failure(String error, double cost) {
        return new TaskOutcome(false, null, error, ErrorKind.HANDLER, cost);
    }

    public boolean isRetryable() {
        return !success && kind != ErrorKind.UNROUTABLE;
    }
}
