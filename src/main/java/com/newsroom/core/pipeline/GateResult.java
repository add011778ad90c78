package com.newsroom.core.pipeline;

/**
 * Verdict of a single {@link QualityGate} predicate.
 */
public record GateResult(boolean passed, String reason) {

    public static GateResult pass(String reason) {
        return new GateResult(true, reason);
    }

    public static GateResult fail(String reason) {
        return new GateResult(false, reason);
    }
}
