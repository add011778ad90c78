package com.newsroom.core.pipeline;

/**
 * Stage-specific predicate over a finished stage attempt. See {@link QualityGates} for the
 * built-in gates.
 */
@FunctionalInterface
public interface QualityGate {

    GateResult evaluate(StageResult result);
}
