package com.newsroom.core.pipeline;

import java.io.Serializable;

/**
 * Result of evaluating a stage's quality gate against the run's budgets.
 *
 * @param outcome whether to continue, retry the stage, or fail the run
 * @param reason  human-readable explanation
 */
public record QualityGateDecision(
    GateOutcome outcome,
    String reason
) implements Serializable {

    public static QualityGateDecision proceed(String reason) {
        return new QualityGateDecision(GateOutcome.CONTINUE, reason);
    }

    public static QualityGateDecision retry(String reason) {
        return new QualityGateDecision(GateOutcome.RETRY, reason);
    }

    public static QualityGateDecision error(String reason) {
        return new QualityGateDecision(GateOutcome.ERROR, reason);
    }
}
