package com.newsroom.core.pipeline;

import java.time.Instant;

/**
 * Record of a stage being re-entered after its gate failed.
 *
 * @param stageId the stage re-entered
 * @param attempt the attempt whose gate failed
 * @param reason  gate reason that triggered the recovery
 * @param at      decision time
 */
public record RecoveryAction(String stageId, int attempt, String reason, Instant at) {

    @Override
    public String toString() {
        return "Retry stage " + stageId + " after attempt " + attempt + ": " + reason;
    }
}
