package com.newsroom.core.pipeline;

/**
 * Lifecycle of a {@link WorkflowRun}. FINALIZED and FAILED are terminal.
 */
public enum PipelineState {
    INITIALIZED,
    STAGE_RUNNING,
    STAGE_GATE,
    STAGE_RETRY,
    FINALIZED,
    FAILED;

    public boolean isTerminal() {
        return this == FINALIZED || this == FAILED;
    }
}
