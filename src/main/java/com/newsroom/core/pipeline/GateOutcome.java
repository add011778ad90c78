package com.newsroom.core.pipeline;

public enum GateOutcome {
    /** Advance to the next stage. */
    CONTINUE,
    /** Re-enter the same stage. */
    RETRY,
    /** Fail the run. */
    ERROR
}
