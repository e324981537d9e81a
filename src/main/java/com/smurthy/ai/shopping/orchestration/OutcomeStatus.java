package com.smurthy.ai.shopping.orchestration;

public enum OutcomeStatus {
    SUCCEEDED,
    FAILED,
    /** Deadline passed; the handler is reported as degraded and left out of the aggregate. */
    TIMED_OUT,
    CANCELLED,
    /** Never invoked because an earlier handler in a sequential chain failed. */
    SKIPPED
}
