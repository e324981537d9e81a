package com.smurthy.ai.shopping.errors;

/**
 * Closed set of error kinds surfaced to callers of the router and the HTTP API.
 */
public enum ErrorKind {
    CLASSIFICATION_AMBIGUOUS,
    HANDLER_UNAVAILABLE,
    HANDLER_TIMEOUT,
    UPSTREAM_INVOCATION_ERROR,
    INVALID_SESSION_STATE,
    RETRY_EXHAUSTED,
    NO_CAPABLE_HANDLER,
    INVALID_REQUEST
}
