package com.smurthy.ai.shopping.mcp;

import java.util.Arrays;

/**
 * Closed set of structured errors a tool endpoint may answer with.
 */
public enum ToolErrorCode {
    INVALID_PARAMS(-32602, false),
    NOT_FOUND(-32601, false),
    UPSTREAM_UNAVAILABLE(-32000, true),
    TIMEOUT(-32001, true);

    private final int code;
    private final boolean transientFailure;

    ToolErrorCode(int code, boolean transientFailure) {
        this.code = code;
        this.transientFailure = transientFailure;
    }

    public int code() {
        return code;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Unknown codes are treated as an unavailable upstream.
     */
    public static ToolErrorCode fromCode(int code) {
        return Arrays.stream(values())
                .filter(c -> c.code == code)
                .findFirst()
                .orElse(UPSTREAM_UNAVAILABLE);
    }
}
