package com.vidnyan.cga.application.error;

/**
 * Error taxonomy of the query boundary.
 */
public enum ErrorCode {
    CALLGRAPH_NOT_BUILT(false),
    CALLGRAPH_CORRUPT(false),
    FUNCTION_NOT_FOUND(true),
    FILE_NOT_FOUND(true),
    INVALID_ARGUMENT(true),
    INVALID_CURSOR(true);

    private final boolean recoverable;

    ErrorCode(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * False for conditions that need a fresh build before any query can succeed.
     */
    public boolean recoverable() {
        return recoverable;
    }
}
