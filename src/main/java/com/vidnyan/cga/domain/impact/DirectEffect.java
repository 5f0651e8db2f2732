package com.vidnyan.cga.domain.impact;

/**
 * A call site that invokes the changed symbol directly.
 */
public record DirectEffect(
    String callerId,
    String callerName,
    String calleeId,
    String file,
    int line,
    int column,
    boolean wouldBreak
) {

    public String effect() {
        return wouldBreak ? "breaking" : "informational";
    }
}
