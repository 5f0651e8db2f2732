package com.vidnyan.cga.domain.graph;

/**
 * A function nothing in the project is known to call.
 */
public record DeadCodeCandidate(
    String functionId,
    String qualifiedName,
    String file,
    int line,
    Confidence confidence,
    String reason
) {

    public enum Confidence {
        HIGH,
        LOW
    }
}
