package com.vidnyan.cga.domain.model;

/**
 * One hop of a call path: the function entered and the line of the call that entered it.
 */
public record CallPathNode(
    String functionId,
    String functionName,
    String file,
    int line
) {

    public static CallPathNode of(FunctionRecord function, int line) {
        return new CallPathNode(function.id(), function.qualifiedName(), function.file(), line);
    }
}
