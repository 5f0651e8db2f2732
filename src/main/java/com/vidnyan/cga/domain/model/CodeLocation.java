package com.vidnyan.cga.domain.model;

/**
 * A position in the analyzed source, optionally tied to a function.
 */
public record CodeLocation(
    String file,
    int line,
    String functionId,
    String functionName
) {

    public static CodeLocation of(FunctionRecord function) {
        return new CodeLocation(function.file(), function.startLine(), function.id(), function.qualifiedName());
    }

    @Override
    public String toString() {
        return file + ":" + line + (functionName != null ? " (" + functionName + ")" : "");
    }
}
