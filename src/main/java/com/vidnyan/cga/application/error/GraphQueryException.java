package com.vidnyan.cga.application.error;

import java.util.List;

/**
 * Structured failure at the query boundary. Carries a remediation hint and
 * alternative operations or candidate names, so callers never see a raw crash.
 */
public class GraphQueryException extends RuntimeException {

    private final ErrorCode code;
    private final String remediation;
    private final List<String> alternatives;

    public GraphQueryException(ErrorCode code, String message, String remediation, List<String> alternatives) {
        super(message);
        this.code = code;
        this.remediation = remediation;
        this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public GraphQueryException(ErrorCode code, String message, String remediation, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.remediation = remediation;
        this.alternatives = List.of();
    }

    public ErrorCode code() {
        return code;
    }

    public String remediation() {
        return remediation;
    }

    public List<String> alternatives() {
        return alternatives;
    }

    public static GraphQueryException notBuilt(String projectRoot) {
        return new GraphQueryException(ErrorCode.CALLGRAPH_NOT_BUILT,
                "No call graph has been built for " + projectRoot,
                "Run a fresh build of the call graph first",
                List.of("build"));
    }

    public static GraphQueryException corrupt(String location, String detail, Throwable cause) {
        return new GraphQueryException(ErrorCode.CALLGRAPH_CORRUPT,
                "Call graph at " + location + " is unreadable: " + detail,
                "Delete the stored graph and run a fresh build",
                cause);
    }

    public static GraphQueryException functionNotFound(String name, List<String> similar) {
        return new GraphQueryException(ErrorCode.FUNCTION_NOT_FOUND,
                "Function '" + name + "' not found in call graph",
                similar.isEmpty()
                        ? "Check the spelling or run a fresh build if the code changed"
                        : "Did you mean one of the listed functions?",
                similar);
    }

    public static GraphQueryException fileNotFound(String file) {
        return new GraphQueryException(ErrorCode.FILE_NOT_FOUND,
                "No functions recorded for file '" + file + "'",
                "Use a path relative to the project root, or run a fresh build",
                List.of());
    }

    public static GraphQueryException invalidArgument(String message) {
        return new GraphQueryException(ErrorCode.INVALID_ARGUMENT, message,
                "Correct the argument and retry", List.of());
    }

    public static GraphQueryException invalidCursor(String cursor) {
        return new GraphQueryException(ErrorCode.INVALID_CURSOR,
                "Cursor '" + cursor + "' is not valid for this query",
                "Repeat the query without a cursor", List.of());
    }
}
