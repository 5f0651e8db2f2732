package com.vidnyan.cga.application.port.in;

import java.util.List;
import java.util.Map;

/**
 * Bounded response of a graph query: payload, a one-line summary for humans,
 * suggested follow-up operations, warnings and pagination state.
 */
public record ToolResponse<T>(
    T data,
    String summary,
    List<NextAction> nextActions,
    List<String> warnings,
    Pagination pagination
) {

    public ToolResponse {
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * A suggested follow-up call.
     */
    public record NextAction(
        String operation,
        String reason,
        Map<String, Object> arguments
    ) {

        public NextAction {
            arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        }
    }

    /**
     * Offset pagination. {@code nextCursor} is null on the last page.
     */
    public record Pagination(
        int total,
        int returned,
        int offset,
        boolean hasMore,
        String nextCursor
    ) {}
}
