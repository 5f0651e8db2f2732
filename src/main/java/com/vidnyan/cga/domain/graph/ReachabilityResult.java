package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CodeLocation;

import java.util.List;

/**
 * Outcome of a forward reachability query.
 * {@code reachableAccess} is in traversal order, so shallower accesses come first.
 */
public record ReachabilityResult(
    CodeLocation origin,
    List<ReachableAccess> reachableAccess,
    List<String> tables,
    List<SensitiveFieldAccess> sensitiveFields,
    int maxDepthReached,
    int functionsVisited,
    List<UnknownReach> unresolvedReach,
    boolean truncated
) {

    public ReachabilityResult {
        reachableAccess = List.copyOf(reachableAccess);
        tables = List.copyOf(tables);
        sensitiveFields = List.copyOf(sensitiveFields);
        unresolvedReach = List.copyOf(unresolvedReach);
    }

    public static ReachabilityResult empty(CodeLocation origin) {
        return new ReachabilityResult(origin, List.of(), List.of(), List.of(), 0, 0, List.of(), false);
    }
}
