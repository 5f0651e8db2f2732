package com.vidnyan.cga.domain.graph;

import java.util.List;

/**
 * Outcome of an inverse reachability query.
 */
public record InverseReachabilityResult(
    String table,
    String field,
    List<InverseAccessPath> accessPaths,
    List<String> entryPoints,
    int totalAccessors,
    boolean truncated
) {

    public InverseReachabilityResult {
        accessPaths = List.copyOf(accessPaths);
        entryPoints = List.copyOf(entryPoints);
    }

    public List<InverseAccessPath> pathsFrom(String entryPointId) {
        return accessPaths.stream().filter(p -> p.entryPoint().equals(entryPointId)).toList();
    }
}
