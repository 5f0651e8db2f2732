package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallPathNode;

import java.util.List;

/**
 * Summary of reachable accesses to one sensitive table field.
 */
public record SensitiveFieldAccess(
    String table,
    String field,
    Sensitivity sensitivity,
    int accessCount,
    List<List<CallPathNode>> paths
) {

    public SensitiveFieldAccess {
        paths = paths.stream().map(List::copyOf).toList();
    }
}
