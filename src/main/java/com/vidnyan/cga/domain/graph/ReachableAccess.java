package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallPathNode;
import com.vidnyan.cga.domain.model.DataAccessFact;

import java.util.List;

/**
 * A data-access fact reached from the origin, with the call path (origin first) and its depth.
 */
public record ReachableAccess(
    DataAccessFact access,
    List<CallPathNode> path,
    int depth
) {

    public ReachableAccess {
        path = List.copyOf(path);
    }

    public String accessorId() {
        return path.get(path.size() - 1).functionId();
    }
}
