package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallPathNode;
import com.vidnyan.cga.domain.model.DataAccessFact;

import java.util.List;

/**
 * Representative path from an entry point down to a function that touches the target data.
 */
public record InverseAccessPath(
    String entryPoint,
    List<CallPathNode> path,
    DataAccessFact accessPoint,
    String accessorId
) {

    public InverseAccessPath {
        path = List.copyOf(path);
    }
}
