package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallPathNode;

import java.util.List;

/**
 * A cycle-free chain of resolved calls, origin first.
 * {@code minConfidence} is the weakest resolution along the chain, 1.0 for a single node.
 */
public record CallPath(
    List<CallPathNode> nodes,
    double minConfidence
) {

    public CallPath {
        nodes = List.copyOf(nodes);
    }

    public int depth() {
        return nodes.size() - 1;
    }

    public String origin() {
        return nodes.get(0).functionId();
    }

    public String target() {
        return nodes.get(nodes.size() - 1).functionId();
    }
}
