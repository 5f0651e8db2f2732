package com.vidnyan.cga.domain.graph;

import java.util.List;

/**
 * Paths found by a search, shortest first. {@code exhaustive} is false when
 * the path limit or the expansion budget stopped the search early.
 */
public record PathSearchResult(
    List<CallPath> paths,
    boolean exhaustive,
    int nodesVisited
) {

    public PathSearchResult {
        paths = List.copyOf(paths);
    }

    public boolean found() {
        return !paths.isEmpty();
    }
}
