package com.vidnyan.cga.application.port.out;

import com.vidnyan.cga.domain.model.CallGraph;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Port for persisting the built graph of a project.
 */
public interface CallGraphRepository {

    void save(Path projectRoot, CallGraph graph);

    /**
     * Load the persisted graph.
     * @return empty if no graph was ever built for this root
     * @throws com.vidnyan.cga.application.error.GraphQueryException with CALLGRAPH_CORRUPT
     *         if the document is unreadable or has another schema version
     */
    Optional<CallGraph> load(Path projectRoot);

    Path location(Path projectRoot);
}
