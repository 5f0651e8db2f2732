package com.vidnyan.cga.application.service;

import com.vidnyan.cga.domain.model.CallGraph;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current graph. A rebuild swaps in a new instance atomically;
 * queries keep whichever instance they started with.
 */
@Component
public class CallGraphSnapshot {

    private final AtomicReference<CallGraph> current = new AtomicReference<>();

    public Optional<CallGraph> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Current graph if it was built for the given project root.
     */
    public Optional<CallGraph> currentFor(String projectRoot) {
        return current().filter(g -> g.projectRoot().equals(projectRoot));
    }

    public void replace(CallGraph graph) {
        current.set(graph);
    }
}
