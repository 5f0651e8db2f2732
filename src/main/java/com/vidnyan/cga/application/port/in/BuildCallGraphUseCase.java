package com.vidnyan.cga.application.port.in;

import com.vidnyan.cga.domain.model.CallGraph;

import java.nio.file.Path;

/**
 * Primary use case: build the call graph of a project and publish it for queries.
 */
public interface BuildCallGraphUseCase {

    /**
     * Scan, extract, assemble, resolve, persist and swap in a new graph snapshot.
     * @param request Build request parameters
     * @return Build result with the new graph and statistics
     */
    BuildResult build(BuildRequest request);

    /**
     * Build request parameters.
     */
    record BuildRequest(
        Path projectRoot,
        boolean persist
    ) {
        public static BuildRequest forPath(Path path) {
            return new BuildRequest(path, true);
        }
    }

    /**
     * Build result.
     */
    record BuildResult(
        CallGraph graph,
        BuildStats stats,
        Path storedAt
    ) {}

    /**
     * Build statistics.
     */
    record BuildStats(
        int filesScanned,
        int filesFailed,
        int filesUsingFallback,
        int functions,
        int callSites,
        long totalDurationMs
    ) {}
}
