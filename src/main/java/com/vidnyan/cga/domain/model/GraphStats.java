package com.vidnyan.cga.domain.model;

import java.util.Map;

/**
 * Summary counts for a built call graph.
 */
public record GraphStats(
    int totalFunctions,
    int totalCallSites,
    int resolvedCallSites,
    int unresolvedCallSites,
    int ambiguousCallSites,
    int totalDataAccessors,
    int totalEntryPoints,
    Map<String, Integer> byLanguage,
    double resolutionRate,
    int filesScanned,
    int filesUsingFallback,
    int filesWithErrors,
    double averageExtractionConfidence
) {

    public GraphStats {
        byLanguage = byLanguage == null ? Map.of() : Map.copyOf(byLanguage);
    }

    public static GraphStats empty() {
        return new GraphStats(0, 0, 0, 0, 0, 0, 0, Map.of(), 0.0, 0, 0, 0, 0.0);
    }
}
