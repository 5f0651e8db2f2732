package com.vidnyan.cga.domain.graph;

/**
 * Limits for a path search between two functions.
 * @param maxDepth call hops a path may have
 * @param maxPaths paths returned before the search stops
 * @param minConfidence calls resolved below this confidence are not followed
 * @param maxExpansions partial paths expanded before the search gives up
 */
public record PathOptions(
    int maxDepth,
    int maxPaths,
    double minConfidence,
    int maxExpansions
) {

    public PathOptions {
        if (maxDepth < 0 || maxPaths < 1 || maxExpansions < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 0, maxPaths and maxExpansions >= 1");
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence out of range: " + minConfidence);
        }
    }

    public static PathOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxDepth = 20;
        private int maxPaths = 100;
        private double minConfidence;
        private int maxExpansions = 100_000;

        public Builder maxDepth(int depth) { this.maxDepth = depth; return this; }
        public Builder maxPaths(int paths) { this.maxPaths = paths; return this; }
        public Builder minConfidence(double confidence) { this.minConfidence = confidence; return this; }
        public Builder maxExpansions(int expansions) { this.maxExpansions = expansions; return this; }

        public PathOptions build() {
            return new PathOptions(maxDepth, maxPaths, minConfidence, maxExpansions);
        }
    }
}
