package com.vidnyan.cga.domain.graph;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options for a forward reachability query.
 * Depth is counted in call hops from the origin, which sits at depth 0.
 */
public record ReachabilityOptions(
    int maxDepth,
    int maxNodes,
    boolean sensitiveOnly,
    Set<String> tables,
    boolean includeUnresolved
) {

    public ReachabilityOptions {
        if (maxDepth < 0 || maxNodes < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 0 and maxNodes >= 1");
        }
        tables = tables == null ? Set.of() : tables.stream().map(String::toLowerCase).collect(Collectors.toUnmodifiableSet());
    }

    public static ReachabilityOptions defaults() {
        return builder().build();
    }

    public static ReachabilityOptions withMaxDepth(int maxDepth) {
        return builder().maxDepth(maxDepth).build();
    }

    public boolean allowsTable(String table) {
        return tables.isEmpty() || tables.contains(table.toLowerCase());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxDepth = Integer.MAX_VALUE;
        private int maxNodes = Integer.MAX_VALUE;
        private boolean sensitiveOnly;
        private Set<String> tables = Set.of();
        private boolean includeUnresolved;

        public Builder maxDepth(int depth) { this.maxDepth = depth; return this; }
        public Builder maxNodes(int nodes) { this.maxNodes = nodes; return this; }
        public Builder sensitiveOnly(boolean sensitiveOnly) { this.sensitiveOnly = sensitiveOnly; return this; }
        public Builder tables(Set<String> tables) { this.tables = tables; return this; }
        public Builder includeUnresolved(boolean include) { this.includeUnresolved = include; return this; }

        public ReachabilityOptions build() {
            return new ReachabilityOptions(maxDepth, maxNodes, sensitiveOnly, tables, includeUnresolved);
        }
    }
}
