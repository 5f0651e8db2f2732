package com.vidnyan.cga.domain.graph;

/**
 * Options for an inverse reachability query: who can reach this table (and field).
 */
public record InverseReachabilityOptions(
    String table,
    String field,
    int maxDepth,
    int maxNodes
) {

    public InverseReachabilityOptions {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table is required");
        }
        if (maxDepth < 0 || maxNodes < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 0 and maxNodes >= 1");
        }
    }

    public static InverseReachabilityOptions forTable(String table) {
        return builder().table(table).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String table;
        private String field;
        private int maxDepth = Integer.MAX_VALUE;
        private int maxNodes = Integer.MAX_VALUE;

        public Builder table(String table) { this.table = table; return this; }
        public Builder field(String field) { this.field = field; return this; }
        public Builder maxDepth(int depth) { this.maxDepth = depth; return this; }
        public Builder maxNodes(int nodes) { this.maxNodes = nodes; return this; }

        public InverseReachabilityOptions build() {
            return new InverseReachabilityOptions(table, field, maxDepth, maxNodes);
        }
    }
}
