package com.vidnyan.cga.domain.impact;

/**
 * Thresholds for impact analysis.
 * @param maxDepth caller hops walked from the changed symbol
 * @param severeEntryPointThreshold affected entry points that make a change severe
 * @param widelyUsedThreshold affected functions that make a change severe
 */
public record ImpactPolicy(
    int maxDepth,
    int severeEntryPointThreshold,
    int widelyUsedThreshold
) {

    public static ImpactPolicy defaults() {
        return new ImpactPolicy(10, 5, 20);
    }
}
