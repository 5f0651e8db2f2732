package com.vidnyan.cga.domain.impact;

import java.util.List;

/**
 * Outcome of an impact analysis.
 */
public record ImpactResult(
    Target target,
    ChangeKind changeKind,
    boolean breaking,
    List<DirectEffect> directEffects,
    List<AffectedFunction> transitiveEffects,
    List<AffectedFunction> affectedEntryPoints,
    List<AffectedFunction> affectedTests,
    BlastRadius blastRadius,
    int riskScore,
    List<AffectedDataPath> sensitiveDataPaths,
    List<EntryPointRisk> entryPointRisks,
    Summary summary
) {

    public ImpactResult {
        directEffects = List.copyOf(directEffects);
        transitiveEffects = List.copyOf(transitiveEffects);
        affectedEntryPoints = List.copyOf(affectedEntryPoints);
        affectedTests = List.copyOf(affectedTests);
        sensitiveDataPaths = List.copyOf(sensitiveDataPaths);
        entryPointRisks = List.copyOf(entryPointRisks);
    }

    public boolean touchesSensitiveData() {
        return !sensitiveDataPaths.isEmpty();
    }

    /**
     * What was analyzed: one function or every function of a file.
     */
    public record Target(
        String type,
        String file,
        List<String> functionIds,
        String name
    ) {

        public Target {
            functionIds = List.copyOf(functionIds);
        }
    }

    public record Summary(
        int directCallers,
        int transitiveCallers,
        int affectedEntryPoints,
        int affectedTests,
        int affectedDataPaths,
        int maxDepth
    ) {}
}
