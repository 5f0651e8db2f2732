package com.vidnyan.cga.application.service;

import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.FunctionRecord;
import com.vidnyan.cga.domain.model.GraphStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of assembly: every function with its calls still unresolved, the symbol index,
 * and the pending calls to hand to the resolver.
 */
public record AssembledGraph(
    String projectRoot,
    Map<String, FunctionRecord> functions,
    SymbolIndex index,
    List<PendingCall> pendingCalls,
    ExtractionSummary extraction
) {

    /**
     * Aggregate extraction quality across the files of one build.
     */
    public record ExtractionSummary(
        int filesScanned,
        int filesUsingFallback,
        int filesWithErrors,
        double averageConfidence
    ) {}

    public AssembledGraph {
        functions = Map.copyOf(functions);
        pendingCalls = List.copyOf(pendingCalls);
    }

    /**
     * The graph as it stands before resolution: all references unresolved.
     */
    public CallGraph unresolvedGraph(Instant generatedAt) {
        List<String> entryPoints = functions.values().stream()
                .filter(FunctionRecord::entryPoint)
                .map(FunctionRecord::id)
                .toList();
        List<String> accessors = functions.values().stream()
                .filter(FunctionRecord::dataAccessor)
                .map(FunctionRecord::id)
                .toList();
        return new CallGraph(CallGraph.SCHEMA_VERSION, generatedAt, projectRoot, new TreeMap<>(functions),
                entryPoints, accessors, GraphStats.empty());
    }
}
