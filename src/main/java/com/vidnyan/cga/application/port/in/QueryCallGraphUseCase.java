package com.vidnyan.cga.application.port.in;

import com.vidnyan.cga.domain.graph.DeadCodeCandidate;
import com.vidnyan.cga.domain.graph.InverseAccessPath;
import com.vidnyan.cga.domain.graph.ReachableAccess;
import com.vidnyan.cga.domain.graph.SensitiveFieldAccess;
import com.vidnyan.cga.domain.graph.UnknownReach;
import com.vidnyan.cga.domain.impact.AffectedDataPath;
import com.vidnyan.cga.domain.impact.AffectedFunction;
import com.vidnyan.cga.domain.impact.BlastRadius;
import com.vidnyan.cga.domain.impact.ChangeKind;
import com.vidnyan.cga.domain.impact.DirectEffect;
import com.vidnyan.cga.domain.impact.EntryPointRisk;
import com.vidnyan.cga.domain.impact.ImpactResult;
import com.vidnyan.cga.domain.model.CodeLocation;
import com.vidnyan.cga.domain.model.EntryPointKind;
import com.vidnyan.cga.domain.model.FunctionRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Read-only operations over a built graph, addressed by plain identifiers.
 * Failures surface as {@link com.vidnyan.cga.application.error.GraphQueryException}.
 */
public interface QueryCallGraphUseCase {

    ToolResponse<CallersData> callers(CallersRequest request);

    ToolResponse<ReachabilityData> reachability(ReachabilityRequest request);

    ToolResponse<InverseData> dataAccessors(InverseRequest request);

    ToolResponse<ImpactData> impact(ImpactRequest request);

    ToolResponse<DeadCodeData> deadCode(DeadCodeRequest request);

    /**
     * Who calls a function. {@code file} narrows a name shared by several files.
     */
    record CallersRequest(
        Path projectRoot,
        String function,
        String file,
        Integer maxDepth,
        Integer limit,
        String cursor
    ) {
        public static CallersRequest of(Path root, String function) {
            return new CallersRequest(root, function, null, null, null, null);
        }
    }

    record CallersData(
        FunctionSummary target,
        List<CallerInfo> callers,
        int directCallers,
        int transitiveCallers,
        int entryPointCallers,
        int ambiguousReferences
    ) {}

    record CallerInfo(
        String id,
        String name,
        String file,
        int line,
        int depth,
        double confidence,
        EntryPointKind entryPointKind
    ) {}

    record FunctionSummary(
        String id,
        String qualifiedName,
        String file,
        int line,
        EntryPointKind entryPointKind
    ) {
        public static FunctionSummary of(FunctionRecord function) {
            return new FunctionSummary(function.id(), function.qualifiedName(), function.file(),
                    function.startLine(), function.entryPointKind());
        }
    }

    /**
     * Forward reachability from a function, or from a {@code file:line} position.
     */
    record ReachabilityRequest(
        Path projectRoot,
        String function,
        String file,
        Integer line,
        Integer maxDepth,
        boolean sensitiveOnly,
        Set<String> tables,
        boolean includeUnresolved,
        Integer limit,
        String cursor
    ) {
        public static ReachabilityRequest fromFunction(Path root, String function, Integer maxDepth) {
            return new ReachabilityRequest(root, function, null, null, maxDepth, false, Set.of(), false, null, null);
        }

        public static ReachabilityRequest fromLocation(Path root, String file, int line, Integer maxDepth) {
            return new ReachabilityRequest(root, null, file, line, maxDepth, false, Set.of(), false, null, null);
        }
    }

    record ReachabilityData(
        CodeLocation origin,
        List<String> tables,
        List<ReachableAccess> accesses,
        List<SensitiveFieldAccess> sensitiveFields,
        int maxDepthReached,
        int functionsVisited,
        List<UnknownReach> unresolvedReach,
        boolean truncated
    ) {}

    record InverseRequest(
        Path projectRoot,
        String table,
        String field,
        Integer maxDepth,
        Integer limit,
        String cursor
    ) {
        public static InverseRequest forTable(Path root, String table) {
            return new InverseRequest(root, table, null, null, null, null);
        }
    }

    record InverseData(
        String table,
        String field,
        List<String> entryPoints,
        List<InverseAccessPath> paths,
        int totalAccessors
    ) {}

    /**
     * Impact of changing a function, or every function of a file when {@code function} is null.
     */
    record ImpactRequest(
        Path projectRoot,
        String function,
        String file,
        String changeKind,
        Integer limit,
        String cursor
    ) {
        public static ImpactRequest forFunction(Path root, String function, String changeKind) {
            return new ImpactRequest(root, function, null, changeKind, null, null);
        }
    }

    record ImpactData(
        ImpactResult.Target target,
        ChangeKind changeKind,
        boolean breaking,
        BlastRadius blastRadius,
        int riskScore,
        ImpactResult.Summary summary,
        List<DirectEffect> directEffects,
        List<AffectedFunction> affectedEntryPoints,
        List<AffectedFunction> affectedTests,
        List<EntryPointRisk> entryPointRisks,
        List<AffectedDataPath> sensitiveDataPaths
    ) {}

    record DeadCodeRequest(
        Path projectRoot,
        String file,
        boolean includeLowConfidence,
        Integer limit,
        String cursor
    ) {
        public static DeadCodeRequest of(Path root) {
            return new DeadCodeRequest(root, null, false, null, null);
        }
    }

    record DeadCodeData(
        List<DeadCodeCandidate> candidates,
        int highConfidence,
        int lowConfidence
    ) {}
}
