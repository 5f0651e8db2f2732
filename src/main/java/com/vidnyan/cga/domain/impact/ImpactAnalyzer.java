package com.vidnyan.cga.domain.impact;

import com.vidnyan.cga.domain.graph.ReachabilityEngine;
import com.vidnyan.cga.domain.graph.ReachabilityOptions;
import com.vidnyan.cga.domain.graph.ReachableAccess;
import com.vidnyan.cga.domain.graph.Sensitivity;
import com.vidnyan.cga.domain.graph.SensitivityClassifier;
import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallPathNode;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.FunctionRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers "what breaks if I change this" by walking incoming call edges
 * from the changed functions. Sensitive data reachable from the changed code
 * is paired with every affected entry point that calls into it, and feeds the
 * risk scores. Read-only over the graph.
 */
public final class ImpactAnalyzer {

    private static final int AFFECTED_WEIGHT = 2;
    private static final int AFFECTED_CAP = 30;
    private static final int ENTRY_POINT_WEIGHT = 5;
    private static final int ENTRY_POINT_CAP = 25;
    private static final int MAX_RISK = 100;

    private final CallGraph graph;
    private final ImpactPolicy policy;
    private final ReachabilityEngine reachability;

    public ImpactAnalyzer(CallGraph graph, ImpactPolicy policy, SensitivityClassifier classifier) {
        this.graph = graph;
        this.policy = policy;
        this.reachability = new ReachabilityEngine(graph, classifier);
    }

    public ImpactAnalyzer(CallGraph graph, ImpactPolicy policy) {
        this(graph, policy, SensitivityClassifier.none());
    }

    public ImpactAnalyzer(CallGraph graph) {
        this(graph, ImpactPolicy.defaults());
    }

    /**
     * @throws IllegalArgumentException if the function id is unknown
     */
    public ImpactResult analyze(String functionId, ChangeKind kind) {
        FunctionRecord function = graph.function(functionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown function: " + functionId));
        ImpactResult.Target target = new ImpactResult.Target("function", function.file(),
                List.of(functionId), function.qualifiedName());
        return analyzeAll(List.of(function), target, kind);
    }

    /**
     * Impact of changing every function defined in a file.
     */
    public ImpactResult analyzeFile(String file, ChangeKind kind) {
        List<FunctionRecord> functions = graph.functionsInFile(file);
        ImpactResult.Target target = new ImpactResult.Target("file", file,
                functions.stream().map(FunctionRecord::id).toList(), file);
        return analyzeAll(functions, target, kind);
    }

    private ImpactResult analyzeAll(List<FunctionRecord> changed, ImpactResult.Target target, ChangeKind kind) {
        Set<String> changedIds = new LinkedHashSet<>();
        changed.forEach(f -> changedIds.add(f.id()));

        List<DirectEffect> directEffects = new ArrayList<>();
        Map<String, AffectedFunction> affected = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>(changedIds);
        Deque<Step> frontier = new ArrayDeque<>();

        for (FunctionRecord function : changed) {
            List<CallPathNode> changedPath = List.of(CallPathNode.of(function, function.startLine()));
            for (CallReference incoming : function.calledBy()) {
                if (changedIds.contains(incoming.callerId())) {
                    continue;
                }
                FunctionRecord caller = graph.functions().get(incoming.callerId());
                if (caller == null) {
                    continue;
                }
                directEffects.add(new DirectEffect(caller.id(), caller.qualifiedName(), function.id(),
                        incoming.file(), incoming.line(), incoming.column(), kind.signatureIncompatible()));
                if (visited.add(caller.id())) {
                    frontier.add(new Step(caller, 1, prepend(caller, changedPath)));
                }
            }
        }

        while (!frontier.isEmpty()) {
            Step step = frontier.poll();
            FunctionRecord current = step.function();
            affected.put(current.id(), new AffectedFunction(current.id(), current.name(), current.qualifiedName(),
                    current.file(), current.startLine(), step.depth(),
                    step.depth() == 1 ? AffectedFunction.DIRECT : AffectedFunction.TRANSITIVE,
                    current.entryPointKind(), accessesSensitiveData(current), step.path()));

            if (step.depth() >= policy.maxDepth()) {
                continue;
            }
            for (CallReference incoming : current.calledBy()) {
                FunctionRecord caller = graph.functions().get(incoming.callerId());
                if (caller == null || !visited.add(caller.id())) {
                    continue;
                }
                frontier.add(new Step(caller, step.depth() + 1, prepend(caller, step.path())));
            }
        }

        List<AffectedFunction> all = affected.values().stream()
                .sorted(Comparator.comparingInt(AffectedFunction::depth).thenComparing(AffectedFunction::id))
                .toList();
        List<AffectedFunction> transitive = all.stream()
                .filter(a -> a.depth() > 1)
                .toList();
        List<AffectedFunction> entryPoints = all.stream()
                .filter(AffectedFunction::entryPoint)
                .toList();
        List<AffectedFunction> tests = all.stream()
                .filter(AffectedFunction::test)
                .toList();

        int directCallers = (int) all.stream().filter(a -> a.depth() == 1).count();
        BlastRadius radius = classify(directCallers, all.size(), entryPoints.size());
        int maxDepth = all.stream().mapToInt(AffectedFunction::depth).max().orElse(0);

        List<AffectedDataPath> dataPaths = sensitiveDataPaths(entryPoints);
        List<EntryPointRisk> risks = entryPoints.stream()
                .map(e -> entryPointRisk(e, dataPaths))
                .sorted(Comparator.comparingInt(EntryPointRisk::riskScore).reversed()
                        .thenComparing(EntryPointRisk::entryPointId))
                .toList();

        return new ImpactResult(target, kind, kind.signatureIncompatible() && !directEffects.isEmpty(),
                directEffects, transitive, entryPoints, tests, radius,
                riskScore(all.size(), entryPoints.size(), dataPaths), dataPaths, risks,
                new ImpactResult.Summary(directCallers, transitive.size(), entryPoints.size(), tests.size(),
                        dataPaths.size(), maxDepth));
    }

    /**
     * Pairs each affected entry point with the sensitive data reachable from the changed function
     * its path ends at.
     */
    private List<AffectedDataPath> sensitiveDataPaths(List<AffectedFunction> entryPoints) {
        ReachabilityOptions options = ReachabilityOptions.builder()
                .sensitiveOnly(true)
                .maxDepth(policy.maxDepth())
                .build();
        Map<String, List<ReachableAccess>> reachedFrom = new HashMap<>();
        List<AffectedDataPath> paths = new ArrayList<>();

        for (AffectedFunction entryPoint : entryPoints) {
            List<CallPathNode> toChange = entryPoint.pathToChange();
            String changedId = toChange.get(toChange.size() - 1).functionId();
            List<ReachableAccess> reached = reachedFrom.computeIfAbsent(changedId,
                    id -> reachability.forward(id, options).reachableAccess());
            for (ReachableAccess access : reached) {
                List<CallPathNode> fullPath = new ArrayList<>(toChange);
                fullPath.addAll(access.path().subList(1, access.path().size()));
                paths.add(new AffectedDataPath(entryPoint.id(), access.access().table(), access.access().fields(),
                        access.access().operation(), reachability.sensitivityOf(access.access()), fullPath));
            }
        }

        paths.sort(Comparator.comparing(AffectedDataPath::sensitivity)
                .thenComparing(AffectedDataPath::entryPoint)
                .thenComparing(AffectedDataPath::table));
        return paths;
    }

    private EntryPointRisk entryPointRisk(AffectedFunction entryPoint, List<AffectedDataPath> dataPaths) {
        List<AffectedDataPath> own = dataPaths.stream()
                .filter(p -> p.entryPoint().equals(entryPoint.id()))
                .toList();
        Sensitivity highest = own.stream()
                .map(AffectedDataPath::sensitivity)
                .min(Comparator.naturalOrder())
                .orElse(Sensitivity.UNKNOWN);
        int score = proximity(entryPoint.depth()) + own.stream().mapToInt(p -> p.sensitivity().riskWeight()).sum();
        return new EntryPointRisk(entryPoint.id(), entryPoint.qualifiedName(), entryPoint.depth(), own.size(),
                highest, Math.min(MAX_RISK, score));
    }

    // Entry points close to the change break first.
    private static int proximity(int depth) {
        if (depth <= 2) {
            return 20;
        }
        return depth <= 5 ? 10 : 0;
    }

    private static int riskScore(int affectedCount, int entryPointCount, List<AffectedDataPath> dataPaths) {
        int score = Math.min(AFFECTED_CAP, affectedCount * AFFECTED_WEIGHT)
                + Math.min(ENTRY_POINT_CAP, entryPointCount * ENTRY_POINT_WEIGHT)
                + dataPaths.stream().mapToInt(p -> p.sensitivity().riskWeight()).sum();
        return Math.min(MAX_RISK, score);
    }

    private boolean accessesSensitiveData(FunctionRecord function) {
        return function.dataAccess().stream().anyMatch(f -> reachability.sensitivityOf(f).sensitive());
    }

    private BlastRadius classify(int directCallers, int affectedCount, int entryPointCount) {
        if (directCallers == 0) {
            return BlastRadius.MINIMAL;
        }
        if (entryPointCount >= policy.severeEntryPointThreshold() || affectedCount >= policy.widelyUsedThreshold()) {
            return BlastRadius.SEVERE;
        }
        if (entryPointCount > 0) {
            return BlastRadius.SIGNIFICANT;
        }
        return BlastRadius.MODERATE;
    }

    private static List<CallPathNode> prepend(FunctionRecord caller, List<CallPathNode> path) {
        List<CallPathNode> extended = new ArrayList<>(path.size() + 1);
        extended.add(CallPathNode.of(caller, caller.startLine()));
        extended.addAll(path);
        return List.copyOf(extended);
    }

    private record Step(FunctionRecord function, int depth, List<CallPathNode> path) {}
}
