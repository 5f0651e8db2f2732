package com.vidnyan.cga.application.service;

import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.application.error.GraphQueryException;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase;
import com.vidnyan.cga.application.port.in.ToolResponse;
import com.vidnyan.cga.application.port.in.ToolResponse.NextAction;
import com.vidnyan.cga.application.port.out.CallGraphRepository;
import com.vidnyan.cga.domain.graph.DeadCodeCandidate;
import com.vidnyan.cga.domain.graph.DeadCodeDetector;
import com.vidnyan.cga.domain.graph.InverseAccessPath;
import com.vidnyan.cga.domain.graph.InverseReachabilityOptions;
import com.vidnyan.cga.domain.graph.InverseReachabilityResult;
import com.vidnyan.cga.domain.graph.ReachabilityEngine;
import com.vidnyan.cga.domain.graph.ReachabilityOptions;
import com.vidnyan.cga.domain.graph.ReachabilityResult;
import com.vidnyan.cga.domain.graph.ReachableAccess;
import com.vidnyan.cga.domain.graph.SensitivityClassifier;
import com.vidnyan.cga.domain.impact.AffectedFunction;
import com.vidnyan.cga.domain.impact.ChangeKind;
import com.vidnyan.cga.domain.impact.DirectEffect;
import com.vidnyan.cga.domain.impact.ImpactAnalyzer;
import com.vidnyan.cga.domain.impact.ImpactPolicy;
import com.vidnyan.cga.domain.impact.ImpactResult;
import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.FunctionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tool-serving facade over the current graph snapshot.
 * Every failure leaves here as a {@link GraphQueryException} with a remediation hint.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallGraphQueryService implements QueryCallGraphUseCase {

    private static final int MAX_SUGGESTIONS = 5;

    private final CallGraphSnapshot snapshot;
    private final CallGraphRepository callGraphRepository;
    private final SensitivityClassifier sensitivityClassifier;
    private final CgaProperties properties;

    @Override
    public ToolResponse<CallersData> callers(CallersRequest request) {
        CallGraph graph = graphFor(request.projectRoot());
        int maxDepth = nonNegative(request.maxDepth(), properties.getQuery().getCallersMaxDepth(), "maxDepth");
        int limit = limit(request.limit());
        List<String> warnings = new ArrayList<>();
        FunctionRecord target = findFunction(graph, request.function(), request.file(), warnings);

        List<CallerInfo> callers = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(target.id());
        Deque<CallerInfo> frontier = new ArrayDeque<>();
        for (CallReference incoming : target.calledBy()) {
            if (visited.add(incoming.callerId())) {
                graph.function(incoming.callerId()).ifPresent(caller ->
                        frontier.add(callerInfo(caller, incoming, 1)));
            }
        }
        while (!frontier.isEmpty()) {
            CallerInfo current = frontier.poll();
            callers.add(current);
            if (current.depth() >= maxDepth) {
                continue;
            }
            FunctionRecord function = graph.functions().get(current.id());
            for (CallReference incoming : function.calledBy()) {
                if (visited.add(incoming.callerId())) {
                    graph.function(incoming.callerId()).ifPresent(caller ->
                            frontier.add(callerInfo(caller, incoming, current.depth() + 1)));
                }
            }
        }

        int direct = (int) callers.stream().filter(c -> c.depth() == 1).count();
        int entryPoints = (int) callers.stream().filter(c -> c.entryPointKind() != null).count();
        int ambiguous = (int) graph.allFunctions().stream()
                .flatMap(f -> f.calls().stream())
                .filter(c -> c.ambiguousMatch() && c.candidates().contains(target.id()))
                .count();
        if (ambiguous > 0) {
            warnings.add(ambiguous + " ambiguous call(s) may also target " + target.qualifiedName());
        }

        Paging.Page<CallerInfo> page = Paging.page(callers, request.cursor(), limit);
        String summary = callers.isEmpty()
                ? target.qualifiedName() + " has no known callers"
                : String.format("%s has %d direct and %d transitive callers (%d entry points)",
                        target.qualifiedName(), direct, callers.size() - direct, entryPoints);

        List<NextAction> next = new ArrayList<>();
        next.add(new NextAction("impact", "See what breaks if " + target.name() + " changes",
                Map.of("function", target.id())));
        if (callers.isEmpty() && target.entryPointKind() == null) {
            next.add(new NextAction("deadCode", "Function may be unused", Map.of("file", target.file())));
        }
        next.add(new NextAction("reachability", "See what data " + target.name() + " can touch",
                Map.of("function", target.id())));

        return new ToolResponse<>(
                new CallersData(FunctionSummary.of(target), page.items(), direct, callers.size() - direct,
                        entryPoints, ambiguous),
                summary, next, warnings, page.pagination());
    }

    @Override
    public ToolResponse<ReachabilityData> reachability(ReachabilityRequest request) {
        CallGraph graph = graphFor(request.projectRoot());
        int maxDepth = nonNegative(request.maxDepth(), properties.getQuery().getReachabilityMaxDepth(), "maxDepth");
        int limit = limit(request.limit());
        List<String> warnings = new ArrayList<>();

        ReachabilityOptions options = ReachabilityOptions.builder()
                .maxDepth(maxDepth)
                .sensitiveOnly(request.sensitiveOnly())
                .tables(request.tables())
                .includeUnresolved(request.includeUnresolved())
                .build();
        ReachabilityEngine engine = new ReachabilityEngine(graph, sensitivityClassifier);

        ReachabilityResult result;
        if (request.function() != null && !request.function().isBlank()) {
            FunctionRecord origin = findFunction(graph, request.function(), request.file(), warnings);
            result = engine.forward(origin.id(), options);
        } else if (request.file() != null && request.line() != null) {
            if (graph.functionsInFile(request.file()).isEmpty()) {
                throw GraphQueryException.fileNotFound(request.file());
            }
            result = engine.forwardFromLocation(request.file(), request.line(), options);
            if (result.origin().functionId() == null) {
                warnings.add("No function spans " + request.file() + ":" + request.line());
            }
        } else {
            throw GraphQueryException.invalidArgument("Either function or file and line are required");
        }

        if (result.truncated()) {
            warnings.add("Traversal stopped at the node budget; results are partial");
        }
        long unresolved = result.unresolvedReach().size();
        Paging.Page<ReachableAccess> page =
                Paging.page(result.reachableAccess(), request.cursor(), limit);

        String originName = result.origin().toString();
        String summary = result.tables().isEmpty()
                ? originName + " reaches no data within depth " + maxDepth
                : String.format("%s reaches %d table(s) [%s] through %d function(s), max depth %d",
                        originName, result.tables().size(), String.join(", ", result.tables()),
                        result.functionsVisited(), result.maxDepthReached());
        if (unresolved > 0) {
            summary += String.format("; %d call(s) could not be followed", unresolved);
        }

        List<NextAction> next = new ArrayList<>();
        for (String table : result.tables().stream().limit(3).toList()) {
            next.add(new NextAction("dataAccessors", "See every entry point that reaches " + table,
                    Map.of("table", table)));
        }
        if (!request.includeUnresolved()) {
            next.add(new NextAction("reachability", "Include calls that could not be resolved",
                    Map.of("includeUnresolved", true)));
        }

        return new ToolResponse<>(
                new ReachabilityData(result.origin(), result.tables(), page.items(), result.sensitiveFields(),
                        result.maxDepthReached(), result.functionsVisited(), result.unresolvedReach(),
                        result.truncated()),
                summary, next, warnings, page.pagination());
    }

    @Override
    public ToolResponse<InverseData> dataAccessors(InverseRequest request) {
        CallGraph graph = graphFor(request.projectRoot());
        if (request.table() == null || request.table().isBlank()) {
            throw GraphQueryException.invalidArgument("table is required");
        }
        int maxDepth = nonNegative(request.maxDepth(), Integer.MAX_VALUE, "maxDepth");
        int limit = limit(request.limit());
        List<String> warnings = new ArrayList<>();

        InverseReachabilityResult result = new ReachabilityEngine(graph, sensitivityClassifier)
                .inverse(InverseReachabilityOptions.builder()
                        .table(request.table())
                        .field(request.field())
                        .maxDepth(maxDepth)
                        .build());

        if (result.totalAccessors() == 0) {
            warnings.add("No function accesses " + target(request.table(), request.field()));
        }
        Paging.Page<InverseAccessPath> page =
                Paging.page(result.accessPaths(), request.cursor(), limit);
        String summary = String.format("%d entry point(s) reach %s through %d accessor(s)",
                result.entryPoints().size(), target(request.table(), request.field()), result.totalAccessors());

        List<NextAction> next = new ArrayList<>();
        for (String entryPoint : result.entryPoints().stream().limit(3).toList()) {
            next.add(new NextAction("reachability", "See everything this entry point can touch",
                    Map.of("function", entryPoint)));
        }

        return new ToolResponse<>(
                new InverseData(result.table(), result.field(), result.entryPoints(), page.items(),
                        result.totalAccessors()),
                summary, next, warnings, page.pagination());
    }

    @Override
    public ToolResponse<ImpactData> impact(ImpactRequest request) {
        CallGraph graph = graphFor(request.projectRoot());
        ChangeKind kind = changeKind(request.changeKind());
        int limit = limit(request.limit());
        List<String> warnings = new ArrayList<>();

        CgaProperties.Impact settings = properties.getImpact();
        ImpactAnalyzer analyzer = new ImpactAnalyzer(graph, new ImpactPolicy(settings.getMaxDepth(),
                settings.getSevereEntryPointThreshold(), settings.getWidelyUsedThreshold()), sensitivityClassifier);

        ImpactResult result;
        if (request.function() != null && !request.function().isBlank()) {
            FunctionRecord target = findFunction(graph, request.function(), request.file(), warnings);
            result = analyzer.analyze(target.id(), kind);
        } else if (request.file() != null && !request.file().isBlank()) {
            if (graph.functionsInFile(request.file()).isEmpty()) {
                throw GraphQueryException.fileNotFound(request.file());
            }
            result = analyzer.analyzeFile(request.file(), kind);
        } else {
            throw GraphQueryException.invalidArgument("Either function or file is required");
        }

        Paging.Page<DirectEffect> page =
                Paging.page(result.directEffects(), request.cursor(), limit);
        ImpactResult.Summary counts = result.summary();
        String summary = String.format("Changing %s (%s): %s blast radius, risk %d/100, %d direct and %d transitive "
                        + "callers, %d entry point(s), %d test(s), %d sensitive data path(s)",
                result.target().name(), kind.tag(), result.blastRadius().tag(), result.riskScore(),
                counts.directCallers(), counts.transitiveCallers(), counts.affectedEntryPoints(),
                counts.affectedTests(), counts.affectedDataPaths());
        if (result.touchesSensitiveData()) {
            warnings.add("Change reaches sensitive data: " + result.sensitiveDataPaths().get(0).sensitivity().tag());
        }

        List<NextAction> next = new ArrayList<>();
        if (!result.affectedTests().isEmpty()) {
            next.add(new NextAction("runTests", "Tests that exercise the change",
                    Map.of("tests", result.affectedTests().stream().limit(limit).map(AffectedFunction::id).toList())));
        }
        if (counts.directCallers() > 0) {
            next.add(new NextAction("callers", "Inspect the direct callers",
                    Map.of("function", result.target().functionIds().get(0))));
        }

        return new ToolResponse<>(
                new ImpactData(result.target(), kind, result.breaking(), result.blastRadius(), result.riskScore(),
                        counts, page.items(),
                        result.affectedEntryPoints().stream().limit(limit).toList(),
                        result.affectedTests().stream().limit(limit).toList(),
                        result.entryPointRisks().stream().limit(limit).toList(),
                        result.sensitiveDataPaths().stream().limit(limit).toList()),
                summary, next, warnings, page.pagination());
    }

    @Override
    public ToolResponse<DeadCodeData> deadCode(DeadCodeRequest request) {
        CallGraph graph = graphFor(request.projectRoot());
        int limit = limit(request.limit());
        if (request.file() != null && graph.functionsInFile(request.file()).isEmpty()) {
            throw GraphQueryException.fileNotFound(request.file());
        }

        List<DeadCodeCandidate> all = new DeadCodeDetector(graph).detect().stream()
                .filter(c -> request.file() == null || c.file().equals(request.file()))
                .toList();
        int high = (int) all.stream().filter(c -> c.confidence() == DeadCodeCandidate.Confidence.HIGH).count();
        List<DeadCodeCandidate> shown = request.includeLowConfidence() ? all
                : all.stream().filter(c -> c.confidence() == DeadCodeCandidate.Confidence.HIGH).toList();

        Paging.Page<DeadCodeCandidate> page = Paging.page(shown, request.cursor(), limit);
        String summary = String.format("%d function(s) without callers (%d high confidence)", all.size(), high);
        List<NextAction> next = page.items().stream()
                .limit(3)
                .map(c -> new NextAction("impact", "Check nothing depends on " + c.qualifiedName(),
                        Map.<String, Object>of("function", c.functionId(), "changeKind", ChangeKind.DELETE.tag())))
                .toList();

        return new ToolResponse<>(new DeadCodeData(page.items(), high, all.size() - high),
                summary, next, List.of(), page.pagination());
    }

    /**
     * Snapshot graph when it belongs to this root, otherwise the persisted one.
     */
    CallGraph graphFor(Path projectRoot) {
        if (projectRoot == null) {
            throw GraphQueryException.invalidArgument("projectRoot is required");
        }
        Path root = projectRoot.toAbsolutePath().normalize();
        return snapshot.currentFor(root.toString())
                .or(() -> {
                    log.debug("Loading persisted graph for {}", root);
                    return callGraphRepository.load(root).map(graph -> {
                        snapshot.replace(graph);
                        return graph;
                    });
                })
                .orElseThrow(() -> GraphQueryException.notBuilt(root.toString()));
    }

    private FunctionRecord findFunction(CallGraph graph, String name, String file, List<String> warnings) {
        if (name == null || name.isBlank()) {
            throw GraphQueryException.invalidArgument("function is required");
        }
        if (graph.functions().containsKey(name)) {
            return graph.functions().get(name);
        }
        List<FunctionRecord> matches = graph.functionsNamed(name).stream()
                .filter(f -> file == null || f.file().equals(file))
                .toList();
        if (matches.isEmpty()) {
            throw GraphQueryException.functionNotFound(name, similarNames(graph, name));
        }
        if (matches.size() > 1) {
            warnings.add(String.format("%d functions named %s; using %s (pass file to choose)",
                    matches.size(), name, matches.get(0).id()));
        }
        return matches.get(0);
    }

    private static List<String> similarNames(CallGraph graph, String name) {
        String needle = name.toLowerCase();
        return graph.allFunctions().stream()
                .filter(f -> f.qualifiedName().toLowerCase().contains(needle)
                        || needle.contains(f.name().toLowerCase()))
                .map(FunctionRecord::qualifiedName)
                .distinct()
                .sorted(Comparator.comparingInt(String::length))
                .limit(MAX_SUGGESTIONS)
                .toList();
    }

    private static CallerInfo callerInfo(FunctionRecord caller, CallReference reference, int depth) {
        return new CallerInfo(caller.id(), caller.qualifiedName(), caller.file(), reference.line(), depth,
                reference.confidence(), caller.entryPointKind());
    }

    private static ChangeKind changeKind(String tag) {
        if (tag == null || tag.isBlank()) {
            return ChangeKind.CHANGE_SIGNATURE;
        }
        try {
            return ChangeKind.fromTag(tag);
        } catch (IllegalArgumentException e) {
            throw GraphQueryException.invalidArgument(e.getMessage());
        }
    }

    private int limit(Integer requested) {
        CgaProperties.Query query = properties.getQuery();
        if (requested == null) {
            return query.getDefaultLimit();
        }
        if (requested < 1) {
            throw GraphQueryException.invalidArgument("limit must be positive");
        }
        return Math.min(requested, query.getMaxLimit());
    }

    private static int nonNegative(Integer requested, int fallback, String name) {
        if (requested == null) {
            return fallback;
        }
        if (requested < 0) {
            throw GraphQueryException.invalidArgument(name + " must not be negative");
        }
        return requested;
    }

    private static String target(String table, String field) {
        return field == null ? table : table + "." + field;
    }
}
