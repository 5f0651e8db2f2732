package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallPathNode;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.CodeLocation;
import com.vidnyan.cga.domain.model.DataAccessFact;
import com.vidnyan.cga.domain.model.FunctionRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Forward and inverse breadth-first traversal over a resolved call graph.
 * Iterative with an explicit frontier and visited set, so recursion in the
 * analyzed code terminates by construction. Never mutates the graph.
 */
public final class ReachabilityEngine {

    private final CallGraph graph;
    private final SensitivityClassifier classifier;

    public ReachabilityEngine(CallGraph graph, SensitivityClassifier classifier) {
        this.graph = graph;
        this.classifier = classifier;
    }

    public ReachabilityEngine(CallGraph graph) {
        this(graph, SensitivityClassifier.none());
    }

    /**
     * What data can this function eventually touch.
     * @throws IllegalArgumentException if the function id is unknown
     */
    public ReachabilityResult forward(String functionId, ReachabilityOptions options) {
        FunctionRecord origin = graph.function(functionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown function: " + functionId));

        List<ReachableAccess> accesses = new ArrayList<>();
        List<UnknownReach> unknown = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<Frame> frontier = new ArrayDeque<>();

        visited.add(origin.id());
        frontier.add(new Frame(origin, 0, List.of(CallPathNode.of(origin, origin.startLine()))));

        int functionsVisited = 0;
        int maxDepthReached = 0;
        boolean truncated = false;

        while (!frontier.isEmpty()) {
            Frame frame = frontier.poll();
            FunctionRecord current = frame.function();
            functionsVisited++;
            maxDepthReached = Math.max(maxDepthReached, frame.depth());

            for (DataAccessFact fact : current.dataAccess()) {
                if (accepts(fact, options)) {
                    accesses.add(new ReachableAccess(fact, frame.path(), frame.depth()));
                }
            }

            if (frame.depth() >= options.maxDepth()) {
                continue;
            }

            for (CallReference call : current.calls()) {
                if (!call.resolved()) {
                    if (options.includeUnresolved()) {
                        unknown.add(new UnknownReach(current.id(), call.calleeName(), call.line(),
                                frame.depth(), call.unresolvedReason(), call.candidates()));
                    }
                    continue;
                }
                if (visited.contains(call.calleeId())) {
                    continue;
                }
                Optional<FunctionRecord> callee = graph.function(call.calleeId());
                if (callee.isEmpty()) {
                    continue;
                }
                if (visited.size() >= options.maxNodes()) {
                    truncated = true;
                    continue;
                }
                visited.add(callee.get().id());
                frontier.add(new Frame(callee.get(), frame.depth() + 1,
                        append(frame.path(), CallPathNode.of(callee.get(), call.line()))));
            }
        }

        List<String> tables = accesses.stream()
                .map(a -> a.access().table())
                .distinct()
                .sorted()
                .toList();

        return new ReachabilityResult(CodeLocation.of(origin), accesses, tables, summarizeSensitive(accesses),
                maxDepthReached, functionsVisited, unknown, truncated);
    }

    /**
     * Forward query from a source position; the innermost function containing the line is the origin.
     * Returns an empty result when no function spans that line.
     */
    public ReachabilityResult forwardFromLocation(String file, int line, ReachabilityOptions options) {
        return graph.functionAt(file, line)
                .map(f -> forward(f.id(), options))
                .orElseGet(() -> ReachabilityResult.empty(new CodeLocation(file, line, null, null)));
    }

    /**
     * Every call path from a source position to the given table (and field, if not null).
     */
    public List<ReachableAccess> callPaths(String file, int line, String table, String field) {
        ReachabilityOptions options = ReachabilityOptions.builder().tables(Set.of(table)).build();
        return forwardFromLocation(file, line, options).reachableAccess().stream()
                .filter(a -> a.access().matches(table, field))
                .toList();
    }

    /**
     * What entry points can eventually touch this data.
     * Keeps one representative path per (entry point, accessor) pair: the first found, which is a shortest one.
     */
    public InverseReachabilityResult inverse(InverseReachabilityOptions options) {
        List<FunctionRecord> accessors = graph.allFunctions().stream()
                .filter(f -> f.dataAccess().stream().anyMatch(d -> d.matches(options.table(), options.field())))
                .toList();

        Set<String> entryPointIds = new HashSet<>(graph.entryPoints());
        List<InverseAccessPath> paths = new ArrayList<>();
        Set<String> entryPointsReached = new TreeSet<>();
        boolean truncated = false;

        for (FunctionRecord accessor : accessors) {
            DataAccessFact accessPoint = accessor.dataAccess().stream()
                    .filter(d -> d.matches(options.table(), options.field()))
                    .findFirst()
                    .orElseThrow();

            // function id -> next hop towards the accessor
            Map<String, Hop> towardsAccessor = new LinkedHashMap<>();
            Map<String, Integer> depthOf = new HashMap<>();
            Deque<String> frontier = new ArrayDeque<>();
            towardsAccessor.put(accessor.id(), null);
            depthOf.put(accessor.id(), 0);
            frontier.add(accessor.id());

            while (!frontier.isEmpty()) {
                String currentId = frontier.poll();
                FunctionRecord current = graph.functions().get(currentId);
                int depth = depthOf.get(currentId);

                if (entryPointIds.contains(currentId)) {
                    entryPointsReached.add(currentId);
                    paths.add(new InverseAccessPath(currentId, pathDown(current, towardsAccessor),
                            accessPoint, accessor.id()));
                }
                if (depth >= options.maxDepth()) {
                    continue;
                }
                for (CallReference incoming : current.calledBy()) {
                    String callerId = incoming.callerId();
                    if (towardsAccessor.containsKey(callerId) || !graph.functions().containsKey(callerId)) {
                        continue;
                    }
                    if (towardsAccessor.size() >= options.maxNodes()) {
                        truncated = true;
                        continue;
                    }
                    towardsAccessor.put(callerId, new Hop(currentId, incoming.line()));
                    depthOf.put(callerId, depth + 1);
                    frontier.add(callerId);
                }
            }
        }

        paths.sort(Comparator.comparing(InverseAccessPath::entryPoint)
                .thenComparing(InverseAccessPath::accessorId));

        return new InverseReachabilityResult(options.table(), options.field(), paths,
                List.copyOf(entryPointsReached), accessors.size(), truncated);
    }

    private List<CallPathNode> pathDown(FunctionRecord entry, Map<String, Hop> towardsAccessor) {
        List<CallPathNode> path = new ArrayList<>();
        path.add(CallPathNode.of(entry, entry.startLine()));
        Hop hop = towardsAccessor.get(entry.id());
        while (hop != null) {
            FunctionRecord next = graph.functions().get(hop.functionId());
            path.add(CallPathNode.of(next, hop.line()));
            hop = towardsAccessor.get(hop.functionId());
        }
        return path;
    }

    private boolean accepts(DataAccessFact fact, ReachabilityOptions options) {
        if (!options.allowsTable(fact.table())) {
            return false;
        }
        return !options.sensitiveOnly() || sensitivityOf(fact).sensitive();
    }

    /**
     * Most sensitive class among the table and the fields a fact touches.
     */
    public Sensitivity sensitivityOf(DataAccessFact fact) {
        Sensitivity best = classifier.classify(fact.table(), null);
        for (String field : fact.fields()) {
            Sensitivity s = classifier.classify(fact.table(), field);
            if (s.ordinal() < best.ordinal()) {
                best = s;
            }
        }
        return best;
    }

    private List<SensitiveFieldAccess> summarizeSensitive(List<ReachableAccess> accesses) {
        Map<FieldKey, List<ReachableAccess>> byField = new LinkedHashMap<>();
        Map<FieldKey, Sensitivity> sensitivityByKey = new HashMap<>();

        for (ReachableAccess access : accesses) {
            for (String field : access.access().fields()) {
                Sensitivity s = classifier.classify(access.access().table(), field);
                if (s.sensitive()) {
                    FieldKey key = new FieldKey(access.access().table(), field);
                    byField.computeIfAbsent(key, k -> new ArrayList<>()).add(access);
                    sensitivityByKey.put(key, s);
                }
            }
        }

        return byField.entrySet().stream()
                .map(e -> new SensitiveFieldAccess(e.getKey().table(), e.getKey().field(),
                        sensitivityByKey.get(e.getKey()), e.getValue().size(),
                        e.getValue().stream().map(ReachableAccess::path).toList()))
                .sorted(Comparator.comparing(SensitiveFieldAccess::sensitivity)
                        .thenComparing(SensitiveFieldAccess::table)
                        .thenComparing(SensitiveFieldAccess::field))
                .toList();
    }

    private static List<CallPathNode> append(List<CallPathNode> path, CallPathNode node) {
        List<CallPathNode> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(node);
        return List.copyOf(extended);
    }

    private record Frame(FunctionRecord function, int depth, List<CallPathNode> path) {}

    private record Hop(String functionId, int line) {}

    private record FieldKey(String table, String field) {}
}
