package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallPathNode;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.FunctionRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Call paths between two functions over resolved edges.
 * Breadth-first over partial paths with an explicit queue, so paths come out
 * shortest first and no path visits a function twice. Never mutates the graph.
 */
public final class PathFinder {

    private final CallGraph graph;

    public PathFinder(CallGraph graph) {
        this.graph = graph;
    }

    /**
     * One shortest path, or empty when the target is out of reach within {@code options.maxDepth()}.
     * @throws IllegalArgumentException if either function id is unknown
     */
    public Optional<CallPath> findShortestPath(String fromId, String toId, PathOptions options) {
        FunctionRecord from = require(fromId);
        require(toId);

        // function id -> the hop that first reached it
        Map<String, Hop> reachedBy = new HashMap<>();
        Map<String, Integer> depthOf = new HashMap<>();
        Deque<FunctionRecord> frontier = new ArrayDeque<>();
        reachedBy.put(from.id(), null);
        depthOf.put(from.id(), 0);
        frontier.add(from);

        while (!frontier.isEmpty()) {
            FunctionRecord current = frontier.poll();
            if (current.id().equals(toId)) {
                return Optional.of(walkBack(from, toId, reachedBy));
            }
            int depth = depthOf.get(current.id());
            if (depth >= options.maxDepth()) {
                continue;
            }
            for (CallReference call : followed(current, options)) {
                if (reachedBy.containsKey(call.calleeId())) {
                    continue;
                }
                reachedBy.put(call.calleeId(), new Hop(current.id(), call.line(), call.confidence()));
                depthOf.put(call.calleeId(), depth + 1);
                frontier.add(graph.functions().get(call.calleeId()));
            }
        }
        return Optional.empty();
    }

    /**
     * Every cycle-free path up to the limits in {@code options}, shortest first.
     * @throws IllegalArgumentException if either function id is unknown
     */
    public PathSearchResult findAllPaths(String fromId, String toId, PathOptions options) {
        FunctionRecord from = require(fromId);
        require(toId);
        return search(from, toId, options, options.maxPaths());
    }

    public boolean isConnected(String fromId, String toId, int maxDepth) {
        return findShortestPath(fromId, toId, PathOptions.builder().maxDepth(maxDepth).build()).isPresent();
    }

    /**
     * Paths from every entry point of the graph to the target, shortest first.
     * @throws IllegalArgumentException if the function id is unknown
     */
    public PathSearchResult findPathsFromEntryPoints(String toId, PathOptions options) {
        require(toId);
        List<CallPath> paths = new ArrayList<>();
        boolean exhaustive = true;
        int nodesVisited = 0;

        for (String entryPointId : graph.entryPoints()) {
            if (paths.size() >= options.maxPaths()) {
                exhaustive = false;
                break;
            }
            Optional<FunctionRecord> entryPoint = graph.function(entryPointId);
            if (entryPoint.isEmpty()) {
                continue;
            }
            PathSearchResult result = search(entryPoint.get(), toId, options, options.maxPaths() - paths.size());
            paths.addAll(result.paths());
            nodesVisited += result.nodesVisited();
            exhaustive &= result.exhaustive();
        }

        paths.sort(Comparator.comparingInt(CallPath::depth).thenComparing(CallPath::origin));
        return new PathSearchResult(paths, exhaustive, nodesVisited);
    }

    private PathSearchResult search(FunctionRecord from, String toId, PathOptions options, int maxPaths) {
        List<CallPath> paths = new ArrayList<>();
        Deque<Partial> frontier = new ArrayDeque<>();
        frontier.add(new Partial(from, List.of(CallPathNode.of(from, from.startLine())), 1.0));
        int nodesVisited = 0;

        while (!frontier.isEmpty() && paths.size() < maxPaths && nodesVisited < options.maxExpansions()) {
            Partial partial = frontier.poll();
            nodesVisited++;
            FunctionRecord current = partial.function();

            if (current.id().equals(toId)) {
                paths.add(new CallPath(partial.nodes(), partial.minConfidence()));
                continue;
            }
            if (partial.nodes().size() - 1 >= options.maxDepth()) {
                continue;
            }
            for (CallReference call : followed(current, options)) {
                if (onPath(partial.nodes(), call.calleeId())) {
                    continue;
                }
                FunctionRecord callee = graph.functions().get(call.calleeId());
                frontier.add(new Partial(callee, append(partial.nodes(), CallPathNode.of(callee, call.line())),
                        Math.min(partial.minConfidence(), call.confidence())));
            }
        }

        return new PathSearchResult(paths, frontier.isEmpty(), nodesVisited);
    }

    private List<CallReference> followed(FunctionRecord function, PathOptions options) {
        return function.calls().stream()
                .filter(CallReference::resolved)
                .filter(c -> c.confidence() >= options.minConfidence())
                .filter(c -> graph.functions().containsKey(c.calleeId()))
                .toList();
    }

    private CallPath walkBack(FunctionRecord from, String toId, Map<String, Hop> reachedBy) {
        List<CallPathNode> reversed = new ArrayList<>();
        double minConfidence = 1.0;
        String currentId = toId;
        Hop hop = reachedBy.get(currentId);
        while (hop != null) {
            reversed.add(CallPathNode.of(graph.functions().get(currentId), hop.line()));
            minConfidence = Math.min(minConfidence, hop.confidence());
            currentId = hop.callerId();
            hop = reachedBy.get(currentId);
        }
        reversed.add(CallPathNode.of(from, from.startLine()));

        List<CallPathNode> nodes = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            nodes.add(reversed.get(i));
        }
        return new CallPath(nodes, minConfidence);
    }

    private FunctionRecord require(String functionId) {
        return graph.function(functionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown function: " + functionId));
    }

    private static boolean onPath(List<CallPathNode> nodes, String functionId) {
        return nodes.stream().anyMatch(n -> n.functionId().equals(functionId));
    }

    private static List<CallPathNode> append(List<CallPathNode> path, CallPathNode node) {
        List<CallPathNode> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(node);
        return List.copyOf(extended);
    }

    private record Partial(FunctionRecord function, List<CallPathNode> nodes, double minConfidence) {}

    private record Hop(String callerId, int line, double confidence) {}
}
