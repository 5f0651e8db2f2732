package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.FunctionRecord;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds functions without incoming resolved calls that are neither entry points nor constructors.
 * Confidence drops to LOW when an unresolved call might still reach the function.
 */
public final class DeadCodeDetector {

    private final CallGraph graph;

    public DeadCodeDetector(CallGraph graph) {
        this.graph = graph;
    }

    public List<DeadCodeCandidate> detect() {
        Set<String> ambiguousTargets = new HashSet<>();
        Set<String> unresolvedNames = new HashSet<>();
        for (FunctionRecord function : graph.allFunctions()) {
            for (CallReference call : function.calls()) {
                if (call.resolved()) {
                    continue;
                }
                ambiguousTargets.addAll(call.candidates());
                unresolvedNames.add(call.calleeName());
            }
        }

        return graph.allFunctions().stream()
                .filter(f -> f.calledBy().isEmpty())
                .filter(f -> !f.entryPoint() && !f.constructor())
                .map(f -> toCandidate(f, ambiguousTargets, unresolvedNames))
                .toList();
    }

    private DeadCodeCandidate toCandidate(FunctionRecord function, Set<String> ambiguousTargets,
                                          Set<String> unresolvedNames) {
        if (ambiguousTargets.contains(function.id())) {
            return new DeadCodeCandidate(function.id(), function.qualifiedName(), function.file(),
                    function.startLine(), DeadCodeCandidate.Confidence.LOW, "candidate of an ambiguous call");
        }
        if (unresolvedNames.contains(function.name())) {
            return new DeadCodeCandidate(function.id(), function.qualifiedName(), function.file(),
                    function.startLine(), DeadCodeCandidate.Confidence.LOW, "name used by an unresolved call");
        }
        return new DeadCodeCandidate(function.id(), function.qualifiedName(), function.file(),
                function.startLine(), DeadCodeCandidate.Confidence.HIGH, "no callers");
    }
}
