package com.vidnyan.cga.domain.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Assembled and resolved call graph of one project.
 * Functions are held in a flat id-indexed map; edges are ids, never object references.
 * Immutable and safe to share between concurrent queries.
 */
public record CallGraph(
    String version,
    Instant generatedAt,
    String projectRoot,
    SortedMap<String, FunctionRecord> functions,
    List<String> entryPoints,
    List<String> dataAccessors,
    GraphStats stats
) {

    public static final String SCHEMA_VERSION = "1.0";

    public CallGraph {
        functions = Collections.unmodifiableSortedMap(new TreeMap<>(functions == null ? Map.of() : functions));
        entryPoints = entryPoints == null ? List.of() : entryPoints.stream().sorted().toList();
        dataAccessors = dataAccessors == null ? List.of() : dataAccessors.stream().sorted().toList();
        stats = stats == null ? GraphStats.empty() : stats;
    }

    public Optional<FunctionRecord> function(String id) {
        return Optional.ofNullable(functions.get(id));
    }

    public Collection<FunctionRecord> allFunctions() {
        return functions.values();
    }

    /**
     * Functions whose simple or qualified name equals the given name.
     */
    public List<FunctionRecord> functionsNamed(String name) {
        return functions.values().stream()
                .filter(f -> f.name().equals(name) || f.qualifiedName().equals(name))
                .toList();
    }

    public List<FunctionRecord> functionsInFile(String file) {
        return functions.values().stream()
                .filter(f -> f.file().equals(file))
                .toList();
    }

    /**
     * Innermost function whose span contains the given line.
     */
    public Optional<FunctionRecord> functionAt(String file, int line) {
        return functions.values().stream()
                .filter(f -> f.file().equals(file) && f.contains(line))
                .min((a, b) -> Integer.compare(a.endLine() - a.startLine(), b.endLine() - b.startLine()));
    }
}
