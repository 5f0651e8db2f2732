package com.vidnyan.cga.adapter.out.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.application.error.GraphQueryException;
import com.vidnyan.cga.application.port.out.CallGraphRepository;
import com.vidnyan.cga.domain.model.CallGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores the graph of a project as one JSON document under
 * {@code <root>/<storage directory>/call-graph/graph.json}.
 * The document is written to a temporary file first and moved into place.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonCallGraphRepository implements CallGraphRepository {

    static final String GRAPH_DIRECTORY = "call-graph";
    static final String GRAPH_FILE = "graph.json";

    private final ObjectMapper objectMapper;
    private final CgaProperties properties;

    @Override
    public void save(Path projectRoot, CallGraph graph) {
        Path target = location(projectRoot);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), GRAPH_FILE, ".tmp");
            objectMapper.writeValue(temp.toFile(), graph);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Saved call graph with {} functions to {}", graph.functions().size(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save call graph to " + target, e);
        }
    }

    @Override
    public Optional<CallGraph> load(Path projectRoot) {
        Path source = location(projectRoot);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        JsonNode document;
        try {
            document = objectMapper.readTree(source.toFile());
        } catch (IOException e) {
            throw GraphQueryException.corrupt(source.toString(), e.getMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw GraphQueryException.corrupt(source.toString(), "not a JSON object", null);
        }
        String version = document.path("version").asText(null);
        if (!CallGraph.SCHEMA_VERSION.equals(version)) {
            throw GraphQueryException.corrupt(source.toString(),
                    "schema version " + version + ", expected " + CallGraph.SCHEMA_VERSION, null);
        }
        try {
            CallGraph graph = objectMapper.treeToValue(document, CallGraph.class);
            log.debug("Loaded call graph with {} functions from {}", graph.functions().size(), source);
            return Optional.of(graph);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw GraphQueryException.corrupt(source.toString(), e.getMessage(), e);
        }
    }

    @Override
    public Path location(Path projectRoot) {
        return projectRoot.resolve(properties.getStorage().getDirectory())
                .resolve(GRAPH_DIRECTORY)
                .resolve(GRAPH_FILE);
    }
}
