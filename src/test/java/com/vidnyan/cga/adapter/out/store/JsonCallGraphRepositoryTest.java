package com.vidnyan.cga.adapter.out.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.application.error.ErrorCode;
import com.vidnyan.cga.application.error.GraphQueryException;
import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallGraphFixture;
import com.vidnyan.cga.domain.model.DataOperation;
import com.vidnyan.cga.domain.model.EntryPointKind;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonCallGraphRepositoryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final JsonCallGraphRepository repository =
            new JsonCallGraphRepository(objectMapper, new CgaProperties());

    private CallGraph sampleGraph() {
        return CallGraphFixture.graph()
                .function("handle", "src/api.ts", 1, 10)
                .function("save", "src/store.ts", 1, 10)
                .entryPoint("handle", EntryPointKind.HTTP_HANDLER)
                .call("handle", "save", 4)
                .unresolved("handle", "plugin", 6, UnresolvedReason.PLUGIN_SYSTEM)
                .access("save", "users", DataOperation.WRITE, "email")
                .build(tempDir.toString());
    }

    @Test
    void save_ShouldWriteUnderStorageDirectoryAndLoadBack() {
        // Arrange
        CallGraph graph = sampleGraph();

        // Act
        repository.save(tempDir, graph);
        Optional<CallGraph> loaded = repository.load(tempDir);

        // Assert
        assertEquals(tempDir.resolve(".cga").resolve("call-graph").resolve("graph.json"),
                repository.location(tempDir));
        assertTrue(Files.isRegularFile(repository.location(tempDir)));
        assertTrue(loaded.isPresent());
        assertEquals(graph, loaded.get());
    }

    @Test
    void save_ShouldReplacePreviousGraph() {
        // Arrange
        repository.save(tempDir, sampleGraph());
        CallGraph smaller = CallGraphFixture.graph().function("only", "a.py", 1).build(tempDir.toString());

        // Act
        repository.save(tempDir, smaller);

        // Assert
        assertEquals(1, repository.load(tempDir).orElseThrow().functions().size());
    }

    @Test
    void load_ShouldReturnEmptyWhenNothingWasSaved() {
        assertTrue(repository.load(tempDir).isEmpty());
    }

    @Test
    void load_ShouldRejectUnreadableDocument() throws Exception {
        // Arrange
        Path location = repository.location(tempDir);
        Files.createDirectories(location.getParent());
        Files.writeString(location, "{ not json");

        // Act
        GraphQueryException error = assertThrows(GraphQueryException.class, () -> repository.load(tempDir));

        // Assert
        assertEquals(ErrorCode.CALLGRAPH_CORRUPT, error.code());
        assertFalse(error.code().recoverable());
    }

    @Test
    void load_ShouldRejectOtherSchemaVersions() throws Exception {
        // Arrange
        Path location = repository.location(tempDir);
        Files.createDirectories(location.getParent());
        Files.writeString(location, "{\"version\": \"0.9\", \"functions\": {}}");

        // Act
        GraphQueryException error = assertThrows(GraphQueryException.class, () -> repository.load(tempDir));

        // Assert
        assertEquals(ErrorCode.CALLGRAPH_CORRUPT, error.code());
        assertTrue(error.getMessage().contains("0.9"));
    }

    @Test
    void load_ShouldRejectNonObjectDocument() throws Exception {
        Path location = repository.location(tempDir);
        Files.createDirectories(location.getParent());
        Files.writeString(location, "[1, 2, 3]");

        assertThrows(GraphQueryException.class, () -> repository.load(tempDir));
    }
}
