package com.vidnyan.cga.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.adapter.out.dataaccess.PatternDataAccessScanner;
import com.vidnyan.cga.adapter.out.parser.JavaParserExtractionStrategy;
import com.vidnyan.cga.adapter.out.parser.regex.JavaRegexExtractionStrategy;
import com.vidnyan.cga.adapter.out.parser.regex.PythonRegexExtractionStrategy;
import com.vidnyan.cga.adapter.out.parser.regex.TypeScriptRegexExtractionStrategy;
import com.vidnyan.cga.adapter.out.registry.DefaultEntryPointRegistry;
import com.vidnyan.cga.adapter.out.store.JsonCallGraphRepository;
import com.vidnyan.cga.application.port.in.BuildCallGraphUseCase.BuildRequest;
import com.vidnyan.cga.application.port.in.BuildCallGraphUseCase.BuildResult;
import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.FunctionRecord;
import com.vidnyan.cga.domain.model.Language;
import com.vidnyan.cga.scanner.RepositoryScanner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphBuildServiceTest {

    @TempDir
    Path tempDir;

    private HybridExtractor hybridExtractor;
    private JsonCallGraphRepository repository;
    private CallGraphSnapshot snapshot;
    private CallGraphBuildService service;

    @BeforeEach
    void setUp() throws IOException {
        CgaProperties properties = new CgaProperties();
        ExtractionStrategyRegistry registry = ExtractionStrategyRegistry.builder()
                .register(new JavaParserExtractionStrategy())
                .register(new JavaRegexExtractionStrategy())
                .register(new PythonRegexExtractionStrategy())
                .register(new TypeScriptRegexExtractionStrategy(Language.TYPESCRIPT))
                .build();
        hybridExtractor = new HybridExtractor(registry, new PatternDataAccessScanner(), properties);
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        repository = new JsonCallGraphRepository(objectMapper, properties);
        snapshot = new CallGraphSnapshot();
        service = new CallGraphBuildService(
                new RepositoryScanner(properties),
                new ExtractionService(hybridExtractor, properties),
                new GraphAssembler(new DefaultEntryPointRegistry()),
                new CallResolver(),
                repository,
                snapshot);

        write("src/repo.ts", "export function findUser(id) {\n  return id;\n}\n");
        write("src/service.ts", "import { findUser } from './repo';\n\nexport function loadProfile(id) {\n"
                + "  return findUser(id);\n}\n");
        write("jobs.py", "def purge():\n    cursor.execute(\"DELETE FROM sessions\")\n\n\n"
                + "def nightly():\n    purge()\n");
    }

    @AfterEach
    void tearDown() {
        hybridExtractor.close();
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void build_ShouldProduceResolvedGraphAndPersistIt() {
        // Act
        BuildResult result = service.build(BuildRequest.forPath(tempDir));

        // Assert
        CallGraph graph = result.graph();
        assertEquals(3, result.stats().filesScanned());
        assertEquals(0, result.stats().filesFailed());
        assertEquals(4, result.stats().functions());
        assertEquals(tempDir.toAbsolutePath().normalize().toString(), graph.projectRoot());

        FunctionRecord loadProfile = graph.functions().get("src/service.ts:loadProfile:3");
        assertNotNull(loadProfile);
        assertTrue(loadProfile.calls().stream()
                .anyMatch(c -> c.resolved() && "src/repo.ts:findUser:1".equals(c.calleeId())));
        assertEquals(1, graph.functions().get("jobs.py:purge:1").dataAccess().size());

        Path root = tempDir.toAbsolutePath().normalize();
        assertEquals(repository.location(root), result.storedAt());
        assertTrue(Files.exists(result.storedAt()));
        assertEquals(Optional.of(graph), repository.load(root));
        assertSame(graph, snapshot.current().orElseThrow());
    }

    @Test
    void build_ShouldKeepCallEdgesConsistentInBothDirections() {
        CallGraph graph = service.build(new BuildRequest(tempDir, false)).graph();

        for (FunctionRecord function : graph.allFunctions()) {
            for (CallReference call : function.calls()) {
                if (!call.resolved()) {
                    continue;
                }
                FunctionRecord callee = graph.functions().get(call.calleeId());
                assertNotNull(callee, call.calleeId());
                assertTrue(callee.calledBy().stream()
                        .anyMatch(in -> in.callerId().equals(function.id()) && in.line() == call.line()));
            }
            for (CallReference incoming : function.calledBy()) {
                FunctionRecord caller = graph.functions().get(incoming.callerId());
                assertNotNull(caller, incoming.callerId());
                assertTrue(caller.calls().stream()
                        .anyMatch(out -> function.id().equals(out.calleeId()) && out.line() == incoming.line()));
            }
        }
    }

    @Test
    void build_ShouldBeIdempotentForUnchangedSources() {
        // Act
        CallGraph first = service.build(BuildRequest.forPath(tempDir)).graph();
        CallGraph second = service.build(BuildRequest.forPath(tempDir)).graph();

        // Assert
        assertEquals(first.functions(), second.functions());
        assertEquals(first.entryPoints(), second.entryPoints());
        assertEquals(first.stats().resolvedCallSites(), second.stats().resolvedCallSites());
        assertEquals(3, second.stats().filesScanned());
    }

    @Test
    void build_ShouldSkipPersistenceWhenNotRequested() {
        BuildResult result = service.build(new BuildRequest(tempDir, false));

        assertNull(result.storedAt());
        assertTrue(repository.load(tempDir.toAbsolutePath().normalize()).isEmpty());
        assertTrue(snapshot.current().isPresent());
    }
}
