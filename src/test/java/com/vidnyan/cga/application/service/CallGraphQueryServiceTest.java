package com.vidnyan.cga.application.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.adapter.out.sensitivity.PatternSensitivityClassifier;
import com.vidnyan.cga.adapter.out.store.JsonCallGraphRepository;
import com.vidnyan.cga.application.error.ErrorCode;
import com.vidnyan.cga.application.error.GraphQueryException;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.CallerInfo;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.CallersData;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.CallersRequest;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.DeadCodeData;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.DeadCodeRequest;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.ImpactData;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.ImpactRequest;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.InverseData;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.InverseRequest;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.ReachabilityData;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.ReachabilityRequest;
import com.vidnyan.cga.application.port.in.ToolResponse;
import com.vidnyan.cga.domain.impact.ChangeKind;
import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallGraphFixture;
import com.vidnyan.cga.domain.model.DataOperation;
import com.vidnyan.cga.domain.model.EntryPointKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphQueryServiceTest {

    @TempDir
    Path tempDir;

    private Path root;
    private CallGraphFixture fixture;
    private CallGraphSnapshot snapshot;
    private JsonCallGraphRepository repository;
    private CallGraphQueryService service;

    @BeforeEach
    void setUp() {
        root = tempDir.toAbsolutePath().normalize();
        fixture = CallGraphFixture.graph()
                .function("handler", "src/api.ts", 1, 5)
                .function("service", "src/service.ts", 1, 5)
                .function("repo", "src/repo.ts", 1, 5)
                .function("worker", "src/jobs.ts", 1, 5)
                .function("orphan", "src/old.ts", 1, 5)
                .entryPoint("handler", EntryPointKind.HTTP_HANDLER)
                .entryPoint("worker", EntryPointKind.SCHEDULED_JOB)
                .call("handler", "service", 2)
                .call("service", "repo", 3)
                .call("worker", "repo", 2)
                .access("repo", "users", DataOperation.READ, "email");

        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        CgaProperties properties = new CgaProperties();
        snapshot = new CallGraphSnapshot();
        repository = new JsonCallGraphRepository(objectMapper, properties);
        service = new CallGraphQueryService(snapshot, repository, new PatternSensitivityClassifier(), properties);
    }

    private void publish() {
        snapshot.replace(fixture.build(root.toString()));
    }

    private static GraphQueryException assertQueryError(ErrorCode code, Executable query) {
        GraphQueryException error = assertThrows(GraphQueryException.class, query);
        assertEquals(code, error.code());
        assertNotNull(error.remediation());
        return error;
    }

    @Test
    void callers_ShouldListDirectAndTransitiveCallers() {
        // Arrange
        publish();

        // Act
        ToolResponse<CallersData> response = service.callers(CallersRequest.of(root, "repo"));

        // Assert
        CallersData data = response.data();
        assertEquals(List.of("worker", "service", "handler"),
                data.callers().stream().map(CallerInfo::name).toList());
        assertEquals(List.of(1, 1, 2), data.callers().stream().map(CallerInfo::depth).toList());
        assertEquals(2, data.directCallers());
        assertEquals(1, data.transitiveCallers());
        assertEquals(2, data.entryPointCallers());
        assertEquals("repo has 2 direct and 1 transitive callers (2 entry points)", response.summary());
        assertFalse(response.pagination().hasMore());
        assertEquals("impact", response.nextActions().get(0).operation());
    }

    @Test
    void callers_ShouldPageWithCursor() {
        // Arrange
        publish();

        // Act
        ToolResponse<CallersData> first = service.callers(new CallersRequest(root, "repo", null, null, 2, null));
        ToolResponse<CallersData> second = service.callers(new CallersRequest(root, "repo", null, null, 2,
                first.pagination().nextCursor()));

        // Assert
        assertEquals(2, first.data().callers().size());
        assertTrue(first.pagination().hasMore());
        assertEquals(List.of("handler"), second.data().callers().stream().map(CallerInfo::name).toList());
        assertNull(second.pagination().nextCursor());
    }

    @Test
    void callers_ShouldHonorMaxDepth() {
        publish();

        CallersData data = service.callers(new CallersRequest(root, "repo", null, 1, null, null)).data();

        assertEquals(2, data.callers().size());
        assertEquals(0, data.transitiveCallers());
    }

    @Test
    void callers_ShouldSuggestSimilarNamesForUnknownFunction() {
        publish();

        GraphQueryException error = assertQueryError(ErrorCode.FUNCTION_NOT_FOUND,
                () -> service.callers(CallersRequest.of(root, "repository")));

        assertEquals(List.of("repo"), error.alternatives());
        assertTrue(error.code().recoverable());
    }

    @Test
    void queries_ShouldRejectInvalidArguments() {
        publish();

        assertQueryError(ErrorCode.INVALID_ARGUMENT,
                () -> service.callers(new CallersRequest(root, "repo", null, null, 0, null)));
        assertQueryError(ErrorCode.INVALID_ARGUMENT,
                () -> service.callers(new CallersRequest(root, "repo", null, -1, null, null)));
        assertQueryError(ErrorCode.INVALID_ARGUMENT, () -> service.callers(CallersRequest.of(root, " ")));
        assertQueryError(ErrorCode.INVALID_ARGUMENT,
                () -> service.impact(ImpactRequest.forFunction(root, "repo", "explode")));
        assertQueryError(ErrorCode.INVALID_ARGUMENT,
                () -> service.dataAccessors(InverseRequest.forTable(root, "")));
        assertQueryError(ErrorCode.INVALID_ARGUMENT, () -> service.reachability(
                new ReachabilityRequest(root, null, null, null, null, false, Set.of(), false, null, null)));
    }

    @Test
    void queries_ShouldRejectForeignCursor() {
        publish();

        assertQueryError(ErrorCode.INVALID_CURSOR,
                () -> service.callers(new CallersRequest(root, "repo", null, null, null, "not-a-cursor")));
        assertQueryError(ErrorCode.INVALID_CURSOR,
                () -> service.deadCode(new DeadCodeRequest(root, null, false, null, Paging.encode(40))));
    }

    @Test
    void queries_ShouldReportMissingGraph() {
        GraphQueryException error = assertQueryError(ErrorCode.CALLGRAPH_NOT_BUILT,
                () -> service.callers(CallersRequest.of(root, "repo")));

        assertFalse(error.code().recoverable());
        assertEquals(List.of("build"), error.alternatives());
    }

    @Test
    void queries_ShouldIgnoreSnapshotOfAnotherProject() {
        snapshot.replace(fixture.build("/some/other/project"));

        assertQueryError(ErrorCode.CALLGRAPH_NOT_BUILT, () -> service.deadCode(DeadCodeRequest.of(root)));
    }

    @Test
    void queries_ShouldLoadPersistedGraphWhenSnapshotIsEmpty() {
        // Arrange
        CallGraph graph = fixture.build(root.toString());
        repository.save(root, graph);

        // Act
        ToolResponse<CallersData> response = service.callers(CallersRequest.of(root, "service"));

        // Assert
        assertEquals(1, response.data().callers().size());
        assertEquals(graph, snapshot.current().orElseThrow());
    }

    @Test
    void reachability_ShouldFindTablesFromFunctionOrLocation() {
        // Arrange
        publish();

        // Act
        ReachabilityData fromFunction = service.reachability(
                ReachabilityRequest.fromFunction(root, "handler", null)).data();
        ReachabilityData fromLocation = service.reachability(
                ReachabilityRequest.fromLocation(root, "src/jobs.ts", 2, null)).data();

        // Assert
        assertEquals(List.of("users"), fromFunction.tables());
        assertEquals(2, fromFunction.maxDepthReached());
        assertEquals(List.of("users"), fromLocation.tables());
        assertQueryError(ErrorCode.FILE_NOT_FOUND,
                () -> service.reachability(ReachabilityRequest.fromLocation(root, "src/missing.ts", 2, null)));
    }

    @Test
    void dataAccessors_ShouldReturnEntryPointsReachingTable() {
        publish();

        ToolResponse<InverseData> response = service.dataAccessors(InverseRequest.forTable(root, "users"));

        assertEquals(Set.of(fixture.id("handler"), fixture.id("worker")), Set.copyOf(response.data().entryPoints()));
        assertEquals(1, response.data().totalAccessors());
        assertTrue(response.warnings().isEmpty());
    }

    @Test
    void dataAccessors_ShouldWarnWhenNothingAccessesTable() {
        publish();

        ToolResponse<InverseData> response = service.dataAccessors(InverseRequest.forTable(root, "invoices"));

        assertEquals(0, response.data().totalAccessors());
        assertEquals(List.of("No function accesses invoices"), response.warnings());
    }

    @Test
    void impact_ShouldDefaultToSignatureChangeAndCountCallers() {
        publish();

        ImpactData defaulted = service.impact(ImpactRequest.forFunction(root, "repo", null)).data();
        ImpactData deletion = service.impact(ImpactRequest.forFunction(root, "repo", "delete")).data();

        assertEquals(ChangeKind.CHANGE_SIGNATURE, defaulted.changeKind());
        assertTrue(defaulted.breaking());
        assertEquals(ChangeKind.DELETE, deletion.changeKind());
        assertEquals(2, deletion.summary().directCallers());
        assertEquals(1, deletion.summary().transitiveCallers());
        assertEquals(2, deletion.affectedEntryPoints().size());
    }

    @Test
    void impact_ShouldReportSensitiveDataReachedThroughTheChange() {
        publish();

        ToolResponse<ImpactData> response = service.impact(ImpactRequest.forFunction(root, "repo", "modify-body"));

        assertEquals(2, response.data().sensitiveDataPaths().size());
        assertEquals(2, response.data().entryPointRisks().size());
        assertEquals(26, response.data().riskScore());
        assertTrue(response.warnings().contains("Change reaches sensitive data: pii"));
    }

    @Test
    void deadCode_ShouldListUncalledFunctions() {
        publish();

        ToolResponse<DeadCodeData> response = service.deadCode(DeadCodeRequest.of(root));

        assertEquals(1, response.data().candidates().size());
        assertEquals(fixture.id("orphan"), response.data().candidates().get(0).functionId());
        assertEquals(1, response.data().highConfidence());
        assertQueryError(ErrorCode.FILE_NOT_FOUND,
                () -> service.deadCode(new DeadCodeRequest(root, "src/nope.ts", false, null, null)));
    }
}
