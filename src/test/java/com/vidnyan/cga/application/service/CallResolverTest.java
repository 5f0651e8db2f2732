package com.vidnyan.cga.application.service;

import com.vidnyan.cga.adapter.out.registry.DefaultEntryPointRegistry;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.EntryPointKind;
import com.vidnyan.cga.domain.model.FunctionRecord;
import com.vidnyan.cga.domain.model.Parameter;
import com.vidnyan.cga.domain.model.ResolutionReason;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.vidnyan.cga.application.service.ExtractionFixture.call;
import static com.vidnyan.cga.application.service.ExtractionFixture.fn;
import static org.junit.jupiter.api.Assertions.*;

class CallResolverTest {

    private final GraphAssembler assembler = new GraphAssembler(new DefaultEntryPointRegistry());
    private final CallResolver resolver = new CallResolver();

    private CallGraph resolve(FileExtraction... files) {
        return resolver.resolve(assembler.assemble("/work", List.of(files)), Instant.EPOCH);
    }

    private static CallReference firstCall(CallGraph graph, String callerId) {
        return graph.function(callerId).orElseThrow().calls().get(0);
    }

    @Test
    void resolve_ShouldFollowRelativeImportsAcrossFiles() {
        // Arrange
        FileExtraction api = ExtractionFixture.file("src/api.ts")
                .namedImport("./store", "save")
                .function(fn("handle", 1, 5).exported(true))
                .call(call("save", 2).argumentCount(1))
                .build();
        FileExtraction store = ExtractionFixture.file("src/store.ts")
                .function(fn("save", 1, 3).exported(true))
                .build();

        // Act
        CallGraph graph = resolve(api, store);

        // Assert
        CallReference reference = firstCall(graph, "src/api.ts:handle:1");
        assertTrue(reference.resolved());
        assertEquals("src/store.ts:save:1", reference.calleeId());
        assertEquals(0.9, reference.confidence(), 1e-9);
        assertEquals(ResolutionReason.IMPORT, reference.resolutionReason());

        FunctionRecord save = graph.function("src/store.ts:save:1").orElseThrow();
        assertEquals(List.of(reference), save.calledBy());
        assertNull(save.entryPointKind());
        assertEquals(EntryPointKind.EXPORTED, graph.function("src/api.ts:handle:1").orElseThrow().entryPointKind());
        assertEquals(1.0, graph.stats().resolutionRate(), 1e-9);
    }

    @Test
    void resolve_ShouldTreatPackageImportsAsExternalEvenWhenNamesCollide() {
        // Arrange
        FileExtraction api = ExtractionFixture.file("src/api.ts")
                .namedImport("axios", "get")
                .function(fn("load", 1, 5))
                .call(call("get", 2))
                .build();
        FileExtraction local = ExtractionFixture.file("src/cache.ts")
                .function(fn("get", 1, 3))
                .build();

        // Act
        CallReference reference = firstCall(resolve(api, local), "src/api.ts:load:1");

        // Assert
        assertFalse(reference.resolved());
        assertEquals(UnresolvedReason.EXTERNAL_LIBRARY, reference.unresolvedReason());
    }

    @Test
    void resolve_ShouldRecordGlobalAmbiguityWithoutChoosing() {
        // Arrange
        FileExtraction a = ExtractionFixture.file("a.py").function(fn("process", 1, 3)).build();
        FileExtraction b = ExtractionFixture.file("b.py").function(fn("process", 1, 3)).build();
        FileExtraction c = ExtractionFixture.file("c.py")
                .function(fn("run", 1, 5))
                .call(call("process", 2))
                .call(call("print", 3))
                .build();

        // Act
        CallGraph graph = resolve(a, b, c);

        // Assert
        List<CallReference> calls = graph.function("c.py:run:1").orElseThrow().calls();
        CallReference process = calls.get(0);
        assertFalse(process.resolved());
        assertTrue(process.ambiguousMatch());
        assertEquals(List.of("a.py:process:1", "b.py:process:1"), process.candidates());
        assertEquals(0.5, process.confidence(), 1e-9);
        assertEquals(ResolutionReason.GLOBAL_AMBIGUOUS, process.resolutionReason());
        assertNull(process.unresolvedReason());
        assertTrue(graph.function("a.py:process:1").orElseThrow().calledBy().isEmpty());

        assertEquals(UnresolvedReason.EXTERNAL_LIBRARY, calls.get(1).unresolvedReason());
        assertEquals(1, graph.stats().ambiguousCallSites());
        assertEquals(0, graph.stats().resolvedCallSites());
    }

    @Test
    void resolve_ShouldResolveUniqueGlobalNameAtLowestTier() {
        // Arrange
        FileExtraction a = ExtractionFixture.file("a.py").function(fn("audit", 1, 3)).build();
        FileExtraction b = ExtractionFixture.file("b.py")
                .function(fn("run", 1, 5))
                .call(call("audit", 2))
                .build();

        // Act
        CallReference reference = firstCall(resolve(a, b), "b.py:run:1");

        // Assert
        assertTrue(reference.resolved());
        assertEquals(0.7, reference.confidence(), 1e-9);
        assertEquals(ResolutionReason.GLOBAL_UNIQUE, reference.resolutionReason());
    }

    @Test
    void resolve_ShouldNeverGuessDynamicShapes() {
        // Arrange
        FileExtraction file = ExtractionFixture.file("tools.py")
                .function(fn("apply", 1, 5).parameters(List.of(Parameter.of("fn", null), Parameter.of("x", null))))
                .function(fn("fn", 7, 9))
                .call(call("fn", 2))
                .call(call("eval", 3).dynamicHint(UnresolvedReason.EVAL))
                .build();

        // Act
        List<CallReference> calls = resolve(file).function("tools.py:apply:1").orElseThrow().calls();

        // Assert
        assertEquals(UnresolvedReason.HIGHER_ORDER, calls.get(0).unresolvedReason());
        assertFalse(calls.get(0).resolved());
        assertEquals(UnresolvedReason.EVAL, calls.get(1).unresolvedReason());
        assertEquals(ResolutionReason.DYNAMIC_SHAPE, calls.get(1).resolutionReason());
    }

    @Test
    void resolve_ShouldPreferSameClassAndNarrowOverloadsByArity() {
        // Arrange
        FileExtraction service = ExtractionFixture.file("src/OrderService.java")
                .type("OrderService", 1, 20)
                .function(fn("place", 3, 6).className("OrderService"))
                .function(fn("format", 8, 10).className("OrderService")
                        .parameters(List.of(Parameter.of("a", "String"))))
                .function(fn("format", 12, 14).className("OrderService")
                        .parameters(List.of(Parameter.of("a", "String"), Parameter.of("b", "int"))))
                .call(call("format", 4).argumentCount(2))
                .call(call("format", 5).argumentCount(3))
                .build();

        // Act
        List<CallReference> calls = resolve(service)
                .function("src/OrderService.java:OrderService.place:3").orElseThrow().calls();

        // Assert
        assertEquals("src/OrderService.java:OrderService.format:12", calls.get(0).calleeId());
        assertEquals(0.95, calls.get(0).confidence(), 1e-9);
        assertEquals(ResolutionReason.SAME_CLASS, calls.get(0).resolutionReason());

        assertEquals("src/OrderService.java:OrderService.format:8", calls.get(1).calleeId());
        assertEquals(0.75, calls.get(1).confidence(), 1e-9);
        assertEquals(ResolutionReason.OVERLOAD_TIE, calls.get(1).resolutionReason());
    }

    @Test
    void resolve_ShouldUseDeclaredReceiverTypesAndConstructors() {
        // Arrange
        FileExtraction controller = ExtractionFixture.file("src/web/UserController.java")
                .type("UserController", 1, 20)
                .function(fn("get", 5, 12).className("UserController"))
                .call(call("findById", 6).receiver("repository").receiverType("OrderRepository"))
                .call(call("size", 7).receiver("items").receiverType("List"))
                .call(call("OrderRepository", 8).constructorCall(true))
                .call(call("UserController", 9).constructorCall(true))
                .build();
        FileExtraction repository = ExtractionFixture.file("src/repo/OrderRepository.java")
                .type("OrderRepository", 1, 10)
                .function(fn("OrderRepository", 2, 2).className("OrderRepository").constructor(true))
                .function(fn("findById", 3, 5).className("OrderRepository"))
                .build();

        // Act
        List<CallReference> calls = resolve(controller, repository)
                .function("src/web/UserController.java:UserController.get:5").orElseThrow().calls();

        // Assert
        assertEquals("src/repo/OrderRepository.java:OrderRepository.findById:3", calls.get(0).calleeId());
        assertEquals(0.85, calls.get(0).confidence(), 1e-9);
        assertEquals(ResolutionReason.DECLARED_TYPE, calls.get(0).resolutionReason());

        assertEquals(UnresolvedReason.EXTERNAL_LIBRARY, calls.get(1).unresolvedReason());

        assertEquals("src/repo/OrderRepository.java:OrderRepository.OrderRepository:2", calls.get(2).calleeId());
        assertEquals(ResolutionReason.CONSTRUCTOR, calls.get(2).resolutionReason());

        assertFalse(calls.get(3).resolved());
        assertNull(calls.get(3).unresolvedReason());
        assertEquals(ResolutionReason.CONSTRUCTOR, calls.get(3).resolutionReason());
    }

    @Test
    void resolve_ShouldFollowInheritanceForSelfCalls() {
        // Arrange
        FileExtraction models = ExtractionFixture.file("app/models.py")
                .type("Base", 1, 5)
                .type("Child", 7, 12, "Base")
                .function(fn("helper", 2, 3).className("Base"))
                .function(fn("run", 8, 10).className("Child"))
                .call(call("helper", 9).receiver("self"))
                .build();

        // Act
        CallReference reference = firstCall(resolve(models), "app/models.py:Child.run:8");

        // Assert
        assertEquals("app/models.py:Base.helper:2", reference.calleeId());
        assertEquals(0.8, reference.confidence(), 1e-9);
        assertEquals(ResolutionReason.INHERITED, reference.resolutionReason());
    }

    @Test
    void resolve_ShouldKeepBackReferencesConsistent() {
        // Arrange
        FileExtraction app = ExtractionFixture.file("app.js")
                .function(fn("main", 1, 5))
                .function(fn("a", 7, 9))
                .function(fn("b", 11, 13))
                .call(call("a", 2))
                .call(call("b", 3))
                .call(call("b", 8))
                .build();

        // Act
        CallGraph graph = resolve(app);

        // Assert
        for (FunctionRecord function : graph.allFunctions()) {
            for (CallReference call : function.calls()) {
                if (call.resolved()) {
                    assertTrue(graph.function(call.calleeId()).orElseThrow().calledBy().contains(call));
                }
            }
            for (CallReference incoming : function.calledBy()) {
                assertEquals(function.id(), incoming.calleeId());
                assertTrue(graph.function(incoming.callerId()).orElseThrow().calls().contains(incoming));
            }
        }
        assertEquals(2, graph.function("app.js:b:11").orElseThrow().calledBy().size());
        assertEquals(EntryPointKind.MAIN, graph.function("app.js:main:1").orElseThrow().entryPointKind());
    }

    @Test
    void resolve_ShouldTreatModuleImportedFromPackageAsImport() {
        // Arrange
        FileExtraction app = ExtractionFixture.file("app/main.py")
                .aliasedImport("pkg", "billing", "bmod")
                .function(fn("run", 1, 3))
                .call(call("charge", 2).receiver("bmod"))
                .build();
        FileExtraction billing = ExtractionFixture.file("pkg/billing.py")
                .function(fn("charge", 1, 2))
                .build();

        // Act
        CallReference reference = firstCall(resolve(app, billing), "app/main.py:run:1");

        // Assert
        assertTrue(reference.resolved());
        assertEquals("pkg/billing.py:charge:1", reference.calleeId());
        assertEquals(0.9, reference.confidence(), 1e-9);
        assertEquals(ResolutionReason.IMPORT, reference.resolutionReason());
    }

    @Test
    void resolve_ShouldMarkExportedFunctionCalledOnlyByItselfAsEntryPoint() {
        // Arrange
        FileExtraction tree = ExtractionFixture.file("src/tree.ts")
                .function(fn("walk", 1, 5).exported(true))
                .call(call("walk", 3))
                .build();

        // Act
        FunctionRecord walk = resolve(tree).function("src/tree.ts:walk:1").orElseThrow();

        // Assert
        assertEquals(1, walk.calledBy().size());
        assertEquals(EntryPointKind.EXPORTED, walk.entryPointKind());
    }

    @Test
    void ambiguityConfidence_ShouldDecreaseWithCandidatesAndFloorAtOneTenth() {
        assertEquals(0.5, CallResolver.ambiguityConfidence(2), 1e-9);
        assertEquals(0.4, CallResolver.ambiguityConfidence(3), 1e-9);
        assertEquals(0.1, CallResolver.ambiguityConfidence(10), 1e-9);
    }

    @Test
    void inferClassName_ShouldCapitalizeReceiver() {
        assertEquals("UserService", CallResolver.inferClassName("_userService"));
        assertNull(CallResolver.inferClassName("a.b"));
        assertEquals("Map", CallResolver.simpleTypeName("java.util.Map<String, Integer>"));
    }
}
