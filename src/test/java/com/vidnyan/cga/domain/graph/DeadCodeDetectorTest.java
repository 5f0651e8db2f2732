package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallGraphFixture;
import com.vidnyan.cga.domain.model.EntryPointKind;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DeadCodeDetectorTest {

    @Test
    void detect_ShouldReportFunctionsWithoutCallers() {
        // Arrange
        CallGraphFixture fixture = CallGraphFixture.graph()
                .function("main", "app/main.py", 1, 10)
                .function("used", "app/main.py", 12, 15)
                .function("orphan", "app/main.py", 20, 25)
                .constructor("Service", "app/service.py", 3)
                .entryPoint("main", EntryPointKind.MAIN)
                .call("main", "used", 4);

        // Act
        List<DeadCodeCandidate> candidates = new DeadCodeDetector(fixture.build()).detect();

        // Assert
        assertEquals(1, candidates.size());
        DeadCodeCandidate orphan = candidates.get(0);
        assertEquals(fixture.id("orphan"), orphan.functionId());
        assertEquals(DeadCodeCandidate.Confidence.HIGH, orphan.confidence());
        assertEquals("no callers", orphan.reason());
        assertEquals(20, orphan.line());
    }

    @Test
    void detect_ShouldLowerConfidenceWhenUnresolvedCallsMightReach() {
        // Arrange
        CallGraphFixture fixture = CallGraphFixture.graph()
                .function("main", "app/main.py", 1, 10)
                .function("save", "app/users.py", 1, 5)
                .function("store", "app/orders.py", 1, 5)
                .function("render", "app/views.py", 1, 5)
                .entryPoint("main", EntryPointKind.MAIN)
                .ambiguous("main", "persist", 3, "save", "store")
                .unresolved("main", "render", 4, UnresolvedReason.DYNAMIC_DISPATCH);

        // Act
        Map<String, DeadCodeCandidate> byName = new DeadCodeDetector(fixture.build()).detect().stream()
                .collect(Collectors.toMap(DeadCodeCandidate::qualifiedName, Function.identity()));

        // Assert
        assertEquals(3, byName.size());
        assertEquals(DeadCodeCandidate.Confidence.LOW, byName.get("save").confidence());
        assertEquals("candidate of an ambiguous call", byName.get("store").reason());
        assertEquals(DeadCodeCandidate.Confidence.LOW, byName.get("render").confidence());
        assertEquals("name used by an unresolved call", byName.get("render").reason());
    }
}
