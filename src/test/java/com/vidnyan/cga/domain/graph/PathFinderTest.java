package com.vidnyan.cga.domain.graph;

import com.vidnyan.cga.domain.model.CallGraphFixture;
import com.vidnyan.cga.domain.model.CallPathNode;
import com.vidnyan.cga.domain.model.EntryPointKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PathFinderTest {

    private CallGraphFixture fixture;
    private PathFinder finder;

    @BeforeEach
    void setUp() {
        fixture = CallGraphFixture.graph()
                .function("handler", "src/api.ts", 1, 10)
                .function("service", "src/service.ts", 1, 10)
                .function("cache", "src/cache.ts", 1, 5)
                .function("audit", "src/audit.ts", 1, 5)
                .function("repo", "src/repo.ts", 1, 5)
                .function("worker", "src/jobs.ts", 1, 5)
                .function("orphan", "src/old.ts", 1, 5)
                .entryPoint("handler", EntryPointKind.HTTP_HANDLER)
                .entryPoint("worker", EntryPointKind.SCHEDULED_JOB)
                .call("handler", "service", 2)
                .call("handler", "audit", 3)
                .call("service", "repo", 4)
                .call("service", "cache", 5)
                .call("cache", "repo", 2, 0.6)
                .call("audit", "service", 3)
                .call("repo", "service", 3)
                .call("worker", "repo", 2);
        finder = new PathFinder(fixture.build());
    }

    private static List<String> names(CallPath path) {
        return path.nodes().stream().map(CallPathNode::functionName).toList();
    }

    @Test
    void findShortestPath_ShouldReturnFewestHops() {
        // Act
        Optional<CallPath> path = finder.findShortestPath(fixture.id("handler"), fixture.id("repo"),
                PathOptions.defaults());

        // Assert
        assertTrue(path.isPresent());
        assertEquals(List.of("handler", "service", "repo"), names(path.get()));
        assertEquals(List.of(1, 2, 4), path.get().nodes().stream().map(CallPathNode::line).toList());
        assertEquals(2, path.get().depth());
        assertEquals(0.95, path.get().minConfidence(), 1e-9);
    }

    @Test
    void findShortestPath_ShouldReturnSingleNodeForSameFunction() {
        Optional<CallPath> path = finder.findShortestPath(fixture.id("repo"), fixture.id("repo"),
                PathOptions.defaults());

        assertTrue(path.isPresent());
        assertEquals(0, path.get().depth());
        assertEquals(1.0, path.get().minConfidence(), 1e-9);
    }

    @Test
    void findAllPaths_ShouldListCycleFreePathsShortestFirst() {
        // Act
        PathSearchResult result = finder.findAllPaths(fixture.id("handler"), fixture.id("repo"),
                PathOptions.defaults());

        // Assert
        assertTrue(result.exhaustive());
        assertEquals(List.of(2, 3, 3, 4), result.paths().stream().map(CallPath::depth).toList());
        assertTrue(result.paths().stream()
                .allMatch(p -> names(p).stream().distinct().count() == p.nodes().size()));
        CallPath viaCache = result.paths().stream()
                .filter(p -> names(p).equals(List.of("handler", "service", "cache", "repo")))
                .findFirst()
                .orElseThrow();
        assertEquals(0.6, viaCache.minConfidence(), 1e-9);
    }

    @Test
    void findAllPaths_ShouldSkipCallsBelowMinConfidence() {
        // Arrange
        PathOptions options = PathOptions.builder().minConfidence(0.9).build();

        // Act
        PathSearchResult result = finder.findAllPaths(fixture.id("handler"), fixture.id("repo"), options);

        // Assert
        assertEquals(2, result.paths().size());
        assertTrue(result.paths().stream().noneMatch(p -> names(p).contains("cache")));
    }

    @Test
    void findAllPaths_ShouldStopAtPathLimit() {
        PathSearchResult result = finder.findAllPaths(fixture.id("handler"), fixture.id("repo"),
                PathOptions.builder().maxPaths(1).build());

        assertEquals(1, result.paths().size());
        assertFalse(result.exhaustive());
    }

    @Test
    void findAllPaths_ShouldGiveUpWhenExpansionBudgetIsSpent() {
        PathSearchResult result = finder.findAllPaths(fixture.id("handler"), fixture.id("repo"),
                PathOptions.builder().maxExpansions(2).build());

        assertFalse(result.found());
        assertFalse(result.exhaustive());
        assertEquals(2, result.nodesVisited());
    }

    @Test
    void isConnected_ShouldFollowCallDirectionAndDepth() {
        assertTrue(finder.isConnected(fixture.id("handler"), fixture.id("repo"), 10));
        assertFalse(finder.isConnected(fixture.id("repo"), fixture.id("handler"), 10));
        assertFalse(finder.isConnected(fixture.id("handler"), fixture.id("repo"), 1));
        assertFalse(finder.isConnected(fixture.id("orphan"), fixture.id("repo"), 10));
    }

    @Test
    void findPathsFromEntryPoints_ShouldMergePathsFromEveryEntryPoint() {
        // Act
        PathSearchResult result = finder.findPathsFromEntryPoints(fixture.id("repo"), PathOptions.defaults());

        // Assert
        assertTrue(result.exhaustive());
        assertEquals(5, result.paths().size());
        assertEquals(List.of("worker", "repo"), names(result.paths().get(0)));
        assertEquals(4, result.paths().stream().filter(p -> p.origin().equals(fixture.id("handler"))).count());
    }

    @Test
    void findAllPaths_ShouldRejectUnknownFunction() {
        assertThrows(IllegalArgumentException.class,
                () -> finder.findAllPaths(fixture.id("handler"), "src/missing.ts:nothing:1", PathOptions.defaults()));
    }
}
