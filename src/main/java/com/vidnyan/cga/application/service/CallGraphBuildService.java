package com.vidnyan.cga.application.service;

import com.vidnyan.cga.application.port.in.BuildCallGraphUseCase;
import com.vidnyan.cga.application.port.out.CallGraphRepository;
import com.vidnyan.cga.domain.extraction.ExtractionException;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.scanner.RepositoryScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Application service that orchestrates a full graph build.
 * Implements the build use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallGraphBuildService implements BuildCallGraphUseCase {

    private final RepositoryScanner repositoryScanner;
    private final ExtractionService extractionService;
    private final GraphAssembler graphAssembler;
    private final CallResolver callResolver;
    private final CallGraphRepository callGraphRepository;
    private final CallGraphSnapshot snapshot;

    @Override
    public BuildResult build(BuildRequest request) {
        Instant startTime = Instant.now();
        Path root = request.projectRoot().toAbsolutePath().normalize();
        log.info("Starting call graph build of: {}", root);

        // Step 1: Scan repository
        log.info("Step 1: Scanning source files...");
        List<Path> files;
        try {
            files = repositoryScanner.scanSourceFiles(root);
        } catch (IOException e) {
            throw new ExtractionException("Cannot scan " + root + ": " + e.getMessage(), e);
        }
        log.info("Found {} source files", files.size());

        // Step 2: Extract facts from every file
        log.info("Step 2: Extracting functions and calls...");
        List<FileExtraction> extractions = extractionService.extractAll(root, files);

        // Step 3: Assemble functions and index
        log.info("Step 3: Assembling graph...");
        AssembledGraph assembled = graphAssembler.assemble(root.toString(), extractions);

        // Step 4: Resolve call sites
        log.info("Step 4: Resolving call sites...");
        CallGraph graph = callResolver.resolve(assembled, Instant.now());

        // Step 5: Persist and publish
        Path storedAt = null;
        if (request.persist()) {
            log.info("Step 5: Persisting graph...");
            callGraphRepository.save(root, graph);
            storedAt = callGraphRepository.location(root);
        }
        snapshot.replace(graph);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        BuildStats stats = new BuildStats(
                extractions.size(),
                (int) extractions.stream().filter(FileExtraction::failedCompletely).count(),
                graph.stats().filesUsingFallback(),
                graph.stats().totalFunctions(),
                graph.stats().totalCallSites(),
                totalDuration.toMillis()
        );

        log.info("Build complete: {} functions, {} call sites, {} entry points in {}ms",
                stats.functions(), stats.callSites(), graph.stats().totalEntryPoints(), stats.totalDurationMs());

        return new BuildResult(graph, stats, storedAt);
    }
}
