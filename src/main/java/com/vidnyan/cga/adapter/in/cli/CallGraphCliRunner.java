package com.vidnyan.cga.adapter.in.cli;

import com.vidnyan.cga.application.error.GraphQueryException;
import com.vidnyan.cga.application.port.in.BuildCallGraphUseCase;
import com.vidnyan.cga.application.port.in.BuildCallGraphUseCase.BuildRequest;
import com.vidnyan.cga.application.port.in.BuildCallGraphUseCase.BuildResult;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.ImpactData;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.ImpactRequest;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.ReachabilityData;
import com.vidnyan.cga.application.port.in.QueryCallGraphUseCase.ReachabilityRequest;
import com.vidnyan.cga.application.port.in.ToolResponse;
import com.vidnyan.cga.domain.graph.ReachableAccess;
import com.vidnyan.cga.domain.impact.EntryPointRisk;
import com.vidnyan.cga.domain.model.GraphStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * CLI Runner for standalone graph builds.
 * Builds the graph when cga.build.path is set, then reports on cga.query.function if given.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallGraphCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED = 20;

    private final BuildCallGraphUseCase buildCallGraphUseCase;
    private final QueryCallGraphUseCase queryCallGraphUseCase;
    private final ConfigurableApplicationContext context;

    @Value("${cga.build.path:}")
    private String sourcePath;

    @Value("${cga.query.function:}")
    private String queryFunction;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set cga.build.path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              CGA - Call Graph Analyzer                        ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Building: {}", truncatePath(sourcePath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            Path root = Path.of(sourcePath);
            BuildResult result = buildCallGraphUseCase.build(BuildRequest.forPath(root));
            printBuild(result);

            if (queryFunction != null && !queryFunction.isBlank()) {
                printReachability(queryCallGraphUseCase.reachability(
                        ReachabilityRequest.fromFunction(root, queryFunction, null)));
                printImpact(queryCallGraphUseCase.impact(
                        ImpactRequest.forFunction(root, queryFunction, null)));
            }

            log.info("");
            log.info("Build complete!");
        } catch (GraphQueryException e) {
            exitCode = 1;
            log.error("[{}] {}", e.code(), e.getMessage());
            log.error("  Remediation: {}", e.remediation());
            if (!e.alternatives().isEmpty()) {
                log.error("  Candidates:  {}", String.join(", ", e.alternatives()));
            }
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printBuild(BuildResult result) {
        GraphStats stats = result.graph().stats();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" CALL GRAPH");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files scanned:    {}", result.stats().filesScanned());
        log.info(" Files failed:     {}", result.stats().filesFailed());
        log.info(" Regex fallback:   {}", result.stats().filesUsingFallback());
        log.info(" Functions:        {}", stats.totalFunctions());
        log.info(" Call sites:       {}", stats.totalCallSites());
        log.info(" Resolved:         {} ({}%)", stats.resolvedCallSites(),
                String.format("%.1f", stats.resolutionRate() * 100));
        log.info(" Ambiguous:        {}", stats.ambiguousCallSites());
        log.info(" Entry points:     {}", stats.totalEntryPoints());
        log.info(" Data accessors:   {}", stats.totalDataAccessors());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        if (result.storedAt() != null) {
            log.info(" Stored at:        {}", result.storedAt());
        }
        log.info("───────────────────────────────────────────────────────────────");
        stats.byLanguage().forEach((language, count) -> log.info("   {}: {} functions", language, count));
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void printReachability(ToolResponse<ReachabilityData> response) {
        ReachabilityData data = response.data();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" REACHABILITY FROM {}", queryFunction);
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" {}", response.summary());
        log.info(" Tables:           {}", data.tables().isEmpty() ? "none" : String.join(", ", data.tables()));
        log.info(" Functions seen:   {}", data.functionsVisited());
        log.info(" Unresolved reach: {}", data.unresolvedReach().size());
        log.info("───────────────────────────────────────────────────────────────");
        int count = 0;
        for (ReachableAccess access : data.accesses()) {
            if (++count > MAX_LISTED) {
                log.info(" ... and {} more", data.accesses().size() - MAX_LISTED);
                break;
            }
            log.info(" {} {} at depth {} ({}:{})", access.access().operation().tag(), access.access().table(),
                    access.depth(), access.access().file(), access.access().line());
        }
        response.warnings().forEach(w -> log.warn(" ⚠️  {}", w));
    }

    private void printImpact(ToolResponse<ImpactData> response) {
        ImpactData data = response.data();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" IMPACT OF CHANGING {}", queryFunction);
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" {}", response.summary());
        log.info(" Blast radius:     {}", data.blastRadius().tag());
        log.info(" Risk score:       {}/100", data.riskScore());
        log.info(" Direct callers:   {}", data.summary().directCallers());
        log.info(" Transitive:       {}", data.summary().transitiveCallers());
        log.info(" Entry points:     {}", data.summary().affectedEntryPoints());
        log.info(" Tests:            {}", data.summary().affectedTests());
        log.info(" Sensitive paths:  {}", data.summary().affectedDataPaths());
        log.info("───────────────────────────────────────────────────────────────");
        int count = 0;
        for (EntryPointRisk risk : data.entryPointRisks()) {
            if (++count > MAX_LISTED) {
                log.info(" ... and {} more", data.entryPointRisks().size() - MAX_LISTED);
                break;
            }
            log.info(" 🔴 {} risk {} ({} sensitive path(s))", risk.qualifiedName(), risk.riskScore(),
                    risk.sensitiveDataPaths());
        }
        response.warnings().forEach(w -> log.warn(" ⚠️  {}", w));
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
