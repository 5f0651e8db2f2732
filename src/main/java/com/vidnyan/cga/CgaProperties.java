package com.vidnyan.cga;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the call graph analyzer.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "cga")
public class CgaProperties {

    private Extraction extraction = new Extraction();
    private Impact impact = new Impact();
    private Query query = new Query();
    private Storage storage = new Storage();

    @Data
    public static class Extraction {

        /**
         * Per-file budget for the structural parser before falling back.
         */
        private long parseTimeoutMs = 5000;

        /**
         * Extraction worker threads. Default: available processors
         */
        private int workerThreads = Runtime.getRuntime().availableProcessors();

        private boolean enableStructural = true;

        private boolean enableRegexFallback = true;

        /**
         * A structural result with no functions and no declarations counts as poor coverage
         * once the file has at least this many non-blank lines.
         */
        private int poorCoverageMinLines = 5;

        /**
         * Directory names never descended into while scanning.
         */
        private List<String> excludeDirectories = new ArrayList<>(List.of(
                "node_modules", ".git", "target", "build", "dist", ".cga",
                "__pycache__", "venv", ".venv", ".idea", ".gradle", "out"));
    }

    @Data
    public static class Impact {
        private int maxDepth = 10;
        private int severeEntryPointThreshold = 5;
        private int widelyUsedThreshold = 20;
    }

    @Data
    public static class Query {
        private int defaultLimit = 20;
        private int maxLimit = 100;
        private int callersMaxDepth = 2;
        private int reachabilityMaxDepth = 10;
    }

    @Data
    public static class Storage {

        /**
         * Directory under the project root holding the persisted graph.
         */
        private String directory = ".cga";
    }
}
