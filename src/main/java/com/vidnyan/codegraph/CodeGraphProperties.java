package com.vidnyan.codegraph;

import com.vidnyan.codegraph.ingestion.PipelineSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the code graph.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "codegraph")
public class CodeGraphProperties {

    /**
     * Application version written into snapshots. A snapshot written by any
     * other version is discarded on load.
     */
    private String appVersion = "1.0.0";

    private Snapshot snapshot = new Snapshot();
    private Pipeline pipeline = new Pipeline();
    private Search search = new Search();
    private Embedding embedding = new Embedding();
    private Cli cli = new Cli();

    @Data
    public static class Snapshot {
        /** PKCS#12 key store holding the signing key. */
        private String keyStorePath = System.getProperty("user.home") + "/.codegraph/snapshot-keys.p12";
        /** Public by default; override to encrypt the key at rest. */
        private String keyStorePassword = "codegraph";
        /** Owner-only key file used when the key store cannot be used. */
        private String keyFilePath = System.getProperty("user.home") + "/.codegraph/snapshot-hmac.key";
        private boolean updateGitignore = true;
        /** Directory scanned by project listing. */
        private String projectsBaseDir = System.getProperty("user.home");
    }

    @Data
    public static class Pipeline {
        private int parseCacheSize = 50;
        private double communityResolution = 1.0;
        private int communityMaxIterations = 10;
        private int processMaxDepth = 10;
        private int processMaxBranching = 4;
        private int processMinSteps = 2;
        private int processMaxCount = 75;
        private long mtimeToleranceMs = 1000L;

        public PipelineSettings toSettings() {
            return new PipelineSettings(parseCacheSize, communityResolution, communityMaxIterations,
                    processMaxDepth, processMaxBranching, processMinSteps, processMaxCount);
        }
    }

    @Data
    public static class Search {
        private int rrfK = 60;
        private int candidateMultiplier = 3;
        private int defaultLimit = 10;
        private double bm25K1 = 1.2;
        private double bm25B = 0.75;
    }

    @Data
    public static class Embedding {
        private boolean enabled = false;
        private int dimensions = 256;
        /** Source lines per symbol fed to the embedding provider. */
        private int maxLines = 40;
    }

    @Data
    public static class Cli {
        /** Project to open on startup; the CLI runner is inactive when blank. */
        private String projectPath;
        private String query;
        private String search;
        private boolean save = true;
    }
}
