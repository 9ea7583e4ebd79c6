package com.vidnyan.codegraph.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.codegraph.CodeGraphProperties;
import com.vidnyan.codegraph.adapter.out.change.ManifestChangeDetector;
import com.vidnyan.codegraph.adapter.out.embedding.FeatureHashingEmbeddingProvider;
import com.vidnyan.codegraph.adapter.out.snapshot.FileSystemSnapshotStore;
import com.vidnyan.codegraph.adapter.out.snapshot.SignedSnapshotStore;
import com.vidnyan.codegraph.adapter.out.snapshot.SigningKeyProvider;
import com.vidnyan.codegraph.adapter.out.snapshot.SnapshotCodec;
import com.vidnyan.codegraph.adapter.out.snapshot.SnapshotSigner;
import com.vidnyan.codegraph.application.port.out.EmbeddingProvider;
import com.vidnyan.codegraph.application.port.out.SnapshotStore;
import com.vidnyan.codegraph.domain.snapshot.SnapshotFormat;
import com.vidnyan.codegraph.ingestion.PipelineSettings;
import com.vidnyan.codegraph.ingestion.language.SourceParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring configuration for CodeGraph components.
 * Wires the adapters that need configuration values into the ports.
 */
@Slf4j
@Configuration
public class CodeGraphConfiguration {

    /**
     * ObjectMapper for meta.json, manifest.json and the REST API.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public PipelineSettings pipelineSettings(CodeGraphProperties properties) {
        return properties.getPipeline().toSettings();
    }

    @Bean
    public ManifestChangeDetector manifestChangeDetector(CodeGraphProperties properties) {
        return new ManifestChangeDetector(properties.getPipeline().getMtimeToleranceMs());
    }

    @Bean
    public SigningKeyProvider signingKeyProvider(CodeGraphProperties properties) {
        CodeGraphProperties.Snapshot snapshot = properties.getSnapshot();
        return new SigningKeyProvider(Path.of(snapshot.getKeyStorePath()), snapshot.getKeyStorePassword(),
                Path.of(snapshot.getKeyFilePath()));
    }

    @Bean
    public SnapshotSigner snapshotSigner(SigningKeyProvider keyProvider) {
        return new SnapshotSigner(keyProvider);
    }

    @Bean
    public FileSystemSnapshotStore fileSystemSnapshotStore(ObjectMapper objectMapper) {
        return new FileSystemSnapshotStore(objectMapper);
    }

    @Bean
    public SnapshotStore snapshotStore(SnapshotCodec codec, SnapshotSigner signer, FileSystemSnapshotStore files,
                                       CodeGraphProperties properties) {
        return new SignedSnapshotStore(codec, signer, files, properties.getAppVersion(),
                properties.getSnapshot().isUpdateGitignore());
    }

    @Bean
    public EmbeddingProvider embeddingProvider(CodeGraphProperties properties) {
        CodeGraphProperties.Embedding embedding = properties.getEmbedding();
        return new FeatureHashingEmbeddingProvider(embedding.isEnabled(), embedding.getDimensions());
    }

    /**
     * Single background thread: phases of one project never run in parallel,
     * and different projects are queued behind each other.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "codegraph-ingestion");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Log available source parsers on startup.
     */
    @Bean
    public String logParsers(List<SourceParser> parsers, CodeGraphProperties properties) {
        log.info("Registered {} source parsers:", parsers.size());
        parsers.forEach(p -> log.info("  - {} {}", p.getClass().getSimpleName(), p.languages()));
        log.info("Snapshot format {}, app version {}", SnapshotFormat.FORMAT_VERSION, properties.getAppVersion());
        return "parsers-logged";
    }
}
