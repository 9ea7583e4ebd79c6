package com.vidnyan.codegraph.adapter.in.cli;

import com.vidnyan.codegraph.CodeGraphProperties;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase.GraphStats;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase.OpenResult;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.pipeline.PipelineProgress;
import com.vidnyan.codegraph.domain.snapshot.SnapshotSaveResult;
import com.vidnyan.codegraph.exception.CodeGraphException;
import com.vidnyan.codegraph.query.QueryResult;
import com.vidnyan.codegraph.query.QueryRow;
import com.vidnyan.codegraph.search.HybridSearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CLI Runner for one-shot graph builds.
 * Runs when codegraph.cli.project-path is set: opens the project (reusing its
 * snapshot when valid), optionally runs a query and a search, saves the
 * snapshot and exits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphCliRunner implements CommandLineRunner {

    private static final int MAX_ROWS = 50;

    private final ProjectGraphUseCase projectGraph;
    private final CodeGraphProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        CodeGraphProperties.Cli cli = properties.getCli();
        if (cli.getProjectPath() == null || cli.getProjectPath().isBlank()) {
            log.info("No project path specified. Set codegraph.cli.project-path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                 CodeGraph - Knowledge Graph                  ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Project: {}", truncatePath(cli.getProjectPath(), 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            OpenResult opened = projectGraph.open(Path.of(cli.getProjectPath()), this::printProgress,
                    CancellationToken.create());
            printStats(opened);

            if (cli.getQuery() != null && !cli.getQuery().isBlank()) {
                printQuery(projectGraph.query(opened.projectId(), cli.getQuery()));
            }
            if (cli.getSearch() != null && !cli.getSearch().isBlank()) {
                printSearch(cli.getSearch(), projectGraph.search(opened.projectId(), cli.getSearch(), 0));
            }
            if (cli.isSave()) {
                SnapshotSaveResult saved = projectGraph.save(opened.projectId());
                if (saved.success()) {
                    log.info(" Snapshot saved: {} bytes in {} ms", saved.size(), saved.durationMs());
                } else {
                    log.warn(" Snapshot not saved: {}", saved.error());
                }
            }

            log.info("");
            log.info("Done!");
        } catch (CodeGraphException e) {
            log.error("CodeGraph failed: {}", e.getMessage());
            exitCode = 1;
        } finally {
            int code = exitCode;
            // Ensure application shuts down after the run
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printProgress(PipelineProgress progress) {
        log.info(" [{}%] {}: {}", String.format("%3d", progress.percent()), progress.phase().wireName(),
                progress.message());
    }

    private void printStats(OpenResult opened) {
        GraphStats stats = opened.stats();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" GRAPH");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Loaded from:      {}", opened.source());
        log.info(" Snapshot status:  {}", opened.snapshotStatus());
        log.info(" Changes applied:  {}", opened.changes().totalChanges());
        log.info(" Files:            {}", stats.files());
        log.info(" Nodes:            {}", stats.nodes());
        log.info(" Relationships:    {}", stats.relationships());
        log.info(" Communities:      {}", stats.communities());
        log.info(" Processes:        {}", stats.processes());
        log.info(" Embeddings:       {}", stats.embeddings());
        log.info(" Duration:         {}ms", opened.durationMs());
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void printQuery(QueryResult result) {
        log.info("");
        log.info(" QUERY RESULT ({} rows, {} ms)", result.size(), result.durationMs());
        log.info(" {}", String.join(" | ", result.columns()));
        log.info("───────────────────────────────────────────────────────────────");
        int count = 0;
        for (QueryRow row : result.rows()) {
            if (++count > MAX_ROWS) {
                log.info(" ... and {} more rows", result.size() - MAX_ROWS);
                break;
            }
            log.info(" {}", format(row));
        }
    }

    private void printSearch(String query, List<HybridSearchResult> results) {
        log.info("");
        log.info(" SEARCH '{}' ({} results)", query, results.size());
        log.info("───────────────────────────────────────────────────────────────");
        for (HybridSearchResult r : results) {
            String symbol = r.nodeName() != null ? "  " + r.label() + " " + r.nodeName() + ":" + r.startLine() : "";
            log.info(" {}. {} [{}] {}{}", r.rank(), r.filePath(), String.join("+", r.sources()),
                    String.format("%.4f", r.score()), symbol);
        }
    }

    private static String format(QueryRow row) {
        return switch (row.kind()) {
            case NODE -> row.node().id();
            case RELATIONSHIP -> row.source().id() + " -[" + row.relationship().type() + "]-> " + row.target().id();
            case VALUES -> row.values().stream().map(String::valueOf).collect(Collectors.joining(" | "));
        };
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
