package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.pipeline.PipelinePhase;
import com.vidnyan.codegraph.domain.pipeline.PipelineProgress;
import com.vidnyan.codegraph.domain.pipeline.PipelineResult;
import com.vidnyan.codegraph.domain.pipeline.ProgressListener;
import com.vidnyan.codegraph.exception.OperationCancelledException;
import com.vidnyan.codegraph.ingestion.language.SourceParsers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full ingestion: runs all seven phases once over a complete set of files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final SourceParsers parsers;
    private final IngestionPhases phases;
    private final PipelineSettings settings;

    public PipelineResult run(List<FileEntry> files, ProgressListener listener, CancellationToken token) {
        Instant startTime = Instant.now();
        ProgressReporter progress = new ProgressReporter(listener);

        Map<String, String> contents = new LinkedHashMap<>();
        files.forEach(f -> contents.put(f.path(), f.content()));
        List<FileEntry> entries = new ArrayList<>();
        contents.forEach((path, content) -> entries.add(new FileEntry(path, content)));

        IngestionContext ctx = new IngestionContext(parsers, settings, token, progress, contents.keySet());
        KnowledgeGraph graph = new KnowledgeGraph();
        log.info("Starting full ingestion of {} files", entries.size());

        try {
            log.info("Step 1: Building structure...");
            progress.report(PipelinePhase.STRUCTURE, 0, "Mapping project structure...");
            phases.getStructure().process(graph, contents.keySet());
            progress.report(PipelinePhase.STRUCTURE, 15, "Structure mapped: " + graph.nodeCount() + " nodes");
            ctx.checkCancelled("structure");

            log.info("Step 2: Parsing sources...");
            phases.getParsing().process(graph, entries, ctx, progress.band(PipelinePhase.PARSING, 15, 50));

            log.info("Step 3: Resolving imports...");
            phases.getImports().process(graph, entries, ctx, progress.band(PipelinePhase.IMPORTS, 50, 60));

            log.info("Step 4: Resolving calls...");
            phases.getCalls().process(graph, entries, ctx, progress.band(PipelinePhase.CALLS, 60, 70));

            log.info("Step 5: Resolving heritage...");
            phases.getHeritage().process(graph, entries, ctx, progress.band(PipelinePhase.HERITAGE, 70, 78));
            ctx.getParseCache().clear();

            log.info("Step 6-7: Detecting communities and processes...");
            IngestionPhases.Derived derived = phases.derive(graph, ctx, 78, 88, 88, 98);

            int pruned = graph.pruneDanglingRelationships();
            if (pruned > 0) {
                log.debug("Pruned {} dangling relationships", pruned);
            }

            Duration duration = Duration.between(startTime, Instant.now());
            progress.report(PipelinePhase.COMPLETE, 100, "Graph complete!",
                    new PipelineProgress.Stats(contents.size(), contents.size(), graph.nodeCount()));
            log.info("Ingestion complete: {} nodes, {} relationships in {}ms",
                    graph.nodeCount(), graph.relationshipCount(), duration.toMillis());

            return new PipelineResult(graph, contents, derived.communityResult(), derived.processResult());
        } catch (OperationCancelledException e) {
            log.info("Ingestion cancelled: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            progress.report(PipelinePhase.ERROR, progress.lastPercent(), "Ingestion failed: " + e.getMessage());
            throw e;
        }
    }
}
