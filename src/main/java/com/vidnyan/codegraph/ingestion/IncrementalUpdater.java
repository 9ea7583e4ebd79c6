package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.pipeline.PipelinePhase;
import com.vidnyan.codegraph.domain.pipeline.PipelineProgress;
import com.vidnyan.codegraph.domain.pipeline.PipelineResult;
import com.vidnyan.codegraph.domain.pipeline.ProgressListener;
import com.vidnyan.codegraph.ingestion.language.SourceParsers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces a new graph from a prior one and a set of file changes, re-running
 * the per-file phases only for added and modified files.
 * <p>
 * Nodes owned by untouched files are carried over unchanged, so their ids stay
 * stable. Relationships are carried over when their source survives; those
 * pointing into removed files are re-created with the same ids when the target
 * file is re-parsed and pruned otherwise. Communities and processes are always
 * recomputed over the entire new graph.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncrementalUpdater {

    private final SourceParsers parsers;
    private final IngestionPhases phases;
    private final PipelineSettings settings;

    public PipelineResult apply(DiffResult diff, Map<String, String> newContents,
                                KnowledgeGraph existingGraph, Map<String, String> existingContents,
                                ProgressListener listener, CancellationToken token) {
        ProgressReporter progress = new ProgressReporter(listener);
        progress.report(PipelinePhase.STRUCTURE, 10, String.format("Incremental update: %d added, %d modified, %d deleted",
                diff.added().size(), diff.modified().size(), diff.deleted().size()));
        log.info("Starting incremental update: {}", diff);

        Set<String> removed = new HashSet<>(diff.added());
        removed.addAll(diff.modified());
        removed.addAll(diff.deleted());

        // Step 1: carry over everything not owned by a changed file
        KnowledgeGraph graph = new KnowledgeGraph();
        Set<String> survivors = new HashSet<>();
        for (GraphNode node : existingGraph.nodes()) {
            if (!node.label().isDerived() && !removed.contains(node.filePath())) {
                graph.addNode(node);
                survivors.add(node.id());
            }
        }
        for (GraphRelationship rel : existingGraph.relationships()) {
            if (!rel.type().isDerived() && survivors.contains(rel.sourceId())) {
                graph.addRelationship(rel);
            }
        }
        log.info("Step 1: Carried over {} nodes, {} relationships", graph.nodeCount(), graph.relationshipCount());

        Map<String, String> contents = new LinkedHashMap<>(existingContents);
        diff.deleted().forEach(contents::remove);
        List<FileEntry> changedFiles = new ArrayList<>();
        for (String path : diff.addedOrModified()) {
            String content = newContents.get(path);
            if (content != null) {
                contents.put(path, content);
                changedFiles.add(new FileEntry(path, content));
            } else {
                log.debug("Excluding unreadable changed file {}", path);
                contents.remove(path);
            }
        }

        IngestionContext ctx = new IngestionContext(parsers, settings, token, progress, contents.keySet());
        ctx.checkCancelled("incremental update");

        // Step 2: structure over the full path list
        phases.getStructure().process(graph, contents.keySet());
        int prunedFolders = phases.getStructure().pruneEmptyFolders(graph, contents.keySet());
        log.info("Step 2: Structure rebuilt, {} empty folders removed", prunedFolders);
        ctx.getSymbolTable().seed(graph);
        ctx.getImportMap().seed(graph);

        // Step 3: per-file phases, scoped to changed files
        if (!changedFiles.isEmpty()) {
            progress.report(PipelinePhase.STRUCTURE, 15, "Re-indexing " + changedFiles.size() + " files...");
            log.info("Step 3: Re-indexing {} changed files", changedFiles.size());
            phases.getParsing().process(graph, changedFiles, ctx, progress.band(PipelinePhase.PARSING, 30, 60));
            phases.getImports().process(graph, changedFiles, ctx, progress.band(PipelinePhase.IMPORTS, 60, 70));
            phases.getCalls().process(graph, changedFiles, ctx, progress.band(PipelinePhase.CALLS, 70, 80));
            phases.getHeritage().process(graph, changedFiles, ctx, progress.band(PipelinePhase.HERITAGE, 80, 85));
            ctx.getParseCache().clear();
        }

        // Step 4: derived structure over the whole graph
        log.info("Step 4: Re-clustering communities and execution flows");
        IngestionPhases.Derived derived = phases.derive(graph, ctx, 85, 90, 92, 98);

        int pruned = graph.pruneDanglingRelationships();
        progress.report(PipelinePhase.COMPLETE, 100,
                "Incremental update complete! " + changedFiles.size() + " files re-indexed.",
                new PipelineProgress.Stats(contents.size(), contents.size(), graph.nodeCount()));
        log.info("Incremental update complete: {} nodes, {} relationships ({} dangling pruned)",
                graph.nodeCount(), graph.relationshipCount(), pruned);

        return new PipelineResult(graph, contents, derived.communityResult(), derived.processResult());
    }
}
