package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.pipeline.CommunityResult;
import com.vidnyan.codegraph.domain.pipeline.PipelinePhase;
import com.vidnyan.codegraph.domain.pipeline.ProcessResult;
import com.vidnyan.codegraph.ingestion.phase.CallProcessor;
import com.vidnyan.codegraph.ingestion.phase.CommunityProcessor;
import com.vidnyan.codegraph.ingestion.phase.HeritageProcessor;
import com.vidnyan.codegraph.ingestion.phase.ImportProcessor;
import com.vidnyan.codegraph.ingestion.phase.ParsingProcessor;
import com.vidnyan.codegraph.ingestion.phase.ProcessTraceProcessor;
import com.vidnyan.codegraph.ingestion.phase.StructureProcessor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The seven ingestion phases, shared by the full pipeline and the incremental updater.
 */
@Slf4j
@Getter
@Component
@RequiredArgsConstructor
public class IngestionPhases {

    private final StructureProcessor structure;
    private final ParsingProcessor parsing;
    private final ImportProcessor imports;
    private final CallProcessor calls;
    private final HeritageProcessor heritage;
    private final CommunityProcessor communities;
    private final ProcessTraceProcessor processes;

    public static IngestionPhases defaults() {
        return new IngestionPhases(new StructureProcessor(), new ParsingProcessor(), new ImportProcessor(),
                new CallProcessor(), new HeritageProcessor(), new CommunityProcessor(), new ProcessTraceProcessor());
    }

    /**
     * Community detection followed by process tracing, over the whole graph.
     */
    public Derived derive(KnowledgeGraph graph, IngestionContext ctx,
                          int communitiesFrom, int communitiesTo, int processesFrom, int processesTo) {
        ProgressReporter progress = ctx.getProgress();
        CommunityResult communityResult = communities.process(graph, ctx,
                progress.band(PipelinePhase.COMMUNITIES, communitiesFrom, communitiesTo));
        ProcessResult processResult = processes.process(graph, communityResult, ctx,
                progress.band(PipelinePhase.PROCESSES, processesFrom, processesTo));
        return new Derived(communityResult, processResult);
    }

    public record Derived(CommunityResult communityResult, ProcessResult processResult) {}
}
