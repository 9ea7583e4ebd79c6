package com.vidnyan.codegraph.domain.pipeline;

import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;

import java.util.Map;

/**
 * End state of a full or incremental pipeline run.
 */
public record PipelineResult(
    KnowledgeGraph graph,
    Map<String, String> fileContents,
    CommunityResult communityResult,
    ProcessResult processResult
) {
}
