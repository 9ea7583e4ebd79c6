package com.vidnyan.codegraph.domain.snapshot;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete persisted state of a project session.
 */
public record SnapshotPayload(
    SnapshotMeta meta,
    List<GraphNode> nodes,
    List<GraphRelationship> relationships,
    Map<String, String> fileContents,
    List<EmbeddingRecord> embeddings
) {

    public SnapshotPayload {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        fileContents = fileContents != null ? new LinkedHashMap<>(fileContents) : new LinkedHashMap<>();
        embeddings = embeddings != null ? List.copyOf(embeddings) : List.of();
    }
}
