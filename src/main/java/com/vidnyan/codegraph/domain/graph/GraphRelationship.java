package com.vidnyan.codegraph.domain.graph;

import java.util.Objects;

/**
 * A typed, directed relationship between two graph nodes.
 *
 * @param confidence resolution confidence in [0, 1]
 * @param reason     provenance of the edge (e.g. "same-file", "leiden-algorithm")
 * @param step       1-based ordinal, only set for STEP_IN_PROCESS
 */
public record GraphRelationship(
    String id,
    RelationshipType type,
    String sourceId,
    String targetId,
    double confidence,
    String reason,
    Integer step
) {

    public GraphRelationship {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(targetId, "targetId");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        reason = reason != null ? reason : "";
    }

    /**
     * Relationship with the deterministic id {@code source_TYPE_target}.
     */
    public static GraphRelationship of(RelationshipType type, String sourceId, String targetId,
                                       double confidence, String reason) {
        return new GraphRelationship(NodeIds.relationship(sourceId, type, targetId),
                type, sourceId, targetId, confidence, reason, null);
    }

    public boolean touches(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }
}
