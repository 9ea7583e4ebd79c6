package com.vidnyan.codegraph.query.ast;

import java.util.List;

/**
 * Alternating node and relationship patterns: {@code nodes.size() == relationships.size() + 1}.
 */
public record PathPattern(List<NodePattern> nodes, List<RelationshipPattern> relationships) {

    public PathPattern {
        nodes = List.copyOf(nodes);
        relationships = List.copyOf(relationships);
    }
}
