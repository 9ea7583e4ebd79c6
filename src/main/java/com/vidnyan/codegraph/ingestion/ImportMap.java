package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.RelationshipType;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * File path → paths of the project files it imports.
 */
public final class ImportMap {

    private final Map<String, Set<String>> imports = new HashMap<>();

    public void add(String fromPath, String toPath) {
        if (!fromPath.equals(toPath)) {
            imports.computeIfAbsent(fromPath, k -> new LinkedHashSet<>()).add(toPath);
        }
    }

    public Set<String> importsOf(String path) {
        return imports.getOrDefault(path, Set.of());
    }

    /**
     * Rebuilds entries from IMPORTS relationships already in the graph.
     */
    public void seed(KnowledgeGraph graph) {
        for (GraphRelationship rel : graph.relationshipsOfType(RelationshipType.IMPORTS)) {
            String from = graph.getNode(rel.sourceId()).map(GraphNode::filePath).orElse("");
            String to = graph.getNode(rel.targetId()).map(GraphNode::filePath).orElse("");
            if (!from.isEmpty() && !to.isEmpty()) {
                add(from, to);
            }
        }
    }

    public int size() {
        return imports.values().stream().mapToInt(Set::size).sum();
    }
}
