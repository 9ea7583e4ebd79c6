package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeLabel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Name index of declared symbols, per file and global.
 */
public final class SymbolTable {

    public record Definition(String nodeId, String name, NodeLabel label, String filePath) {}

    private final Map<String, Map<String, List<Definition>>> byFile = new HashMap<>();
    private final Map<String, List<Definition>> byName = new HashMap<>();
    private int size;

    public void add(Definition definition) {
        byFile.computeIfAbsent(definition.filePath(), k -> new HashMap<>())
                .computeIfAbsent(definition.name(), k -> new ArrayList<>())
                .add(definition);
        byName.computeIfAbsent(definition.name(), k -> new ArrayList<>()).add(definition);
        size++;
    }

    /**
     * Registers every symbol node already in the graph, so files parsed later can
     * resolve names declared in files that are not re-parsed.
     */
    public void seed(KnowledgeGraph graph) {
        for (GraphNode node : graph.nodes()) {
            if (node.label().isSymbol() && !node.filePath().isEmpty()) {
                add(new Definition(node.id(), node.name(), node.label(), node.filePath()));
            }
        }
    }

    public List<Definition> lookupInFile(String filePath, String name) {
        return byFile.getOrDefault(filePath, Map.of()).getOrDefault(name, List.of());
    }

    public List<Definition> lookupGlobal(String name) {
        return byName.getOrDefault(name, List.of());
    }

    public int size() {
        return size;
    }

    public void clear() {
        byFile.clear();
        byName.clear();
        size = 0;
    }
}
