package com.vidnyan.codegraph.domain.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * In-memory graph store owning the node and relationship collections of one
 * project session.
 * <p>
 * Insertion order is preserved so that serialization and derived algorithms are
 * deterministic. Adding a node or relationship whose id already exists is a no-op.
 * Not thread-safe: a graph is owned by the single pipeline run that builds it.
 */
public final class KnowledgeGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphRelationship> relationships = new LinkedHashMap<>();

    public static KnowledgeGraph of(Collection<GraphNode> nodes, Collection<GraphRelationship> relationships) {
        KnowledgeGraph graph = new KnowledgeGraph();
        nodes.forEach(graph::addNode);
        relationships.forEach(graph::addRelationship);
        return graph;
    }

    /**
     * @return true if the node was added, false if a node with the same id exists
     */
    public boolean addNode(GraphNode node) {
        return nodes.putIfAbsent(node.id(), node) == null;
    }

    public boolean addRelationship(GraphRelationship relationship) {
        return relationships.putIfAbsent(relationship.id(), relationship) == null;
    }

    public Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<GraphRelationship> getRelationship(String id) {
        return Optional.ofNullable(relationships.get(id));
    }

    /**
     * Removes a node together with every relationship touching it.
     */
    public void removeNode(String id) {
        if (nodes.remove(id) != null) {
            relationships.values().removeIf(r -> r.touches(id));
        }
    }

    public int removeNodesIf(Predicate<GraphNode> predicate) {
        Set<String> removed = new HashSet<>();
        Iterator<GraphNode> it = nodes.values().iterator();
        while (it.hasNext()) {
            GraphNode node = it.next();
            if (predicate.test(node)) {
                removed.add(node.id());
                it.remove();
            }
        }
        if (!removed.isEmpty()) {
            relationships.values().removeIf(r -> removed.contains(r.sourceId()) || removed.contains(r.targetId()));
        }
        return removed.size();
    }

    /**
     * Drops relationships whose endpoints are missing. A graph is only complete
     * once this has run after a rebuild.
     *
     * @return number of relationships removed
     */
    public int pruneDanglingRelationships() {
        int before = relationships.size();
        relationships.values().removeIf(r -> !nodes.containsKey(r.sourceId()) || !nodes.containsKey(r.targetId()));
        return before - relationships.size();
    }

    public boolean hasDanglingRelationships() {
        return relationships.values().stream()
                .anyMatch(r -> !nodes.containsKey(r.sourceId()) || !nodes.containsKey(r.targetId()));
    }

    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Collection<GraphRelationship> relationships() {
        return Collections.unmodifiableCollection(relationships.values());
    }

    public List<GraphNode> nodesWithLabel(NodeLabel label) {
        return nodes.values().stream().filter(n -> n.label() == label).toList();
    }

    public List<GraphRelationship> relationshipsOfType(RelationshipType type) {
        return relationships.values().stream().filter(r -> r.type() == type).toList();
    }

    public List<GraphRelationship> outgoing(String nodeId, RelationshipType type) {
        return relationships.values().stream()
                .filter(r -> r.type() == type && r.sourceId().equals(nodeId))
                .toList();
    }

    /**
     * Adjacency index for one relationship type: source id → target ids.
     */
    public Map<String, List<String>> adjacency(RelationshipType type) {
        Map<String, List<String>> index = new HashMap<>();
        for (GraphRelationship r : relationships.values()) {
            if (r.type() == type) {
                index.computeIfAbsent(r.sourceId(), k -> new ArrayList<>()).add(r.targetId());
            }
        }
        return index;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int relationshipCount() {
        return relationships.size();
    }

    public Stats stats() {
        Map<NodeLabel, Integer> byLabel = new LinkedHashMap<>();
        nodes.values().forEach(n -> byLabel.merge(n.label(), 1, Integer::sum));
        Map<RelationshipType, Integer> byType = new LinkedHashMap<>();
        relationships.values().forEach(r -> byType.merge(r.type(), 1, Integer::sum));
        return new Stats(nodes.size(), relationships.size(), byLabel, byType);
    }

    public record Stats(
        int nodeCount,
        int relationshipCount,
        Map<NodeLabel, Integer> nodesByLabel,
        Map<RelationshipType, Integer> relationshipsByType
    ) {}
}
