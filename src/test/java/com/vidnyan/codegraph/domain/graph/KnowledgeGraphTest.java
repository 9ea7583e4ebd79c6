package com.vidnyan.codegraph.domain.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeGraphTest {

    private static GraphNode function(String path, String name) {
        return GraphNode.builder(NodeIds.symbol(NodeLabel.FUNCTION, path, name), NodeLabel.FUNCTION)
                .name(name)
                .filePath(path)
                .lines(1, 3)
                .build();
    }

    @Test
    void addNode_ShouldIgnoreDuplicateIds() {
        KnowledgeGraph graph = new KnowledgeGraph();
        GraphNode foo = function("a.ts", "foo");

        assertTrue(graph.addNode(foo));
        assertFalse(graph.addNode(function("a.ts", "foo")));
        assertEquals(1, graph.nodeCount());
    }

    @Test
    void removeNode_ShouldDropTouchingRelationships() {
        // Arrange
        GraphNode foo = function("a.ts", "foo");
        GraphNode bar = function("b.ts", "bar");
        GraphNode baz = function("b.ts", "baz");
        KnowledgeGraph graph = KnowledgeGraph.of(List.of(foo, bar, baz), List.of(
                GraphRelationship.of(RelationshipType.CALLS, bar.id(), foo.id(), 0.9, "import-resolved"),
                GraphRelationship.of(RelationshipType.CALLS, bar.id(), baz.id(), 0.95, "same-file")));

        // Act
        graph.removeNode(foo.id());

        // Assert
        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.relationshipCount());
        assertFalse(graph.hasDanglingRelationships());
        assertEquals(baz.id(), graph.relationships().iterator().next().targetId());
    }

    @Test
    void pruneDanglingRelationships_ShouldRemoveEdgesWithMissingEndpoints() {
        GraphNode bar = function("b.ts", "bar");
        KnowledgeGraph graph = KnowledgeGraph.of(List.of(bar), List.of(
                GraphRelationship.of(RelationshipType.CALLS, bar.id(), "Function:a.ts:foo", 0.9, "import-resolved")));

        assertTrue(graph.hasDanglingRelationships());
        assertEquals(1, graph.pruneDanglingRelationships());
        assertFalse(graph.hasDanglingRelationships());
        assertEquals(0, graph.relationshipCount());
    }

    @Test
    void relationshipIds_ShouldBeDeterministic() {
        GraphRelationship first = GraphRelationship.of(RelationshipType.CALLS, "x", "y", 0.5, "fuzzy-global");
        GraphRelationship second = GraphRelationship.of(RelationshipType.CALLS, "x", "y", 0.9, "import-resolved");

        assertEquals(first.id(), second.id());
        assertEquals("x_CALLS_y", first.id());
    }

    @Test
    void removeNodesIf_ShouldRemoveDerivedNodesAndMemberships() {
        // Arrange
        GraphNode foo = function("a.ts", "foo");
        GraphNode community = GraphNode.builder(NodeIds.community(0), NodeLabel.COMMUNITY).name("Cluster").build();
        KnowledgeGraph graph = KnowledgeGraph.of(List.of(foo, community), List.of(
                new GraphRelationship(NodeIds.membership(foo.id(), community.id()), RelationshipType.MEMBER_OF,
                        foo.id(), community.id(), 1.0, "leiden-algorithm", null)));

        // Act
        int removed = graph.removeNodesIf(n -> n.label().isDerived());

        // Assert
        assertEquals(1, removed);
        assertTrue(graph.containsNode(foo.id()));
        assertEquals(0, graph.relationshipCount());
    }

    @Test
    void stats_ShouldCountByLabelAndType() {
        GraphNode foo = function("a.ts", "foo");
        GraphNode bar = function("b.ts", "bar");
        KnowledgeGraph graph = KnowledgeGraph.of(List.of(foo, bar), List.of(
                GraphRelationship.of(RelationshipType.CALLS, bar.id(), foo.id(), 0.9, "import-resolved")));

        KnowledgeGraph.Stats stats = graph.stats();

        assertEquals(2, stats.nodesByLabel().get(NodeLabel.FUNCTION));
        assertEquals(1, stats.relationshipsByType().get(RelationshipType.CALLS));
        assertEquals(List.of(foo.id()), graph.adjacency(RelationshipType.CALLS).get(bar.id()));
    }
}
