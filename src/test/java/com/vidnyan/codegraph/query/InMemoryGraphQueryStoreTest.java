package com.vidnyan.codegraph.query;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.exception.GraphNotLoadedException;
import com.vidnyan.codegraph.exception.GraphQueryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryGraphQueryStoreTest {

    private static final String FOO = NodeIds.symbol(NodeLabel.FUNCTION, "a.ts", "foo");
    private static final String BAR = NodeIds.symbol(NodeLabel.FUNCTION, "b.ts", "bar");
    private static final String BAZ = NodeIds.symbol(NodeLabel.FUNCTION, "b.ts", "baz");

    private InMemoryGraphQueryStore store;

    @BeforeEach
    void setUp() {
        GraphNode fileA = GraphNode.builder(NodeIds.file("a.ts"), NodeLabel.FILE).name("a.ts").filePath("a.ts").build();
        GraphNode fileB = GraphNode.builder(NodeIds.file("b.ts"), NodeLabel.FILE).name("b.ts").filePath("b.ts").build();
        GraphNode foo = GraphNode.builder(FOO, NodeLabel.FUNCTION).name("foo").filePath("a.ts").lines(1, 1).build();
        GraphNode bar = GraphNode.builder(BAR, NodeLabel.FUNCTION).name("bar").filePath("b.ts").lines(2, 4).build();
        GraphNode baz = GraphNode.builder(BAZ, NodeLabel.FUNCTION).name("baz").filePath("b.ts").lines(5, 6).build();
        KnowledgeGraph graph = KnowledgeGraph.of(List.of(fileA, fileB, foo, bar, baz), List.of(
                GraphRelationship.of(RelationshipType.CONTAINS, fileA.id(), FOO, 1.0, ""),
                GraphRelationship.of(RelationshipType.CONTAINS, fileB.id(), BAR, 1.0, ""),
                GraphRelationship.of(RelationshipType.CONTAINS, fileB.id(), BAZ, 1.0, ""),
                GraphRelationship.of(RelationshipType.CALLS, BAR, FOO, 0.9, "import-resolved"),
                GraphRelationship.of(RelationshipType.CALLS, BAR, BAZ, 0.95, "same-file")));
        store = new InMemoryGraphQueryStore();
        store.load(graph);
    }

    @Test
    void query_ShouldFailBeforeGraphIsLoaded() {
        InMemoryGraphQueryStore empty = new InMemoryGraphQueryStore();

        assertThrows(GraphNotLoadedException.class, () -> empty.query("MATCH (n) RETURN n"));
    }

    @Test
    void query_ShouldReturnNodeRows() {
        QueryResult result = store.query("MATCH (n:Function {name: 'foo'}) RETURN n");

        assertEquals(1, result.size());
        assertEquals(QueryRow.Kind.NODE, result.rows().get(0).kind());
        assertEquals(FOO, result.rows().get(0).node().id());
    }

    @Test
    void query_ShouldReturnRelationshipTriples() {
        QueryResult result = store.query(
                "MATCH (a:Function)-[r:CALLS]->(b:Function) WHERE b.name = 'foo' RETURN a, r, b");

        assertEquals(1, result.size());
        QueryRow row = result.rows().get(0);
        assertEquals(QueryRow.Kind.RELATIONSHIP, row.kind());
        assertEquals(BAR, row.source().id());
        assertEquals(RelationshipType.CALLS, row.relationship().type());
        assertEquals(FOO, row.target().id());
    }

    @Test
    void query_ShouldProjectValuesWithSourceTextColumns() {
        QueryResult result = store.query(
                "MATCH (f:File)-[:CONTAINS]->(n:Function) RETURN f.name, n.name ORDER BY n.name DESC LIMIT 2");

        assertEquals(List.of("f.name", "n.name"), result.columns());
        assertEquals(2, result.size());
        assertEquals(QueryRow.Kind.VALUES, result.rows().get(0).kind());
        assertEquals(List.of("a.ts", "foo"), result.rows().get(0).values());
        assertEquals(List.of("b.ts", "baz"), result.rows().get(1).values());
    }

    @Test
    void query_ShouldCountPerGroup() {
        QueryResult result = store.query(
                "MATCH (a)-[:CALLS]->(b) RETURN a.name AS caller, count(*) AS calls");

        assertEquals(List.of("caller", "calls"), result.columns());
        assertEquals(1, result.size());
        assertEquals(List.of("bar", 2L), result.rows().get(0).values());
    }

    @Test
    void query_ShouldFollowIncomingEdges() {
        QueryResult result = store.query("MATCH (n:Function)<-[:CALLS]-(caller) RETURN n.name ORDER BY n.name");

        assertEquals(2, result.size());
        assertEquals(List.of("baz"), result.rows().get(0).values());
        assertEquals(List.of("foo"), result.rows().get(1).values());
    }

    @Test
    void query_ShouldSupportStringPredicatesAndBooleanLogic() {
        QueryResult result = store.query(
                "MATCH (n:Function) WHERE n.name STARTS WITH 'ba' AND NOT n.name ENDS WITH 'z' RETURN n.name");

        assertEquals(1, result.size());
        assertEquals(List.of("bar"), result.rows().get(0).values());
    }

    @Test
    void query_ShouldRejectMalformedQueries() {
        assertThrows(GraphQueryException.class, () -> store.query(""));
        assertThrows(GraphQueryException.class, () -> store.query("MATCH (n RETURN n"));
        assertThrows(GraphQueryException.class, () -> store.query("MATCH (n) RETURN m"));
        assertThrows(GraphQueryException.class, () -> store.query("MATCH (n)-[*]->(m) RETURN n"));
        assertThrows(GraphQueryException.class, () -> store.query("MATCH (n) RETURN unknownFn(n)"));
    }

    @Test
    void query_ShouldSeeReloadedGraph() {
        store.load(new KnowledgeGraph());

        QueryResult result = store.query("MATCH (n) RETURN count(*) AS total");

        assertEquals(List.of(0L), result.rows().get(0).values());
    }
}
