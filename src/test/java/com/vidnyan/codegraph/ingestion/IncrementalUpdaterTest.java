package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.pipeline.PipelineResult;
import com.vidnyan.codegraph.domain.pipeline.ProgressListener;
import com.vidnyan.codegraph.ingestion.language.SourceParsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.vidnyan.codegraph.ingestion.IngestionPipelineTest.A_TS;
import static com.vidnyan.codegraph.ingestion.IngestionPipelineTest.BAR;
import static com.vidnyan.codegraph.ingestion.IngestionPipelineTest.B_TS;
import static com.vidnyan.codegraph.ingestion.IngestionPipelineTest.FOO;
import static org.junit.jupiter.api.Assertions.*;

class IncrementalUpdaterTest {

    private static final String B_TS_V2 = "import { foo } from './a';\n"
            + "export function bar() { return foo(); }\n"
            + "export function qux() { return bar(); }\n";

    private static final String B_TS_RETARGETED = "export function bar() { return helper(); }\n"
            + "function helper() { return 2; }\n";

    private IncrementalUpdater updater;
    private PipelineResult initial;

    @BeforeEach
    void setUp() {
        updater = new IncrementalUpdater(SourceParsers.defaults(), IngestionPhases.defaults(),
                PipelineSettings.defaults());
        initial = IngestionPipelineTest.pipeline().run(
                List.of(new FileEntry("a.ts", A_TS), new FileEntry("b.ts", B_TS)),
                ProgressListener.NONE, CancellationToken.none());
    }

    private PipelineResult apply(DiffResult diff, Map<String, String> newContents) {
        return updater.apply(diff, newContents, initial.graph(), initial.fileContents(),
                ProgressListener.NONE, CancellationToken.none());
    }

    private static Set<String> nodeIds(KnowledgeGraph graph) {
        return graph.nodes().stream().map(GraphNode::id).collect(Collectors.toSet());
    }

    private static Set<String> relationshipIds(KnowledgeGraph graph) {
        return graph.relationships().stream().map(GraphRelationship::id).collect(Collectors.toSet());
    }

    @Test
    void apply_ShouldPreserveGraphForEmptyDiff() {
        // Act
        PipelineResult result = apply(DiffResult.empty(false), Map.of());

        // Assert
        assertEquals(nodeIds(initial.graph()), nodeIds(result.graph()));
        assertEquals(relationshipIds(initial.graph()), relationshipIds(result.graph()));
        assertEquals(initial.fileContents(), result.fileContents());
    }

    @Test
    void apply_ShouldKeepIdsOfUntouchedFilesWhenOneFileChanges() {
        // Arrange
        DiffResult diff = DiffResult.builder().modified("b.ts").build();

        // Act
        PipelineResult result = apply(diff, Map.of("b.ts", B_TS_V2));

        // Assert
        KnowledgeGraph graph = result.graph();
        assertSame(initial.graph().getNode(FOO).orElseThrow(), graph.getNode(FOO).orElseThrow());
        assertTrue(graph.containsNode(NodeIds.file("a.ts")));
        assertTrue(graph.containsNode(BAR));
        String qux = NodeIds.symbol(NodeLabel.FUNCTION, "b.ts", "qux");
        assertTrue(graph.containsNode(qux));
        assertTrue(graph.getRelationship(NodeIds.relationship(BAR, RelationshipType.CALLS, FOO)).isPresent());
        assertTrue(graph.getRelationship(NodeIds.relationship(qux, RelationshipType.CALLS, BAR)).isPresent());
        assertEquals(B_TS_V2, result.fileContents().get("b.ts"));
        assertFalse(graph.hasDanglingRelationships());
    }

    @Test
    void apply_ShouldRecomputeCommunitiesAndProcessesOverWholeGraph() {
        PipelineResult result = apply(DiffResult.builder().modified("b.ts").build(), Map.of("b.ts", B_TS_V2));

        KnowledgeGraph graph = result.graph();
        String qux = NodeIds.symbol(NodeLabel.FUNCTION, "b.ts", "qux");
        assertEquals(1, result.processResult().processes().size());
        assertEquals(List.of(qux, BAR, FOO), result.processResult().processes().get(0).trace());
        assertEquals(3, graph.relationshipsOfType(RelationshipType.STEP_IN_PROCESS).size());
        assertEquals(1, graph.nodesWithLabel(NodeLabel.PROCESS).size());
        assertEquals(3, graph.relationshipsOfType(RelationshipType.MEMBER_OF).size());
    }

    @Test
    void apply_ShouldMatchFullIngestionOfSameFiles() {
        PipelineResult incremental = apply(DiffResult.builder().modified("b.ts").build(), Map.of("b.ts", B_TS_V2));

        PipelineResult full = IngestionPipelineTest.pipeline().run(
                List.of(new FileEntry("a.ts", A_TS), new FileEntry("b.ts", B_TS_V2)),
                ProgressListener.NONE, CancellationToken.none());

        assertEquals(nodeIds(full.graph()), nodeIds(incremental.graph()));
        assertEquals(relationshipIds(full.graph()), relationshipIds(incremental.graph()));
    }

    @Test
    void apply_ShouldReplaceCallEdgesWhenModifiedFileCallsNewTarget() {
        // Arrange
        KnowledgeGraph before = initial.graph();
        String helper = NodeIds.symbol(NodeLabel.FUNCTION, "b.ts", "helper");

        // Act
        PipelineResult result = apply(DiffResult.builder().modified("b.ts").build(),
                Map.of("b.ts", B_TS_RETARGETED));

        // Assert
        KnowledgeGraph graph = result.graph();
        assertFalse(graph.getRelationship(NodeIds.relationship(BAR, RelationshipType.CALLS, FOO)).isPresent());
        assertTrue(graph.getRelationship(NodeIds.relationship(BAR, RelationshipType.CALLS, helper)).isPresent());
        assertSame(before.getNode(NodeIds.file("a.ts")).orElseThrow(),
                graph.getNode(NodeIds.file("a.ts")).orElseThrow());
        assertSame(before.getNode(FOO).orElseThrow(), graph.getNode(FOO).orElseThrow());
        assertTrue(graph.relationshipsOfType(RelationshipType.STEP_IN_PROCESS).stream().noneMatch(r -> r.touches(FOO)));
        assertTrue(result.processResult().processes().stream().noneMatch(p -> p.trace().contains(FOO)));
        assertTrue(result.processResult().processes().stream().anyMatch(p -> p.trace().equals(List.of(BAR, helper))));
        assertFalse(graph.hasDanglingRelationships());

        PipelineResult full = IngestionPipelineTest.pipeline().run(
                List.of(new FileEntry("a.ts", A_TS), new FileEntry("b.ts", B_TS_RETARGETED)),
                ProgressListener.NONE, CancellationToken.none());
        assertEquals(nodeIds(full.graph()), nodeIds(graph));
        assertEquals(relationshipIds(full.graph()), relationshipIds(graph));
    }

    @Test
    void apply_ShouldRemoveDeletedFileAndPruneEdgesIntoIt() {
        // Act
        PipelineResult result = apply(DiffResult.builder().deleted("a.ts").build(), Map.of());

        // Assert
        KnowledgeGraph graph = result.graph();
        assertFalse(graph.containsNode(FOO));
        assertFalse(graph.containsNode(NodeIds.file("a.ts")));
        assertTrue(graph.containsNode(BAR));
        assertTrue(graph.nodes().stream().noneMatch(n -> n.isOwnedBy("a.ts")));
        assertTrue(graph.relationshipsOfType(RelationshipType.CALLS).isEmpty());
        assertFalse(graph.hasDanglingRelationships());
        assertFalse(result.fileContents().containsKey("a.ts"));
        assertTrue(graph.nodesWithLabel(NodeLabel.COMMUNITY).isEmpty());
    }

    @Test
    void apply_ShouldIndexAddedFileInNewFolder() {
        String added = "import { bar } from '../b';\nexport function entry() { return bar(); }\n";

        PipelineResult result = apply(DiffResult.builder().added("lib/c.ts").build(), Map.of("lib/c.ts", added));

        KnowledgeGraph graph = result.graph();
        String entry = NodeIds.symbol(NodeLabel.FUNCTION, "lib/c.ts", "entry");
        assertTrue(graph.containsNode(NodeIds.folder("lib")));
        assertTrue(graph.containsNode(entry));
        assertTrue(graph.getRelationship(NodeIds.relationship(entry, RelationshipType.CALLS, BAR)).isPresent());
        assertSame(initial.graph().getNode(BAR).orElseThrow(), graph.getNode(BAR).orElseThrow());
    }

    @Test
    void apply_ShouldPruneFolderLeftEmptyByDeletion() {
        PipelineResult withFolder = apply(DiffResult.builder().added("lib/c.ts").build(),
                Map.of("lib/c.ts", "export const c = 1;\n"));

        PipelineResult result = updater.apply(DiffResult.builder().deleted("lib/c.ts").build(), Map.of(),
                withFolder.graph(), withFolder.fileContents(), ProgressListener.NONE, CancellationToken.none());

        assertTrue(withFolder.graph().containsNode(NodeIds.folder("lib")));
        assertFalse(result.graph().containsNode(NodeIds.folder("lib")));
    }
}
