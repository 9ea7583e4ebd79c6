package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.pipeline.PipelinePhase;
import com.vidnyan.codegraph.domain.pipeline.PipelineProgress;
import com.vidnyan.codegraph.domain.pipeline.PipelineResult;
import com.vidnyan.codegraph.domain.pipeline.ProgressListener;
import com.vidnyan.codegraph.exception.OperationCancelledException;
import com.vidnyan.codegraph.ingestion.language.SourceParsers;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IngestionPipelineTest {

    static final String A_TS = "export function foo() { return 1; }\n";
    static final String B_TS = "import { foo } from './a';\nexport function bar() { return foo(); }\n";

    static final String FOO = NodeIds.symbol(NodeLabel.FUNCTION, "a.ts", "foo");
    static final String BAR = NodeIds.symbol(NodeLabel.FUNCTION, "b.ts", "bar");

    static IngestionPipeline pipeline() {
        return new IngestionPipeline(SourceParsers.defaults(), IngestionPhases.defaults(), PipelineSettings.defaults());
    }

    @Test
    void run_ShouldBuildGraphForTwoImportingFiles() {
        // Act
        PipelineResult result = pipeline().run(
                List.of(new FileEntry("a.ts", A_TS), new FileEntry("b.ts", B_TS)),
                ProgressListener.NONE, CancellationToken.none());

        // Assert
        KnowledgeGraph graph = result.graph();
        assertEquals(2, graph.nodesWithLabel(NodeLabel.FILE).size());
        assertEquals(2, graph.nodesWithLabel(NodeLabel.FUNCTION).size());
        assertTrue(graph.containsNode(FOO));
        assertTrue(graph.containsNode(BAR));

        List<GraphRelationship> calls = graph.relationshipsOfType(RelationshipType.CALLS);
        assertEquals(1, calls.size());
        assertEquals(BAR, calls.get(0).sourceId());
        assertEquals(FOO, calls.get(0).targetId());
        assertEquals(0.9, calls.get(0).confidence(), 1e-9);
        assertEquals("import-resolved", calls.get(0).reason());

        assertTrue(graph.getRelationship(
                NodeIds.relationship(NodeIds.file("b.ts"), RelationshipType.IMPORTS, NodeIds.file("a.ts"))).isPresent());
        assertFalse(graph.hasDanglingRelationships());
        assertEquals(2, result.fileContents().size());
    }

    @Test
    void run_ShouldDeriveCommunityAndProcess() {
        PipelineResult result = pipeline().run(
                List.of(new FileEntry("a.ts", A_TS), new FileEntry("b.ts", B_TS)),
                ProgressListener.NONE, CancellationToken.none());

        KnowledgeGraph graph = result.graph();
        assertEquals(1, graph.nodesWithLabel(NodeLabel.COMMUNITY).size());
        assertEquals(2, graph.relationshipsOfType(RelationshipType.MEMBER_OF).size());
        assertEquals(1, result.processResult().processes().size());
        assertEquals(List.of(BAR, FOO), result.processResult().processes().get(0).trace());

        List<GraphRelationship> steps = graph.relationshipsOfType(RelationshipType.STEP_IN_PROCESS);
        assertEquals(2, steps.size());
        assertTrue(steps.stream().anyMatch(s -> s.sourceId().equals(BAR) && s.step() == 1));
        assertTrue(steps.stream().anyMatch(s -> s.sourceId().equals(FOO) && s.step() == 2));
    }

    @Test
    void run_ShouldReportMonotonicProgressEndingAtComplete() {
        List<PipelineProgress> events = new ArrayList<>();

        pipeline().run(List.of(new FileEntry("a.ts", A_TS), new FileEntry("b.ts", B_TS)),
                events::add, CancellationToken.none());

        assertFalse(events.isEmpty());
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).percent() >= events.get(i - 1).percent(),
                    "progress went backwards at event " + i);
        }
        PipelineProgress last = events.get(events.size() - 1);
        assertEquals(PipelinePhase.COMPLETE, last.phase());
        assertEquals(100, last.percent());
    }

    @Test
    void run_ShouldStopWhenCancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(OperationCancelledException.class, () -> pipeline().run(
                List.of(new FileEntry("a.ts", A_TS)), ProgressListener.NONE, token));
    }

    @Test
    void run_ShouldLinkJavaHeritageAcrossFiles() {
        String base = "package com.example;\n\npublic class Base {\n    public void run() {\n    }\n}\n";
        String child = "package com.example;\n\npublic class Child extends Base {\n"
                + "    public void go() {\n        run();\n    }\n}\n";

        PipelineResult result = pipeline().run(List.of(
                new FileEntry("src/com/example/Base.java", base),
                new FileEntry("src/com/example/Child.java", child)), ProgressListener.NONE, CancellationToken.none());

        KnowledgeGraph graph = result.graph();
        String childId = NodeIds.symbol(NodeLabel.CLASS, "src/com/example/Child.java", "Child");
        String baseId = NodeIds.symbol(NodeLabel.CLASS, "src/com/example/Base.java", "Base");
        assertTrue(graph.containsNode(childId));
        assertTrue(graph.containsNode(NodeIds.symbol(NodeLabel.METHOD, "src/com/example/Child.java", "Child.go")));
        assertTrue(graph.relationshipsOfType(RelationshipType.EXTENDS).stream()
                .anyMatch(r -> r.sourceId().equals(childId) && r.targetId().equals(baseId)));
        assertTrue(graph.containsNode(NodeIds.folder("src/com/example")));
    }

    @Test
    void run_ShouldKeepUnparseableFilesAsFileNodes() {
        PipelineResult result = pipeline().run(List.of(
                new FileEntry("README.md", "# demo\n"),
                new FileEntry("a.ts", A_TS)), ProgressListener.NONE, CancellationToken.none());

        assertTrue(result.graph().containsNode(NodeIds.file("README.md")));
        assertTrue(result.graph().containsNode(FOO));
    }
}
