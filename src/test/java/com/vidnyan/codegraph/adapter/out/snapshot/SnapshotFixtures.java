package com.vidnyan.codegraph.adapter.out.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.snapshot.EmbeddingRecord;
import com.vidnyan.codegraph.domain.snapshot.SnapshotFormat;
import com.vidnyan.codegraph.domain.snapshot.SnapshotMeta;
import com.vidnyan.codegraph.domain.snapshot.SnapshotPayload;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class SnapshotFixtures {

    static final String APP_VERSION = "1.0.0";

    private SnapshotFixtures() {
    }

    static SnapshotPayload payload() {
        GraphNode file = GraphNode.builder(NodeIds.file("a.ts"), NodeLabel.FILE)
                .name("a.ts")
                .filePath("a.ts")
                .build();
        GraphNode foo = GraphNode.builder(NodeIds.symbol(NodeLabel.FUNCTION, "a.ts", "foo"), NodeLabel.FUNCTION)
                .name("foo")
                .filePath("a.ts")
                .lines(1, 1)
                .language("typescript")
                .property("exported", true)
                .build();
        GraphRelationship contains = GraphRelationship.of(RelationshipType.CONTAINS, file.id(), foo.id(), 1.0, "");
        SnapshotMeta meta = new SnapshotMeta(SnapshotFormat.FORMAT_VERSION, APP_VERSION, "demo", null,
                "2026-01-01T00:00:00Z", 2, 1, 1, 1);
        return new SnapshotPayload(meta, List.of(file, foo), List.of(contains),
                Map.of("a.ts", "export function foo() {}\n"),
                List.of(new EmbeddingRecord(foo.id(), new float[]{0.25f, -0.5f, 1.0f})));
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    static SignedSnapshotStore store(Path keyDir, String appVersion) {
        SigningKeyProvider keys = new SigningKeyProvider(keyDir.resolve("keys.p12"), "test-password",
                keyDir.resolve("hmac.key"));
        return new SignedSnapshotStore(new SnapshotCodec(), new SnapshotSigner(keys),
                new FileSystemSnapshotStore(objectMapper()), appVersion, true);
    }
}
