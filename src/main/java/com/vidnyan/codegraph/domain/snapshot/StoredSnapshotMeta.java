package com.vidnyan.codegraph.domain.snapshot;

/**
 * Content of {@code meta.json}: the payload header plus the integrity hash of
 * the compressed snapshot bytes.
 */
public record StoredSnapshotMeta(
    int formatVersion,
    String appVersion,
    String projectName,
    String gitCommit,
    String createdAt,
    int nodeCount,
    int relationshipCount,
    int fileCount,
    int embeddingCount,
    String hmac
) {

    public static StoredSnapshotMeta signed(SnapshotMeta meta, String hmac) {
        return new StoredSnapshotMeta(meta.formatVersion(), meta.appVersion(), meta.projectName(),
                meta.gitCommit(), meta.createdAt(), meta.nodeCount(), meta.relationshipCount(),
                meta.fileCount(), meta.embeddingCount(), hmac);
    }

    public SnapshotMeta toMeta() {
        return new SnapshotMeta(formatVersion, appVersion, projectName, gitCommit, createdAt,
                nodeCount, relationshipCount, fileCount, embeddingCount);
    }
}
