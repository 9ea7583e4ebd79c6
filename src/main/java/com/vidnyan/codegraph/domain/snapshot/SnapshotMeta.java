package com.vidnyan.codegraph.domain.snapshot;

/**
 * Header of a snapshot payload.
 *
 * @param formatVersion binary layout version, see {@link SnapshotFormat#FORMAT_VERSION}
 * @param appVersion    version of the application that wrote the snapshot
 * @param gitCommit     HEAD commit at save time, null when the project is not a repository
 * @param createdAt     ISO-8601 instant
 */
public record SnapshotMeta(
    int formatVersion,
    String appVersion,
    String projectName,
    String gitCommit,
    String createdAt,
    int nodeCount,
    int relationshipCount,
    int fileCount,
    int embeddingCount
) {
}
