package com.vidnyan.codegraph.application.port.in;

import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.pipeline.ProgressListener;
import com.vidnyan.codegraph.domain.snapshot.SnapshotLoadResult;
import com.vidnyan.codegraph.domain.snapshot.SnapshotMeta;
import com.vidnyan.codegraph.domain.snapshot.SnapshotSaveResult;
import com.vidnyan.codegraph.query.QueryResult;
import com.vidnyan.codegraph.search.HybridSearchResult;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Primary use case: keep the knowledge graph of a project in sync with its
 * files and answer queries against it.
 */
public interface ProjectGraphUseCase {

    /**
     * Opens a project: reuses a valid snapshot (updating it incrementally when
     * files changed) or ingests the project from scratch.
     */
    OpenResult open(Path projectRoot, ProgressListener listener, CancellationToken token);

    /**
     * Runs {@link #open} on the ingestion executor. The single-flight check
     * happens before the task is queued.
     */
    CompletableFuture<OpenResult> openAsync(Path projectRoot, ProgressListener listener, CancellationToken token);

    /**
     * Discards the graph and ingests the project again.
     */
    OpenResult reingest(String projectId, ProgressListener listener, CancellationToken token);

    /**
     * Applies a set of changed paths reported by a watcher. Each path is
     * classified as added, modified or deleted from the disk and the session.
     */
    UpdateResult applyChanges(String projectId, Collection<String> changedPaths,
                              ProgressListener listener, CancellationToken token);

    CompletableFuture<UpdateResult> applyChangesAsync(String projectId, Collection<String> changedPaths,
                                                      ProgressListener listener, CancellationToken token);

    /**
     * Detects changes since the session was last synced and applies them.
     */
    UpdateResult refresh(String projectId, ProgressListener listener, CancellationToken token);

    SnapshotSaveResult save(String projectId);

    QueryResult query(String projectId, String cypher);

    List<HybridSearchResult> search(String projectId, String query, int limit);

    GraphStats stats(String projectId);

    List<String> openProjects();

    void close(String projectId);

    /**
     * Snapshot of a project on disk, whether or not the project is open.
     */
    SnapshotInfo snapshotInfo(Path projectRoot);

    /**
     * Removes the snapshot directory of a project. The open session, if any, is kept.
     */
    void deleteSnapshot(Path projectRoot);

    /**
     * Projects under the configured base directory that have a snapshot.
     */
    List<Path> snapshotProjects();

    enum LoadSource {
        SNAPSHOT,
        SNAPSHOT_UPDATED,
        FULL_INGESTION
    }

    /**
     * @param snapshotStatus outcome of the snapshot load attempt
     * @param changes        changes applied on top of the snapshot, empty for a full ingestion
     */
    record OpenResult(
        String projectId,
        LoadSource source,
        SnapshotLoadResult.Status snapshotStatus,
        DiffResult changes,
        GraphStats stats,
        long durationMs
    ) {}

    /**
     * @param fullReingest true when the incremental path failed and the project was ingested again
     */
    record UpdateResult(
        String projectId,
        DiffResult changes,
        boolean fullReingest,
        GraphStats stats,
        long durationMs
    ) {}

    /**
     * @param meta header of the stored snapshot, null when there is none or it is unreadable
     */
    record SnapshotInfo(
        Path projectRoot,
        boolean exists,
        SnapshotMeta meta,
        long diskUsageBytes
    ) {}

    record GraphStats(
        int files,
        int nodes,
        int relationships,
        int communities,
        int processes,
        int embeddings
    ) {}
}
