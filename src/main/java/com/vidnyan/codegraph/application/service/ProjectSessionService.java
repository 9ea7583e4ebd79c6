package com.vidnyan.codegraph.application.service;

import com.vidnyan.codegraph.CodeGraphProperties;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase;
import com.vidnyan.codegraph.application.port.out.ChangeDetector;
import com.vidnyan.codegraph.application.port.out.ProjectFiles;
import com.vidnyan.codegraph.application.port.out.SnapshotStore;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.domain.model.FileManifest;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.pipeline.CommunityResult;
import com.vidnyan.codegraph.domain.pipeline.PipelinePhase;
import com.vidnyan.codegraph.domain.pipeline.PipelineProgress;
import com.vidnyan.codegraph.domain.pipeline.PipelineResult;
import com.vidnyan.codegraph.domain.pipeline.ProcessResult;
import com.vidnyan.codegraph.domain.pipeline.ProgressListener;
import com.vidnyan.codegraph.domain.snapshot.EmbeddingRecord;
import com.vidnyan.codegraph.domain.snapshot.SnapshotFormat;
import com.vidnyan.codegraph.domain.snapshot.SnapshotLoadResult;
import com.vidnyan.codegraph.domain.snapshot.SnapshotMeta;
import com.vidnyan.codegraph.domain.snapshot.SnapshotPayload;
import com.vidnyan.codegraph.domain.snapshot.SnapshotSaveResult;
import com.vidnyan.codegraph.exception.GraphNotLoadedException;
import com.vidnyan.codegraph.exception.OperationCancelledException;
import com.vidnyan.codegraph.exception.ProjectNotOpenException;
import com.vidnyan.codegraph.ingestion.IncrementalUpdater;
import com.vidnyan.codegraph.ingestion.IngestionPipeline;
import com.vidnyan.codegraph.query.QueryResult;
import com.vidnyan.codegraph.search.Bm25Index;
import com.vidnyan.codegraph.search.EmbeddingService;
import com.vidnyan.codegraph.search.HybridSearchResult;
import com.vidnyan.codegraph.search.HybridSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Orchestrates project sessions: snapshot reuse, full and incremental
 * ingestion, snapshot saves, queries and search.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectSessionService implements ProjectGraphUseCase {

    private final ProjectFiles projectFiles;
    private final ChangeDetector changeDetector;
    private final SnapshotStore snapshotStore;
    private final IngestionPipeline ingestionPipeline;
    private final IncrementalUpdater incrementalUpdater;
    private final EmbeddingService embeddingService;
    private final HybridSearchService searchService;
    private final SingleFlightGuard guard;
    private final CodeGraphProperties properties;
    @Qualifier("ingestionExecutor")
    private final Executor ingestionExecutor;

    private final Map<String, ProjectSession> sessions = new ConcurrentHashMap<>();

    private record Sync(PipelineResult result, boolean fullReingest) {}

    public static String projectIdOf(Path projectRoot) {
        return projectRoot.toAbsolutePath().normalize().toString();
    }

    @Override
    public OpenResult open(Path projectRoot, ProgressListener listener, CancellationToken token) {
        Path root = projectRoot.toAbsolutePath().normalize();
        String projectId = projectIdOf(root);
        try (SingleFlightGuard.Permit permit = guard.acquire(projectId, "open")) {
            return doOpen(root, projectId, listener, token);
        }
    }

    @Override
    public CompletableFuture<OpenResult> openAsync(Path projectRoot, ProgressListener listener,
                                                   CancellationToken token) {
        Path root = projectRoot.toAbsolutePath().normalize();
        String projectId = projectIdOf(root);
        return submit(guard.acquire(projectId, "open"), () -> doOpen(root, projectId, listener, token));
    }

    private OpenResult doOpen(Path root, String projectId, ProgressListener listener, CancellationToken token) {
        long start = System.currentTimeMillis();
        log.info("Opening project: {}", root);

        // Step 1: try the snapshot
        log.info("Step 1: Loading snapshot...");
        SnapshotLoadResult loaded = snapshotStore.load(root);
        ProjectSession session = new ProjectSession(projectId, root, newLexicalIndex());

        if (!loaded.isValid()) {
            log.info("Step 2: No usable snapshot ({}), ingesting from scratch", loaded.status());
            PipelineResult result = fullIngest(root, listener, token);
            List<EmbeddingRecord> embeddings = embeddingService.generate(result.graph(), result.fileContents(), token);
            install(session, result, embeddings);
            return openResult(session, LoadSource.FULL_INGESTION, loaded.status(), DiffResult.empty(false), start);
        }

        SnapshotPayload payload = loaded.payload();
        KnowledgeGraph graph = KnowledgeGraph.of(payload.nodes(), payload.relationships());
        log.info("Step 2: Snapshot restored: {} nodes, {} relationships, {} files",
                graph.nodeCount(), graph.relationshipCount(), payload.fileContents().size());

        // Step 3: bring it up to date
        log.info("Step 3: Detecting changes since snapshot...");
        FileManifest manifest = snapshotStore.loadManifest(root).orElse(FileManifest.empty());
        DiffResult diff = changeDetector.detectChanges(root, payload.meta().gitCommit(), manifest);

        if (diff.isEmpty()) {
            log.info("Snapshot is up to date");
            listener.onProgress(PipelineProgress.of(PipelinePhase.COMPLETE, 100, "Loaded from snapshot"));
            PipelineResult result = new PipelineResult(graph, payload.fileContents(),
                    CommunityResult.empty(), ProcessResult.empty());
            install(session, result, embeddingService.reconcile(payload.embeddings(), graph,
                    payload.fileContents(), token));
            return openResult(session, LoadSource.SNAPSHOT, loaded.status(), diff, start);
        }

        log.info("Step 4: Applying {} changes to snapshot", diff.totalChanges());
        Sync sync = updateOrReingest(root, diff, graph, payload.fileContents(), listener, token);
        List<EmbeddingRecord> embeddings = embeddingService.reconcile(payload.embeddings(),
                sync.result().graph(), sync.result().fileContents(), diff.addedOrModified(), token);
        install(session, sync.result(), embeddings);
        return openResult(session, sync.fullReingest() ? LoadSource.FULL_INGESTION : LoadSource.SNAPSHOT_UPDATED,
                loaded.status(), diff, start);
    }

    @Override
    public OpenResult reingest(String projectId, ProgressListener listener, CancellationToken token) {
        ProjectSession existing = requireSession(projectId);
        try (SingleFlightGuard.Permit permit = guard.acquire(projectId, "reingest")) {
            long start = System.currentTimeMillis();
            ProjectSession session = new ProjectSession(projectId, existing.getRoot(), newLexicalIndex());
            PipelineResult result = fullIngest(existing.getRoot(), listener, token);
            install(session, result, embeddingService.generate(result.graph(), result.fileContents(), token));
            return openResult(session, LoadSource.FULL_INGESTION, SnapshotLoadResult.Status.MISSING,
                    DiffResult.empty(false), start);
        }
    }

    @Override
    public UpdateResult applyChanges(String projectId, Collection<String> changedPaths,
                                     ProgressListener listener, CancellationToken token) {
        ProjectSession session = requireSession(projectId);
        try (SingleFlightGuard.Permit permit = guard.acquire(projectId, "update")) {
            return doUpdate(session, classify(session, changedPaths), listener, token);
        }
    }

    @Override
    public CompletableFuture<UpdateResult> applyChangesAsync(String projectId, Collection<String> changedPaths,
                                                             ProgressListener listener, CancellationToken token) {
        ProjectSession session = requireSession(projectId);
        List<String> paths = List.copyOf(changedPaths);
        return submit(guard.acquire(projectId, "update"),
                () -> doUpdate(session, classify(session, paths), listener, token));
    }

    @Override
    public UpdateResult refresh(String projectId, ProgressListener listener, CancellationToken token) {
        ProjectSession session = requireSession(projectId);
        try (SingleFlightGuard.Permit permit = guard.acquire(projectId, "update")) {
            // the session's own manifest is newer than any recorded commit
            DiffResult diff = changeDetector.detectChanges(session.getRoot(), null, session.getState().manifest());
            return doUpdate(session, diff, listener, token);
        }
    }

    private UpdateResult doUpdate(ProjectSession session, DiffResult diff, ProgressListener listener,
                                  CancellationToken token) {
        long start = System.currentTimeMillis();
        if (diff.isEmpty()) {
            listener.onProgress(PipelineProgress.of(PipelinePhase.COMPLETE, 100, "No changes"));
            return new UpdateResult(session.getProjectId(), diff, false, session.stats(), 0L);
        }
        ProjectSession.State state = session.getState();
        Sync sync = updateOrReingest(session.getRoot(), diff, state.graph(), state.fileContents(), listener, token);
        List<EmbeddingRecord> embeddings = embeddingService.reconcile(state.embeddings(),
                sync.result().graph(), sync.result().fileContents(), diff.addedOrModified(), token);
        install(session, sync.result(), embeddings);
        return new UpdateResult(session.getProjectId(), diff, sync.fullReingest(), session.stats(),
                System.currentTimeMillis() - start);
    }

    /**
     * Incremental update; if it fails for any reason but cancellation the
     * project is ingested from scratch instead.
     */
    private Sync updateOrReingest(Path root, DiffResult diff, KnowledgeGraph graph, Map<String, String> contents,
                                  ProgressListener listener, CancellationToken token) {
        try {
            Map<String, String> newContents = projectFiles.read(root, diff.addedOrModified());
            return new Sync(incrementalUpdater.apply(diff, newContents, graph, contents, listener, token), false);
        } catch (OperationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Incremental update of {} failed, falling back to full ingestion: {}", root, e.getMessage());
            return new Sync(fullIngest(root, listener, token), true);
        }
    }

    private PipelineResult fullIngest(Path root, ProgressListener listener, CancellationToken token) {
        List<FileEntry> files = projectFiles.scan(root);
        token.throwIfCancelled("file discovery");
        return ingestionPipeline.run(files, listener, token);
    }

    /**
     * Watcher paths become added, modified or deleted depending on whether
     * they exist on disk and in the session.
     */
    private DiffResult classify(ProjectSession session, Collection<String> changedPaths) {
        Map<String, String> known = session.getState().fileContents();
        DiffResult.Builder diff = DiffResult.builder();
        for (String raw : new TreeSet<>(changedPaths)) {
            String path = raw.replace('\\', '/');
            boolean onDisk = projectFiles.exists(session.getRoot(), path);
            boolean tracked = known.containsKey(path);
            if (onDisk && tracked) {
                diff.modified(path);
            } else if (onDisk) {
                diff.added(path);
            } else if (tracked) {
                diff.deleted(path);
            }
        }
        return diff.build();
    }

    private void install(ProjectSession session, PipelineResult result, List<EmbeddingRecord> embeddings) {
        Path root = session.getRoot();
        FileManifest manifest = changeDetector.buildManifest(root, result.fileContents());
        String commit = changeDetector.currentCommit(root).orElse(null);
        session.install(result, embeddings, manifest, commit);
        sessions.put(session.getProjectId(), session);
        log.info("Project {} ready: {}", session.getProjectName(), session.stats());
    }

    @Override
    public SnapshotSaveResult save(String projectId) {
        ProjectSession session = requireSession(projectId);
        try (SingleFlightGuard.Permit permit = guard.acquire(projectId, "save")) {
            ProjectSession.State state = session.getState();
            Path root = session.getRoot();
            SnapshotMeta meta = new SnapshotMeta(
                    SnapshotFormat.FORMAT_VERSION,
                    properties.getAppVersion(),
                    session.getProjectName(),
                    changeDetector.currentCommit(root).orElse(null),
                    Instant.now().toString(),
                    state.graph().nodeCount(),
                    state.graph().relationshipCount(),
                    state.fileContents().size(),
                    state.embeddings().size());
            SnapshotPayload payload = new SnapshotPayload(meta, new ArrayList<>(state.graph().nodes()),
                    new ArrayList<>(state.graph().relationships()), state.fileContents(), state.embeddings());
            FileManifest manifest = changeDetector.buildManifest(root, state.fileContents());
            return snapshotStore.save(root, payload, manifest);
        }
    }

    @Override
    public QueryResult query(String projectId, String cypher) {
        ProjectSession session = sessions.get(projectId);
        if (session == null || !session.isLoaded()) {
            throw new GraphNotLoadedException("No graph loaded for " + projectId);
        }
        return session.getQueryStore().query(cypher);
    }

    @Override
    public List<HybridSearchResult> search(String projectId, String query, int limit) {
        ProjectSession session = requireSession(projectId);
        int k = limit > 0 ? limit : properties.getSearch().getDefaultLimit();
        return searchService.search(session.getLexicalIndex(), session.getSemanticIndex(), query, k);
    }

    @Override
    public GraphStats stats(String projectId) {
        return requireSession(projectId).stats();
    }

    @Override
    public List<String> openProjects() {
        return new ArrayList<>(new TreeSet<>(sessions.keySet()));
    }

    @Override
    public void close(String projectId) {
        if (sessions.remove(projectId) != null) {
            log.info("Closed project {}", projectId);
        }
    }

    @Override
    public SnapshotInfo snapshotInfo(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        boolean exists = snapshotStore.exists(root);
        return new SnapshotInfo(root, exists,
                exists ? snapshotStore.readMeta(root).orElse(null) : null,
                snapshotStore.diskUsage(root));
    }

    @Override
    public void deleteSnapshot(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        try (SingleFlightGuard.Permit permit = guard.acquire(projectIdOf(root), "delete-snapshot")) {
            snapshotStore.delete(root);
        }
    }

    @Override
    public List<Path> snapshotProjects() {
        return snapshotStore.listProjects(Path.of(properties.getSnapshot().getProjectsBaseDir()));
    }

    public Optional<ProjectSession> session(String projectId) {
        return Optional.ofNullable(sessions.get(projectId));
    }

    private ProjectSession requireSession(String projectId) {
        ProjectSession session = sessions.get(projectId);
        if (session == null || !session.isLoaded()) {
            throw new ProjectNotOpenException(projectId);
        }
        return session;
    }

    private Bm25Index newLexicalIndex() {
        CodeGraphProperties.Search search = properties.getSearch();
        return new Bm25Index(search.getBm25K1(), search.getBm25B());
    }

    private OpenResult openResult(ProjectSession session, LoadSource source, SnapshotLoadResult.Status status,
                                  DiffResult changes, long start) {
        long duration = System.currentTimeMillis() - start;
        log.info("Opened {} from {} in {} ms", session.getProjectName(), source, duration);
        return new OpenResult(session.getProjectId(), source, status, changes, session.stats(), duration);
    }

    /**
     * Runs the task on the ingestion executor; the permit is released when it finishes.
     */
    private <T> CompletableFuture<T> submit(SingleFlightGuard.Permit permit, Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try (permit) {
                    return task.get();
                }
            }, ingestionExecutor);
        } catch (RejectedExecutionException e) {
            permit.close();
            throw e;
        }
    }
}
