package com.vidnyan.codegraph.application.service;

import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase.GraphStats;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.model.FileManifest;
import com.vidnyan.codegraph.domain.pipeline.PipelineResult;
import com.vidnyan.codegraph.domain.snapshot.EmbeddingRecord;
import com.vidnyan.codegraph.query.InMemoryGraphQueryStore;
import com.vidnyan.codegraph.search.Bm25Index;
import com.vidnyan.codegraph.search.SemanticIndex;
import lombok.Getter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * State of one open project: the current graph, file contents, embeddings and
 * the indexes derived from them. Everything is replaced together by
 * {@link #install}; readers never see a half-updated session.
 */
@Getter
public class ProjectSession {

    private final String projectId;
    private final Path root;
    private final String projectName;

    private final Bm25Index lexicalIndex;
    private final SemanticIndex semanticIndex = new SemanticIndex();
    private final InMemoryGraphQueryStore queryStore = new InMemoryGraphQueryStore();

    private volatile State state;

    /**
     * @param manifest  files as of the last sync, used to detect later changes
     * @param gitCommit HEAD at the last sync, null outside a repository
     */
    public record State(
        KnowledgeGraph graph,
        Map<String, String> fileContents,
        List<EmbeddingRecord> embeddings,
        FileManifest manifest,
        String gitCommit
    ) {}

    public ProjectSession(String projectId, Path root, Bm25Index lexicalIndex) {
        this.projectId = projectId;
        this.root = root;
        this.projectName = root.getFileName() != null ? root.getFileName().toString() : projectId;
        this.lexicalIndex = lexicalIndex;
    }

    synchronized void install(PipelineResult result, List<EmbeddingRecord> embeddings,
                              FileManifest manifest, String gitCommit) {
        KnowledgeGraph graph = result.graph();
        lexicalIndex.build(result.fileContents());
        semanticIndex.load(embeddings, graph);
        queryStore.load(graph);
        state = new State(graph, Map.copyOf(result.fileContents()), List.copyOf(embeddings), manifest, gitCommit);
    }

    public boolean isLoaded() {
        return state != null;
    }

    public GraphStats stats() {
        State current = state;
        if (current == null) {
            return new GraphStats(0, 0, 0, 0, 0, 0);
        }
        KnowledgeGraph graph = current.graph();
        return new GraphStats(
                current.fileContents().size(),
                graph.nodeCount(),
                graph.relationshipCount(),
                graph.nodesWithLabel(NodeLabel.COMMUNITY).size(),
                graph.nodesWithLabel(NodeLabel.PROCESS).size(),
                current.embeddings().size());
    }
}
