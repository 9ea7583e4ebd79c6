package com.vidnyan.codegraph.search;

import com.vidnyan.codegraph.CodeGraphProperties;
import com.vidnyan.codegraph.application.port.out.EmbeddingProvider;
import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.snapshot.EmbeddingRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generates symbol embeddings from their source lines.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingService {

    static final Set<NodeLabel> EMBEDDABLE = EnumSet.of(
            NodeLabel.FUNCTION, NodeLabel.CLASS, NodeLabel.METHOD, NodeLabel.INTERFACE);

    private final EmbeddingProvider provider;
    private final CodeGraphProperties properties;

    public boolean isEnabled() {
        return provider.isEnabled();
    }

    public float[] embedQuery(String query) {
        return provider.embed(query);
    }

    /**
     * Embeds every embeddable node of the graph.
     *
     * @return empty when the provider is disabled
     */
    public List<EmbeddingRecord> generate(KnowledgeGraph graph, Map<String, String> fileContents,
                                          CancellationToken token) {
        return reconcile(List.of(), graph, fileContents, token);
    }

    /**
     * Drops embeddings of nodes no longer in the graph and embeds nodes that
     * have none. Existing vectors of surviving nodes are kept as they are.
     */
    public List<EmbeddingRecord> reconcile(List<EmbeddingRecord> existing, KnowledgeGraph graph,
                                           Map<String, String> fileContents, CancellationToken token) {
        return reconcile(existing, graph, fileContents, Set.of(), token);
    }

    /**
     * Like {@link #reconcile(List, KnowledgeGraph, Map, CancellationToken)}, but
     * nodes defined in {@code changedFiles} are always re-embedded from their
     * current source.
     */
    public List<EmbeddingRecord> reconcile(List<EmbeddingRecord> existing, KnowledgeGraph graph,
                                           Map<String, String> fileContents, Set<String> changedFiles,
                                           CancellationToken token) {
        List<EmbeddingRecord> kept = new ArrayList<>();
        Set<String> covered = new HashSet<>();
        for (EmbeddingRecord record : existing) {
            boolean current = graph.getNode(record.nodeId())
                    .map(node -> !changedFiles.contains(node.filePath()))
                    .orElse(false);
            if (current && record.dimensions() == provider.dimensions()) {
                kept.add(record);
                covered.add(record.nodeId());
            }
        }
        if (!provider.isEnabled()) {
            return kept;
        }

        int created = 0;
        for (GraphNode node : graph.nodes()) {
            if (!EMBEDDABLE.contains(node.label()) || covered.contains(node.id())) {
                continue;
            }
            token.throwIfCancelled("embedding generation");
            kept.add(new EmbeddingRecord(node.id(), provider.embed(textOf(node, fileContents))));
            created++;
        }
        log.info("Embeddings: {} kept, {} generated, {} dropped",
                kept.size() - created, created, existing.size() - (kept.size() - created));
        return kept;
    }

    /**
     * Label, name, path and the first source lines of the node.
     */
    String textOf(GraphNode node, Map<String, String> fileContents) {
        StringBuilder text = new StringBuilder()
                .append(node.label().displayName()).append(' ')
                .append(node.name()).append('\n')
                .append(node.filePath()).append('\n');
        String content = fileContents.get(node.filePath());
        if (content != null && node.startLine() > 0) {
            String[] lines = content.split("\n", -1);
            int from = node.startLine() - 1;
            int to = Math.min(lines.length, Math.min(node.endLine(), node.startLine() + properties.getEmbedding().getMaxLines() - 1));
            for (int i = from; i < to; i++) {
                text.append(lines[i]).append('\n');
            }
        }
        return text.toString();
    }
}
