package com.vidnyan.codegraph.search;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.snapshot.EmbeddingRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brute-force cosine similarity over symbol embeddings.
 */
public class SemanticIndex {

    public record Hit(String nodeId, String name, String label, String filePath,
                      int startLine, int endLine, double similarity, int rank) {}

    private record Entry(GraphNode node, float[] vector, double norm) {}

    private record Scored(Entry entry, double similarity) {}

    private volatile List<Entry> entries = List.of();

    /**
     * Embeddings whose node is not in the graph are ignored.
     */
    public void load(List<EmbeddingRecord> embeddings, KnowledgeGraph graph) {
        List<Entry> loaded = new ArrayList<>();
        for (EmbeddingRecord record : embeddings) {
            graph.getNode(record.nodeId()).ifPresent(node -> {
                float[] vector = record.vector();
                loaded.add(new Entry(node, vector, norm(vector)));
            });
        }
        entries = loaded;
    }

    public void clear() {
        entries = List.of();
    }

    public boolean isReady() {
        return !entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<Hit> search(float[] query, int limit, double minSimilarity) {
        List<Entry> current = entries;
        double queryNorm = norm(query);
        if (current.isEmpty() || queryNorm == 0.0 || limit <= 0) {
            return List.of();
        }

        List<Scored> scored = new ArrayList<>();
        for (Entry entry : current) {
            if (entry.vector().length != query.length || entry.norm() == 0.0) {
                continue;
            }
            double dot = 0.0;
            for (int i = 0; i < query.length; i++) {
                dot += entry.vector()[i] * query[i];
            }
            double similarity = dot / (entry.norm() * queryNorm);
            if (similarity >= minSimilarity) {
                scored.add(new Scored(entry, similarity));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::similarity).reversed()
                .thenComparing(s -> s.entry().node().id()));

        List<Hit> hits = new ArrayList<>();
        for (int i = 0; i < Math.min(limit, scored.size()); i++) {
            GraphNode node = scored.get(i).entry().node();
            hits.add(new Hit(node.id(), node.name(), node.label().displayName(), node.filePath(),
                    node.startLine(), node.endLine(), scored.get(i).similarity(), i + 1));
        }
        return hits;
    }

    private static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }
}
