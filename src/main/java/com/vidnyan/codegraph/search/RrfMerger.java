package com.vidnyan.codegraph.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion of a lexical and a semantic ranking, keyed by file.
 * Each list contributes {@code 1 / (k + rank)} per file, using the best rank
 * a file has in that list.
 */
public final class RrfMerger {

    public static final int DEFAULT_K = 60;
    public static final String BM25 = "bm25";
    public static final String SEMANTIC = "semantic";

    private RrfMerger() {
    }

    private static final class Fused {
        final String filePath;
        final int firstSeen;
        double score;
        final List<String> sources = new ArrayList<>();
        SemanticIndex.Hit node;

        Fused(String filePath, int firstSeen) {
            this.filePath = filePath;
            this.firstSeen = firstSeen;
        }
    }

    public static List<HybridSearchResult> merge(List<Bm25Index.Hit> lexical, List<SemanticIndex.Hit> semantic,
                                                 int k, int limit) {
        Map<String, Fused> fused = new LinkedHashMap<>();

        for (Bm25Index.Hit hit : lexical) {
            Fused entry = fused.computeIfAbsent(hit.filePath(), p -> new Fused(p, fused.size()));
            if (!entry.sources.contains(BM25)) {
                entry.score += 1.0 / (k + hit.rank());
                entry.sources.add(BM25);
            }
        }
        for (SemanticIndex.Hit hit : semantic) {
            Fused entry = fused.computeIfAbsent(hit.filePath(), p -> new Fused(p, fused.size()));
            if (!entry.sources.contains(SEMANTIC)) {
                entry.score += 1.0 / (k + hit.rank());
                entry.sources.add(SEMANTIC);
                entry.node = hit;
            }
        }

        List<Fused> ranked = new ArrayList<>(fused.values());
        ranked.sort(Comparator.comparingDouble((Fused f) -> f.score).reversed()
                .thenComparingInt(f -> f.firstSeen));

        List<HybridSearchResult> results = new ArrayList<>();
        for (int i = 0; i < Math.min(limit, ranked.size()); i++) {
            Fused f = ranked.get(i);
            SemanticIndex.Hit node = f.node;
            results.add(new HybridSearchResult(f.filePath, f.score, i + 1, List.copyOf(f.sources),
                    node != null ? node.nodeId() : null,
                    node != null ? node.name() : null,
                    node != null ? node.label() : null,
                    node != null ? node.startLine() : null,
                    node != null ? node.endLine() : null));
        }
        return results;
    }
}
