package com.vidnyan.codegraph.search;

import com.vidnyan.codegraph.CodeGraphProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Lexical plus semantic search fused with RRF. Falls back to lexical only when
 * no embeddings are loaded or semantic ranking fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridSearchService {

    private static final double MIN_SIMILARITY = 0.0;

    private final EmbeddingService embeddingService;
    private final CodeGraphProperties properties;

    public List<HybridSearchResult> search(Bm25Index lexicalIndex, SemanticIndex semanticIndex, String query, int k) {
        CodeGraphProperties.Search settings = properties.getSearch();
        int candidates = k * settings.getCandidateMultiplier();

        List<Bm25Index.Hit> lexical = lexicalIndex.search(query, candidates);
        List<SemanticIndex.Hit> semantic = List.of();
        if (semanticIndex.isReady() && embeddingService.isEnabled()) {
            try {
                semantic = semanticIndex.search(embeddingService.embedQuery(query), candidates, MIN_SIMILARITY);
            } catch (RuntimeException e) {
                log.warn("Semantic search failed, using lexical results only: {}", e.getMessage());
            }
        }

        List<HybridSearchResult> results = RrfMerger.merge(lexical, semantic, settings.getRrfK(), k);
        log.debug("Search '{}': {} lexical, {} semantic, {} fused", query, lexical.size(), semantic.size(),
                results.size());
        return results;
    }
}
