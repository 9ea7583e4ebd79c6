package com.vidnyan.codegraph.search;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class RrfMergerTest {

    private static List<Bm25Index.Hit> lexical(String... files) {
        return IntStream.range(0, files.length)
                .mapToObj(i -> new Bm25Index.Hit(files[i], 10.0 - i, i + 1))
                .toList();
    }

    private static List<SemanticIndex.Hit> semantic(String... files) {
        return IntStream.range(0, files.length)
                .mapToObj(i -> new SemanticIndex.Hit("Function:" + files[i] + ":f" + i, "f" + i, "Function",
                        files[i], 1, 2, 0.9 - i * 0.1, i + 1))
                .toList();
    }

    @Test
    void merge_ShouldRankFilesFoundByBothListsFirst() {
        // Act
        List<HybridSearchResult> results = RrfMerger.merge(lexical("A", "B", "C"), semantic("B", "A", "D"),
                RrfMerger.DEFAULT_K, 10);

        // Assert
        assertEquals(4, results.size());
        double top = 1.0 / 61 + 1.0 / 62;
        assertEquals(top, results.get(0).score(), 1e-12);
        assertEquals(top, results.get(1).score(), 1e-12);
        assertEquals(List.of("A", "B"), List.of(results.get(0).filePath(), results.get(1).filePath()));
        assertEquals(1.0 / 63, results.get(2).score(), 1e-12);
        assertEquals(1.0 / 63, results.get(3).score(), 1e-12);
        assertEquals(List.of("C", "D"), List.of(results.get(2).filePath(), results.get(3).filePath()));
        assertEquals(List.of(RrfMerger.BM25, RrfMerger.SEMANTIC), results.get(0).sources());
        assertEquals(List.of(RrfMerger.SEMANTIC), results.get(3).sources());
    }

    @Test
    void merge_ShouldAssignConsecutiveRanksAndRespectLimit() {
        List<HybridSearchResult> results = RrfMerger.merge(lexical("A", "B", "C"), semantic("B", "A", "D"),
                RrfMerger.DEFAULT_K, 2);

        assertEquals(2, results.size());
        assertEquals(1, results.get(0).rank());
        assertEquals(2, results.get(1).rank());
    }

    @Test
    void merge_ShouldCarryNodeFieldsOnlyForSemanticMatches() {
        List<HybridSearchResult> results = RrfMerger.merge(lexical("A"), semantic("D"), RrfMerger.DEFAULT_K, 10);

        HybridSearchResult lexicalOnly = results.stream().filter(r -> r.filePath().equals("A")).findFirst().orElseThrow();
        HybridSearchResult semanticOnly = results.stream().filter(r -> r.filePath().equals("D")).findFirst().orElseThrow();
        assertNull(lexicalOnly.nodeId());
        assertEquals("Function:D:f0", semanticOnly.nodeId());
        assertEquals(1, semanticOnly.startLine());
    }

    @Test
    void merge_ShouldCountBestRankOnceWhenFileRepeats() {
        List<SemanticIndex.Hit> repeated = semantic("A", "A");

        List<HybridSearchResult> results = RrfMerger.merge(List.of(), repeated, RrfMerger.DEFAULT_K, 10);

        assertEquals(1, results.size());
        assertEquals(1.0 / 61, results.get(0).score(), 1e-12);
    }

    @Test
    void merge_ShouldReturnEmptyForEmptyInputs() {
        assertTrue(RrfMerger.merge(List.of(), List.of(), RrfMerger.DEFAULT_K, 10).isEmpty());
    }
}
