package com.vidnyan.codegraph.search;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class Bm25IndexTest {

    private static Bm25Index index() {
        Bm25Index index = new Bm25Index();
        index.build(Map.of(
                "src/auth/login.ts", "export function validateToken(token) { return checkSignature(token); }",
                "src/billing/invoice.ts", "export function createInvoice(customer) { return total(customer); }",
                "src/util/strings.ts", "export function trim(value) { return value.trim(); }"));
        return index;
    }

    @Test
    void search_ShouldRankMatchingFileFirst() {
        List<Bm25Index.Hit> hits = index().search("validate token", 10);

        assertFalse(hits.isEmpty());
        assertEquals("src/auth/login.ts", hits.get(0).filePath());
        assertEquals(1, hits.get(0).rank());
    }

    @Test
    void search_ShouldMatchCamelCaseParts() {
        List<Bm25Index.Hit> hits = index().search("invoice", 10);

        assertEquals(1, hits.size());
        assertEquals("src/billing/invoice.ts", hits.get(0).filePath());
    }

    @Test
    void search_ShouldReturnConsecutiveRanksInScoreOrder() {
        List<Bm25Index.Hit> hits = index().search("function return customer token", 10);

        for (int i = 0; i < hits.size(); i++) {
            assertEquals(i + 1, hits.get(i).rank());
            if (i > 0) {
                assertTrue(hits.get(i - 1).score() >= hits.get(i).score());
            }
        }
    }

    @Test
    void search_ShouldReturnNothingForUnknownTermsOrEmptyIndex() {
        assertTrue(index().search("kubernetes", 10).isEmpty());
        assertTrue(new Bm25Index().search("token", 10).isEmpty());
        assertFalse(new Bm25Index().isReady());
    }

    @Test
    void search_ShouldHonourLimit() {
        List<Bm25Index.Hit> hits = index().search("export function return", 2);

        assertEquals(2, hits.size());
    }
}
