package com.vidnyan.codegraph.search;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * BM25 index over raw file text, one document per file.
 * Rebuilt wholesale after every ingestion or update.
 */
@Slf4j
public class Bm25Index {

    public static final double DEFAULT_K1 = 1.2;
    public static final double DEFAULT_B = 0.75;

    /**
     * @param rank 1-based
     */
    public record Hit(String filePath, double score, int rank) {}

    private record Document(String filePath, Map<String, Integer> termFrequencies, int length) {}

    private final double k1;
    private final double b;

    private volatile List<Document> documents = List.of();
    private volatile Map<String, Integer> documentFrequencies = Map.of();
    private volatile double averageLength;

    public Bm25Index() {
        this(DEFAULT_K1, DEFAULT_B);
    }

    public Bm25Index(double k1, double b) {
        this.k1 = k1;
        this.b = b;
    }

    public void build(Map<String, String> fileContents) {
        List<Document> docs = new ArrayList<>();
        Map<String, Integer> df = new HashMap<>();
        long totalLength = 0;
        // sorted so equal scores rank deterministically
        for (Map.Entry<String, String> file : new TreeMap<>(fileContents).entrySet()) {
            List<String> terms = new ArrayList<>(Tokenizer.tokenize(file.getValue()));
            terms.addAll(Tokenizer.tokenize(file.getKey()));
            Map<String, Integer> tf = new HashMap<>();
            terms.forEach(t -> tf.merge(t, 1, Integer::sum));
            tf.keySet().forEach(t -> df.merge(t, 1, Integer::sum));
            docs.add(new Document(file.getKey(), tf, terms.size()));
            totalLength += terms.size();
        }
        this.averageLength = docs.isEmpty() ? 0.0 : (double) totalLength / docs.size();
        this.documentFrequencies = df;
        this.documents = docs;
        log.debug("BM25 index built: {} documents, {} terms", docs.size(), df.size());
    }

    public List<Hit> search(String query, int limit) {
        List<Document> docs = documents;
        if (docs.isEmpty() || limit <= 0) {
            return List.of();
        }
        LinkedHashSet<String> queryTerms = new LinkedHashSet<>(Tokenizer.tokenize(query));
        int n = docs.size();

        List<double[]> scored = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Document doc = docs.get(i);
            double score = 0.0;
            for (String term : queryTerms) {
                Integer tf = doc.termFrequencies().get(term);
                if (tf == null) {
                    continue;
                }
                int df = documentFrequencies.getOrDefault(term, 0);
                double idf = Math.log(1 + (n - df + 0.5) / (df + 0.5));
                double norm = tf + k1 * (1 - b + b * doc.length() / Math.max(averageLength, 1e-9));
                score += idf * tf * (k1 + 1) / norm;
            }
            if (score > 0) {
                scored.add(new double[]{i, score});
            }
        }
        scored.sort((x, y) -> y[1] != x[1] ? Double.compare(y[1], x[1]) : Double.compare(x[0], y[0]));

        List<Hit> hits = new ArrayList<>();
        for (int i = 0; i < Math.min(limit, scored.size()); i++) {
            double[] entry = scored.get(i);
            hits.add(new Hit(docs.get((int) entry[0]).filePath(), entry[1], i + 1));
        }
        return hits;
    }

    public boolean isReady() {
        return !documents.isEmpty();
    }

    public int documentCount() {
        return documents.size();
    }

    public int termCount() {
        return documentFrequencies.size();
    }
}
