package com.vidnyan.codegraph.adapter.out.embedding;

import com.vidnyan.codegraph.application.port.out.EmbeddingProvider;
import com.vidnyan.codegraph.search.Tokenizer;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Local embedding by signed feature hashing of terms and term bigrams,
 * L2-normalized. No model download, deterministic across runs.
 */
public class FeatureHashingEmbeddingProvider implements EmbeddingProvider {

    private final boolean enabled;
    private final int dimensions;

    public FeatureHashingEmbeddingProvider(boolean enabled, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive: " + dimensions);
        }
        this.enabled = enabled;
        this.dimensions = dimensions;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        String previous = null;
        for (String term : Tokenizer.tokenize(text)) {
            add(vector, term, 1.0f);
            if (previous != null) {
                add(vector, previous + " " + term, 0.5f);
            }
            previous = term;
        }
        normalize(vector);
        return vector;
    }

    private void add(float[] vector, String feature, float weight) {
        CRC32 crc = new CRC32();
        crc.update(feature.getBytes(StandardCharsets.UTF_8));
        long hash = crc.getValue();
        int index = (int) (hash % dimensions);
        float sign = ((hash >>> 31) & 1L) == 0 ? 1.0f : -1.0f;
        vector[index] += sign * weight;
    }

    private static void normalize(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += v * v;
        }
        if (sum == 0.0) {
            return;
        }
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
