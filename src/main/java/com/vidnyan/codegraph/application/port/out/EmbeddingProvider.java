package com.vidnyan.codegraph.application.port.out;

import java.util.List;

/**
 * Port for turning text into embedding vectors.
 * Implemented by local or remote embedding adapters.
 */
public interface EmbeddingProvider {

    /**
     * Disabled providers are never asked to embed; search stays lexical.
     */
    boolean isEnabled();

    int dimensions();

    float[] embed(String text);

    default List<float[]> embedAll(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }
}
