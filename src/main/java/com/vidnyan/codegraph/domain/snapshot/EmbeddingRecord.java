package com.vidnyan.codegraph.domain.snapshot;

import java.util.Arrays;
import java.util.Objects;

/**
 * Embedding vector of one code symbol.
 */
public record EmbeddingRecord(String nodeId, float[] vector) {

    public EmbeddingRecord {
        Objects.requireNonNull(nodeId, "nodeId");
        vector = vector != null ? vector.clone() : new float[0];
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dimensions() {
        return vector.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingRecord other)) return false;
        return nodeId.equals(other.nodeId) && Arrays.equals(vector, other.vector);
    }

    @Override
    public int hashCode() {
        return 31 * nodeId.hashCode() + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "EmbeddingRecord[nodeId=" + nodeId + ", dimensions=" + vector.length + "]";
    }
}
