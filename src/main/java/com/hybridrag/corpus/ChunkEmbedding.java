package com.hybridrag.corpus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record ChunkEmbedding(
        UUID chunkId,
        EmbeddingKind kind,
        String model,
        int dimension,
        float[] vector,
        Instant createdAt) {

    public ChunkEmbedding {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(vector, "vector");
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        if (vector.length != dimension) {
            throw new DimensionMismatchException(model, dimension, vector.length);
        }
        vector = vector.clone();
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    ChunkEmbedding stampedAt(Instant now) {
        return createdAt != null ? this : new ChunkEmbedding(chunkId, kind, model, dimension, vector, now);
    }

    EmbeddingSlot slot() {
        return new EmbeddingSlot(kind, model);
    }

    record EmbeddingSlot(EmbeddingKind kind, String model) {
    }
}
