package com.hybridrag.corpus;

import java.util.Objects;
import java.util.UUID;

public record EmbeddingDraft(EmbeddingKind kind, String model, int dimension, float[] vector) {

    public EmbeddingDraft {
        Objects.requireNonNull(kind, "kind");
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        Objects.requireNonNull(vector, "vector");
        if (vector.length != dimension) {
            throw new DimensionMismatchException(model, dimension, vector.length);
        }
        vector = vector.clone();
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public static EmbeddingDraft of(EmbeddingKind kind, String model, float[] vector) {
        return new EmbeddingDraft(kind, model, vector.length, vector);
    }

    public ChunkEmbedding forChunk(UUID chunkId) {
        return new ChunkEmbedding(chunkId, kind, model, dimension, vector, null);
    }
}
