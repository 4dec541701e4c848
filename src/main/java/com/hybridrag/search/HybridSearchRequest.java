package com.hybridrag.search;

import java.time.Duration;

import com.hybridrag.corpus.EmbeddingKind;

public record HybridSearchRequest(
        String textQuery,
        float[] queryVector,
        EmbeddingKind kind,
        String model,
        double textWeight,
        double vectorWeight,
        int limit,
        double threshold,
        Duration timeout,
        String category) {

    public static final double NO_THRESHOLD = -1.0;

    public HybridSearchRequest {
        kind = kind == null ? EmbeddingKind.CHUNK : kind;
        requireWeight("textWeight", textWeight);
        requireWeight("vectorWeight", vectorWeight);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static HybridSearchRequest of(
            String textQuery,
            float[] queryVector,
            EmbeddingKind kind,
            String model,
            double textWeight,
            double vectorWeight,
            int limit) {
        return new HybridSearchRequest(textQuery, queryVector, kind, model, textWeight, vectorWeight, limit, NO_THRESHOLD, null, null);
    }

    public HybridSearchRequest withThreshold(double value) {
        return new HybridSearchRequest(textQuery, queryVector, kind, model, textWeight, vectorWeight, limit, value, timeout, category);
    }

    public HybridSearchRequest withTimeout(Duration value) {
        return new HybridSearchRequest(textQuery, queryVector, kind, model, textWeight, vectorWeight, limit, threshold, value, category);
    }

    public HybridSearchRequest withCategory(String value) {
        return new HybridSearchRequest(textQuery, queryVector, kind, model, textWeight, vectorWeight, limit, threshold, timeout, value);
    }

    boolean hasTextQuery() {
        return textQuery != null && !textQuery.isBlank();
    }

    boolean hasQueryVector() {
        return queryVector != null && queryVector.length > 0 && model != null && !model.isBlank();
    }

    private static void requireWeight(String name, double weight) {
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException(name + " must be a finite value >= 0");
        }
    }
}
