package com.hybridrag.ingest;

import java.util.Locale;

public class HashingEmbeddingService implements EmbeddingService {
    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
        }

        double norm = 0d;
        for (float v : vector) {
            norm += (double) v * v;
        }
        if (norm > 0d) {
            float scale = (float) (1d / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String model() {
        return "hashing-" + dimension;
    }
}
