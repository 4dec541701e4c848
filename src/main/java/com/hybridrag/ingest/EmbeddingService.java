package com.hybridrag.ingest;

public interface EmbeddingService {
    float[] embed(String text);

    int dimension();

    /** Model name stored on every embedding this service produces. */
    String model();
}
