package com.hybridrag.corpus;

import java.util.Map;

public record CorpusStatistics(
        long resourceCount,
        long chunkCount,
        long imageCount,
        long parsedArtifactCount,
        long embeddingCount,
        Map<String, Long> countsByCategory) {

    public CorpusStatistics {
        countsByCategory = countsByCategory == null ? Map.of() : Map.copyOf(countsByCategory);
    }
}
