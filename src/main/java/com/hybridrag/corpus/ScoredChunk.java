package com.hybridrag.corpus;

import java.util.Comparator;
import java.util.UUID;

public record ScoredChunk(UUID chunkId, double score) {

    /** Score descending, then chunk id ascending. */
    public static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparing(scored -> scored.chunkId().toString());
}
