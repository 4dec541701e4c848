package com.hybridrag.vector;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

import com.hybridrag.corpus.ChunkEmbedding;
import com.hybridrag.corpus.EmbeddingKind;
import com.hybridrag.corpus.ScoredChunk;
import com.hybridrag.corpus.StagedChange;

public interface VectorIndex {
    StagedChange stage(ChunkEmbedding embedding);

    void remove(Collection<UUID> chunkIds);

    /** Only chunks accepted by {@code chunkFilter} are scored; {@code null} accepts every chunk. */
    List<ScoredChunk> searchVector(float[] queryVector, EmbeddingKind kind, String model, double threshold, int limit, long snapshot,
            Predicate<UUID> chunkFilter);

    default List<ScoredChunk> searchVector(float[] queryVector, EmbeddingKind kind, String model, double threshold, int limit,
            long snapshot) {
        return searchVector(queryVector, kind, model, threshold, limit, snapshot, null);
    }

    Set<String> models();

    Optional<Integer> dimension(String model);

    static void validateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < -1.0 || threshold > 1.0) {
            throw new InvalidThresholdException(threshold);
        }
    }
}
