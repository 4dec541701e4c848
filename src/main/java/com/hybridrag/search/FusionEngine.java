package com.hybridrag.search;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.hybridrag.corpus.ScoredChunk;

public class FusionEngine {

    /** Combined score descending, then chunk id ascending. */
    public static final Comparator<FusedScore> RANKING = Comparator
            .comparingDouble(FusedScore::combinedScore).reversed()
            .thenComparing(fused -> fused.chunkId().toString());

    public List<FusedScore> fuse(List<ScoredChunk> lexical, List<ScoredChunk> vector, double textWeight, double vectorWeight, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        List<FusedScore> ranked = fuse(lexical, vector, textWeight, vectorWeight);
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : ranked;
    }

    public List<FusedScore> fuse(List<ScoredChunk> lexical, List<ScoredChunk> vector, double textWeight, double vectorWeight) {
        Map<UUID, Double> textScores = new HashMap<>();
        for (ScoredChunk hit : lexical) {
            textScores.merge(hit.chunkId(), hit.score(), Math::max);
        }
        Map<UUID, Double> vectorScores = new HashMap<>();
        for (ScoredChunk hit : vector) {
            vectorScores.merge(hit.chunkId(), hit.score(), Math::max);
        }

        Map<UUID, FusedScore> joined = new HashMap<>();
        for (UUID chunkId : textScores.keySet()) {
            joined.put(chunkId, combine(chunkId, textScores, vectorScores, textWeight, vectorWeight));
        }
        for (UUID chunkId : vectorScores.keySet()) {
            joined.computeIfAbsent(chunkId, id -> combine(id, textScores, vectorScores, textWeight, vectorWeight));
        }
        return joined.values().stream()
                .sorted(RANKING)
                .toList();
    }

    private static FusedScore combine(UUID chunkId, Map<UUID, Double> textScores, Map<UUID, Double> vectorScores,
            double textWeight, double vectorWeight) {
        double text = textScores.getOrDefault(chunkId, 0.0);
        double vector = vectorScores.getOrDefault(chunkId, 0.0);
        return new FusedScore(chunkId, text, vector, textWeight * text + vectorWeight * vector);
    }
}
