package com.hybridrag.search;

import java.util.UUID;

public record HybridSearchHit(
        UUID chunkId,
        UUID resourceId,
        String text,
        String description,
        double textScore,
        double vectorScore,
        double combinedScore) {
}
