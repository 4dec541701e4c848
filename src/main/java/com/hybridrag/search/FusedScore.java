package com.hybridrag.search;

import java.util.UUID;

public record FusedScore(UUID chunkId, double textScore, double vectorScore, double combinedScore) {
}
