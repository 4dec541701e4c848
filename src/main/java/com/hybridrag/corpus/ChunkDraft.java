package com.hybridrag.corpus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record ChunkDraft(
        UUID resourceId,
        UUID parsedArtifactId,
        UUID imageId,
        Integer page,
        int order,
        Integer tokenSize,
        String text,
        String description) {

    public ChunkDraft {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(text, "text");
        if (order < 0) {
            throw new IllegalArgumentException("order must be >= 0");
        }
        if (page != null && page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (tokenSize != null && tokenSize < 0) {
            throw new IllegalArgumentException("tokenSize must be >= 0");
        }
    }

    public static ChunkDraft of(UUID resourceId, int order, String text, String description) {
        return new ChunkDraft(resourceId, null, null, null, order, null, text, description);
    }

    public ChunkDraft withTokenSize(Integer value) {
        return new ChunkDraft(resourceId, parsedArtifactId, imageId, page, order, value, text, description);
    }

    public ChunkDraft withPage(Integer value) {
        return new ChunkDraft(resourceId, parsedArtifactId, imageId, value, order, tokenSize, text, description);
    }

    public ChunkDraft withParsedArtifact(UUID value) {
        return new ChunkDraft(resourceId, value, imageId, page, order, tokenSize, text, description);
    }

    public ChunkDraft withImage(UUID value) {
        return new ChunkDraft(resourceId, parsedArtifactId, value, page, order, tokenSize, text, description);
    }

    Chunk toChunk(UUID id, Instant now) {
        return new Chunk(id, resourceId, parsedArtifactId, imageId, page, order, tokenSize, text, description, now, now);
    }
}
