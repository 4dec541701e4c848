package com.hybridrag.corpus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record Chunk(
        UUID id,
        UUID resourceId,
        UUID parsedArtifactId,
        UUID imageId,
        Integer page,
        int order,
        Integer tokenSize,
        String text,
        String description,
        Instant createdAt,
        Instant updatedAt) {

    public Chunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(text, "text");
    }
}
