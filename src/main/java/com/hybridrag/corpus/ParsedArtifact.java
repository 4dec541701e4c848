package com.hybridrag.corpus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record ParsedArtifact(
        UUID id,
        UUID resourceId,
        String parseSetting,
        String localParsedPath,
        Instant createdAt,
        Instant updatedAt) {

    public ParsedArtifact {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(parseSetting, "parseSetting");
    }
}
