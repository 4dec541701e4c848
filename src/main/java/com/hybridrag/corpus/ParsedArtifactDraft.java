package com.hybridrag.corpus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record ParsedArtifactDraft(UUID resourceId, String parseSetting, String localParsedPath) {

    public ParsedArtifactDraft {
        Objects.requireNonNull(resourceId, "resourceId");
        if (parseSetting == null || parseSetting.isBlank()) {
            throw new IllegalArgumentException("parseSetting must not be blank");
        }
    }

    ParsedArtifact toArtifact(UUID id, Instant now) {
        return new ParsedArtifact(id, resourceId, parseSetting, localParsedPath, now, now);
    }
}
