package com.hybridrag.corpus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record Image(
        UUID id,
        UUID resourceId,
        String localPath,
        String remoteUrl,
        String description,
        Integer width,
        Integer height,
        String mimeType,
        String sha256,
        Instant createdAt,
        Instant updatedAt) {

    public Image {
        Objects.requireNonNull(id, "id");
    }

    Image detachedFromResource(Instant now) {
        return new Image(id, null, localPath, remoteUrl, description, width, height, mimeType, sha256, createdAt, now);
    }
}
