package com.hybridrag.corpus;

import java.time.Instant;
import java.util.UUID;

public record ImageDraft(
        UUID resourceId,
        String localPath,
        String remoteUrl,
        String description,
        Integer width,
        Integer height,
        String mimeType,
        String sha256) {

    public ImageDraft {
        if (width != null && width < 0) {
            throw new IllegalArgumentException("width must be >= 0");
        }
        if (height != null && height < 0) {
            throw new IllegalArgumentException("height must be >= 0");
        }
    }

    public static ImageDraft of(UUID resourceId, String remoteUrl) {
        return new ImageDraft(resourceId, null, remoteUrl, null, null, null, null, null);
    }

    Image toImage(UUID id, Instant now) {
        return new Image(id, resourceId, localPath, remoteUrl, description, width, height, mimeType, sha256, now, now);
    }
}
