package com.hybridrag.corpus;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record Resource(
        UUID id,
        String sourceUrl,
        String title,
        List<String> authors,
        String category,
        String fileType,
        String localPath,
        Instant contentTime,
        String lang,
        String contentSha256,
        boolean needsParsing,
        boolean crawlCompleted,
        Instant createdAt,
        Instant updatedAt) {

    public Resource {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceUrl, "sourceUrl");
        authors = authors == null ? List.of() : List.copyOf(authors);
    }
}
