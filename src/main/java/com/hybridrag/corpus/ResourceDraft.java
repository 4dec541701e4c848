package com.hybridrag.corpus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ResourceDraft(
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
        boolean crawlCompleted) {

    public ResourceDraft {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("sourceUrl must not be blank");
        }
        sourceUrl = sourceUrl.strip();
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static ResourceDraft of(String sourceUrl, String title, String category) {
        return new ResourceDraft(sourceUrl, title, List.of(), category, null, null, null, null, null, false, false);
    }

    public ResourceDraft withAuthors(List<String> newAuthors) {
        return new ResourceDraft(sourceUrl, title, newAuthors, category, fileType, localPath, contentTime, lang,
                contentSha256, needsParsing, crawlCompleted);
    }

    public ResourceDraft withFileType(String newFileType) {
        return new ResourceDraft(sourceUrl, title, authors, category, newFileType, localPath, contentTime, lang,
                contentSha256, needsParsing, crawlCompleted);
    }

    public ResourceDraft withContentSha256(String newContentSha256) {
        return new ResourceDraft(sourceUrl, title, authors, category, fileType, localPath, contentTime, lang,
                newContentSha256, needsParsing, crawlCompleted);
    }

    public ResourceDraft withNeedsParsing(boolean value) {
        return new ResourceDraft(sourceUrl, title, authors, category, fileType, localPath, contentTime, lang,
                contentSha256, value, crawlCompleted);
    }

    Resource toResource(UUID id, Instant now) {
        return new Resource(id, sourceUrl, title, authors, category, fileType, localPath, contentTime, lang,
                contentSha256, needsParsing, crawlCompleted, now, now);
    }
}
