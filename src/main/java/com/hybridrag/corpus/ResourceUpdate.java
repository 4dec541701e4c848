package com.hybridrag.corpus;

import java.time.Instant;
import java.util.List;

public record ResourceUpdate(
        String title,
        List<String> authors,
        String category,
        String fileType,
        String localPath,
        String lang,
        String contentSha256,
        Boolean needsParsing,
        Boolean crawlCompleted) {

    public static ResourceUpdate title(String title) {
        return new ResourceUpdate(title, null, null, null, null, null, null, null, null);
    }

    public static ResourceUpdate parsed() {
        return new ResourceUpdate(null, null, null, null, null, null, null, false, null);
    }

    public static ResourceUpdate markCrawlCompleted() {
        return new ResourceUpdate(null, null, null, null, null, null, null, null, true);
    }

    Resource applyTo(Resource current, Instant now) {
        return new Resource(
                current.id(),
                current.sourceUrl(),
                title != null ? title : current.title(),
                authors != null ? authors : current.authors(),
                category != null ? category : current.category(),
                fileType != null ? fileType : current.fileType(),
                localPath != null ? localPath : current.localPath(),
                current.contentTime(),
                lang != null ? lang : current.lang(),
                contentSha256 != null ? contentSha256 : current.contentSha256(),
                needsParsing != null ? needsParsing : current.needsParsing(),
                crawlCompleted != null ? crawlCompleted : current.crawlCompleted(),
                current.createdAt(),
                now);
    }
}
