package com.hybridrag.corpus;

import java.util.UUID;

import com.hybridrag.HybridRagException;

public class DuplicateResourceException extends HybridRagException {
    private final String sourceUrl;
    private final UUID existingResourceId;

    public DuplicateResourceException(String sourceUrl, UUID existingResourceId) {
        super("Resource already exists for url %s (id=%s)".formatted(sourceUrl, existingResourceId));
        this.sourceUrl = sourceUrl;
        this.existingResourceId = existingResourceId;
    }

    public String sourceUrl() {
        return sourceUrl;
    }

    public UUID existingResourceId() {
        return existingResourceId;
    }
}
