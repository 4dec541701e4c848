package com.hybridrag.corpus;

import java.util.UUID;

import com.hybridrag.HybridRagException;

public class DuplicateParsedArtifactException extends HybridRagException {
    private final UUID existingArtifactId;

    public DuplicateParsedArtifactException(UUID resourceId, String parseSetting, UUID existingArtifactId) {
        super("Resource %s already has a parsed artifact for setting '%s'".formatted(resourceId, parseSetting));
        this.existingArtifactId = existingArtifactId;
    }

    public UUID existingArtifactId() {
        return existingArtifactId;
    }
}
