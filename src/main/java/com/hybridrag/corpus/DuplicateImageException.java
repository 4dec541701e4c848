package com.hybridrag.corpus;

import java.util.UUID;

import com.hybridrag.HybridRagException;

public class DuplicateImageException extends HybridRagException {
    private final UUID existingImageId;

    public DuplicateImageException(String remoteUrl, UUID existingImageId) {
        super("Image already exists for url " + remoteUrl);
        this.existingImageId = existingImageId;
    }

    public UUID existingImageId() {
        return existingImageId;
    }
}
