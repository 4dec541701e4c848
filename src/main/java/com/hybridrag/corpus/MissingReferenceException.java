package com.hybridrag.corpus;

import java.util.UUID;

import com.hybridrag.HybridRagException;

public class MissingReferenceException extends HybridRagException {
    public MissingReferenceException(String entity, UUID id) {
        super("Unknown %s %s".formatted(entity, id));
    }

    public MissingReferenceException(String message) {
        super(message);
    }
}
