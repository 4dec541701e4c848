package com.hybridrag.corpus;

import java.util.UUID;

import com.hybridrag.HybridRagException;

public class OrderConflictException extends HybridRagException {
    private final UUID resourceId;
    private final int order;

    public OrderConflictException(UUID resourceId, int order) {
        super("Chunk order %d is already used by resource %s".formatted(order, resourceId));
        this.resourceId = resourceId;
        this.order = order;
    }

    public UUID resourceId() {
        return resourceId;
    }

    public int order() {
        return order;
    }
}
