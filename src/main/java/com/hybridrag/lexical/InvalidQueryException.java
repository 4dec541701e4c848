package com.hybridrag.lexical;

import com.hybridrag.HybridRagException;

public class InvalidQueryException extends HybridRagException {
    private final String query;

    public InvalidQueryException(String query, Throwable cause) {
        super("Invalid text query '%s': %s".formatted(query, cause.getMessage()), cause);
        this.query = query;
    }

    public InvalidQueryException(String query, String reason) {
        super("Invalid text query '%s': %s".formatted(query, reason));
        this.query = query;
    }

    public String query() {
        return query;
    }
}
