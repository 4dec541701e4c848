package com.hybridrag.search;

import java.time.Duration;

import com.hybridrag.HybridRagException;

public class SearchTimeoutException extends HybridRagException {
    public SearchTimeoutException(Duration timeout) {
        super("Search exceeded deadline of %d ms".formatted(timeout.toMillis()));
    }

    public SearchTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
