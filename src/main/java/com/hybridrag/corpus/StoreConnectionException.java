package com.hybridrag.corpus;

import com.hybridrag.HybridRagException;

public class StoreConnectionException extends HybridRagException {
    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
