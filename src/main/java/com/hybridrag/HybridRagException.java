package com.hybridrag;

public class HybridRagException extends RuntimeException {
    public HybridRagException(String message) {
        super(message);
    }

    public HybridRagException(String message, Throwable cause) {
        super(message, cause);
    }
}
