package com.hybridrag.vector;

import com.hybridrag.HybridRagException;

public class InvalidThresholdException extends HybridRagException {
    public InvalidThresholdException(double threshold) {
        super("Similarity threshold must be within [-1, 1] but was " + threshold);
    }
}
