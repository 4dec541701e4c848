package com.hybridrag.corpus;

import com.hybridrag.HybridRagException;

public class DimensionMismatchException extends HybridRagException {
    private final String model;
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String model, int expected, int actual) {
        super("Embedding for model %s must have %d dimensions but has %d".formatted(model, expected, actual));
        this.model = model;
        this.expected = expected;
        this.actual = actual;
    }

    public String model() {
        return model;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
