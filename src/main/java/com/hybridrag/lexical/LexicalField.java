package com.hybridrag.lexical;

public enum LexicalField {
    TEXT("text"),
    DESCRIPTION("description");

    private final String fieldName;

    LexicalField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
