package com.hybridrag.corpus;

public enum EmbeddingKind {
    CHUNK,
    DESCRIPTION
}
