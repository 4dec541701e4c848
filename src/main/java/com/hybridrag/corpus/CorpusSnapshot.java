package com.hybridrag.corpus;

import java.util.List;

record CorpusSnapshot(
        int version,
        List<Resource> resources,
        List<ParsedArtifact> parsedArtifacts,
        List<Image> images,
        List<Chunk> chunks,
        List<ChunkEmbedding> embeddings) {

    CorpusSnapshot {
        resources = resources == null ? List.of() : resources;
        parsedArtifacts = parsedArtifacts == null ? List.of() : parsedArtifacts;
        images = images == null ? List.of() : images;
        chunks = chunks == null ? List.of() : chunks;
        embeddings = embeddings == null ? List.of() : embeddings;
    }
}
