package com.hybridrag.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.hybridrag.corpus.Chunk;
import com.hybridrag.corpus.ChunkDraft;
import com.hybridrag.corpus.EmbeddingKind;
import com.hybridrag.corpus.Resource;
import com.hybridrag.corpus.ResourceDraft;
import com.hybridrag.corpus.StoreConnectionException;
import com.hybridrag.ingest.HashingEmbeddingService;
import com.hybridrag.lexical.LexicalField;
import com.hybridrag.search.HybridSearchHit;
import com.hybridrag.search.HybridSearchRequest;

class HybridRagEngineTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRestoreSearchAfterSnapshotReload() throws Exception {
        AppConfig config = new AppConfig();
        config.getStore().setSnapshotPath(tempDir.resolve("corpus.json").toString());
        HashingEmbeddingService embedder = new HashingEmbeddingService(256);
        Chunk chunk;

        try (HybridRagEngine engine = HybridRagEngine.open(config)) {
            Resource resource = engine.ingestion().ingestResource(ResourceDraft.of("u1", "Doc", "web"));
            chunk = engine.ingestion().ingestChunk(ChunkDraft.of(resource.id(), 0, "durable hybrid retrieval", null), embedder);
            engine.save();
        }
        assertTrue(Files.exists(tempDir.resolve("corpus.json")));

        try (HybridRagEngine engine = HybridRagEngine.open(config)) {
            assertEquals(1, engine.retrieval().getStatistics().chunkCount());
            assertEquals(chunk.id(), engine.retrieval().searchText("durable", LexicalField.TEXT, 5).get(0).chunkId());
            List<HybridSearchHit> hits = engine.retrieval().hybridSearch(HybridSearchRequest.of(
                    "retrieval", embedder.embed("durable hybrid retrieval"), EmbeddingKind.CHUNK, embedder.model(), 0.5, 0.5, 5));
            assertEquals(chunk.id(), hits.get(0).chunkId());
            assertEquals(1.0, hits.get(0).vectorScore(), 1e-6);
            assertEquals(Optional.of(256), engine.vectorIndex().dimension(embedder.model()));
        }
    }

    @Test
    void shouldRunInMemoryWithoutSnapshotPath() throws Exception {
        AppConfig config = new AppConfig();
        config.getStore().setSnapshotPath("");

        HybridRagEngine engine = HybridRagEngine.open(config);
        engine.ingestion().ingestResource(ResourceDraft.of("u1", "Doc", null));
        engine.save();
        engine.close();

        assertFalse(Files.exists(tempDir.resolve("corpus.json")));
        assertTrue(engine.corpusStore().isClosed());
        assertThrows(StoreConnectionException.class, () -> engine.retrieval().getStatistics());
    }
}
