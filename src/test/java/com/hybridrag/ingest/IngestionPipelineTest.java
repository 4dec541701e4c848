package com.hybridrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.hybridrag.corpus.Chunk;
import com.hybridrag.corpus.ChunkDraft;
import com.hybridrag.corpus.ChunkEmbedding;
import com.hybridrag.corpus.CorpusSession;
import com.hybridrag.corpus.CorpusStore;
import com.hybridrag.corpus.DimensionMismatchException;
import com.hybridrag.corpus.EmbeddingDraft;
import com.hybridrag.corpus.EmbeddingKind;
import com.hybridrag.corpus.MissingReferenceException;
import com.hybridrag.corpus.OrderConflictException;
import com.hybridrag.corpus.PublicationClock;
import com.hybridrag.corpus.Resource;
import com.hybridrag.corpus.ResourceDraft;
import com.hybridrag.corpus.ResourceUpdate;
import com.hybridrag.corpus.ScoredChunk;
import com.hybridrag.lexical.LexicalField;
import com.hybridrag.lexical.LuceneLexicalIndex;
import com.hybridrag.runtime.AppConfig;
import com.hybridrag.vector.LocalVectorIndex;

class IngestionPipelineTest {
    private static final String MODEL = "m";

    private CorpusStore store;
    private LuceneLexicalIndex lexicalIndex;
    private LocalVectorIndex vectorIndex;
    private IngestionPipeline pipeline;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        store = new CorpusStore(new PublicationClock(), Clock.systemUTC());
        lexicalIndex = new LuceneLexicalIndex(new AppConfig.LexicalConfig(), store.publicationClock());
        vectorIndex = new LocalVectorIndex(new AppConfig.VectorConfig(), store.publicationClock());
        pipeline = new IngestionPipeline(store, lexicalIndex, vectorIndex);
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        lexicalIndex.close();
    }

    @Test
    void shouldReturnOriginalResourceWhenUrlIsIngestedAgain() {
        Resource first = pipeline.ingestResource(ResourceDraft.of("u1", "Original", "web"));

        Resource second = pipeline.ingestResource(ResourceDraft.of("u1", "Different title", "web"));

        assertEquals(first.id(), second.id());
        assertEquals("Original", second.title());
        assertEquals(1, store.getStatistics().resourceCount());

        Resource renamed = pipeline.updateResource(first.id(), ResourceUpdate.title("Renamed")).orElseThrow();
        assertEquals("Renamed", renamed.title());
    }

    @Test
    void shouldCreateExactlyOneResourceUnderConcurrentIngestion() throws Exception {
        List<Resource> results = runConcurrently(8, () -> pipeline.ingestResource(ResourceDraft.of("https://race.example", "t", "web")));

        Set<UUID> ids = new HashSet<>();
        results.forEach(resource -> ids.add(resource.id()));
        assertEquals(1, ids.size());
        assertEquals(1, store.getStatistics().resourceCount());
    }

    @Test
    void shouldKeepChunkOrdersDenseAndRejectReuse() {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        for (int order = 0; order < 4; order++) {
            pipeline.ingestChunk(ChunkDraft.of(resource.id(), order, "chunk number " + order, null));
        }

        assertEquals(List.of(0, 1, 2, 3), store.getChunksByResource(resource.id(), 10).stream().map(Chunk::order).toList());
        assertThrows(OrderConflictException.class,
                () -> pipeline.ingestChunk(ChunkDraft.of(resource.id(), 2, "reused order", null)));
        assertEquals(4, store.getStatistics().chunkCount());
    }

    @Test
    void shouldAllowOnlyOneWinnerForConcurrentOrder() throws Exception {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Chunk>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String text = "contender " + i;
            futures.add(executor.submit(() -> {
                start.await();
                return pipeline.ingestChunk(ChunkDraft.of(resource.id(), 0, text, null));
            }));
        }
        start.countDown();

        int winners = 0;
        int conflicts = 0;
        for (Future<Chunk> future : futures) {
            try {
                future.get(10, TimeUnit.SECONDS);
                winners++;
            } catch (ExecutionException e) {
                assertTrue(e.getCause() instanceof OrderConflictException, e.getCause().toString());
                conflicts++;
            }
        }
        assertEquals(1, winners);
        assertEquals(7, conflicts);
        assertEquals(1, lexicalIndex.searchText("contender", LexicalField.TEXT, 10).size());
    }

    @Test
    void shouldRollBackEveryPartWhenAnEmbeddingIsRejected() {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        pipeline.ingestChunk(ChunkDraft.of(resource.id(), 0, "first chunk", null),
                List.of(EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, new float[] { 1f, 0f })));

        assertThrows(DimensionMismatchException.class, () -> pipeline.ingestChunk(
                ChunkDraft.of(resource.id(), 1, "doomed chunk", null),
                List.of(EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, new float[] { 1f, 0f, 0f }))));

        assertEquals(1, store.getStatistics().chunkCount());
        assertEquals(1, store.getStatistics().embeddingCount());
        assertTrue(lexicalIndex.searchText("doomed", LexicalField.TEXT, 10).isEmpty());
        Chunk retried = pipeline.ingestChunk(ChunkDraft.of(resource.id(), 1, "second chunk", null));
        assertEquals(1, retried.order());
    }

    @Test
    void shouldPublishChunkWithAllEmbeddingsAtOnce() {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        HashingEmbeddingService embedder = new HashingEmbeddingService(64);

        Chunk chunk = pipeline.ingestChunk(ChunkDraft.of(resource.id(), 0, "vector search basics", "intro slide"), embedder);

        List<ChunkEmbedding> embeddings = store.getEmbeddings(chunk.id());
        assertEquals(List.of(EmbeddingKind.CHUNK, EmbeddingKind.DESCRIPTION), embeddings.stream().map(ChunkEmbedding::kind).toList());
        assertEquals(chunk.id(), vectorIndex.searchVector(embedder.embed("vector search basics"), EmbeddingKind.CHUNK, embedder.model(),
                0.99, 1).get(0).chunkId());
        assertEquals(chunk.id(), vectorIndex.searchVector(embedder.embed("intro slide"), EmbeddingKind.DESCRIPTION, embedder.model(),
                0.99, 1).get(0).chunkId());
        assertEquals(1, lexicalIndex.searchText("basics", LexicalField.TEXT, 10).size());
    }

    @Test
    void shouldAttachEmbeddingToExistingChunk() {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        Chunk chunk = pipeline.ingestChunk(ChunkDraft.of(resource.id(), 0, "late embedding", null));

        pipeline.attachEmbedding(chunk.id(), EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, new float[] { 0f, 1f }));
        pipeline.attachEmbedding(chunk.id(), EmbeddingDraft.of(EmbeddingKind.CHUNK, "other-model", new float[] { 1f, 1f, 1f }));

        assertEquals(2, store.getEmbeddings(chunk.id()).size());
        assertEquals(1, vectorIndex.searchVector(new float[] { 0f, 1f }, EmbeddingKind.CHUNK, MODEL, 0.5, 10).size());
        assertThrows(MissingReferenceException.class, () -> pipeline.attachEmbedding(UUID.randomUUID(),
                EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, new float[] { 0f, 1f })));
    }

    @Test
    void shouldRemoveIndexEntriesWhenResourceIsDeleted() {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        pipeline.ingestChunk(ChunkDraft.of(resource.id(), 0, "ephemeral content", null),
                List.of(EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, new float[] { 1f, 0f })));

        assertTrue(pipeline.deleteResource(resource.id()).isPresent());

        assertTrue(lexicalIndex.searchText("ephemeral", LexicalField.TEXT, 10).isEmpty());
        assertTrue(vectorIndex.searchVector(new float[] { 1f, 0f }, EmbeddingKind.CHUNK, MODEL, -1.0, 10).isEmpty());
        assertEquals(0, store.getStatistics().chunkCount());
        assertNotEquals(resource.id(), pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web")).id());
    }

    @Test
    void shouldRollBackChunkWhenResourceIsDeletedBeforeCommit() {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));

        try (CorpusSession session = store.openSession()) {
            Chunk chunk = session.stageChunk(ChunkDraft.of(resource.id(), 0, "orphaned words", null));
            session.enlist(lexicalIndex.stage(chunk));
            ChunkEmbedding embedding = session.stageEmbedding(
                    EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, new float[] { 1f, 0f }).forChunk(chunk.id()));
            session.enlist(vectorIndex.stage(embedding));

            assertTrue(pipeline.deleteResource(resource.id()).isPresent());

            assertThrows(MissingReferenceException.class, session::commit);
        }

        assertEquals(0, store.getStatistics().chunkCount());
        assertEquals(0, store.getStatistics().embeddingCount());
        assertTrue(store.getChunksByResource(resource.id(), 10).isEmpty());
        assertTrue(lexicalIndex.searchText("orphaned", LexicalField.TEXT, 10).isEmpty());
        assertTrue(vectorIndex.searchVector(new float[] { 1f, 0f }, EmbeddingKind.CHUNK, MODEL, -1.0, 10).isEmpty());
    }

    @Test
    void shouldRejectEmbeddingForChunkDeletedBeforeCommit() {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        Chunk chunk = pipeline.ingestChunk(ChunkDraft.of(resource.id(), 0, "short lived", null));

        try (CorpusSession session = store.openSession()) {
            ChunkEmbedding embedding = session.stageEmbedding(
                    EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, new float[] { 0f, 1f }).forChunk(chunk.id()));
            session.enlist(vectorIndex.stage(embedding));
            pipeline.deleteResource(resource.id());

            assertThrows(MissingReferenceException.class, session::commit);
        }

        assertTrue(store.getEmbeddings(chunk.id()).isEmpty());
        assertTrue(vectorIndex.searchVector(new float[] { 0f, 1f }, EmbeddingKind.CHUNK, MODEL, -1.0, 10).isEmpty());
    }

    @Test
    void shouldKeepStoredVectorWhenCallerMutatesItsArray() {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        float[] vector = { 1f, 0f };
        Chunk chunk = pipeline.ingestChunk(ChunkDraft.of(resource.id(), 0, "copied vector", null),
                List.of(EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, vector)));

        vector[0] = -1f;
        store.getEmbeddings(chunk.id()).get(0).vector()[1] = 7f;

        float[] stored = store.getEmbeddings(chunk.id()).get(0).vector();
        assertEquals(1f, stored[0]);
        assertEquals(0f, stored[1]);
        LocalVectorIndex rebuiltVector = new LocalVectorIndex(new AppConfig.VectorConfig(), store.publicationClock());
        new IngestionPipeline(store, lexicalIndex, rebuiltVector).rebuildIndices();
        assertEquals(List.of(chunk.id()), rebuiltVector.searchVector(new float[] { 1f, 0f }, EmbeddingKind.CHUNK, MODEL, 0.99, 10)
                .stream().map(ScoredChunk::chunkId).toList());
        assertEquals(List.of(chunk.id()), vectorIndex.searchVector(new float[] { 1f, 0f }, EmbeddingKind.CHUNK, MODEL, 0.99, 10)
                .stream().map(ScoredChunk::chunkId).toList());
    }

    @Test
    void shouldRebuildFreshIndicesFromCorpus() throws Exception {
        Resource resource = pipeline.ingestResource(ResourceDraft.of("u1", "Doc", "web"));
        pipeline.ingestChunk(ChunkDraft.of(resource.id(), 0, "rebuilt lexical entry", null),
                List.of(EmbeddingDraft.of(EmbeddingKind.CHUNK, MODEL, new float[] { 1f, 0f })));

        try (LuceneLexicalIndex freshLexical = new LuceneLexicalIndex(new AppConfig.LexicalConfig(), store.publicationClock())) {
            LocalVectorIndex freshVector = new LocalVectorIndex(new AppConfig.VectorConfig(), store.publicationClock());
            IngestionPipeline rebuilt = new IngestionPipeline(store, freshLexical, freshVector);

            assertEquals(1, rebuilt.rebuildIndices());

            assertEquals(1, freshLexical.searchText("rebuilt", LexicalField.TEXT, 10).size());
            assertEquals(1, freshVector.searchVector(new float[] { 1f, 0f }, EmbeddingKind.CHUNK, MODEL, 0.5, 10).size());
        }
    }

    private <T> List<T> runConcurrently(int threads, Callable<T> task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }
        return results;
    }
}
