package com.hybridrag.search;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.corpus.Chunk;
import com.hybridrag.corpus.CorpusStatistics;
import com.hybridrag.corpus.CorpusStore;
import com.hybridrag.corpus.EmbeddingKind;
import com.hybridrag.corpus.ScoredChunk;
import com.hybridrag.corpus.StoreConnectionException;
import com.hybridrag.lexical.LexicalField;
import com.hybridrag.lexical.LexicalIndex;
import com.hybridrag.runtime.AppConfig;
import com.hybridrag.vector.VectorIndex;

public class HybridRetrievalService {
    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalService.class);

    private final CorpusStore corpusStore;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;
    private final FusionEngine fusionEngine;
    private final ExecutorService searchExecutor;
    private final Duration defaultTimeout;
    private final int candidateMultiplier;

    public HybridRetrievalService(
            CorpusStore corpusStore,
            LexicalIndex lexicalIndex,
            VectorIndex vectorIndex,
            ExecutorService searchExecutor,
            AppConfig.SearchConfig config) {
        this.corpusStore = corpusStore;
        this.lexicalIndex = lexicalIndex;
        this.vectorIndex = vectorIndex;
        this.fusionEngine = new FusionEngine();
        this.searchExecutor = searchExecutor;
        this.defaultTimeout = Duration.ofMillis(config.getTimeoutMs());
        this.candidateMultiplier = Math.max(1, config.getCandidateMultiplier());
    }

    public List<ScoredChunk> searchText(String query, LexicalField field, int limit) {
        return searchText(query, field, limit, null, defaultTimeout);
    }

    public List<ScoredChunk> searchText(String query, LexicalField field, int limit, Duration timeout) {
        return searchText(query, field, limit, null, timeout);
    }

    /**
     * Keyword search restricted to resources of {@code category} when it is not {@code null}. A {@code null}
     * timeout falls back to the configured default.
     */
    public List<ScoredChunk> searchText(String query, LexicalField field, int limit, String category, Duration timeout) {
        Duration effectiveTimeout = timeout == null ? defaultTimeout : timeout;
        long snapshot = corpusStore.publicationClock().snapshot();
        long deadline = deadline(effectiveTimeout);
        Set<UUID> resourceIds = scope(category);
        Future<List<ScoredChunk>> future = submit(() -> lexicalIndex.searchText(query, field, limit, snapshot, resourceIds));
        try {
            return await(future, deadline, effectiveTimeout);
        } finally {
            future.cancel(true);
        }
    }

    public List<ScoredChunk> searchVector(float[] queryVector, EmbeddingKind kind, String model, double threshold, int limit) {
        return searchVector(queryVector, kind, model, threshold, limit, null, defaultTimeout);
    }

    public List<ScoredChunk> searchVector(float[] queryVector, EmbeddingKind kind, String model, double threshold, int limit,
            Duration timeout) {
        return searchVector(queryVector, kind, model, threshold, limit, null, timeout);
    }

    public List<ScoredChunk> searchVector(float[] queryVector, EmbeddingKind kind, String model, double threshold, int limit,
            String category, Duration timeout) {
        VectorIndex.validateThreshold(threshold);
        Duration effectiveTimeout = timeout == null ? defaultTimeout : timeout;
        long snapshot = corpusStore.publicationClock().snapshot();
        long deadline = deadline(effectiveTimeout);
        Predicate<UUID> chunkFilter = chunkFilter(scope(category), snapshot);
        Future<List<ScoredChunk>> future = submit(() -> vectorIndex.searchVector(queryVector, kind, model, threshold, limit, snapshot,
                chunkFilter));
        try {
            return await(future, deadline, effectiveTimeout);
        } finally {
            future.cancel(true);
        }
    }

    /**
     * Runs the lexical and vector queries in parallel and fuses them. A side whose weight is zero is skipped
     * unless both weights are zero, in which case both run and the chunk-id tie-break orders the output.
     */
    public List<HybridSearchHit> hybridSearch(HybridSearchRequest request) {
        VectorIndex.validateThreshold(request.threshold());
        Duration timeout = request.timeout() == null ? defaultTimeout : request.timeout();
        long snapshot = corpusStore.publicationClock().snapshot();
        long deadline = deadline(timeout);
        int candidates = candidatePool(request.limit());
        Set<UUID> resourceIds = scope(request.category());
        Predicate<UUID> chunkFilter = chunkFilter(resourceIds, snapshot);

        boolean bothZero = request.textWeight() == 0.0 && request.vectorWeight() == 0.0;
        boolean runText = request.hasTextQuery() && (request.textWeight() != 0.0 || bothZero);
        boolean runVector = request.hasQueryVector() && (request.vectorWeight() != 0.0 || bothZero);

        Future<List<ScoredChunk>> lexicalFuture = runText
                ? submit(() -> lexicalIndex.searchText(request.textQuery(), LexicalField.TEXT, candidates, snapshot, resourceIds))
                : CompletableFuture.completedFuture(List.of());
        Future<List<ScoredChunk>> vectorFuture = runVector
                ? submit(() -> vectorIndex.searchVector(request.queryVector(), request.kind(), request.model(),
                        request.threshold(), candidates, snapshot, chunkFilter))
                : CompletableFuture.completedFuture(List.of());

        List<ScoredChunk> lexical;
        List<ScoredChunk> vector;
        try {
            lexical = await(lexicalFuture, deadline, timeout);
            vector = await(vectorFuture, deadline, timeout);
        } finally {
            lexicalFuture.cancel(true);
            vectorFuture.cancel(true);
        }

        List<FusedScore> fused = fusionEngine.fuse(lexical, vector, request.textWeight(), request.vectorWeight());
        List<HybridSearchHit> hits = new ArrayList<>(Math.min(fused.size(), request.limit()));
        for (FusedScore score : fused) {
            if (hits.size() >= request.limit()) {
                break;
            }
            Optional<Chunk> chunk = corpusStore.getChunk(score.chunkId(), snapshot);
            chunk.ifPresent(found -> hits.add(new HybridSearchHit(
                    found.id(),
                    found.resourceId(),
                    found.text(),
                    found.description(),
                    score.textScore(),
                    score.vectorScore(),
                    score.combinedScore())));
        }
        log.debug("Hybrid search text={} vector={} category={} lexicalHits={} vectorHits={} returned={}",
                runText, runVector, request.category(), lexical.size(), vector.size(), hits.size());
        return hits;
    }

    public CorpusStatistics getStatistics() {
        return corpusStore.getStatistics();
    }

    private Set<UUID> scope(String category) {
        return category == null ? null : corpusStore.resourceIdsInCategory(category);
    }

    private Predicate<UUID> chunkFilter(Set<UUID> resourceIds, long snapshot) {
        if (resourceIds == null) {
            return null;
        }
        return chunkId -> corpusStore.getChunk(chunkId, snapshot)
                .map(chunk -> resourceIds.contains(chunk.resourceId()))
                .orElse(false);
    }

    private int candidatePool(int limit) {
        long pool = (long) limit * candidateMultiplier;
        return (int) Math.min(Integer.MAX_VALUE, pool);
    }

    private <T> Future<T> submit(Callable<T> task) {
        return searchExecutor.submit(task);
    }

    private static long deadline(Duration timeout) {
        return System.nanoTime() + timeout.toNanos();
    }

    private static <T> T await(Future<T> future, long deadline, Duration timeout) {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new SearchTimeoutException(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchTimeoutException("Search interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new StoreConnectionException("Search failed", cause);
        }
    }
}
