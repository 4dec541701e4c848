package com.hybridrag.vector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.corpus.ChunkEmbedding;
import com.hybridrag.corpus.DimensionMismatchException;
import com.hybridrag.corpus.EmbeddingKind;
import com.hybridrag.corpus.PublicationClock;
import com.hybridrag.corpus.ScoredChunk;
import com.hybridrag.corpus.StagedChange;
import com.hybridrag.runtime.AppConfig;

public class LocalVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(LocalVectorIndex.class);
    private static final double EXACT_MATCH_TOLERANCE = 1e-6;
    private static final List<Integer> PROBE_MASKS = List.of(0x0000, 0x00FF, 0xFF00, 0x0F0F);

    private final Map<PartitionKey, Partition> partitions = new ConcurrentHashMap<>();
    private final Map<String, Integer> dimensions = new ConcurrentHashMap<>();
    private final PublicationClock publicationClock;
    private final int exhaustiveScanThreshold;
    private final int minCandidateFactor;

    public LocalVectorIndex(AppConfig.VectorConfig config, PublicationClock publicationClock) {
        this(publicationClock, config.getExhaustiveScanThreshold(), config.getMinCandidateFactor());
    }

    LocalVectorIndex(PublicationClock publicationClock, int exhaustiveScanThreshold, int minCandidateFactor) {
        this.publicationClock = publicationClock;
        this.exhaustiveScanThreshold = exhaustiveScanThreshold;
        this.minCandidateFactor = minCandidateFactor;
    }

    @Override
    public StagedChange stage(ChunkEmbedding embedding) {
        Integer registered = dimensions.putIfAbsent(embedding.model(), embedding.dimension());
        if (registered != null && registered != embedding.dimension()) {
            throw new DimensionMismatchException(embedding.model(), registered, embedding.dimension());
        }
        float[] vector = embedding.vector();
        PartitionKey key = new PartitionKey(embedding.model(), embedding.kind());
        return new StagedChange() {
            @Override
            public void publish(long epoch) {
                partitions.computeIfAbsent(key, unused -> new Partition())
                        .put(new IndexedVector(embedding.chunkId(), vector, signature(vector), epoch));
            }

            @Override
            public void rollback() {
                // the vector is only held by this change until publication
            }
        };
    }

    @Override
    public void remove(Collection<UUID> chunkIds) {
        if (chunkIds.isEmpty()) {
            return;
        }
        for (Partition partition : partitions.values()) {
            chunkIds.forEach(partition::remove);
        }
        log.debug("Removed vectors for {} chunks", chunkIds.size());
    }

    public List<ScoredChunk> searchVector(float[] queryVector, EmbeddingKind kind, String model, double threshold, int limit) {
        return searchVector(queryVector, kind, model, threshold, limit, publicationClock.snapshot(), null);
    }

    @Override
    public List<ScoredChunk> searchVector(float[] queryVector, EmbeddingKind kind, String model, double threshold, int limit, long snapshot,
            Predicate<UUID> chunkFilter) {
        VectorIndex.validateThreshold(threshold);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        Integer dimension = dimensions.get(model);
        Partition partition = partitions.get(new PartitionKey(model, kind));
        if (dimension == null || partition == null || partition.entries.isEmpty()) {
            return List.of();
        }
        if (queryVector.length != dimension) {
            throw new DimensionMismatchException(model, dimension, queryVector.length);
        }

        List<ScoredChunk> matches = new ArrayList<>();
        // a filtered query scans the whole partition because buckets know nothing about resources
        Collection<UUID> candidates = chunkFilter == null ? candidateIds(partition, queryVector, limit) : partition.entries.keySet();
        for (UUID candidate : candidates) {
            IndexedVector indexed = partition.entries.get(candidate);
            if (indexed == null || !PublicationClock.isVisible(indexed.epoch(), snapshot)) {
                continue;
            }
            if (chunkFilter != null && !chunkFilter.test(indexed.chunkId())) {
                continue;
            }
            double similarity = cosine(queryVector, indexed.vector());
            if (passes(similarity, threshold)) {
                matches.add(new ScoredChunk(indexed.chunkId(), similarity));
            }
        }
        matches.sort(ScoredChunk.RANKING);
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : List.copyOf(matches);
    }

    @Override
    public Set<String> models() {
        return new TreeSet<>(dimensions.keySet());
    }

    @Override
    public Optional<Integer> dimension(String model) {
        return Optional.ofNullable(dimensions.get(model));
    }

    public int size(String model, EmbeddingKind kind) {
        Partition partition = partitions.get(new PartitionKey(model, kind));
        return partition == null ? 0 : partition.entries.size();
    }

    private Collection<UUID> candidateIds(Partition partition, float[] queryVector, int limit) {
        if (partition.entries.size() <= Math.max(exhaustiveScanThreshold, limit * 20)) {
            return partition.entries.keySet();
        }
        Set<UUID> candidates = new HashSet<>();
        int querySignature = signature(queryVector);
        for (Integer mask : PROBE_MASKS) {
            candidates.addAll(partition.buckets.getOrDefault(querySignature ^ mask, Set.of()));
        }
        if (candidates.size() < limit * minCandidateFactor) {
            return partition.entries.keySet();
        }
        return candidates;
    }

    private static boolean passes(double similarity, double threshold) {
        if (threshold >= 1.0) {
            return similarity >= 1.0 - EXACT_MATCH_TOLERANCE;
        }
        return similarity > threshold;
    }

    static int signature(float[] vector) {
        int signature = 0;
        for (int i = 0; i < Math.min(16, vector.length); i++) {
            if (vector[i] >= 0f) {
                signature |= (1 << i);
            }
        }
        return signature;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            aNorm += (double) a[i] * a[i];
            bNorm += (double) b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        double cosine = dot / Math.sqrt(aNorm * bNorm);
        return Math.max(-1d, Math.min(1d, cosine));
    }

    private record PartitionKey(String model, EmbeddingKind kind) {
    }

    private record IndexedVector(UUID chunkId, float[] vector, int signature, long epoch) {
    }

    private static final class Partition {
        private final Map<UUID, IndexedVector> entries = new ConcurrentHashMap<>();
        private final Map<Integer, Set<UUID>> buckets = new ConcurrentHashMap<>();

        void put(IndexedVector vector) {
            IndexedVector previous = entries.put(vector.chunkId(), vector);
            if (previous != null && previous.signature() != vector.signature()) {
                dropFromBucket(previous);
            }
            buckets.computeIfAbsent(vector.signature(), unused -> ConcurrentHashMap.newKeySet()).add(vector.chunkId());
        }

        void remove(UUID chunkId) {
            IndexedVector removed = entries.remove(chunkId);
            if (removed != null) {
                dropFromBucket(removed);
            }
        }

        private void dropFromBucket(IndexedVector vector) {
            Set<UUID> bucket = buckets.get(vector.signature());
            if (bucket != null) {
                bucket.remove(vector.chunkId());
            }
        }
    }
}
