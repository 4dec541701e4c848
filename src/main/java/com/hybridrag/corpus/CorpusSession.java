package com.hybridrag.corpus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Scoped unit of work against the corpus store. Staged chunks reserve their (resource, order) key immediately,
 * so a concurrent duplicate fails fast, but nothing becomes visible before {@link #commit()}. Closing an
 * uncommitted session rolls back every staged change, including changes enlisted by derived indices.
 *
 * <p>{@link #commit()} checks again, under the publication lock, that every referenced resource and chunk still
 * exists. A resource deleted after staging fails the commit with {@link MissingReferenceException} and the whole
 * unit is rolled back on close.
 */
public final class CorpusSession implements AutoCloseable {
    private final CorpusStore store;
    private final List<StagedChange> changes = new ArrayList<>();
    private final Map<UUID, UUID> stagedChunkResources = new HashMap<>();
    private final Set<UUID> embeddedChunkIds = new HashSet<>();
    private boolean committed;
    private boolean closed;

    CorpusSession(CorpusStore store) {
        this.store = store;
    }

    public Chunk stageChunk(ChunkDraft draft) {
        ensureActive();
        Chunk chunk = store.newChunk(draft);
        changes.add(store.reserveChunk(chunk));
        stagedChunkResources.put(chunk.id(), chunk.resourceId());
        return chunk;
    }

    public ChunkEmbedding stageEmbedding(ChunkEmbedding embedding) {
        ensureActive();
        Objects.requireNonNull(embedding, "embedding");
        if (!stagedChunkResources.containsKey(embedding.chunkId()) && !store.chunkExists(embedding.chunkId())) {
            throw new MissingReferenceException("chunk", embedding.chunkId());
        }
        changes.add(store.stageEmbedding(embedding));
        embeddedChunkIds.add(embedding.chunkId());
        return embedding;
    }

    public void enlist(StagedChange change) {
        ensureActive();
        changes.add(Objects.requireNonNull(change, "change"));
    }

    public void commit() {
        ensureActive();
        store.commit(List.copyOf(changes), Map.copyOf(stagedChunkResources), Set.copyOf(embeddedChunkIds));
        committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (committed) {
            return;
        }
        RuntimeException failure = null;
        for (int i = changes.size() - 1; i >= 0; i--) {
            try {
                changes.get(i).rollback();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        changes.clear();
        if (failure != null) {
            throw failure;
        }
    }

    private void ensureActive() {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
        if (committed) {
            throw new IllegalStateException("Session is already committed");
        }
        store.ensureOpen();
    }
}
