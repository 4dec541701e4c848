package com.hybridrag.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.corpus.Chunk;
import com.hybridrag.corpus.ChunkDraft;
import com.hybridrag.corpus.ChunkEmbedding;
import com.hybridrag.corpus.CorpusSession;
import com.hybridrag.corpus.CorpusStore;
import com.hybridrag.corpus.DuplicateResourceException;
import com.hybridrag.corpus.EmbeddingDraft;
import com.hybridrag.corpus.EmbeddingKind;
import com.hybridrag.corpus.MissingReferenceException;
import com.hybridrag.corpus.Resource;
import com.hybridrag.corpus.ResourceDraft;
import com.hybridrag.corpus.ResourceUpdate;
import com.hybridrag.corpus.StagedChange;
import com.hybridrag.lexical.LexicalIndex;
import com.hybridrag.vector.VectorIndex;

public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final CorpusStore corpusStore;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;

    public IngestionPipeline(CorpusStore corpusStore, LexicalIndex lexicalIndex, VectorIndex vectorIndex) {
        this.corpusStore = corpusStore;
        this.lexicalIndex = lexicalIndex;
        this.vectorIndex = vectorIndex;
    }

    /**
     * Returns the resource registered for the draft's source URL, creating it when none exists. Callers racing on
     * the same URL all receive the single stored row.
     */
    public Resource ingestResource(ResourceDraft draft) {
        Objects.requireNonNull(draft, "draft");
        Optional<Resource> existing = corpusStore.getResourceByUrl(draft.sourceUrl());
        if (existing.isPresent()) {
            log.debug("Resource already ingested url={} id={}", draft.sourceUrl(), existing.get().id());
            return existing.get();
        }
        try {
            Resource created = corpusStore.createResource(draft);
            log.info("Ingested resource id={} url={} category={}", created.id(), created.sourceUrl(), created.category());
            return created;
        } catch (DuplicateResourceException e) {
            log.warn("Lost ingestion race for url={}, using existing resource {}", e.sourceUrl(), e.existingResourceId());
            return corpusStore.getResource(e.existingResourceId())
                    .orElseThrow(() -> new MissingReferenceException("resource", e.existingResourceId()));
        }
    }

    public Chunk ingestChunk(ChunkDraft draft) {
        return ingestChunk(draft, List.of());
    }

    public Chunk ingestChunk(ChunkDraft draft, List<EmbeddingDraft> embeddings) {
        Objects.requireNonNull(draft, "draft");
        Objects.requireNonNull(embeddings, "embeddings");
        try (CorpusSession session = corpusStore.openSession()) {
            Chunk chunk = session.stageChunk(draft);
            session.enlist(lexicalIndex.stage(chunk));
            for (EmbeddingDraft embedding : embeddings) {
                stageEmbedding(session, embedding.forChunk(chunk.id()));
            }
            session.commit();
            log.info("Ingested chunk id={} resource={} order={} embeddings={}",
                    chunk.id(), chunk.resourceId(), chunk.order(), embeddings.size());
            return chunk;
        } catch (RuntimeException e) {
            log.warn("Rolled back chunk resource={} order={}: {}", draft.resourceId(), draft.order(), e.getMessage());
            throw e;
        }
    }

    public ChunkEmbedding attachEmbedding(UUID chunkId, EmbeddingDraft draft) {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(draft, "draft");
        try (CorpusSession session = corpusStore.openSession()) {
            ChunkEmbedding embedding = stageEmbedding(session, draft.forChunk(chunkId));
            session.commit();
            log.info("Attached {} embedding model={} to chunk {}", embedding.kind(), embedding.model(), chunkId);
            return embedding;
        }
    }

    public Chunk ingestChunk(ChunkDraft draft, EmbeddingService embeddingService) {
        List<EmbeddingDraft> embeddings = new ArrayList<>();
        embeddings.add(EmbeddingDraft.of(EmbeddingKind.CHUNK, embeddingService.model(), embeddingService.embed(draft.text())));
        if (draft.description() != null && !draft.description().isBlank()) {
            embeddings.add(EmbeddingDraft.of(EmbeddingKind.DESCRIPTION, embeddingService.model(),
                    embeddingService.embed(draft.description())));
        }
        return ingestChunk(draft, embeddings);
    }

    public Optional<Resource> updateResource(UUID resourceId, ResourceUpdate update) {
        return corpusStore.updateResource(resourceId, update);
    }

    public Optional<Resource> deleteResource(UUID resourceId) {
        return corpusStore.deleteResource(resourceId, removedChunks -> {
            lexicalIndex.remove(removedChunks);
            vectorIndex.remove(removedChunks);
        });
    }

    /**
     * Repopulates both indices from the visible corpus in a single publication, typically right after a snapshot
     * has been loaded into an empty store.
     *
     * @return number of chunks indexed
     */
    public int rebuildIndices() {
        List<Chunk> chunks = corpusStore.allChunks();
        List<ChunkEmbedding> embeddings = corpusStore.allEmbeddings();
        List<StagedChange> changes = new ArrayList<>(chunks.size() + embeddings.size());
        for (Chunk chunk : chunks) {
            changes.add(lexicalIndex.stage(chunk));
        }
        for (ChunkEmbedding embedding : embeddings) {
            changes.add(vectorIndex.stage(embedding));
        }
        corpusStore.publicationClock().publish(epoch -> changes.forEach(change -> change.publish(epoch)));
        log.info("Rebuilt indices from corpus: chunks={} embeddings={}", chunks.size(), embeddings.size());
        return chunks.size();
    }

    private ChunkEmbedding stageEmbedding(CorpusSession session, ChunkEmbedding embedding) {
        ChunkEmbedding staged = session.stageEmbedding(embedding);
        session.enlist(vectorIndex.stage(staged));
        return staged;
    }
}
