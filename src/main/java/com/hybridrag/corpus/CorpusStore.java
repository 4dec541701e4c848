package com.hybridrag.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class CorpusStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CorpusStore.class);
    private static final int SNAPSHOT_VERSION = 1;

    private final PublicationClock publicationClock;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    private final Map<UUID, Resource> resources = new ConcurrentHashMap<>();
    private final Map<String, UUID> resourceIdsByUrl = new ConcurrentHashMap<>();
    private final Map<UUID, ParsedArtifact> parsedArtifacts = new ConcurrentHashMap<>();
    private final Map<String, UUID> parsedArtifactKeys = new ConcurrentHashMap<>();
    private final Map<UUID, Image> images = new ConcurrentHashMap<>();
    private final Map<String, UUID> imageIdsByUrl = new ConcurrentHashMap<>();
    private final Map<UUID, PublishedChunk> chunks = new ConcurrentHashMap<>();
    private final Map<String, UUID> chunkOrderKeys = new ConcurrentHashMap<>();
    private final Map<UUID, NavigableMap<Integer, UUID>> chunkOrdersByResource = new ConcurrentHashMap<>();
    private final Map<UUID, Map<ChunkEmbedding.EmbeddingSlot, ChunkEmbedding>> embeddings = new ConcurrentHashMap<>();

    private volatile boolean closed;

    public CorpusStore(PublicationClock publicationClock, Clock clock) {
        this.publicationClock = Objects.requireNonNull(publicationClock, "publicationClock");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PublicationClock publicationClock() {
        return publicationClock;
    }

    // ---- resources

    public Resource createResource(ResourceDraft draft) {
        ensureOpen();
        Resource resource = draft.toResource(UUID.randomUUID(), clock.instant());
        // the row is stored while the URL key is held, so a losing writer always finds the winner's row
        UUID[] existing = new UUID[1];
        resourceIdsByUrl.compute(resource.sourceUrl(), (url, current) -> {
            if (current != null) {
                existing[0] = current;
                return current;
            }
            resources.put(resource.id(), resource);
            return resource.id();
        });
        if (existing[0] != null) {
            throw new DuplicateResourceException(resource.sourceUrl(), existing[0]);
        }
        log.debug("Created resource id={} url={}", resource.id(), resource.sourceUrl());
        return resource;
    }

    public Optional<Resource> getResource(UUID id) {
        ensureOpen();
        return Optional.ofNullable(resources.get(id));
    }

    public Optional<Resource> getResourceByUrl(String sourceUrl) {
        ensureOpen();
        if (sourceUrl == null) {
            return Optional.empty();
        }
        UUID id = resourceIdsByUrl.get(sourceUrl.strip());
        return id == null ? Optional.empty() : Optional.ofNullable(resources.get(id));
    }

    public List<Resource> getResourcesByCategory(String category, int limit) {
        ensureOpen();
        requirePositive(limit);
        return resources.values().stream()
                .filter(resource -> Objects.equals(category, resource.category()))
                .sorted(Comparator.comparing(Resource::createdAt).thenComparing(resource -> resource.id().toString()))
                .limit(limit)
                .toList();
    }

    public List<Resource> getResourcesNeedingParsing(String category, int limit) {
        ensureOpen();
        requirePositive(limit);
        return resources.values().stream()
                .filter(Resource::needsParsing)
                .filter(resource -> category == null || category.equals(resource.category()))
                .sorted(Comparator.comparing(Resource::createdAt).thenComparing(resource -> resource.id().toString()))
                .limit(limit)
                .toList();
    }

    public Set<UUID> resourceIdsInCategory(String category) {
        ensureOpen();
        return resources.values().stream()
                .filter(resource -> Objects.equals(category, resource.category()))
                .map(Resource::id)
                .collect(Collectors.toUnmodifiableSet());
    }

    public List<Resource> listResources(int limit) {
        ensureOpen();
        requirePositive(limit);
        return resources.values().stream()
                .sorted(Comparator.comparing(Resource::createdAt).thenComparing(resource -> resource.id().toString()))
                .limit(limit)
                .toList();
    }

    public Optional<Resource> updateResource(UUID id, ResourceUpdate update) {
        ensureOpen();
        Objects.requireNonNull(update, "update");
        Resource updated = resources.computeIfPresent(id, (key, current) -> update.applyTo(current, clock.instant()));
        if (updated != null) {
            log.debug("Updated resource id={}", id);
        }
        return Optional.ofNullable(updated);
    }

    public Optional<Resource> deleteResource(UUID id) {
        return deleteResource(id, removedChunks -> {
        });
    }

    /**
     * Deletes a resource with its chunks, embeddings and parsed artifacts in one publication step. Images keep
     * existing but lose their resource reference. {@code cascade} receives the removed chunk ids inside the same
     * step so derived indices can drop them atomically.
     */
    public Optional<Resource> deleteResource(UUID id, Consumer<Set<UUID>> cascade) {
        ensureOpen();
        Resource[] removed = new Resource[1];
        publicationClock.publish(epoch -> {
            Resource resource = resources.remove(id);
            if (resource == null) {
                return;
            }
            removed[0] = resource;
            resourceIdsByUrl.remove(resource.sourceUrl(), id);

            Set<UUID> removedChunks = new HashSet<>();
            NavigableMap<Integer, UUID> orders = chunkOrdersByResource.remove(id);
            if (orders != null) {
                for (Map.Entry<Integer, UUID> entry : orders.entrySet()) {
                    chunks.remove(entry.getValue());
                    embeddings.remove(entry.getValue());
                    chunkOrderKeys.remove(orderKey(id, entry.getKey()), entry.getValue());
                    removedChunks.add(entry.getValue());
                }
            }
            parsedArtifacts.values().removeIf(artifact -> {
                if (!artifact.resourceId().equals(id)) {
                    return false;
                }
                parsedArtifactKeys.remove(artifactKey(id, artifact.parseSetting()), artifact.id());
                return true;
            });
            images.replaceAll((imageId, image) -> id.equals(image.resourceId())
                    ? image.detachedFromResource(clock.instant())
                    : image);
            cascade.accept(removedChunks);
        });
        if (removed[0] != null) {
            log.info("Deleted resource id={} url={}", id, removed[0].sourceUrl());
        }
        return Optional.ofNullable(removed[0]);
    }

    // ---- parsed artifacts and images

    public ParsedArtifact createParsedArtifact(ParsedArtifactDraft draft) {
        ensureOpen();
        ParsedArtifact artifact = draft.toArtifact(UUID.randomUUID(), clock.instant());
        // under the publication lock so a concurrent deleteResource cannot leave the artifact orphaned
        publicationClock.publish(epoch -> {
            if (!resources.containsKey(draft.resourceId())) {
                throw new MissingReferenceException("resource", draft.resourceId());
            }
            UUID existing = parsedArtifactKeys.putIfAbsent(artifactKey(draft.resourceId(), draft.parseSetting()), artifact.id());
            if (existing != null) {
                throw new DuplicateParsedArtifactException(draft.resourceId(), draft.parseSetting(), existing);
            }
            parsedArtifacts.put(artifact.id(), artifact);
        });
        return artifact;
    }

    public Optional<ParsedArtifact> getParsedArtifact(UUID id) {
        ensureOpen();
        return Optional.ofNullable(parsedArtifacts.get(id));
    }

    public Image createImage(ImageDraft draft) {
        ensureOpen();
        Image image = draft.toImage(UUID.randomUUID(), clock.instant());
        publicationClock.publish(epoch -> {
            if (draft.resourceId() != null && !resources.containsKey(draft.resourceId())) {
                throw new MissingReferenceException("resource", draft.resourceId());
            }
            if (image.remoteUrl() != null) {
                UUID existing = imageIdsByUrl.putIfAbsent(image.remoteUrl(), image.id());
                if (existing != null) {
                    throw new DuplicateImageException(image.remoteUrl(), existing);
                }
            }
            images.put(image.id(), image);
        });
        return image;
    }

    public Optional<Image> getImage(UUID id) {
        ensureOpen();
        return Optional.ofNullable(images.get(id));
    }

    // ---- chunks and embeddings

    public CorpusSession openSession() {
        ensureOpen();
        return new CorpusSession(this);
    }

    public Optional<Chunk> getChunk(UUID id) {
        return getChunk(id, publicationClock.snapshot());
    }

    public Optional<Chunk> getChunk(UUID id, long snapshot) {
        ensureOpen();
        PublishedChunk published = chunks.get(id);
        if (published == null || !PublicationClock.isVisible(published.epoch(), snapshot)) {
            return Optional.empty();
        }
        return Optional.of(published.chunk());
    }

    public List<Chunk> getChunksByResource(UUID resourceId, int limit) {
        ensureOpen();
        requirePositive(limit);
        NavigableMap<Integer, UUID> orders = chunkOrdersByResource.get(resourceId);
        if (orders == null) {
            return List.of();
        }
        long snapshot = publicationClock.snapshot();
        List<Chunk> result = new ArrayList<>();
        for (UUID chunkId : orders.values()) {
            if (result.size() >= limit) {
                break;
            }
            getChunk(chunkId, snapshot).ifPresent(result::add);
        }
        return result;
    }

    public int nextChunkOrder(UUID resourceId) {
        ensureOpen();
        NavigableMap<Integer, UUID> orders = chunkOrdersByResource.get(resourceId);
        return orders == null || orders.isEmpty() ? 0 : orders.lastKey() + 1;
    }

    public List<ChunkEmbedding> getEmbeddings(UUID chunkId) {
        ensureOpen();
        Map<ChunkEmbedding.EmbeddingSlot, ChunkEmbedding> slots = embeddings.get(chunkId);
        if (slots == null) {
            return List.of();
        }
        return slots.values().stream()
                .sorted(Comparator.comparing(ChunkEmbedding::kind).thenComparing(ChunkEmbedding::model))
                .toList();
    }

    /** Visible chunks in resource order, used to repopulate derived indices. */
    public List<Chunk> allChunks() {
        ensureOpen();
        long snapshot = publicationClock.snapshot();
        return chunks.values().stream()
                .filter(published -> PublicationClock.isVisible(published.epoch(), snapshot))
                .map(PublishedChunk::chunk)
                .sorted(Comparator.comparing((Chunk chunk) -> chunk.resourceId().toString()).thenComparingInt(Chunk::order))
                .toList();
    }

    public List<ChunkEmbedding> allEmbeddings() {
        ensureOpen();
        return embeddings.values().stream()
                .flatMap(slots -> slots.values().stream())
                .toList();
    }

    public CorpusStatistics getStatistics() {
        ensureOpen();
        long snapshot = publicationClock.snapshot();
        Map<String, Long> byCategory = resources.values().stream()
                .filter(resource -> resource.category() != null)
                .collect(Collectors.groupingBy(Resource::category, TreeMap::new, Collectors.counting()));
        long chunkCount = chunks.values().stream()
                .filter(published -> PublicationClock.isVisible(published.epoch(), snapshot))
                .count();
        long embeddingCount = embeddings.values().stream().mapToLong(Map::size).sum();
        return new CorpusStatistics(resources.size(), chunkCount, images.size(), parsedArtifacts.size(), embeddingCount, byCategory);
    }

    Chunk newChunk(ChunkDraft draft) {
        ensureOpen();
        if (!resources.containsKey(draft.resourceId())) {
            throw new MissingReferenceException("resource", draft.resourceId());
        }
        if (draft.parsedArtifactId() != null) {
            ParsedArtifact artifact = parsedArtifacts.get(draft.parsedArtifactId());
            if (artifact == null) {
                throw new MissingReferenceException("parsed artifact", draft.parsedArtifactId());
            }
            if (!artifact.resourceId().equals(draft.resourceId())) {
                throw new MissingReferenceException("Parsed artifact %s does not belong to resource %s"
                        .formatted(artifact.id(), draft.resourceId()));
            }
        }
        if (draft.imageId() != null && !images.containsKey(draft.imageId())) {
            throw new MissingReferenceException("image", draft.imageId());
        }
        return draft.toChunk(UUID.randomUUID(), clock.instant());
    }

    StagedChange reserveChunk(Chunk chunk) {
        String key = orderKey(chunk.resourceId(), chunk.order());
        UUID existing = chunkOrderKeys.putIfAbsent(key, chunk.id());
        if (existing != null) {
            throw new OrderConflictException(chunk.resourceId(), chunk.order());
        }
        return new StagedChange() {
            @Override
            public void publish(long epoch) {
                chunks.put(chunk.id(), new PublishedChunk(chunk, epoch));
                chunkOrdersByResource.computeIfAbsent(chunk.resourceId(), unused -> new ConcurrentSkipListMap<>())
                        .put(chunk.order(), chunk.id());
            }

            @Override
            public void rollback() {
                chunkOrderKeys.remove(key, chunk.id());
            }
        };
    }

    boolean chunkExists(UUID chunkId) {
        return chunks.containsKey(chunkId);
    }

    StagedChange stageEmbedding(ChunkEmbedding embedding) {
        ChunkEmbedding stamped = embedding.stampedAt(clock.instant());
        return new StagedChange() {
            @Override
            public void publish(long epoch) {
                embeddings.computeIfAbsent(stamped.chunkId(), unused -> new ConcurrentHashMap<>())
                        .put(stamped.slot(), stamped);
            }

            @Override
            public void rollback() {
                // nothing was written before publication
            }
        };
    }

    void commit(List<StagedChange> changes, Map<UUID, UUID> chunkResources, Set<UUID> embeddedChunkIds) {
        ensureOpen();
        publicationClock.publish(epoch -> {
            requireReferences(chunkResources, embeddedChunkIds);
            changes.forEach(change -> change.publish(epoch));
        });
    }

    // deleteResource publishes under the same lock, so nothing can disappear between this check and publication
    private void requireReferences(Map<UUID, UUID> chunkResources, Set<UUID> embeddedChunkIds) {
        for (UUID resourceId : chunkResources.values()) {
            if (!resources.containsKey(resourceId)) {
                throw new MissingReferenceException("resource", resourceId);
            }
        }
        for (UUID chunkId : embeddedChunkIds) {
            if (!chunkResources.containsKey(chunkId) && !chunks.containsKey(chunkId)) {
                throw new MissingReferenceException("chunk", chunkId);
            }
        }
    }

    // ---- durability

    public void save(Path path) throws IOException {
        ensureOpen();
        long snapshot = publicationClock.snapshot();
        CorpusSnapshot content = new CorpusSnapshot(
                SNAPSHOT_VERSION,
                resources.values().stream().sorted(Comparator.comparing(resource -> resource.id().toString())).toList(),
                parsedArtifacts.values().stream().sorted(Comparator.comparing(artifact -> artifact.id().toString())).toList(),
                images.values().stream().sorted(Comparator.comparing(image -> image.id().toString())).toList(),
                chunks.values().stream()
                        .filter(published -> PublicationClock.isVisible(published.epoch(), snapshot))
                        .map(PublishedChunk::chunk)
                        .sorted(Comparator.comparing(chunk -> chunk.id().toString()))
                        .toList(),
                allEmbeddings().stream()
                        .sorted(Comparator.comparing((ChunkEmbedding embedding) -> embedding.chunkId().toString())
                                .thenComparing(ChunkEmbedding::kind)
                                .thenComparing(ChunkEmbedding::model))
                        .toList());
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), content);
        log.info("Saved corpus snapshot to {} (resources={}, chunks={})", path, content.resources().size(), content.chunks().size());
    }

    public static CorpusStore load(Path path, PublicationClock publicationClock, Clock clock) throws IOException {
        CorpusStore store = new CorpusStore(publicationClock, clock);
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return store;
        }
        CorpusSnapshot content = store.mapper.readValue(path.toFile(), CorpusSnapshot.class);
        if (content.version() != SNAPSHOT_VERSION) {
            throw new IOException("Unsupported corpus snapshot version " + content.version());
        }
        for (Resource resource : content.resources()) {
            store.resources.put(resource.id(), resource);
            store.resourceIdsByUrl.put(resource.sourceUrl(), resource.id());
        }
        for (ParsedArtifact artifact : content.parsedArtifacts()) {
            store.parsedArtifacts.put(artifact.id(), artifact);
            store.parsedArtifactKeys.put(artifactKey(artifact.resourceId(), artifact.parseSetting()), artifact.id());
        }
        for (Image image : content.images()) {
            store.images.put(image.id(), image);
            if (image.remoteUrl() != null) {
                store.imageIdsByUrl.put(image.remoteUrl(), image.id());
            }
        }
        List<StagedChange> changes = new ArrayList<>();
        Map<UUID, UUID> chunkResources = new HashMap<>();
        Set<UUID> embeddedChunkIds = new HashSet<>();
        for (Chunk chunk : content.chunks()) {
            changes.add(store.reserveChunk(chunk));
            chunkResources.put(chunk.id(), chunk.resourceId());
        }
        for (ChunkEmbedding embedding : content.embeddings()) {
            changes.add(store.stageEmbedding(embedding));
            embeddedChunkIds.add(embedding.chunkId());
        }
        store.commit(changes, chunkResources, embeddedChunkIds);
        log.info("Loaded corpus snapshot from {} (resources={}, chunks={}, embeddings={})",
                path, content.resources().size(), content.chunks().size(), content.embeddings().size());
        return store;
    }

    // ---- lifecycle

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    void ensureOpen() {
        if (closed) {
            throw new StoreConnectionException("Corpus store is closed");
        }
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }

    private static String orderKey(UUID resourceId, int order) {
        return resourceId + "#" + order;
    }

    private static String artifactKey(UUID resourceId, String parseSetting) {
        return resourceId + "#" + parseSetting;
    }

    private record PublishedChunk(Chunk chunk, long epoch) {
    }
}
