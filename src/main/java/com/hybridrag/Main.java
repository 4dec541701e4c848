package com.hybridrag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hybridrag.corpus.Chunk;
import com.hybridrag.corpus.ChunkDraft;
import com.hybridrag.corpus.ContentHashes;
import com.hybridrag.corpus.CorpusStatistics;
import com.hybridrag.corpus.EmbeddingKind;
import com.hybridrag.corpus.Resource;
import com.hybridrag.corpus.ResourceDraft;
import com.hybridrag.corpus.ScoredChunk;
import com.hybridrag.ingest.EmbeddingService;
import com.hybridrag.ingest.HashingEmbeddingService;
import com.hybridrag.lexical.LexicalField;
import com.hybridrag.runtime.AppConfig;
import com.hybridrag.runtime.HybridRagEngine;
import com.hybridrag.search.HybridSearchHit;
import com.hybridrag.search.HybridSearchRequest;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

@Command(
        name = "hybrid-rag",
        mixinStandardHelpOptions = true,
        version = "hybrid-rag 0.1.0",
        description = "Ingest resources and chunks into a local corpus and run lexical, vector and hybrid searches.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_DOMAIN_ERROR = 3;
    static final int CLI_EMBEDDING_DIMENSION = 256;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: stats, ingest-resource, ingest-chunk, search-text, search-vector, search, list-resources",
            defaultValue = "stats", converter = ModeConverter.class)
    Mode mode;

    @Option(names = "--snapshot", description = "Corpus snapshot path, overrides store.snapshotPath")
    Path snapshotPath;

    @Option(names = "--url", description = "Source URL of the resource")
    String url;

    @Option(names = "--title", description = "Resource title")
    String title;

    @Option(names = "--category", description = "Resource category tag; restricts the search modes to that category")
    String category;

    @Option(names = "--resource-id", description = "Resource id for ingest-chunk (alternative to --url)")
    UUID resourceId;

    @Option(names = "--order", description = "Chunk position within the resource; defaults to the next free position")
    Integer order;

    @Option(names = "--text", description = "Chunk text, or resource content to fingerprint in ingest-resource")
    String text;

    @Option(names = "--description", description = "Chunk description")
    String description;

    @Option(names = "--query", description = "Query text used by the search modes")
    String query;

    @Option(names = "--vector-file", description = "JSON file holding the query vector for search-vector, as an array or {\"embedding\": [...]}")
    Path vectorFile;

    @Option(names = "--model", description = "Embedding model for search-vector, defaults to the built-in hashing embedder")
    String model;

    @Option(names = "--field", description = "Lexical field for search-text: ${COMPLETION-CANDIDATES}", defaultValue = "TEXT")
    LexicalField field;

    @Option(names = "--kind", description = "Embedding kind for search and search-vector: ${COMPLETION-CANDIDATES}", defaultValue = "CHUNK")
    EmbeddingKind kind;

    @Option(names = "--text-weight", description = "Weight of the lexical score, defaults to search.defaultTextWeight")
    Double textWeight;

    @Option(names = "--vector-weight", description = "Weight of the vector score, defaults to search.defaultVectorWeight")
    Double vectorWeight;

    @Option(names = "--threshold", description = "Minimum cosine similarity, -1 keeps everything", defaultValue = "-1")
    double threshold;

    @Option(names = "--limit", description = "Maximum number of results, defaults to search.defaultLimit")
    Integer limit;

    private final EmbeddingService embeddingService = new HashingEmbeddingService(CLI_EMBEDDING_DIMENSION);

    enum Mode {
        STATS("stats", false),
        INGEST_RESOURCE("ingest-resource", true),
        INGEST_CHUNK("ingest-chunk", true),
        SEARCH_TEXT("search-text", false),
        SEARCH_VECTOR("search-vector", false),
        SEARCH("search", false),
        LIST_RESOURCES("list-resources", false);

        private final String label;
        private final boolean writes;

        Mode(String label, boolean writes) {
            this.label = label;
            this.writes = writes;
        }

        static Mode fromLabel(String value) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (Mode candidate : values()) {
                if (candidate.label.equals(normalized)) {
                    return candidate;
                }
            }
            throw new IllegalArgumentException("Unknown mode '" + value + "'");
        }

        @Override
        public String toString() {
            return label;
        }
    }

    public static class ModeConverter implements ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            try {
                return Mode.fromLabel(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        if (snapshotPath != null) {
            config.getStore().setSnapshotPath(snapshotPath.toString());
        }
        log.info("Starting hybrid-rag in {} mode", mode);
        log.info("Using config file: {} snapshot: {}", configPath, config.getStore().getSnapshotPath());

        try (HybridRagEngine engine = HybridRagEngine.open(config)) {
            int exitCode = run(engine, config);
            if (exitCode == EXIT_OK && mode.writes) {
                engine.save();
            }
            return exitCode;
        } catch (HybridRagException e) {
            log.error("{} failed: {}", mode, e.getMessage());
            return EXIT_DOMAIN_ERROR;
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments for {}: {}", mode, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
    }

    private int run(HybridRagEngine engine, AppConfig config) {
        switch (mode) {
            case STATS:
                return printStatistics(engine.retrieval().getStatistics());
            case INGEST_RESOURCE:
                return ingestResource(engine);
            case INGEST_CHUNK:
                return ingestChunk(engine);
            case SEARCH_TEXT:
                return searchText(engine, config);
            case SEARCH_VECTOR:
                return searchVector(engine, config);
            case SEARCH:
                return search(engine, config);
            case LIST_RESOURCES:
                return listResources(engine, config);
            default:
                throw new IllegalStateException("Unhandled mode " + mode);
        }
    }

    private int printStatistics(CorpusStatistics statistics) {
        log.info("Corpus resources={} chunks={} images={} parsedArtifacts={} embeddings={}",
                statistics.resourceCount(),
                statistics.chunkCount(),
                statistics.imageCount(),
                statistics.parsedArtifactCount(),
                statistics.embeddingCount());
        statistics.countsByCategory().forEach((name, count) -> log.info("Category {} resources={}", name, count));
        return EXIT_OK;
    }

    private int ingestResource(HybridRagEngine engine) {
        if (url == null || url.isBlank()) {
            log.error("--url is required in ingest-resource mode");
            return EXIT_USAGE_ERROR;
        }
        ResourceDraft draft = ResourceDraft.of(url, title, category);
        if (text != null) {
            draft = draft.withContentSha256(ContentHashes.sha256Hex(text));
        }
        Resource resource = engine.ingestion().ingestResource(draft);
        log.info("Resource id={} url={} title={}", resource.id(), resource.sourceUrl(), resource.title());
        return EXIT_OK;
    }

    private int ingestChunk(HybridRagEngine engine) {
        if (text == null) {
            log.error("--text is required in ingest-chunk mode");
            return EXIT_USAGE_ERROR;
        }
        Optional<UUID> owner = resolveResourceId(engine);
        if (owner.isEmpty()) {
            log.error("--resource-id or the --url of an ingested resource is required in ingest-chunk mode");
            return EXIT_USAGE_ERROR;
        }
        int position = order != null ? order : engine.corpusStore().nextChunkOrder(owner.get());
        Chunk chunk = engine.ingestion().ingestChunk(ChunkDraft.of(owner.get(), position, text, description), embeddingService);
        log.info("Chunk id={} resource={} order={}", chunk.id(), chunk.resourceId(), chunk.order());
        return EXIT_OK;
    }

    private int searchText(HybridRagEngine engine, AppConfig config) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search-text mode");
            return EXIT_USAGE_ERROR;
        }
        logScored(engine, engine.retrieval().searchText(query, field, resolveLimit(config), category, null));
        return EXIT_OK;
    }

    private int searchVector(HybridRagEngine engine, AppConfig config) {
        if (vectorFile == null) {
            log.error("--vector-file is required in search-vector mode");
            return EXIT_USAGE_ERROR;
        }
        float[] queryVector;
        try {
            queryVector = readVector(vectorFile);
        } catch (IOException e) {
            log.error("Unable to read query vector from {}: {}", vectorFile, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        String searchModel = model != null ? model : embeddingService.model();
        logScored(engine, engine.retrieval().searchVector(queryVector, kind, searchModel, threshold, resolveLimit(config), category, null));
        return EXIT_OK;
    }

    private void logScored(HybridRagEngine engine, List<ScoredChunk> results) {
        for (int i = 0; i < results.size(); i++) {
            ScoredChunk result = results.get(i);
            String snippet = engine.corpusStore().getChunk(result.chunkId()).map(chunk -> snippet(chunk.text())).orElse("");
            log.info("Result #{} score={} chunk={} text={}",
                    i + 1,
                    String.format("%.4f", result.score()),
                    result.chunkId(),
                    snippet);
        }
    }

    private int search(HybridRagEngine engine, AppConfig config) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return EXIT_USAGE_ERROR;
        }
        HybridSearchRequest request = new HybridSearchRequest(
                query,
                embeddingService.embed(query),
                kind,
                embeddingService.model(),
                textWeight != null ? textWeight : config.getSearch().getDefaultTextWeight(),
                vectorWeight != null ? vectorWeight : config.getSearch().getDefaultVectorWeight(),
                resolveLimit(config),
                threshold,
                null,
                category);
        List<HybridSearchHit> hits = engine.retrieval().hybridSearch(request);
        for (int i = 0; i < hits.size(); i++) {
            HybridSearchHit hit = hits.get(i);
            log.info("Result #{} combined={} text={} vector={} chunk={} snippet={}",
                    i + 1,
                    String.format("%.4f", hit.combinedScore()),
                    String.format("%.4f", hit.textScore()),
                    String.format("%.4f", hit.vectorScore()),
                    hit.chunkId(),
                    snippet(hit.text()));
        }
        return EXIT_OK;
    }

    private int listResources(HybridRagEngine engine, AppConfig config) {
        List<Resource> resources = category == null
                ? engine.corpusStore().listResources(resolveLimit(config))
                : engine.corpusStore().getResourcesByCategory(category, resolveLimit(config));
        for (Resource resource : resources) {
            log.info("Resource id={} category={} url={} title={}",
                    resource.id(), resource.category(), resource.sourceUrl(), resource.title());
        }
        return EXIT_OK;
    }

    private Optional<UUID> resolveResourceId(HybridRagEngine engine) {
        if (resourceId != null) {
            return Optional.of(resourceId);
        }
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        return engine.corpusStore().getResourceByUrl(url).map(Resource::id);
    }

    private int resolveLimit(AppConfig config) {
        return limit != null ? limit : config.getSearch().getDefaultLimit();
    }

    private static String snippet(String value) {
        String flattened = value.replaceAll("\\s+", " ").strip();
        return flattened.length() <= 80 ? flattened : flattened.substring(0, 77) + "...";
    }

    private static float[] readVector(Path file) throws IOException {
        JsonNode root = new ObjectMapper().readTree(file.toFile());
        JsonNode values = root != null && root.isObject() ? root.get("embedding") : root;
        if (values == null || !values.isArray() || values.isEmpty()) {
            throw new IOException("expected a non-empty JSON array or an object with an \"embedding\" array");
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = values.get(i);
            if (!value.isNumber()) {
                throw new IOException("element " + i + " is not a number");
            }
            vector[i] = value.floatValue();
        }
        return vector;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
