package com.hybridrag.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.corpus.CorpusStore;
import com.hybridrag.corpus.PublicationClock;
import com.hybridrag.corpus.StoreConnectionException;
import com.hybridrag.ingest.IngestionPipeline;
import com.hybridrag.lexical.LuceneLexicalIndex;
import com.hybridrag.search.HybridRetrievalService;
import com.hybridrag.vector.LocalVectorIndex;

public final class HybridRagEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HybridRagEngine.class);

    private final Path snapshotPath;
    private final CorpusStore corpusStore;
    private final LuceneLexicalIndex lexicalIndex;
    private final LocalVectorIndex vectorIndex;
    private final IngestionPipeline ingestionPipeline;
    private final HybridRetrievalService retrievalService;
    private final ExecutorService searchExecutor;

    private HybridRagEngine(Path snapshotPath, CorpusStore corpusStore, AppConfig config) throws IOException {
        this.snapshotPath = snapshotPath;
        this.corpusStore = corpusStore;
        this.lexicalIndex = new LuceneLexicalIndex(config.getLexical(), corpusStore.publicationClock());
        this.vectorIndex = new LocalVectorIndex(config.getVector(), corpusStore.publicationClock());
        this.ingestionPipeline = new IngestionPipeline(corpusStore, lexicalIndex, vectorIndex);
        this.searchExecutor = Executors.newFixedThreadPool(Math.max(1, config.getSearch().getThreads()), searchThreadFactory());
        this.retrievalService = new HybridRetrievalService(corpusStore, lexicalIndex, vectorIndex, searchExecutor, config.getSearch());
    }

    public static HybridRagEngine open(AppConfig config) throws IOException {
        return open(config, Clock.systemUTC());
    }

    public static HybridRagEngine open(AppConfig config, Clock clock) throws IOException {
        String configuredPath = config.getStore().getSnapshotPath();
        PublicationClock publicationClock = new PublicationClock();
        if (configuredPath == null || configuredPath.isBlank()) {
            return new HybridRagEngine(null, new CorpusStore(publicationClock, clock), config);
        }
        Path path = Path.of(configuredPath);
        HybridRagEngine engine = new HybridRagEngine(path, CorpusStore.load(path, publicationClock, clock), config);
        engine.ingestionPipeline.rebuildIndices();
        return engine;
    }

    public IngestionPipeline ingestion() {
        return ingestionPipeline;
    }

    public HybridRetrievalService retrieval() {
        return retrievalService;
    }

    public CorpusStore corpusStore() {
        return corpusStore;
    }

    public LocalVectorIndex vectorIndex() {
        return vectorIndex;
    }

    /** Writes the corpus to the configured snapshot path; a no-op for in-memory engines. */
    public void save() throws IOException {
        if (snapshotPath == null) {
            log.debug("No snapshot path configured, skipping save");
            return;
        }
        corpusStore.save(snapshotPath);
    }

    @Override
    public void close() {
        searchExecutor.shutdownNow();
        try {
            if (!searchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Search executor did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            lexicalIndex.close();
        } catch (IOException e) {
            throw new StoreConnectionException("Unable to close lexical index", e);
        } finally {
            corpusStore.close();
        }
    }

    private static ThreadFactory searchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "hybrid-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
