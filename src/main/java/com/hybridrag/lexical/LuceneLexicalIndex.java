package com.hybridrag.lexical;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.SynonymQuery;
import org.apache.lucene.search.TermInSetQuery;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.search.similarities.Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.corpus.Chunk;
import com.hybridrag.corpus.PublicationClock;
import com.hybridrag.corpus.ScoredChunk;
import com.hybridrag.corpus.StagedChange;
import com.hybridrag.corpus.StoreConnectionException;
import com.hybridrag.runtime.AppConfig;

public class LuceneLexicalIndex implements LexicalIndex, Closeable {
    private static final Logger log = LoggerFactory.getLogger(LuceneLexicalIndex.class);
    static final String CHUNK_ID = "chunk_id";
    static final String RESOURCE_ID = "resource_id";
    private static final int MIN_PAGE_SIZE = 16;
    // a trailing '?' is punctuation in natural-language queries, not a single-character wildcard
    private static final Pattern UNESCAPED_QUESTION_MARK = Pattern.compile("(?<!\\\\)\\?");

    private final Directory directory;
    private final Analyzer analyzer;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final PublicationClock publicationClock;
    private final Map<UUID, Long> publishedEpochs = new ConcurrentHashMap<>();

    public LuceneLexicalIndex(AppConfig.LexicalConfig config, PublicationClock publicationClock) throws IOException {
        this(new ByteBuffersDirectory(),
                LexicalAnalyzers.create(config.getAnalyzer()),
                new BM25Similarity((float) config.getBm25K1(), (float) config.getBm25B()),
                publicationClock);
    }

    LuceneLexicalIndex(Directory directory, Analyzer analyzer, Similarity similarity, PublicationClock publicationClock)
            throws IOException {
        this.directory = directory;
        this.analyzer = analyzer;
        this.publicationClock = publicationClock;
        IndexWriterConfig writerConfig = new IndexWriterConfig(analyzer);
        writerConfig.setSimilarity(similarity);
        writerConfig.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        this.writer = new IndexWriter(directory, writerConfig);
        this.searcherManager = new SearcherManager(writer, new SearcherFactory() {
            @Override
            public IndexSearcher newSearcher(IndexReader reader, IndexReader previousReader) {
                IndexSearcher searcher = new IndexSearcher(reader);
                searcher.setSimilarity(similarity);
                return searcher;
            }
        });
    }

    @Override
    public StagedChange stage(Chunk chunk) {
        Term idTerm = new Term(CHUNK_ID, chunk.id().toString());
        Document document = new Document();
        document.add(new StringField(CHUNK_ID, chunk.id().toString(), Field.Store.YES));
        document.add(new StringField(RESOURCE_ID, chunk.resourceId().toString(), Field.Store.NO));
        document.add(new TextField(LexicalField.TEXT.fieldName(), chunk.text(), Field.Store.NO));
        if (chunk.description() != null) {
            document.add(new TextField(LexicalField.DESCRIPTION.fieldName(), chunk.description(), Field.Store.NO));
        }
        try {
            writer.updateDocument(idTerm, document);
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new StoreConnectionException("Unable to index chunk " + chunk.id(), e);
        }
        return new StagedChange() {
            @Override
            public void publish(long epoch) {
                publishedEpochs.put(chunk.id(), epoch);
            }

            @Override
            public void rollback() {
                try {
                    writer.deleteDocuments(idTerm);
                    searcherManager.maybeRefreshBlocking();
                } catch (IOException e) {
                    throw new StoreConnectionException("Unable to roll back lexical entry for chunk " + chunk.id(), e);
                }
            }
        };
    }

    @Override
    public void remove(Collection<UUID> chunkIds) {
        if (chunkIds.isEmpty()) {
            return;
        }
        Term[] terms = chunkIds.stream()
                .map(id -> new Term(CHUNK_ID, id.toString()))
                .toArray(Term[]::new);
        try {
            writer.deleteDocuments(terms);
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new StoreConnectionException("Unable to remove lexical entries", e);
        }
        chunkIds.forEach(publishedEpochs::remove);
        log.debug("Removed {} lexical entries", chunkIds.size());
    }

    public List<ScoredChunk> searchText(String query, LexicalField field, int limit) {
        return searchText(query, field, limit, publicationClock.snapshot(), null);
    }

    /**
     * Ranked keyword search. Terms are combined with AND and quoted text is matched as a phrase. A non-null
     * {@code resourceIds} restricts hits to chunks of those resources. Hits are
     * collected page by page until {@code limit} visible hits are found, plus any hits tied with the last one, so
     * the chunk-id tie-break stays total.
     */
    @Override
    public List<ScoredChunk> searchText(String query, LexicalField field, int limit, long snapshot, Set<UUID> resourceIds) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Query parsed = parse(query, field);
        if (resourceIds != null) {
            if (resourceIds.isEmpty()) {
                return List.of();
            }
            List<BytesRef> terms = resourceIds.stream()
                    .map(id -> new BytesRef(id.toString()))
                    .toList();
            parsed = new BooleanQuery.Builder()
                    .add(parsed, BooleanClause.Occur.MUST)
                    .add(new TermInSetQuery(RESOURCE_ID, terms), BooleanClause.Occur.FILTER)
                    .build();
        }
        IndexSearcher searcher = acquire();
        try {
            StoredFields storedFields = searcher.storedFields();
            int pageSize = Math.max(limit, MIN_PAGE_SIZE);
            List<ScoredChunk> hits = new ArrayList<>();
            ScoreDoc after = null;
            boolean exhausted = false;
            while (!exhausted) {
                TopDocs page = after == null
                        ? searcher.search(parsed, pageSize)
                        : searcher.searchAfter(after, parsed, pageSize);
                for (ScoreDoc scoreDoc : page.scoreDocs) {
                    after = scoreDoc;
                    if (hits.size() >= limit && scoreDoc.score < hits.get(hits.size() - 1).score()) {
                        exhausted = true;
                        break;
                    }
                    UUID chunkId = UUID.fromString(storedFields.document(scoreDoc.doc).get(CHUNK_ID));
                    if (isVisible(chunkId, snapshot)) {
                        hits.add(new ScoredChunk(chunkId, scoreDoc.score));
                    }
                }
                if (page.scoreDocs.length < pageSize) {
                    exhausted = true;
                }
            }
            hits.sort(ScoredChunk.RANKING);
            return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
        } catch (IndexSearcher.TooManyClauses e) {
            throw new InvalidQueryException(query, e);
        } catch (IOException e) {
            throw new StoreConnectionException("Lexical search failed", e);
        } finally {
            release(searcher);
        }
    }

    @Override
    public int size() {
        return publishedEpochs.size();
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
        analyzer.close();
    }

    private Query parse(String query, LexicalField field) {
        QueryParser parser = new QueryParser(field.fieldName(), analyzer);
        parser.setDefaultOperator(QueryParser.Operator.AND);
        Query parsed;
        try {
            parsed = parser.parse(UNESCAPED_QUESTION_MARK.matcher(query).replaceAll("\\\\?"));
        } catch (ParseException e) {
            throw new InvalidQueryException(query, e);
        }
        requireSupported(parsed, field.fieldName(), query);
        return parsed;
    }

    /**
     * Only term, phrase and boolean queries on the requested field are accepted. Wildcards, fuzzy terms, ranges,
     * boosts, proximity and field prefixes are rejected.
     */
    private static void requireSupported(Query query, String field, String original) {
        if (query instanceof BooleanQuery booleanQuery) {
            for (BooleanClause clause : booleanQuery.clauses()) {
                requireSupported(clause.getQuery(), field, original);
            }
        } else if (query instanceof TermQuery termQuery) {
            requireField(termQuery.getTerm().field(), field, original);
        } else if (query instanceof PhraseQuery phraseQuery) {
            if (phraseQuery.getSlop() != 0) {
                throw new InvalidQueryException(original, "proximity search is not supported");
            }
            requireField(phraseQuery.getField(), field, original);
        } else if (query instanceof SynonymQuery synonymQuery) {
            requireField(synonymQuery.getField(), field, original);
        } else {
            throw new InvalidQueryException(original, "unsupported syntax (" + query.getClass().getSimpleName() + ")");
        }
    }

    private static void requireField(String actual, String expected, String original) {
        if (!expected.equals(actual)) {
            throw new InvalidQueryException(original, "field '" + actual + "' cannot be searched here");
        }
    }

    private boolean isVisible(UUID chunkId, long snapshot) {
        Long epoch = publishedEpochs.get(chunkId);
        return epoch != null && PublicationClock.isVisible(epoch, snapshot);
    }

    private IndexSearcher acquire() {
        try {
            return searcherManager.acquire();
        } catch (IOException e) {
            throw new StoreConnectionException("Unable to open lexical searcher", e);
        }
    }

    private void release(IndexSearcher searcher) {
        try {
            searcherManager.release(searcher);
        } catch (IOException e) {
            throw new StoreConnectionException("Unable to release lexical searcher", e);
        }
    }
}
