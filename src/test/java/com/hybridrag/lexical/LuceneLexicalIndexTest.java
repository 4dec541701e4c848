package com.hybridrag.lexical;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.hybridrag.corpus.Chunk;
import com.hybridrag.corpus.PublicationClock;
import com.hybridrag.corpus.ScoredChunk;
import com.hybridrag.corpus.StagedChange;
import com.hybridrag.runtime.AppConfig;

class LuceneLexicalIndexTest {
    private static final UUID RESOURCE = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private PublicationClock clock;
    private LuceneLexicalIndex index;

    @BeforeEach
    void setUp() throws Exception {
        clock = new PublicationClock();
        index = new LuceneLexicalIndex(new AppConfig.LexicalConfig(), clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        index.close();
    }

    @Test
    void shouldRankByBm25AndRequireEveryTerm() {
        Chunk strong = publish("rust memory safety rust ownership", null);
        Chunk weak = publish("rust memory model and a lot of unrelated words about other languages entirely", null);
        publish("python memory management", null);

        List<ScoredChunk> results = index.searchText("rust memory", LexicalField.TEXT, 10);

        assertEquals(List.of(strong.id(), weak.id()), results.stream().map(ScoredChunk::chunkId).toList());
        assertTrue(results.get(0).score() > results.get(1).score());
    }

    @Test
    void shouldMatchPhrasesAndExclusions() {
        Chunk phrase = publish("borrow checker rules", null);
        Chunk scattered = publish("checker of the borrow", null);

        assertEquals(List.of(phrase.id()), ids(index.searchText("\"borrow checker\"", LexicalField.TEXT, 10)));
        assertEquals(List.of(scattered.id()), ids(index.searchText("borrow -rules", LexicalField.TEXT, 10)));
        assertEquals(2, index.searchText("rules OR scattered OR of", LexicalField.TEXT, 10).size());
    }

    @Test
    void shouldSearchDescriptionField() {
        Chunk described = publish("plain text body", "architecture diagram");
        publish("architecture notes", null);

        assertEquals(List.of(described.id()), ids(index.searchText("diagram", LexicalField.DESCRIPTION, 10)));
        assertTrue(index.searchText("diagram", LexicalField.TEXT, 10).isEmpty());
    }

    @Test
    void shouldBreakEqualScoresByChunkId() {
        Chunk first = publish("identical words here", null);
        Chunk second = publish("identical words here", null);
        List<UUID> expected = first.id().toString().compareTo(second.id().toString()) < 0
                ? List.of(first.id(), second.id())
                : List.of(second.id(), first.id());

        assertEquals(expected, ids(index.searchText("identical", LexicalField.TEXT, 10)));
        assertEquals(expected.subList(0, 1), ids(index.searchText("identical", LexicalField.TEXT, 1)));
    }

    @Test
    void shouldReturnEmptyForBlankQuery() {
        publish("anything", null);

        assertTrue(index.searchText("   ", LexicalField.TEXT, 10).isEmpty());
        assertTrue(index.searchText(null, LexicalField.TEXT, 10).isEmpty());
    }

    @Test
    void shouldRejectMalformedQueries() {
        publish("rust", null);

        assertThrows(InvalidQueryException.class, () -> index.searchText("rust AND", LexicalField.TEXT, 10));
        assertThrows(InvalidQueryException.class, () -> index.searchText("\"unbalanced quote", LexicalField.TEXT, 10));
    }

    @Test
    void shouldRejectSyntaxBeyondTermsPhrasesAndBooleans() {
        publish("rust memory safety", "described rust");

        for (String query : List.of("rus*", "ru?t*", "rust~", "[a TO z]", "rust^5", "\"rust memory\"~2", "*:*",
                "description:described", "chunk_id:abc", "/ru.t/")) {
            assertThrows(InvalidQueryException.class, () -> index.searchText(query, LexicalField.TEXT, 10), query);
        }
        assertThrows(InvalidQueryException.class, () -> index.searchText("text:rust", LexicalField.DESCRIPTION, 10));
        assertEquals(1, index.searchText("text:rust", LexicalField.TEXT, 10).size());
    }

    @Test
    void shouldTreatQuestionMarkAsPunctuation() {
        Chunk chunk = publish("what is rust and why does it matter", null);

        assertEquals(List.of(chunk.id()), ids(index.searchText("what is rust?", LexicalField.TEXT, 10)));
        assertEquals(List.of(chunk.id()), ids(index.searchText("rust?", LexicalField.TEXT, 10)));
    }

    @Test
    void shouldRestrictHitsToGivenResources() {
        UUID otherResource = UUID.randomUUID();
        Chunk mine = publish("shared keyword here", null);
        Chunk other = publish(chunk(otherResource, "shared keyword there", null));

        assertEquals(List.of(other.id()),
                ids(index.searchText("shared", LexicalField.TEXT, 10, clock.snapshot(), Set.of(otherResource))));
        assertEquals(List.of(mine.id()),
                ids(index.searchText("shared", LexicalField.TEXT, 10, clock.snapshot(), Set.of(RESOURCE))));
        assertTrue(index.searchText("shared", LexicalField.TEXT, 10, clock.snapshot(), Set.of()).isEmpty());
        assertEquals(2, index.searchText("shared", LexicalField.TEXT, 10).size());
    }

    @Test
    void shouldHideStagedDocumentsAndDropRolledBackOnes() {
        Chunk chunk = chunk("staged only", null);
        StagedChange change = index.stage(chunk);

        assertTrue(index.searchText("staged", LexicalField.TEXT, 10).isEmpty());

        change.rollback();
        clock.publish(epoch -> {
        });
        assertTrue(index.searchText("staged", LexicalField.TEXT, 10).isEmpty());
        assertEquals(0, index.size());
    }

    @Test
    void shouldIgnoreDocumentsNewerThanSnapshot() {
        Chunk old = publish("versioned content", null);
        long snapshot = clock.snapshot();
        publish("versioned content again", null);

        assertEquals(List.of(old.id()), ids(index.searchText("versioned", LexicalField.TEXT, 10, snapshot)));
        assertEquals(2, index.searchText("versioned", LexicalField.TEXT, 10).size());
    }

    @Test
    void shouldRemoveDocuments() {
        Chunk chunk = publish("removable text", null);

        index.remove(List.of(chunk.id()));

        assertTrue(index.searchText("removable", LexicalField.TEXT, 10).isEmpty());
        assertEquals(0, index.size());
    }

    @Test
    void shouldRejectUnknownAnalyzer() {
        assertThrows(IllegalArgumentException.class, () -> LexicalAnalyzers.create("klingon"));
    }

    private Chunk publish(String text, String description) {
        return publish(chunk(text, description));
    }

    private Chunk publish(Chunk chunk) {
        StagedChange change = index.stage(chunk);
        clock.publish(change::publish);
        return chunk;
    }

    private static Chunk chunk(String text, String description) {
        return chunk(RESOURCE, text, description);
    }

    private static Chunk chunk(UUID resourceId, String text, String description) {
        return new Chunk(UUID.randomUUID(), resourceId, null, null, null, 0, null, text, description, NOW, NOW);
    }

    private static List<UUID> ids(List<ScoredChunk> results) {
        return results.stream().map(ScoredChunk::chunkId).toList();
    }
}
