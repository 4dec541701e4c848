package com.hybridrag.lexical;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.hybridrag.corpus.Chunk;
import com.hybridrag.corpus.ScoredChunk;
import com.hybridrag.corpus.StagedChange;

public interface LexicalIndex {
    StagedChange stage(Chunk chunk);

    void remove(Collection<UUID> chunkIds);

    /** {@code resourceIds} of {@code null} searches every resource. */
    List<ScoredChunk> searchText(String query, LexicalField field, int limit, long snapshot, Set<UUID> resourceIds);

    default List<ScoredChunk> searchText(String query, LexicalField field, int limit, long snapshot) {
        return searchText(query, field, limit, snapshot, null);
    }

    int size();
}
