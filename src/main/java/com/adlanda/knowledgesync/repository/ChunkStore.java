package com.adlanda.knowledgesync.repository;

import com.adlanda.knowledgesync.model.StoredChunk;

import java.util.List;

/**
 * Chunk/content store with insert and delete-by-source operations.
 */
public interface ChunkStore {

    /**
     * Deletes every chunk of a source item.
     *
     * @return number of chunks deleted
     */
    int deleteBySourceItem(String sourceItemId);

    /**
     * Inserts chunks. Each chunk must carry an embedding.
     */
    void insertAll(List<StoredChunk> chunks);

    /**
     * Replaces all chunks of a source item with the given set.
     */
    default void replace(String sourceItemId, List<StoredChunk> chunks) {
        deleteBySourceItem(sourceItemId);
        insertAll(chunks);
    }

    /**
     * Chunks of one source item ordered by chunk index.
     */
    List<StoredChunk> findBySourceItem(String sourceItemId);

    long count();
}
