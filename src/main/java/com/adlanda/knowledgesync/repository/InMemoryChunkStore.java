package com.adlanda.knowledgesync.repository;

import com.adlanda.knowledgesync.model.StoredChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local chunk store.
 *
 * Selected with {@code sync.store.type=memory}; useful for trying the sync side
 * without PostgreSQL. Contents are lost on restart, so pair it with a fresh checkpoint.
 */
@Repository
@ConditionalOnProperty(name = "sync.store.type", havingValue = "memory")
public class InMemoryChunkStore implements ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChunkStore.class);

    private final Map<String, StoredChunk> chunks = new ConcurrentHashMap<>();

    @Override
    public int deleteBySourceItem(String sourceItemId) {
        List<String> ids = chunks.values().stream()
                .filter(chunk -> chunk.sourceItemId().equals(sourceItemId))
                .map(StoredChunk::id)
                .toList();
        ids.forEach(chunks::remove);
        return ids.size();
    }

    @Override
    public void insertAll(List<StoredChunk> chunksToStore) {
        for (StoredChunk chunk : chunksToStore) {
            if (!chunk.hasEmbedding()) {
                throw new IllegalArgumentException("Cannot store chunk without embedding");
            }
            chunks.put(chunk.id(), chunk);
        }
        log.debug("Stored {} chunks in memory", chunksToStore.size());
    }

    @Override
    public synchronized void replace(String sourceItemId, List<StoredChunk> newChunks) {
        deleteBySourceItem(sourceItemId);
        insertAll(newChunks);
    }

    @Override
    public List<StoredChunk> findBySourceItem(String sourceItemId) {
        return chunks.values().stream()
                .filter(chunk -> chunk.sourceItemId().equals(sourceItemId))
                .sorted(Comparator.comparingInt(StoredChunk::chunkIndex))
                .toList();
    }

    @Override
    public long count() {
        return chunks.size();
    }

    /**
     * Clears all chunks from the store.
     */
    public void clear() {
        chunks.clear();
    }
}
