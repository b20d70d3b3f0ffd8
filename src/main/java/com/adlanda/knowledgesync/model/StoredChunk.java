package com.adlanda.knowledgesync.model;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A chunk of text from a source item, along with its embedding vector.
 *
 * @param id           Deterministic identifier derived from the item id and chunk index
 * @param sourceItemId Id of the source item this chunk belongs to
 * @param chunkIndex   0-based position of this chunk within the item
 * @param content      The text content of the chunk
 * @param embedding    Vector representation of the content (1536 dimensions for text-embedding-3-small)
 * @param metadata     Title, path, mime type and content hash of the source item
 */
public record StoredChunk(
        String id,
        String sourceItemId,
        int chunkIndex,
        String content,
        List<Double> embedding,
        Map<String, Object> metadata
) {
    /**
     * Creates a chunk without an embedding (before embedding is generated).
     */
    public static StoredChunk withoutEmbedding(String sourceItemId, int chunkIndex, String content,
                                               Map<String, Object> metadata) {
        return new StoredChunk(chunkId(sourceItemId, chunkIndex), sourceItemId, chunkIndex, content, null, metadata);
    }

    /**
     * Creates a new chunk with the given embedding.
     */
    public StoredChunk withEmbedding(List<Double> embedding) {
        return new StoredChunk(id, sourceItemId, chunkIndex, content, embedding, metadata);
    }

    /**
     * Returns true if this chunk has an embedding.
     */
    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }

    /**
     * Same item and index always map to the same id, so a replayed insert cannot duplicate a chunk.
     */
    public static String chunkId(String sourceItemId, int chunkIndex) {
        return UUID.nameUUIDFromBytes((sourceItemId + "#" + chunkIndex).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
