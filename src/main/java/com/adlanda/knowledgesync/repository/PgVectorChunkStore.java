package com.adlanda.knowledgesync.repository;

import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.model.StoredChunk;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PostgreSQL chunk store using the PGVector extension.
 *
 * Embeddings are computed by the caller and written as {@code vector} literals,
 * so storing a chunk never triggers a second embedding call.
 */
@Repository
@ConditionalOnProperty(name = "sync.store.type", havingValue = "pgvector", matchIfMissing = true)
public class PgVectorChunkStore implements ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(PgVectorChunkStore.class);

    static final String DELETE_SQL = "DELETE FROM document_chunks WHERE source_item_id = ?";

    static final String INSERT_SQL = """
            INSERT INTO document_chunks (id, source_item_id, chunk_index, content, metadata, embedding)
            VALUES (?::uuid, ?, ?, ?, ?::jsonb, ?::vector)
            """;

    static final String SELECT_SQL = """
            SELECT id, source_item_id, chunk_index, content, metadata::text AS metadata, embedding::text AS embedding
            FROM document_chunks WHERE source_item_id = ? ORDER BY chunk_index
            """;

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final SyncProperties properties;

    public PgVectorChunkStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SyncProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    void initializeSchema() {
        if (!properties.getStore().isInitializeSchema()) {
            return;
        }
        int dimensions = properties.getStore().getDimensions();
        jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS document_chunks (
                    id uuid PRIMARY KEY,
                    source_item_id varchar(500) NOT NULL,
                    chunk_index int NOT NULL,
                    content text NOT NULL,
                    metadata jsonb,
                    embedding vector(%d),
                    created_at timestamptz NOT NULL DEFAULT now(),
                    UNIQUE (source_item_id, chunk_index)
                )
                """.formatted(dimensions));
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_document_chunks_source ON document_chunks (source_item_id)");
        log.info("Chunk table ready (vector dimensions: {})", dimensions);
    }

    @Override
    public int deleteBySourceItem(String sourceItemId) {
        int deleted = jdbcTemplate.update(DELETE_SQL, sourceItemId);
        log.debug("Deleted {} chunks for {}", deleted, sourceItemId);
        return deleted;
    }

    @Override
    public void insertAll(List<StoredChunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }

        List<Object[]> rows = new ArrayList<>(chunks.size());
        for (StoredChunk chunk : chunks) {
            if (!chunk.hasEmbedding()) {
                throw new IllegalArgumentException("Cannot store chunk without embedding");
            }
            rows.add(new Object[]{
                    chunk.id(),
                    chunk.sourceItemId(),
                    chunk.chunkIndex(),
                    chunk.content(),
                    toJson(chunk.metadata()),
                    toVectorLiteral(chunk.embedding())
            });
        }

        jdbcTemplate.batchUpdate(INSERT_SQL, rows);
        log.debug("Stored {} chunks in document_chunks", chunks.size());
    }

    /**
     * Delete and insert run in one transaction, so readers never see an item half-replaced.
     */
    @Override
    @Transactional
    public void replace(String sourceItemId, List<StoredChunk> chunks) {
        deleteBySourceItem(sourceItemId);
        insertAll(chunks);
    }

    @Override
    public List<StoredChunk> findBySourceItem(String sourceItemId) {
        return jdbcTemplate.query(SELECT_SQL, this::mapRow, sourceItemId);
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM document_chunks", Long.class);
        return count != null ? count : 0L;
    }

    private StoredChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new StoredChunk(
                rs.getString("id"),
                rs.getString("source_item_id"),
                rs.getInt("chunk_index"),
                rs.getString("content"),
                parseVector(rs.getString("embedding")),
                parseMetadata(rs.getString("metadata"))
        );
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Chunk metadata is not serializable", e);
        }
    }

    private Map<String, Object> parseMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable chunk metadata: {}", e.getMessage());
            return Map.of();
        }
    }

    static String toVectorLiteral(List<Double> embedding) {
        return embedding.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",", "[", "]"));
    }

    static List<Double> parseVector(String literal) {
        if (literal == null || literal.length() < 2) {
            return null;
        }
        String body = literal.substring(1, literal.length() - 1).trim();
        if (body.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(body.split(","))
                .map(String::trim)
                .map(Double::valueOf)
                .toList();
    }
}
