package com.adlanda.knowledgesync.repository;

import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.model.StoredChunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PgVectorChunkStore.
 * Tests SQL issued for chunk replacement and vector literal handling.
 */
@ExtendWith(MockitoExtension.class)
class PgVectorChunkStoreTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private SyncProperties properties;
    private PgVectorChunkStore store;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        store = new PgVectorChunkStore(jdbcTemplate, new ObjectMapper(), properties);
    }

    @Test
    void deleteBySourceItem_executesCorrectSql() {
        when(jdbcTemplate.update(anyString(), eq("docs/a.md"))).thenReturn(3);

        int deleted = store.deleteBySourceItem("docs/a.md");

        assertThat(deleted).isEqualTo(3);
        verify(jdbcTemplate).update("DELETE FROM document_chunks WHERE source_item_id = ?", "docs/a.md");
    }

    @Test
    @SuppressWarnings("unchecked")
    void insertAll_writesOneBatchRowPerChunk() {
        StoredChunk chunk = StoredChunk.withoutEmbedding("docs/a.md", 0, "Hello", Map.of("title", "a.md"))
                .withEmbedding(List.of(0.25, -1.0));

        store.insertAll(List.of(chunk));

        ArgumentCaptor<List<Object[]>> rows = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(eq(PgVectorChunkStore.INSERT_SQL), rows.capture());
        Object[] row = rows.getValue().get(0);
        assertThat(row[0]).isEqualTo(chunk.id());
        assertThat(row[1]).isEqualTo("docs/a.md");
        assertThat(row[2]).isEqualTo(0);
        assertThat(row[4]).isEqualTo("{\"title\":\"a.md\"}");
        assertThat(row[5]).isEqualTo("[0.25,-1.0]");
    }

    @Test
    void insertAll_chunkWithoutEmbedding_isRejected() {
        StoredChunk chunk = StoredChunk.withoutEmbedding("docs/a.md", 0, "Hello", Map.of());

        assertThatThrownBy(() -> store.insertAll(List.of(chunk))).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void insertAll_emptyList_doesNothing() {
        store.insertAll(List.of());

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void initializeSchema_createsTableWithConfiguredDimensions() {
        properties.getStore().setDimensions(768);

        store.initializeSchema();

        verify(jdbcTemplate).execute("CREATE EXTENSION IF NOT EXISTS vector");
        verify(jdbcTemplate).execute(contains("embedding vector(768)"));
    }

    @Test
    void initializeSchema_disabled_issuesNoDdl() {
        properties.getStore().setInitializeSchema(false);

        store.initializeSchema();

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void parseVector_readsPostgresLiteral() {
        assertThat(PgVectorChunkStore.parseVector("[0.5,1,-2.25]")).containsExactly(0.5, 1.0, -2.25);
        assertThat(PgVectorChunkStore.parseVector(null)).isNull();
    }
}
