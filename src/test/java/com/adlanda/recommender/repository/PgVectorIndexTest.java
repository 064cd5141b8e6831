package com.adlanda.recommender.repository;

import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.ItemMetadata;
import com.adlanda.recommender.model.ScoredItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PgVectorIndex.
 * Verifies the SQL issued and the translation of data access failures.
 */
@ExtendWith(MockitoExtension.class)
class PgVectorIndexTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private PgVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new PgVectorIndex(jdbcTemplate);
    }

    @Test
    void initializeSchema_createsExtensionAndTable() {
        index.initializeSchema();

        verify(jdbcTemplate).execute(PgVectorIndex.CREATE_EXTENSION_SQL);
        verify(jdbcTemplate).execute(PgVectorIndex.CREATE_TABLE_SQL);
    }

    @Test
    void upsert_bindsVectorLiteralAndMetadata() {
        ItemMetadata metadata = new ItemMetadata("Title", "Summary", "STEM", "Provider", "Lagos",
                LocalDate.of(2024, 6, 30), "hash");

        index.upsert("a", new float[]{1.0f, 0.5f}, metadata, T0);

        verify(jdbcTemplate).update(PgVectorIndex.UPSERT_SQL,
                "a", "[1.0,0.5]", "Title", "Summary", "STEM", "Provider", "Lagos",
                Date.valueOf(LocalDate.of(2024, 6, 30)), "hash", Timestamp.from(T0));
    }

    @Test
    void upsertSql_onlyOverwritesOlderRecords() {
        assertThat(PgVectorIndex.UPSERT_SQL)
                .contains("ON CONFLICT (item_id) DO UPDATE")
                .contains("WHERE item_embeddings.updated_at <= EXCLUDED.updated_at");
    }

    @Test
    void upsert_emptyVector_throwsException() {
        ItemMetadata metadata = new ItemMetadata("T", null, null, null, null, null, "h");

        assertThatThrownBy(() -> index.upsert("a", new float[0], metadata, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void delete_existingRow_returnsTrue() {
        when(jdbcTemplate.update(PgVectorIndex.DELETE_SQL, "a")).thenReturn(1);

        assertThat(index.delete("a")).isTrue();
    }

    @Test
    void delete_missingRow_returnsFalse() {
        when(jdbcTemplate.update(PgVectorIndex.DELETE_SQL, "missing")).thenReturn(0);

        assertThat(index.delete("missing")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void query_passesDimensionThresholdAndLimit() {
        ScoredItem hit = new ScoredItem("a", 0.9, null, T0);
        when(jdbcTemplate.query(eq(PgVectorIndex.QUERY_SQL), any(RowMapper.class),
                eq("[1.0,0.0]"), eq(2), eq("[1.0,0.0]"), eq(0.6), eq(5)))
                .thenReturn(List.of(hit));

        List<ScoredItem> results = index.query(new float[]{1.0f, 0.0f}, 5, 0.6);

        assertThat(results).containsExactly(hit);
    }

    @Test
    void query_nonPositiveK_skipsDatabase() {
        assertThat(index.query(new float[]{1.0f}, 0, 0.5)).isEmpty();
    }

    @Test
    void querySql_ordersBySimilarityThenRecency() {
        assertThat(PgVectorIndex.QUERY_SQL).contains("ORDER BY similarity DESC, updated_at DESC");
    }

    @Test
    void listIds_databaseDown_throwsStoreUnavailable() {
        when(jdbcTemplate.queryForList(PgVectorIndex.LIST_IDS_SQL, String.class))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> index.listIds())
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("list ids");
    }

    @Test
    void listIds_returnsAllIds() {
        when(jdbcTemplate.queryForList(PgVectorIndex.LIST_IDS_SQL, String.class)).thenReturn(List.of("a", "b"));

        assertThat(index.listIds()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void count_returnsRowCount() {
        when(jdbcTemplate.queryForObject(PgVectorIndex.COUNT_SQL, Long.class)).thenReturn(3L);

        assertThat(index.count()).isEqualTo(3L);
    }

    @Test
    void vectorLiteral_parsesPgvectorTextOutput() {
        assertThat(PgVectorIndex.parseVectorLiteral("[0.25,-1,3.5]")).containsExactly(0.25f, -1f, 3.5f);
        assertThat(PgVectorIndex.toVectorLiteral(new float[]{0.25f, -1f})).isEqualTo("[0.25,-1.0]");
    }
}
