package com.adlanda.recommender.repository;

import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.EmbeddingRecord;
import com.adlanda.recommender.model.ItemMetadata;
import com.adlanda.recommender.model.ScoredItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * PostgreSQL vector index using the pgvector extension.
 *
 * Vectors are bound as text literals ({@code [0.1,0.2,...]}) and cast to
 * {@code vector}. Similarity is {@code 1 - cosine distance}.
 */
public class PgVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);

    static final String TABLE = "item_embeddings";

    static final String CREATE_EXTENSION_SQL = "CREATE EXTENSION IF NOT EXISTS vector";

    static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS item_embeddings (
                item_id      TEXT PRIMARY KEY,
                embedding    vector NOT NULL,
                title        TEXT,
                summary      TEXT,
                category     TEXT,
                provider     TEXT,
                location     TEXT,
                deadline     DATE,
                content_hash VARCHAR(64),
                updated_at   TIMESTAMPTZ NOT NULL
            )""";

    static final String UPSERT_SQL = """
            INSERT INTO item_embeddings
                (item_id, embedding, title, summary, category, provider, location, deadline, content_hash, updated_at)
            VALUES (?, ?::vector, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (item_id) DO UPDATE SET
                embedding = EXCLUDED.embedding,
                title = EXCLUDED.title,
                summary = EXCLUDED.summary,
                category = EXCLUDED.category,
                provider = EXCLUDED.provider,
                location = EXCLUDED.location,
                deadline = EXCLUDED.deadline,
                content_hash = EXCLUDED.content_hash,
                updated_at = EXCLUDED.updated_at
            WHERE item_embeddings.updated_at <= EXCLUDED.updated_at""";

    static final String DELETE_SQL = "DELETE FROM item_embeddings WHERE item_id = ?";

    static final String QUERY_SQL = """
            SELECT item_id, title, summary, category, provider, location, deadline, content_hash, updated_at,
                   1 - (embedding <=> ?::vector) AS similarity
            FROM item_embeddings
            WHERE vector_dims(embedding) = ?
              AND 1 - (embedding <=> ?::vector) >= ?
            ORDER BY similarity DESC, updated_at DESC
            LIMIT ?""";

    static final String LIST_IDS_SQL = "SELECT item_id FROM item_embeddings";

    static final String LIST_HASHES_SQL = "SELECT item_id, content_hash FROM item_embeddings";

    static final String FIND_SQL = """
            SELECT item_id, embedding::text AS embedding, title, summary, category, provider, location,
                   deadline, content_hash, updated_at
            FROM item_embeddings
            WHERE item_id = ?""";

    static final String COUNT_SQL = "SELECT COUNT(*) FROM item_embeddings";

    private final JdbcTemplate jdbcTemplate;

    public PgVectorIndex(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the extension and table when missing.
     */
    public void initializeSchema() {
        execute("initialize schema", () -> {
            jdbcTemplate.execute(CREATE_EXTENSION_SQL);
            jdbcTemplate.execute(CREATE_TABLE_SQL);
            return null;
        });
        log.info("Vector index table '{}' ready", TABLE);
    }

    @Override
    public void upsert(String itemId, float[] vector, ItemMetadata metadata, Instant updatedAt) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Cannot store item without embedding: " + itemId);
        }
        int rows = execute("upsert " + itemId, () -> jdbcTemplate.update(UPSERT_SQL,
                itemId,
                toVectorLiteral(vector),
                metadata.title(),
                metadata.summary(),
                metadata.category(),
                metadata.provider(),
                metadata.location(),
                metadata.deadline() != null ? Date.valueOf(metadata.deadline()) : null,
                metadata.contentHash(),
                Timestamp.from(updatedAt)));
        if (rows == 0) {
            log.debug("Ignoring stale write for {} at {}", itemId, updatedAt);
        }
    }

    @Override
    public boolean delete(String itemId) {
        return execute("delete " + itemId, () -> jdbcTemplate.update(DELETE_SQL, itemId)) > 0;
    }

    @Override
    public List<ScoredItem> query(float[] vector, int k, double minSimilarity) {
        if (k <= 0) {
            return List.of();
        }
        String literal = toVectorLiteral(vector);
        return execute("query", () -> jdbcTemplate.query(QUERY_SQL, SCORED_ITEM_MAPPER,
                literal, vector.length, literal, minSimilarity, k));
    }

    @Override
    public Set<String> listIds() {
        return execute("list ids", () -> new HashSet<>(jdbcTemplate.queryForList(LIST_IDS_SQL, String.class)));
    }

    @Override
    public Map<String, String> listContentHashes() {
        return execute("list content hashes", () -> {
            Map<String, String> hashes = new HashMap<>();
            jdbcTemplate.query(LIST_HASHES_SQL,
                    rs -> {
                        hashes.put(rs.getString("item_id"), rs.getString("content_hash"));
                    });
            return hashes;
        });
    }

    @Override
    public Optional<EmbeddingRecord> find(String itemId) {
        List<EmbeddingRecord> rows = execute("find " + itemId,
                () -> jdbcTemplate.query(FIND_SQL, RECORD_MAPPER, itemId));
        return rows.stream().findFirst();
    }

    @Override
    public long count() {
        Long count = execute("count", () -> jdbcTemplate.queryForObject(COUNT_SQL, Long.class));
        return count != null ? count : 0L;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Vector index " + operation + " failed: " + e.getMessage(), e);
        }
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 10);
        sb.append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }

    static float[] parseVectorLiteral(String literal) {
        String body = literal.trim();
        if (body.startsWith("[")) {
            body = body.substring(1, body.length() - 1);
        }
        if (body.isBlank()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    private static ItemMetadata metadataOf(ResultSet rs) throws SQLException {
        Date deadline = rs.getDate("deadline");
        LocalDate localDeadline = deadline != null ? deadline.toLocalDate() : null;
        return new ItemMetadata(
                rs.getString("title"),
                rs.getString("summary"),
                rs.getString("category"),
                rs.getString("provider"),
                rs.getString("location"),
                localDeadline,
                rs.getString("content_hash"));
    }

    private static Instant instantOf(ResultSet rs) throws SQLException {
        Timestamp ts = rs.getTimestamp("updated_at");
        return ts != null ? ts.toInstant() : null;
    }

    private static final RowMapper<ScoredItem> SCORED_ITEM_MAPPER = (rs, rowNum) -> new ScoredItem(
            rs.getString("item_id"),
            rs.getDouble("similarity"),
            metadataOf(rs),
            instantOf(rs));

    private static final RowMapper<EmbeddingRecord> RECORD_MAPPER = (rs, rowNum) -> new EmbeddingRecord(
            rs.getString("item_id"),
            parseVectorLiteral(rs.getString("embedding")),
            metadataOf(rs),
            instantOf(rs));
}
