package com.adlanda.recommender.repository;

import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.CatalogItem;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Catalog reader over the {@code opportunities} table.
 */
@Repository
public class JdbcCatalogStore implements CatalogStore {

    private static final String COLUMNS =
            "id, title, summary, description, category, provider, location, deadline, requirements, benefits, created_at";

    static final String SELECT_ALL_SQL = "SELECT " + COLUMNS + " FROM opportunities";

    static final String SELECT_BY_ID_SQL = SELECT_ALL_SQL + " WHERE id = ?";

    static final String SELECT_RECENT_SQL = SELECT_ALL_SQL + " ORDER BY created_at DESC LIMIT ?";

    static final String COUNT_SQL = "SELECT COUNT(*) FROM opportunities";

    private static final RowMapper<CatalogItem> ITEM_MAPPER = (rs, rowNum) -> {
        Date deadline = rs.getDate("deadline");
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new CatalogItem(
                rs.getString("id"),
                rs.getString("title"),
                rs.getString("summary"),
                rs.getString("description"),
                rs.getString("category"),
                rs.getString("provider"),
                rs.getString("location"),
                deadline != null ? deadline.toLocalDate() : null,
                rs.getString("requirements"),
                rs.getString("benefits"),
                createdAt != null ? createdAt.toInstant() : null);
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcCatalogStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<CatalogItem> getAll() {
        return execute("read catalog", () -> jdbcTemplate.query(SELECT_ALL_SQL, ITEM_MAPPER));
    }

    @Override
    public Optional<CatalogItem> getById(String id) {
        return execute("read item " + id,
                () -> jdbcTemplate.query(SELECT_BY_ID_SQL, ITEM_MAPPER, id).stream().findFirst());
    }

    @Override
    public List<CatalogItem> getMostRecent(int limit) {
        return execute("read recent items", () -> jdbcTemplate.query(SELECT_RECENT_SQL, ITEM_MAPPER, limit));
    }

    @Override
    public long count() {
        Long count = execute("count catalog", () -> jdbcTemplate.queryForObject(COUNT_SQL, Long.class));
        return count != null ? count : 0L;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Catalog store failed to " + operation, e);
        }
    }
}
