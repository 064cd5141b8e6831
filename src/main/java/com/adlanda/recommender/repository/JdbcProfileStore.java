package com.adlanda.recommender.repository;

import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.UserProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Profile reader over the {@code user_profiles} table, whose
 * {@code preferences} column holds a JSON object.
 */
@Repository
public class JdbcProfileStore implements ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcProfileStore.class);

    static final String SELECT_SQL = "SELECT preferences FROM user_profiles WHERE user_id = ?";

    private static final TypeReference<Map<String, Object>> PREFERENCES_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcProfileStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<UserProfile> getProfile(String userId) {
        List<String> rows;
        try {
            rows = jdbcTemplate.queryForList(SELECT_SQL, String.class, userId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Profile store failed to read user " + userId, e);
        }
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new UserProfile(userId, parsePreferences(userId, rows.get(0))));
    }

    private Map<String, Object> parsePreferences(String userId, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PREFERENCES_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable preferences for user {}: {}", userId, e.getOriginalMessage());
            return Map.of();
        }
    }
}
