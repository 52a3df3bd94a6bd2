package com.designauditor.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class JdbcProgressStore implements ProgressStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcProgressStore.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcProgressStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public void set(String key, JsonNode value) {
        String serialized;
        try {
            serialized = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for " + key + " is not serializable", e);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", serialized)
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE progress_store
                SET store_value = :value,
                    updated_at = :now
                WHERE store_key = :key
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO progress_store (store_key, store_value, updated_at)
                    VALUES (:key, :value, :now)
                    """,
                params
            );
        }
    }

    @Override
    public Map<String, JsonNode> get(Collection<String> keys) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        if (keys == null || keys.isEmpty()) {
            return out;
        }
        List<Map.Entry<String, String>> rows = jdbc.query(
            """
                SELECT store_key, store_value
                FROM progress_store
                WHERE store_key IN (:keys)
                """,
            new MapSqlParameterSource("keys", List.copyOf(keys)),
            (rs, rowNum) -> Map.entry(rs.getString("store_key"), rs.getString("store_value"))
        );
        for (Map.Entry<String, String> row : rows) {
            try {
                out.put(row.getKey(), objectMapper.readTree(row.getValue()));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable progress entry {}", row.getKey(), e);
            }
        }
        return out;
    }

    @Override
    public void remove(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return;
        }
        jdbc.update(
            "DELETE FROM progress_store WHERE store_key IN (:keys)",
            new MapSqlParameterSource("keys", List.copyOf(keys))
        );
    }
}
