package com.assetvault.upload.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcMetadataFieldWriter implements MetadataFieldWriter {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public MetadataValidation validate(UUID tenantId, UUID categoryId, Map<String, Object> fields) {
        Set<String> schema = categoryId == null ? Set.of() : new HashSet<>(jdbcTemplate.queryForList("""
                SELECT field_key FROM category_metadata_fields
                WHERE category_id = :categoryId AND tenant_id = :tenantId AND enabled = TRUE
                """,
                new MapSqlParameterSource()
                        .addValue("categoryId", categoryId)
                        .addValue("tenantId", tenantId),
                String.class));

        Map<String, Object> accepted = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();
        fields.forEach((key, value) -> {
            if (schema.contains(key) && !isEmptyValue(value)) {
                accepted.put(key, value);
            } else {
                rejected.add(key);
            }
        });
        return new MetadataValidation(accepted, rejected);
    }

    @Override
    public void persist(UUID assetId, Map<String, Object> acceptedFields, UUID userId) {
        if (acceptedFields.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO asset_metadata_values (asset_id, field_key, value_json, source, created_by, created_at)
            VALUES (:assetId, :fieldKey, :valueJson, 'user', :createdBy, :createdAt)
            ON CONFLICT (asset_id, field_key) DO UPDATE SET
                value_json = EXCLUDED.value_json,
                created_by = EXCLUDED.created_by,
                created_at = EXCLUDED.created_at
            """;
        Timestamp now = Timestamp.from(Instant.now());
        SqlParameterSource[] batch = acceptedFields.entrySet().stream()
                .map(e -> new MapSqlParameterSource()
                        .addValue("assetId", assetId)
                        .addValue("fieldKey", e.getKey())
                        .addValue("valueJson", toJson(e.getKey(), e.getValue()))
                        .addValue("createdBy", userId)
                        .addValue("createdAt", now))
                .toArray(SqlParameterSource[]::new);
        jdbcTemplate.batchUpdate(sql, batch);
        log.debug("Persisted {} metadata fields for asset={}", batch.length, assetId);
    }

    private String toJson(String fieldKey, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata field " + fieldKey + " is not serialisable", e);
        }
    }

    static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }
}
