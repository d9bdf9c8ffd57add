package com.company.bookingsync.repository;

import com.company.bookingsync.domain.SyncMetric;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.SyncTrigger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only store for sync runs, scores and check durations.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SyncMetricRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SyncMetric save(SyncMetric metric) {
        if (metric.getRecordedAt() == null) {
            metric.setRecordedAt(Instant.now());
        }

        String sql = """
            INSERT INTO sync_metrics (
                tenant_id, provider, metric_type, metric_value, metadata, recorded_at
            ) VALUES (?, ?, ?, ?, CAST(? AS jsonb), ?)
            """;

        String metadataJson = writeMetadata(metric.getMetadata());
        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"metric_id"});
            ps.setString(1, metric.getTenantId());
            ps.setString(2, metric.getProvider().getCode());
            ps.setString(3, metric.getMetricType().getCode());
            ps.setDouble(4, metric.getValue());
            ps.setString(5, metadataJson);
            ps.setTimestamp(6, Timestamp.from(metric.getRecordedAt()));
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key != null) {
            metric.setMetricId(key.longValue());
        }
        return metric;
    }

    public List<SyncMetric> findSince(String tenantId, Instant since) {
        String sql = """
            SELECT metric_id, tenant_id, provider, metric_type, metric_value, metadata, recorded_at
            FROM sync_metrics
            WHERE tenant_id = ? AND recorded_at >= ?
            ORDER BY recorded_at DESC
            """;
        return jdbcTemplate.query(sql, new SyncMetricRowMapper(), tenantId, Timestamp.from(since));
    }

    /**
     * Latest sync run recorded for a provider by the given trigger, across all tenants.
     */
    public Optional<SyncMetric> findLatestRun(Provider provider, SyncTrigger trigger) {
        String sql = """
            SELECT metric_id, tenant_id, provider, metric_type, metric_value, metadata, recorded_at
            FROM sync_metrics
            WHERE provider = ? AND metric_type = ? AND metadata ->> 'trigger' = ?
            ORDER BY recorded_at DESC
            LIMIT 1
            """;
        List<SyncMetric> results = jdbcTemplate.query(sql, new SyncMetricRowMapper(),
                provider.getCode(), MetricType.SYNC_RUN.getCode(), trigger.getCode());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metric metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metric metadata, ignoring: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private class SyncMetricRowMapper implements RowMapper<SyncMetric> {
        @Override
        public SyncMetric mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SyncMetric.builder()
                    .metricId(rs.getLong("metric_id"))
                    .tenantId(rs.getString("tenant_id"))
                    .provider(Provider.fromCode(rs.getString("provider")))
                    .metricType(MetricType.fromCode(rs.getString("metric_type")))
                    .value(rs.getDouble("metric_value"))
                    .metadata(readMetadata(rs.getString("metadata")))
                    .recordedAt(rs.getTimestamp("recorded_at").toInstant())
                    .build();
        }
    }
}
