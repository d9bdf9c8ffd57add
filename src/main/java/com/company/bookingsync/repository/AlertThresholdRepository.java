package com.company.bookingsync.repository;

import com.company.bookingsync.domain.AlertThreshold;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class AlertThresholdRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Enabled thresholds that apply to a tenant: its own rows first, then provider-wide defaults.
     */
    public List<AlertThreshold> findApplicable(String tenantId, Provider provider, MetricType metricType) {
        String sql = """
            SELECT threshold_id, tenant_id, provider, metric_type, min_value,
                   severity, cooldown_minutes, is_enabled
            FROM alert_thresholds
            WHERE provider = ? AND metric_type = ? AND is_enabled = true
            AND (tenant_id = ? OR tenant_id IS NULL)
            ORDER BY tenant_id NULLS LAST, min_value DESC
            """;
        return jdbcTemplate.query(sql, new AlertThresholdRowMapper(),
                provider.getCode(), metricType.getCode(), tenantId);
    }

    private static class AlertThresholdRowMapper implements RowMapper<AlertThreshold> {
        @Override
        public AlertThreshold mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AlertThreshold.builder()
                    .thresholdId(rs.getLong("threshold_id"))
                    .tenantId(rs.getString("tenant_id"))
                    .provider(Provider.fromCode(rs.getString("provider")))
                    .metricType(MetricType.fromCode(rs.getString("metric_type")))
                    .minValue(rs.getDouble("min_value"))
                    .severity(Severity.fromString(rs.getString("severity")))
                    .cooldownMinutes(rs.getInt("cooldown_minutes"))
                    .enabled(rs.getBoolean("is_enabled"))
                    .build();
        }
    }
}
