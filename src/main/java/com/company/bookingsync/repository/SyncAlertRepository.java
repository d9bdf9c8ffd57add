package com.company.bookingsync.repository;

import com.company.bookingsync.domain.SyncAlert;
import com.company.bookingsync.domain.enums.AlertStatus;
import com.company.bookingsync.domain.enums.DispatchStatus;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.Severity;
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

import static com.company.bookingsync.repository.IntegrationRepository.toInstant;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SyncAlertRepository {

    private final JdbcTemplate jdbcTemplate;

    public SyncAlert save(SyncAlert alert) {
        if (alert.getTriggeredAt() == null) {
            alert.setTriggeredAt(Instant.now());
        }

        String sql = """
            INSERT INTO sync_alerts (
                tenant_id, provider, metric_type, metric_value, threshold_value,
                severity, status, dispatch_status, retry_count, last_error,
                triggered_at, dispatched_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"alert_id"});
            ps.setString(1, alert.getTenantId());
            ps.setString(2, alert.getProvider().getCode());
            ps.setString(3, alert.getMetricType().getCode());
            ps.setDouble(4, alert.getMetricValue());
            ps.setDouble(5, alert.getThresholdValue());
            ps.setString(6, alert.getSeverity().name());
            ps.setString(7, alert.getStatus().name());
            ps.setString(8, alert.getDispatchStatus().name());
            ps.setInt(9, alert.getRetryCount() != null ? alert.getRetryCount() : 0);
            ps.setString(10, alert.getLastError());
            ps.setTimestamp(11, Timestamp.from(alert.getTriggeredAt()));
            ps.setTimestamp(12, alert.getDispatchedAt() != null ? Timestamp.from(alert.getDispatchedAt()) : null);
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key != null) {
            alert.setAlertId(key.longValue());
        }
        return alert;
    }

    /**
     * True when an unacknowledged alert for the same tenant, provider and metric was raised at or after {@code since}.
     */
    public boolean existsActiveSince(String tenantId, Provider provider, MetricType metricType, Instant since) {
        String sql = """
            SELECT EXISTS (
                SELECT 1 FROM sync_alerts
                WHERE tenant_id = ? AND provider = ? AND metric_type = ?
                AND status = 'ACTIVE' AND triggered_at >= ?
            )
            """;
        Boolean exists = jdbcTemplate.queryForObject(sql, Boolean.class,
                tenantId, provider.getCode(), metricType.getCode(), Timestamp.from(since));
        return Boolean.TRUE.equals(exists);
    }

    public List<SyncAlert> findUndispatched(int limit) {
        String sql = """
            SELECT alert_id, tenant_id, provider, metric_type, metric_value, threshold_value,
                   severity, status, dispatch_status, retry_count, last_error,
                   triggered_at, dispatched_at
            FROM sync_alerts
            WHERE dispatch_status IN ('PENDING', 'FAILED')
            ORDER BY triggered_at ASC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, new SyncAlertRowMapper(), limit);
    }

    public void updateDispatch(SyncAlert alert) {
        String sql = """
            UPDATE sync_alerts
            SET dispatch_status = ?,
                dispatched_at = ?,
                retry_count = ?,
                last_error = ?
            WHERE alert_id = ?
            """;

        jdbcTemplate.update(sql,
                alert.getDispatchStatus().name(),
                alert.getDispatchedAt() != null ? Timestamp.from(alert.getDispatchedAt()) : null,
                alert.getRetryCount(),
                alert.getLastError(),
                alert.getAlertId()
        );
    }

    private static class SyncAlertRowMapper implements RowMapper<SyncAlert> {
        @Override
        public SyncAlert mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SyncAlert.builder()
                    .alertId(rs.getLong("alert_id"))
                    .tenantId(rs.getString("tenant_id"))
                    .provider(Provider.fromCode(rs.getString("provider")))
                    .metricType(MetricType.fromCode(rs.getString("metric_type")))
                    .metricValue(rs.getDouble("metric_value"))
                    .thresholdValue(rs.getDouble("threshold_value"))
                    .severity(Severity.fromString(rs.getString("severity")))
                    .status(AlertStatus.fromString(rs.getString("status")))
                    .dispatchStatus(DispatchStatus.fromString(rs.getString("dispatch_status")))
                    .retryCount(rs.getInt("retry_count"))
                    .lastError(rs.getString("last_error"))
                    .triggeredAt(toInstant(rs.getTimestamp("triggered_at")))
                    .dispatchedAt(toInstant(rs.getTimestamp("dispatched_at")))
                    .build();
        }
    }
}
