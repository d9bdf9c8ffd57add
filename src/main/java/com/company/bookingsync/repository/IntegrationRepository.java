package com.company.bookingsync.repository;

import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.enums.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class IntegrationRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, tenant_id, provider, is_connected, last_sync,
               sync_health_score, data_quality_score, last_health_check,
               created_at, updated_at
        FROM project_integrations
        """;

    /**
     * Connected integrations, optionally narrowed to one provider and/or one tenant.
     * Ordered by registration so the tenant loop is first-registered, first-processed.
     */
    public List<Integration> findConnected(Provider provider, String tenantId) {
        StringBuilder sql = new StringBuilder(SELECT_BASE).append(" WHERE is_connected = true");
        List<Object> params = new ArrayList<>();

        if (provider != null) {
            sql.append(" AND provider = ?");
            params.add(provider.getCode());
        }
        if (tenantId != null) {
            sql.append(" AND tenant_id = ?");
            params.add(tenantId);
        }
        sql.append(" ORDER BY created_at ASC, id ASC");

        return jdbcTemplate.query(sql.toString(), new IntegrationRowMapper(), params.toArray());
    }

    /**
     * Move the cursor forward. An older timestamp never rewinds it.
     */
    public int advanceLastSync(String tenantId, Provider provider, Instant syncedAt) {
        String sql = """
            UPDATE project_integrations
            SET last_sync = GREATEST(COALESCE(last_sync, ?), ?),
                updated_at = ?
            WHERE tenant_id = ? AND provider = ?
            """;

        Timestamp ts = Timestamp.from(syncedAt);
        return jdbcTemplate.update(sql, ts, ts, Timestamp.from(Instant.now()), tenantId, provider.getCode());
    }

    public int updateHealthScores(String tenantId, Provider provider,
                                  int healthScore, int dataQualityScore, Instant checkedAt) {
        String sql = """
            UPDATE project_integrations
            SET sync_health_score = ?,
                data_quality_score = ?,
                last_health_check = ?,
                updated_at = ?
            WHERE tenant_id = ? AND provider = ?
            """;

        return jdbcTemplate.update(sql,
                healthScore,
                dataQualityScore,
                Timestamp.from(checkedAt),
                Timestamp.from(Instant.now()),
                tenantId,
                provider.getCode()
        );
    }

    private static class IntegrationRowMapper implements RowMapper<Integration> {
        @Override
        public Integration mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Integration.builder()
                    .id(rs.getLong("id"))
                    .tenantId(rs.getString("tenant_id"))
                    .provider(Provider.fromCode(rs.getString("provider")))
                    .connected(rs.getBoolean("is_connected"))
                    .lastSync(toInstant(rs.getTimestamp("last_sync")))
                    .syncHealthScore(rs.getObject("sync_health_score", Integer.class))
                    .dataQualityScore(rs.getObject("data_quality_score", Integer.class))
                    .lastHealthCheck(toInstant(rs.getTimestamp("last_health_check")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
