package com.company.bookingsync.remote;

import com.company.bookingsync.domain.enums.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcAccessTokenProvider implements AccessTokenProvider {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<AccessToken> findAccessToken(String tenantId, Provider provider) {
        String sql = """
            SELECT access_token, owner_uri, expires_at
            FROM integration_credentials
            WHERE tenant_id = ? AND provider = ?
            """;

        List<AccessToken> results = jdbcTemplate.query(sql, new AccessTokenRowMapper(), tenantId, provider.getCode());
        if (results.isEmpty()) {
            log.debug("No {} credentials stored for tenant {}", provider.getCode(), tenantId);
            return Optional.empty();
        }
        return Optional.of(results.get(0));
    }

    private static class AccessTokenRowMapper implements RowMapper<AccessToken> {
        @Override
        public AccessToken mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp expiresAt = rs.getTimestamp("expires_at");
            return new AccessToken(
                    rs.getString("access_token"),
                    rs.getString("owner_uri"),
                    expiresAt != null ? expiresAt.toInstant() : null
            );
        }
    }
}
