package com.company.bookingsync.repository;

import com.company.bookingsync.config.RedisCacheConfig;
import com.company.bookingsync.domain.enums.Provider;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class EventTypeMappingRepository {

    private final JdbcTemplate jdbcTemplate;

    @Cacheable(cacheNames = RedisCacheConfig.TRACKED_EVENT_TYPES_CACHE, key = "#tenantId")
    public List<String> findTrackedEventTypeIds(String tenantId) {
        String sql = """
            SELECT provider_event_type_id
            FROM event_type_mappings
            WHERE tenant_id = ? AND is_active = true
            ORDER BY provider_event_type_id
            """;
        return new ArrayList<>(jdbcTemplate.queryForList(sql, String.class, tenantId));
    }

    /**
     * Tenants with a connected integration that actively track the given event type.
     */
    public List<String> findTenantsTracking(Provider provider, String eventTypeId) {
        String sql = """
            SELECT DISTINCT m.tenant_id
            FROM event_type_mappings m
            JOIN project_integrations i
              ON i.tenant_id = m.tenant_id AND i.provider = ? AND i.is_connected = true
            WHERE m.provider_event_type_id = ? AND m.is_active = true
            ORDER BY m.tenant_id
            """;
        return jdbcTemplate.queryForList(sql, String.class, provider.getCode(), eventTypeId);
    }
}
