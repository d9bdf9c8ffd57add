package com.company.bookingsync.cache;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.remote.RemoteEventDetail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last known good invitee detail per event, used when enrichment is throttled.
 * Redis errors are logged and treated as a miss.
 */
@Component
@Slf4j
public class EnrichmentCache {

    private static final String KEY_PREFIX = "bsync:enrichment:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final Duration ttl;

    public EnrichmentCache(RedisTemplate<String, Object> redisTemplate, SyncProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getEnrichment().getCacheTtl();
    }

    public void put(String tenantId, String eventId, RemoteEventDetail detail) {
        if (detail == null || detail.isEmpty()) {
            return;
        }
        try {
            Map<String, Object> value = new HashMap<>();
            value.put("inviteeName", detail.inviteeName());
            value.put("inviteeEmail", detail.inviteeEmail());
            redisTemplate.opsForValue().set(key(tenantId, eventId), value, ttl);
        } catch (Exception e) {
            log.warn("Failed to cache enrichment for event {}: {}", eventId, e.getMessage());
        }
    }

    public Optional<RemoteEventDetail> get(String tenantId, String eventId) {
        try {
            Object cached = redisTemplate.opsForValue().get(key(tenantId, eventId));
            if (cached instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) cached;
                return Optional.of(new RemoteEventDetail(
                        (String) map.get("inviteeName"),
                        (String) map.get("inviteeEmail")));
            }
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Failed to read cached enrichment for event {}: {}", eventId, e.getMessage());
            return Optional.empty();
        }
    }

    private static String key(String tenantId, String eventId) {
        return KEY_PREFIX + tenantId + ":" + eventId;
    }
}
