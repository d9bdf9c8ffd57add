package com.company.bookingsync.domain;

import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.RunOutcome;
import com.company.bookingsync.domain.enums.SyncMode;
import com.company.bookingsync.domain.enums.SyncTrigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one orchestrator pass for a single tenant.
 * Persisted as a {@code sync_run} metric; the counts travel in the metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRun {
    private String tenantId;
    private Provider provider;
    private Instant windowStart;
    private Instant windowEnd;
    private SyncMode mode;
    private SyncTrigger trigger;
    private RunOutcome outcome;

    private int remoteSeen;
    private int gapsFound;
    private int eventsSynced;
    private int statusUpdated;
    private int errors;
    private boolean rateLimitHit;

    private long durationMs;
    private String errorMessage;
    private Instant startedAt;

    public boolean isSuccessful() {
        return outcome == RunOutcome.SUCCESS;
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("outcome", outcome != null ? outcome.name() : RunOutcome.FAILED.name());
        metadata.put("mode", mode != null ? mode.getCode() : null);
        metadata.put("trigger", trigger != null ? trigger.getCode() : SyncTrigger.MANUAL.getCode());
        metadata.put("window_start", windowStart != null ? windowStart.toString() : null);
        metadata.put("window_end", windowEnd != null ? windowEnd.toString() : null);
        metadata.put("remote_seen", remoteSeen);
        metadata.put("gaps_found", gapsFound);
        metadata.put("events_synced", eventsSynced);
        metadata.put("status_updated", statusUpdated);
        metadata.put("errors", errors);
        metadata.put("rate_limit_hit", rateLimitHit);
        metadata.put("duration_ms", durationMs);
        if (errorMessage != null) {
            metadata.put("error", errorMessage);
        }
        return metadata;
    }

    public static SyncRun fromMetric(SyncMetric metric) {
        Map<String, Object> metadata = metric.getMetadata() != null ? metric.getMetadata() : Map.of();
        return SyncRun.builder()
                .tenantId(metric.getTenantId())
                .provider(metric.getProvider())
                .outcome(RunOutcome.fromString((String) metadata.get("outcome")))
                .mode(SyncMode.fromString((String) metadata.get("mode")))
                .trigger(SyncTrigger.fromString((String) metadata.get("trigger")))
                .windowStart(parseInstant(metadata.get("window_start")))
                .windowEnd(parseInstant(metadata.get("window_end")))
                .remoteSeen(intValue(metadata.get("remote_seen")))
                .gapsFound(intValue(metadata.get("gaps_found")))
                .eventsSynced(intValue(metadata.get("events_synced")))
                .statusUpdated(intValue(metadata.get("status_updated")))
                .errors(intValue(metadata.get("errors")))
                .rateLimitHit(Boolean.TRUE.equals(metadata.get("rate_limit_hit")))
                .durationMs(longValue(metadata.get("duration_ms")))
                .errorMessage((String) metadata.get("error"))
                .startedAt(metric.getRecordedAt())
                .build();
    }

    private static Instant parseInstant(Object value) {
        return value != null ? Instant.parse(value.toString()) : null;
    }

    private static int intValue(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    private static long longValue(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
