package com.company.bookingsync.repository;

import com.company.bookingsync.domain.BookingEvent;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.SyncMetric;
import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.EventStatus;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.SyncTrigger;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical event table and integration registry as seen by the sync engine.
 *
 * <p>Implementations throw {@link com.company.bookingsync.exception.LocalStoreUnavailableException}
 * when the store cannot be reached at all; any other failure is scoped to the call.
 */
public interface LocalStore {

    List<Integration> listConnectedIntegrations(Provider provider, String tenantFilter);

    /**
     * Like {@link #listConnectedIntegrations} but a null provider matches every provider.
     */
    List<Integration> listAllConnectedIntegrations(Provider providerFilter, String tenantFilter);

    List<String> getTrackedEventTypes(String tenantId);

    /**
     * Connected tenants of the provider whose tracked list contains the event type.
     */
    List<String> findTenantsTrackingEventType(Provider provider, String eventTypeId);

    /**
     * Provider event ids stored for the tenant whose scheduled or creation time lies in the window.
     */
    Set<String> listLocalEventIds(String tenantId, Instant windowStart, Instant windowEnd);

    Map<String, EventStatus> findLocalEventStatuses(String tenantId, Instant windowStart, Instant windowEnd);

    /**
     * Idempotent on (tenant, provider event id).
     */
    void upsertEvent(BookingEvent event);

    /**
     * Advance the cursor; a timestamp older than the stored one is ignored.
     */
    void updateLastSync(String tenantId, Provider provider, Instant syncedAt);

    void recordMetric(String tenantId, Provider provider, MetricType type, double value, Map<String, Object> metadata);

    List<SyncMetric> listRecentMetrics(String tenantId, Instant since);

    Optional<SyncRun> findLatestSyncRun(Provider provider, SyncTrigger trigger);

    long countStaleActiveEvents(String tenantId, Instant scheduledBefore);

    long countEventsCreatedSince(String tenantId, Instant since);

    List<BookingEvent> findActiveEventsScheduledBetween(String tenantId, Instant from, Instant to);

    void updateHealthScores(String tenantId, Provider provider, int healthScore, int dataQualityScore, Instant checkedAt);
}
