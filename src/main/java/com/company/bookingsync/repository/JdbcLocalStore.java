package com.company.bookingsync.repository;

import com.company.bookingsync.domain.BookingEvent;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.SyncMetric;
import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.EventStatus;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.SyncTrigger;
import com.company.bookingsync.exception.LocalStoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcLocalStore implements LocalStore {

    private final IntegrationRepository integrationRepository;
    private final BookingEventRepository bookingEventRepository;
    private final EventTypeMappingRepository eventTypeMappingRepository;
    private final SyncMetricRepository syncMetricRepository;

    @Override
    public List<Integration> listConnectedIntegrations(Provider provider, String tenantFilter) {
        return reachable(() -> integrationRepository.findConnected(provider, tenantFilter));
    }

    @Override
    public List<Integration> listAllConnectedIntegrations(Provider providerFilter, String tenantFilter) {
        return reachable(() -> integrationRepository.findConnected(providerFilter, tenantFilter));
    }

    @Override
    public List<String> getTrackedEventTypes(String tenantId) {
        return reachable(() -> eventTypeMappingRepository.findTrackedEventTypeIds(tenantId));
    }

    @Override
    public List<String> findTenantsTrackingEventType(Provider provider, String eventTypeId) {
        return reachable(() -> eventTypeMappingRepository.findTenantsTracking(provider, eventTypeId));
    }

    @Override
    public Set<String> listLocalEventIds(String tenantId, Instant windowStart, Instant windowEnd) {
        return reachable(() -> new HashSet<>(
                bookingEventRepository.findEventIdsInWindow(tenantId, windowStart, windowEnd)));
    }

    @Override
    public Map<String, EventStatus> findLocalEventStatuses(String tenantId, Instant windowStart, Instant windowEnd) {
        return reachable(() -> bookingEventRepository.findStatusesInWindow(tenantId, windowStart, windowEnd));
    }

    @Override
    public void upsertEvent(BookingEvent event) {
        reachable(() -> {
            bookingEventRepository.upsert(event);
            return null;
        });
    }

    @Override
    public void updateLastSync(String tenantId, Provider provider, Instant syncedAt) {
        int updated = reachable(() -> integrationRepository.advanceLastSync(tenantId, provider, syncedAt));
        if (updated == 0) {
            log.warn("No {} integration row for tenant {}, last_sync not advanced", provider.getCode(), tenantId);
        }
    }

    @Override
    public void recordMetric(String tenantId, Provider provider, MetricType type, double value,
                             Map<String, Object> metadata) {
        SyncMetric metric = SyncMetric.builder()
                .tenantId(tenantId)
                .provider(provider)
                .metricType(type)
                .value(value)
                .metadata(metadata)
                .recordedAt(Instant.now())
                .build();
        reachable(() -> syncMetricRepository.save(metric));
    }

    @Override
    public List<SyncMetric> listRecentMetrics(String tenantId, Instant since) {
        return reachable(() -> syncMetricRepository.findSince(tenantId, since));
    }

    @Override
    public Optional<SyncRun> findLatestSyncRun(Provider provider, SyncTrigger trigger) {
        return reachable(() -> syncMetricRepository.findLatestRun(provider, trigger).map(SyncRun::fromMetric));
    }

    @Override
    public long countStaleActiveEvents(String tenantId, Instant scheduledBefore) {
        return reachable(() -> bookingEventRepository.countActiveScheduledBefore(tenantId, scheduledBefore));
    }

    @Override
    public long countEventsCreatedSince(String tenantId, Instant since) {
        return reachable(() -> bookingEventRepository.countCreatedSince(tenantId, since));
    }

    @Override
    public List<BookingEvent> findActiveEventsScheduledBetween(String tenantId, Instant from, Instant to) {
        return reachable(() -> bookingEventRepository.findActiveScheduledBetween(tenantId, from, to));
    }

    @Override
    public void updateHealthScores(String tenantId, Provider provider, int healthScore, int dataQualityScore,
                                   Instant checkedAt) {
        reachable(() -> integrationRepository.updateHealthScores(
                tenantId, provider, healthScore, dataQualityScore, checkedAt));
    }

    /**
     * Connection-level failures become {@link LocalStoreUnavailableException}; query errors pass through.
     */
    private <T> T reachable(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException e) {
            throw new LocalStoreUnavailableException("Local store unreachable: " + e.getMessage(), e);
        }
    }
}
