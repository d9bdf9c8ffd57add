package com.company.bookingsync.service.sync;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.BookingEvent;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.enums.EventStatus;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.exception.LocalStoreUnavailableException;
import com.company.bookingsync.remote.RateLimitedException;
import com.company.bookingsync.remote.RemoteEvent;
import com.company.bookingsync.remote.RemoteEventClient;
import com.company.bookingsync.repository.LocalStore;
import com.company.bookingsync.service.ratelimit.RateLimitCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Re-reads recently passed events that are still active locally. The provider answers
 * these with their final status; an event it no longer knows is marked cancelled.
 */
@Service
@Slf4j
public class EventStatusRefreshService {

    private final LocalStore localStore;
    private final RemoteEventClient client;
    private final RateLimitCoordinator rateLimitCoordinator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final SyncProperties.StatusRefresh settings;

    public EventStatusRefreshService(LocalStore localStore,
                                     List<RemoteEventClient> remoteClients,
                                     RateLimitCoordinator rateLimitCoordinator,
                                     MeterRegistry meterRegistry,
                                     Clock clock,
                                     SyncProperties properties) {
        this.localStore = localStore;
        this.client = remoteClients.stream()
                .filter(candidate -> candidate.provider() == Provider.CALENDLY)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No Calendly client configured"));
        this.rateLimitCoordinator = rateLimitCoordinator;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.settings = properties.getStatusRefresh();
    }

    public StatusRefreshResult refreshAll() {
        StatusRefreshResult result = new StatusRefreshResult();
        List<Integration> integrations = localStore.listConnectedIntegrations(client.provider(), null);

        for (Integration integration : integrations) {
            MDC.put("tenantId", integration.getTenantId());
            try {
                refreshTenant(integration.getTenantId(), result);
                result.setTenantsChecked(result.getTenantsChecked() + 1);
            } catch (LocalStoreUnavailableException e) {
                throw e;
            } catch (RateLimitedException e) {
                result.setTenantsFailed(result.getTenantsFailed() + 1);
                log.warn("Status refresh for tenant {} stopped by rate limit", integration.getTenantId());
            } catch (Exception e) {
                result.setTenantsFailed(result.getTenantsFailed() + 1);
                log.error("Status refresh failed for tenant {}: {}", integration.getTenantId(), e.getMessage());
            } finally {
                MDC.remove("tenantId");
            }
        }

        meterRegistry.counter("sync.status_refresh.updated").increment(result.getEventsUpdated());
        log.info("Status refresh completed: tenants={}, failed={}, checked={}, updated={}, errors={}",
                result.getTenantsChecked(), result.getTenantsFailed(), result.getEventsChecked(),
                result.getEventsUpdated(), result.getErrors());
        return result;
    }

    private void refreshTenant(String tenantId, StatusRefreshResult result) {
        Instant now = clock.instant();
        List<BookingEvent> candidates =
                localStore.findActiveEventsScheduledBetween(tenantId, now.minus(settings.getLookback()), now);
        if (candidates.isEmpty()) {
            return;
        }

        rateLimitCoordinator.acquire(tenantId);
        log.debug("Refreshing status of {} event(s) for tenant {}", candidates.size(), tenantId);

        int inBatch = 0;
        for (BookingEvent event : candidates) {
            if (inBatch == settings.getBatchSize()) {
                // Batch boundary: a full tenant slot before the next batch
                rateLimitCoordinator.acquire(tenantId);
                inBatch = 0;
            }
            rateLimitCoordinator.acquireSubRequest();
            inBatch++;
            result.setEventsChecked(result.getEventsChecked() + 1);

            try {
                Optional<RemoteEvent> remote = client.fetchEvent(tenantId, event.getProviderEventId());
                EventStatus status = remote.map(RemoteEvent::status).orElse(EventStatus.CANCELLED);
                if (status != event.getStatus()) {
                    localStore.upsertEvent(event.toBuilder().status(status).build());
                    result.setEventsUpdated(result.getEventsUpdated() + 1);
                    log.debug("Event {} for tenant {}: {} -> {}{}", event.getProviderEventId(), tenantId,
                            event.getStatus().getCode(), status.getCode(), remote.isEmpty() ? " (gone at provider)" : "");
                }
            } catch (RateLimitedException | LocalStoreUnavailableException e) {
                throw e;
            } catch (Exception e) {
                result.setErrors(result.getErrors() + 1);
                log.warn("Could not refresh event {} for tenant {}: {}",
                        event.getProviderEventId(), tenantId, e.getMessage());
            }
        }
    }
}
