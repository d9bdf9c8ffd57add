package com.company.bookingsync.service.sync;

import com.company.bookingsync.cache.EnrichmentCache;
import com.company.bookingsync.domain.BookingEvent;
import com.company.bookingsync.domain.enums.EventStatus;
import com.company.bookingsync.exception.LocalStoreUnavailableException;
import com.company.bookingsync.exception.TenantSyncException;
import com.company.bookingsync.remote.RateLimitedException;
import com.company.bookingsync.remote.RemoteEvent;
import com.company.bookingsync.remote.RemoteEventClient;
import com.company.bookingsync.remote.RemoteEventDetail;
import com.company.bookingsync.repository.LocalStore;
import com.company.bookingsync.service.ratelimit.RateLimitCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diffs the provider's events against the local store for one tenant window and writes
 * what is missing.
 *
 * <p>Events of untracked types are ignored. Missing events are enriched with invitee data
 * on a best-effort basis and upserted; events already stored whose provider status moved
 * are re-upserted without enrichment so stored invitee data is kept.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GapReconciler {

    private final LocalStore localStore;
    private final RateLimitCoordinator rateLimitCoordinator;
    private final EnrichmentCache enrichmentCache;

    public ReconciliationResult reconcile(String tenantId, SyncWindow window, RemoteEventClient client) {
        List<String> trackedTypes = localStore.getTrackedEventTypes(tenantId);
        if (trackedTypes == null || trackedTypes.isEmpty()) {
            throw new TenantSyncException(tenantId, "No tracked event types configured for tenant " + tenantId);
        }
        Set<String> tracked = new HashSet<>(trackedTypes);

        Map<String, RemoteEvent> remote = fetchRemote(tenantId, window, client, tracked);

        Set<String> localIds = localStore.listLocalEventIds(tenantId, window.start(), window.end());

        ReconciliationResult result = ReconciliationResult.builder()
                .remoteSeen(remote.size())
                .build();

        for (RemoteEvent event : remote.values()) {
            if (!localIds.contains(event.eventId())) {
                result.setGapsFound(result.getGapsFound() + 1);
                ingestGap(tenantId, event, client, result);
            }
        }

        if (remote.keySet().stream().anyMatch(localIds::contains)) {
            applyStatusChanges(tenantId, window, remote, localIds, result);
        }

        log.info("Reconciled tenant {} [{} - {}]: remote={}, gaps={}, synced={}, failed={}, statusUpdated={}{}",
                tenantId, window.start(), window.end(),
                result.getRemoteSeen(), result.getGapsFound(), result.getSynced(),
                result.getFailed(), result.getStatusUpdated(),
                result.isRateLimitHit() ? ", rate limited" : "");

        return result;
    }

    /**
     * Union of events scheduled in the window and events created in it, deduplicated by id
     * and narrowed to tracked types.
     */
    private Map<String, RemoteEvent> fetchRemote(String tenantId, SyncWindow window,
                                                 RemoteEventClient client, Set<String> tracked) {
        Map<String, RemoteEvent> merged = new LinkedHashMap<>();
        for (RemoteEvent event : client.listWindowEvents(tenantId, window.start(), window.end())) {
            merged.putIfAbsent(event.eventId(), event);
        }

        int before = merged.size();
        merged.values().removeIf(event -> !tracked.contains(event.eventTypeId()));
        if (before != merged.size()) {
            log.debug("Ignored {} events of untracked types for tenant {}", before - merged.size(), tenantId);
        }
        return merged;
    }

    private void ingestGap(String tenantId, RemoteEvent event, RemoteEventClient client,
                           ReconciliationResult result) {
        RemoteEventDetail detail = enrich(tenantId, event, client, result);

        BookingEvent booking = toBookingEvent(tenantId, event, detail);
        try {
            localStore.upsertEvent(booking);
            result.setSynced(result.getSynced() + 1);
        } catch (LocalStoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            result.setFailed(result.getFailed() + 1);
            log.error("Failed to upsert event {} for tenant {}: {}", event.eventId(), tenantId, e.getMessage());
        }
    }

    private RemoteEventDetail enrich(String tenantId, RemoteEvent event, RemoteEventClient client,
                                     ReconciliationResult result) {
        rateLimitCoordinator.acquireSubRequest();
        try {
            RemoteEventDetail detail = client.getEventDetail(tenantId, event.eventId());
            enrichmentCache.put(tenantId, event.eventId(), detail);
            return detail != null ? detail : RemoteEventDetail.EMPTY;
        } catch (RateLimitedException e) {
            result.setRateLimitHit(true);
            RemoteEventDetail cached = enrichmentCache.get(tenantId, event.eventId()).orElse(RemoteEventDetail.EMPTY);
            log.warn("Enrichment throttled for event {} (tenant {}), using {}",
                    event.eventId(), tenantId, cached.isEmpty() ? "no invitee data" : "last known invitee");
            return cached;
        } catch (RuntimeException e) {
            log.warn("Enrichment failed for event {} (tenant {}): {}", event.eventId(), tenantId, e.getMessage());
            return RemoteEventDetail.EMPTY;
        }
    }

    private void applyStatusChanges(String tenantId, SyncWindow window, Map<String, RemoteEvent> remote,
                                    Set<String> localIds, ReconciliationResult result) {
        Map<String, EventStatus> stored = localStore.findLocalEventStatuses(tenantId, window.start(), window.end());

        for (RemoteEvent event : remote.values()) {
            if (!localIds.contains(event.eventId())) {
                continue;
            }
            EventStatus current = stored.get(event.eventId());
            if (current == event.status()) {
                continue;
            }
            try {
                localStore.upsertEvent(toBookingEvent(tenantId, event, RemoteEventDetail.EMPTY));
                result.setStatusUpdated(result.getStatusUpdated() + 1);
                log.debug("Event {} for tenant {} moved {} -> {}", event.eventId(), tenantId,
                        current != null ? current.getCode() : "unknown", event.status().getCode());
            } catch (LocalStoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                result.setFailed(result.getFailed() + 1);
                log.error("Failed to update status of event {} for tenant {}: {}",
                        event.eventId(), tenantId, e.getMessage());
            }
        }
    }

    private static BookingEvent toBookingEvent(String tenantId, RemoteEvent event, RemoteEventDetail detail) {
        return BookingEvent.builder()
                .tenantId(tenantId)
                .providerEventId(event.eventId())
                .providerEventTypeId(event.eventTypeId())
                .eventTypeName(event.name())
                .scheduledAt(event.scheduledAt())
                .createdAt(event.createdAt())
                .status(event.status())
                .inviteeName(detail.inviteeName())
                .inviteeEmail(detail.inviteeEmail())
                .build();
    }
}
