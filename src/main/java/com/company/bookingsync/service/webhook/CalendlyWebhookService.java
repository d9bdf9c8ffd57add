package com.company.bookingsync.service.webhook;

import com.company.bookingsync.domain.BookingEvent;
import com.company.bookingsync.domain.enums.EventStatus;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.dto.request.CalendlyWebhookRequest;
import com.company.bookingsync.exception.LocalStoreUnavailableException;
import com.company.bookingsync.exception.TenantSyncException;
import com.company.bookingsync.remote.RemoteApiException;
import com.company.bookingsync.remote.RemoteEvent;
import com.company.bookingsync.remote.RemoteEventClient;
import com.company.bookingsync.repository.LocalStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Pushes single Calendly bookings into the event table as they happen, for every tenant
 * tracking the booked event type. The gap reconciler remains the safety net for deliveries
 * that never arrive.
 */
@Service
@Slf4j
public class CalendlyWebhookService {

    private final LocalStore localStore;
    private final RemoteEventClient client;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CalendlyWebhookService(LocalStore localStore,
                                  List<RemoteEventClient> remoteClients,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.localStore = localStore;
        this.client = remoteClients.stream()
                .filter(candidate -> candidate.provider() == Provider.CALENDLY)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No Calendly client configured"));
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException when the delivery names no scheduled event or event type
     */
    public WebhookResult handle(CalendlyWebhookRequest request) {
        WebhookResult result = new WebhookResult();
        result.setEvent(request.getEvent());

        if (!CalendlyWebhookRequest.INVITEE_CREATED.equals(request.getEvent()) && !request.isCancellation()) {
            return ignore(result, "Unsupported webhook event " + request.getEvent());
        }

        CalendlyWebhookRequest.ScheduledEvent scheduled = request.scheduledEvent();
        if (scheduled == null || scheduled.getUri() == null || scheduled.getUri().isBlank()) {
            throw new IllegalArgumentException("Webhook payload has no scheduled event URI");
        }
        if (scheduled.getEventType() == null || scheduled.getEventType().isBlank()) {
            throw new IllegalArgumentException("Webhook payload has no event type");
        }

        List<String> tenants = localStore.findTenantsTrackingEventType(Provider.CALENDLY, scheduled.getEventType());
        if (tenants.isEmpty()) {
            return ignore(result, "Event type " + scheduled.getEventType() + " is not tracked");
        }
        result.setTenantsMatched(tenants.size());

        for (String tenantId : tenants) {
            MDC.put("tenantId", tenantId);
            try {
                localStore.upsertEvent(toBookingEvent(tenantId, request, scheduled));
                result.setProcessed(result.getProcessed() + 1);
            } catch (LocalStoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                result.setFailed(result.getFailed() + 1);
                log.error("Failed to store webhook event {} for tenant {}: {}",
                        scheduled.getUri(), tenantId, e.getMessage());
            } finally {
                MDC.remove("tenantId");
            }
        }

        meterRegistry.counter("sync.webhook.events",
                "event", request.getEvent(),
                "outcome", result.getFailed() == 0 ? "stored" : "partial"
        ).increment();

        log.info("Calendly {} for {} stored for {}/{} tenant(s)", request.getEvent(), scheduled.getUri(),
                result.getProcessed(), result.getTenantsMatched());
        return result;
    }

    private BookingEvent toBookingEvent(String tenantId, CalendlyWebhookRequest request,
                                        CalendlyWebhookRequest.ScheduledEvent scheduled) {
        RemoteEvent event = currentState(tenantId, scheduled)
                .orElseGet(() -> RemoteEvent.of(
                        scheduled.getUri(),
                        scheduled.getEventType(),
                        scheduled.getName(),
                        scheduled.getStartTime(),
                        scheduled.getCreatedAt(),
                        scheduled.getStatus()));

        EventStatus status = request.isCancellation() ? EventStatus.CANCELLED : event.status();

        Instant createdAt = event.createdAt();
        if (createdAt == null) {
            createdAt = request.bookedAt() != null ? request.bookedAt() : clock.instant();
        }

        return BookingEvent.builder()
                .tenantId(tenantId)
                .providerEventId(event.eventId())
                .providerEventTypeId(event.eventTypeId())
                .eventTypeName(event.name())
                .scheduledAt(event.scheduledAt())
                .createdAt(createdAt)
                .status(status)
                .inviteeName(request.inviteeName())
                .inviteeEmail(request.inviteeEmail())
                .build();
    }

    /**
     * The provider's view of the event, empty when it cannot be read; the delivery's own
     * snapshot is used then.
     */
    private Optional<RemoteEvent> currentState(String tenantId, CalendlyWebhookRequest.ScheduledEvent scheduled) {
        try {
            return client.fetchEvent(tenantId, scheduled.getUri());
        } catch (RemoteApiException | TenantSyncException e) {
            log.warn("Could not re-read event {} for tenant {}, using webhook payload: {}",
                    scheduled.getUri(), tenantId, e.getMessage());
            return Optional.empty();
        }
    }

    private WebhookResult ignore(WebhookResult result, String reason) {
        result.setIgnoredReason(reason);
        meterRegistry.counter("sync.webhook.events",
                "event", String.valueOf(result.getEvent()),
                "outcome", "ignored"
        ).increment();
        log.info("Ignoring Calendly webhook: {}", reason);
        return result;
    }
}
