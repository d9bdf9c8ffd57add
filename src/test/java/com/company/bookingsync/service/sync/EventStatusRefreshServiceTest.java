package com.company.bookingsync.service.sync;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.BookingEvent;
import com.company.bookingsync.domain.enums.EventStatus;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.remote.RateLimitedException;
import com.company.bookingsync.remote.RemoteApiException;
import com.company.bookingsync.remote.RemoteEvent;
import com.company.bookingsync.remote.RemoteEventClient;
import com.company.bookingsync.service.ratelimit.RateLimitCoordinator;
import com.company.bookingsync.service.ratelimit.UsageSignal;
import com.company.bookingsync.support.InMemoryLocalStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventStatusRefreshServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    private RemoteEventClient client;
    @Mock
    private RateLimitCoordinator rateLimitCoordinator;

    private InMemoryLocalStore localStore;
    private SyncProperties properties;
    private EventStatusRefreshService service;

    @BeforeEach
    void setUp() {
        localStore = new InMemoryLocalStore();
        properties = new SyncProperties();
        properties.getStatusRefresh().setBatchSize(2);
        when(client.provider()).thenReturn(Provider.CALENDLY);
        service = new EventStatusRefreshService(localStore, List.of(client), rateLimitCoordinator,
                new SimpleMeterRegistry(), Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void refreshAll_marksGoneEventsCancelledAndAppliesFinalStatuses() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        store("tenant-a", "e1", NOW.minus(Duration.ofDays(1)));
        store("tenant-a", "e2", NOW.minus(Duration.ofDays(2)));
        store("tenant-a", "e3", NOW.minus(Duration.ofHours(5)));
        when(client.fetchEvent("tenant-a", "e1")).thenReturn(Optional.empty());
        when(client.fetchEvent("tenant-a", "e2")).thenReturn(Optional.of(remote("e2", "completed")));
        when(client.fetchEvent("tenant-a", "e3")).thenReturn(Optional.of(remote("e3", "active")));

        StatusRefreshResult result = service.refreshAll();

        assertEquals(1, result.getTenantsChecked());
        assertEquals(3, result.getEventsChecked());
        assertEquals(2, result.getEventsUpdated());
        assertEquals(EventStatus.CANCELLED, localStore.event("tenant-a", "e1").orElseThrow().getStatus());
        assertEquals(EventStatus.COMPLETED, localStore.event("tenant-a", "e2").orElseThrow().getStatus());
        assertEquals(EventStatus.ACTIVE, localStore.event("tenant-a", "e3").orElseThrow().getStatus());
        assertEquals("Ada", localStore.event("tenant-a", "e1").orElseThrow().getInviteeName());
    }

    @Test
    void refreshAll_takesATenantSlotPerBatch() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        store("tenant-a", "e1", NOW.minus(Duration.ofHours(30)));
        store("tenant-a", "e2", NOW.minus(Duration.ofHours(20)));
        store("tenant-a", "e3", NOW.minus(Duration.ofHours(10)));
        when(client.fetchEvent(any(), anyString())).thenReturn(Optional.of(remote("x", "active")));

        service.refreshAll();

        verify(rateLimitCoordinator, times(2)).acquire("tenant-a");
        verify(rateLimitCoordinator, times(3)).acquireSubRequest();
    }

    @Test
    void refreshAll_ignoresEventsOutsideTheLookback() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        store("tenant-a", "old", NOW.minus(Duration.ofDays(10)));
        store("tenant-a", "future", NOW.plus(Duration.ofDays(1)));

        StatusRefreshResult result = service.refreshAll();

        assertEquals(0, result.getEventsChecked());
        verify(client, never()).fetchEvent(any(), any());
        verify(rateLimitCoordinator, never()).acquire(any());
    }

    @Test
    void refreshAll_rateLimitedTenant_doesNotStopTheNextOne() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        localStore.addIntegration("tenant-b", Provider.CALENDLY, null);
        store("tenant-a", "e1", NOW.minus(Duration.ofDays(1)));
        store("tenant-b", "e2", NOW.minus(Duration.ofDays(1)));
        when(client.fetchEvent("tenant-a", "e1"))
                .thenThrow(new RateLimitedException(UsageSignal.hardLimit(), "throttled"));
        when(client.fetchEvent("tenant-b", "e2")).thenReturn(Optional.of(remote("e2", "no_show")));

        StatusRefreshResult result = service.refreshAll();

        assertEquals(1, result.getTenantsFailed());
        assertEquals(1, result.getTenantsChecked());
        assertEquals(EventStatus.NO_SHOW, localStore.event("tenant-b", "e2").orElseThrow().getStatus());
    }

    @Test
    void refreshAll_singleEventFailure_isCountedAndSkipped() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        store("tenant-a", "e1", NOW.minus(Duration.ofHours(30)));
        store("tenant-a", "e2", NOW.minus(Duration.ofHours(20)));
        when(client.fetchEvent("tenant-a", "e1")).thenThrow(new RemoteApiException(500, "boom"));
        when(client.fetchEvent("tenant-a", "e2")).thenReturn(Optional.empty());

        StatusRefreshResult result = service.refreshAll();

        assertEquals(1, result.getErrors());
        assertEquals(1, result.getEventsUpdated());
        assertEquals(1, result.getTenantsChecked());
    }

    private void store(String tenantId, String eventId, Instant scheduledAt) {
        localStore.upsertEvent(BookingEvent.builder()
                .tenantId(tenantId)
                .providerEventId(eventId)
                .providerEventTypeId("type-a")
                .scheduledAt(scheduledAt)
                .createdAt(scheduledAt.minus(Duration.ofDays(3)))
                .status(EventStatus.ACTIVE)
                .inviteeName("Ada")
                .build());
    }

    private static RemoteEvent remote(String id, String status) {
        return RemoteEvent.of(id, "type-a", "Intro call", NOW.minus(Duration.ofDays(1)), NOW.minus(Duration.ofDays(4)), status);
    }
}
