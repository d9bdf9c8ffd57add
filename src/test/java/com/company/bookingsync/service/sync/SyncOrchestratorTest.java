package com.company.bookingsync.service.sync;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.SyncMetric;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.SyncMode;
import com.company.bookingsync.domain.enums.SyncTrigger;
import com.company.bookingsync.event.SyncRunCompletedEvent;
import com.company.bookingsync.exception.LocalStoreUnavailableException;
import com.company.bookingsync.exception.NoConnectedIntegrationsException;
import com.company.bookingsync.exception.SyncAlreadyRunningException;
import com.company.bookingsync.exception.TenantSyncException;
import com.company.bookingsync.remote.PageLimitExceededException;
import com.company.bookingsync.remote.RateLimitedException;
import com.company.bookingsync.remote.RemoteApiException;
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
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    private GapReconciler reconciler;
    @Mock
    private RateLimitCoordinator rateLimitCoordinator;
    @Mock
    private RemoteEventClient client;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryLocalStore localStore;
    private SimpleMeterRegistry meterRegistry;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        localStore = new InMemoryLocalStore();
        meterRegistry = new SimpleMeterRegistry();
        when(client.provider()).thenReturn(Provider.CALENDLY);
        orchestrator = new SyncOrchestrator(
                localStore,
                new SyncWindowPlanner(new SyncProperties()),
                reconciler,
                rateLimitCoordinator,
                List.of(client),
                eventPublisher,
                meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void runSync_oneTenantFailing_doesNotStopTheOthers() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        localStore.addIntegration("tenant-b", Provider.CALENDLY, null);
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client)))
                .thenThrow(new RemoteApiException(500, "Calendly returned 500"));
        when(reconciler.reconcile(eq("tenant-b"), any(), eq(client)))
                .thenReturn(ReconciliationResult.builder().remoteSeen(4).gapsFound(3).synced(3).build());

        SyncSummary summary = orchestrator.runSync(request(SyncMode.DEFAULT));

        assertEquals(2, summary.getTotalTenants());
        assertEquals(1, summary.getTenantsProcessed());
        assertEquals(1, summary.getTenantsWithErrors());
        assertFalse(summary.getResults().get(0).isSuccess());
        assertEquals("Calendly returned 500", summary.getResults().get(0).getError());
        assertTrue(summary.getResults().get(1).isSuccess());
        assertEquals(3, summary.getResults().get(1).getEventsSynced());

        assertNull(localStore.integration("tenant-a", Provider.CALENDLY).getLastSync());
        assertEquals(NOW, localStore.integration("tenant-b", Provider.CALENDLY).getLastSync());

        List<SyncMetric> runs = localStore.metrics(MetricType.SYNC_RUN);
        assertEquals(2, runs.size());
        assertEquals(0.0, runs.get(0).getValue());
        assertEquals(1.0, runs.get(1).getValue());
        verify(eventPublisher, times(2)).publishEvent(any(SyncRunCompletedEvent.class));
        verify(rateLimitCoordinator).acquire("tenant-a");
        verify(rateLimitCoordinator).acquire("tenant-b");
    }

    @Test
    void runSync_incremental_plansFromTheStoredCursor() {
        Instant lastSync = NOW.minus(Duration.ofHours(10));
        localStore.addIntegration("tenant-a", Provider.CALENDLY, lastSync);
        AtomicReference<SyncWindow> planned = new AtomicReference<>();
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client))).thenAnswer(invocation -> {
            planned.set(invocation.getArgument(1));
            return ReconciliationResult.builder().build();
        });

        orchestrator.runSync(request(SyncMode.INCREMENTAL));

        assertEquals(lastSync.minus(Duration.ofHours(1)), planned.get().start());
        assertEquals(NOW, planned.get().end());
        assertEquals("incremental", localStore.metrics(MetricType.SYNC_RUN).get(0).getMetadata().get("mode"));
    }

    @Test
    void runSync_tenantWithoutToken_isRecordedAsFailedRun() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client)))
                .thenThrow(new TenantSyncException("tenant-a", "No Calendly access token for tenant tenant-a"));

        SyncSummary summary = orchestrator.runSync(request(SyncMode.DEFAULT));

        assertEquals(0, summary.getTenantsProcessed());
        assertEquals(1, summary.getTenantsWithErrors());
        assertEquals("FAILED", localStore.metrics(MetricType.SYNC_RUN).get(0).getMetadata().get("outcome"));
    }

    @Test
    void runSync_rateLimitedTenant_startsCooldownAndContinues() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        localStore.addIntegration("tenant-b", Provider.CALENDLY, null);
        UsageSignal signal = UsageSignal.hardLimit();
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client)))
                .thenThrow(new RateLimitedException(signal, "Calendly rate limit hit"));
        when(reconciler.reconcile(eq("tenant-b"), any(), eq(client)))
                .thenReturn(ReconciliationResult.builder().build());

        SyncSummary summary = orchestrator.runSync(request(SyncMode.DEFAULT));

        assertTrue(summary.getResults().get(0).isRateLimitHit());
        assertEquals(1, summary.getTenantsProcessed());
        verify(rateLimitCoordinator).reportUsage(signal);
    }

    @Test
    void runSync_noConnectedTenants_throws() {
        localStore.addIntegration("tenant-x", Provider.FACEBOOK, null);

        assertThrows(NoConnectedIntegrationsException.class, () -> orchestrator.runSync(request(SyncMode.DEFAULT)));
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void runSync_tenantFilter_limitsTheBatch() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        localStore.addIntegration("tenant-b", Provider.CALENDLY, null);
        when(reconciler.reconcile(eq("tenant-b"), any(), eq(client)))
                .thenReturn(ReconciliationResult.builder().build());

        SyncRequest request = request(SyncMode.DEFAULT);
        request.setTenantId("tenant-b");
        SyncSummary summary = orchestrator.runSync(request);

        assertEquals(1, summary.getTotalTenants());
        verify(reconciler, never()).reconcile(eq("tenant-a"), any(), any());
    }

    @Test
    void runSync_localStoreDown_abortsTheBatch() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        localStore.addIntegration("tenant-b", Provider.CALENDLY, null);
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client)))
                .thenThrow(new LocalStoreUnavailableException("connection refused", null));

        assertThrows(LocalStoreUnavailableException.class, () -> orchestrator.runSync(request(SyncMode.DEFAULT)));
        verify(reconciler, never()).reconcile(eq("tenant-b"), any(), any());
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void cancelCurrentRun_stopsBeforeTheNextTenant() {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        localStore.addIntegration("tenant-b", Provider.CALENDLY, null);
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client))).thenAnswer(invocation -> {
            assertTrue(orchestrator.cancelCurrentRun());
            return ReconciliationResult.builder().build();
        });

        SyncSummary summary = orchestrator.runSync(request(SyncMode.DEFAULT));

        assertTrue(summary.isCancelled());
        assertEquals(1, summary.getResults().size());
        assertEquals(2, summary.getTotalTenants());
        verify(reconciler, never()).reconcile(eq("tenant-b"), any(), any());
    }

    @Test
    void cancelCurrentRun_withoutRunningBatch_returnsFalse() {
        assertFalse(orchestrator.cancelCurrentRun());
    }

    @Test
    void runSync_whileAnotherBatchRuns_isRejected() throws Exception {
        localStore.addIntegration("tenant-a", Provider.CALENDLY, null);
        ExecutorService otherCaller = Executors.newSingleThreadExecutor();
        AtomicReference<Throwable> rejection = new AtomicReference<>();
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client))).thenAnswer(invocation -> {
            Future<SyncSummary> concurrent = otherCaller.submit(() -> orchestrator.runSync(request(SyncMode.DEFAULT)));
            try {
                concurrent.get();
            } catch (ExecutionException e) {
                rejection.set(e.getCause());
            }
            return ReconciliationResult.builder().build();
        });

        try {
            orchestrator.runSync(request(SyncMode.DEFAULT));
        } finally {
            otherCaller.shutdownNow();
        }

        assertInstanceOf(SyncAlreadyRunningException.class, rejection.get());
        verify(reconciler, times(1)).reconcile(any(), any(), any());
    }

    @Test
    void runSync_storedCursorAheadOfNow_isNeverRewound() {
        Instant aheadOfNow = NOW.plus(Duration.ofHours(6));
        localStore.addIntegration("tenant-a", Provider.CALENDLY, aheadOfNow);
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client)))
                .thenReturn(ReconciliationResult.builder().remoteSeen(1).build());

        SyncSummary summary = orchestrator.runSync(request(SyncMode.INCREMENTAL));

        assertEquals(1, summary.getTenantsProcessed());
        assertEquals(aheadOfNow, localStore.integration("tenant-a", Provider.CALENDLY).getLastSync());
    }

    @Test
    void runSync_truncatedRemoteListing_failsTheTenantAndKeepsTheCursor() {
        Instant lastSync = NOW.minus(Duration.ofHours(10));
        localStore.addIntegration("tenant-a", Provider.CALENDLY, lastSync);
        when(reconciler.reconcile(eq("tenant-a"), any(), eq(client)))
                .thenThrow(new PageLimitExceededException(50, "Calendly listing for tenant tenant-a exceeds 50 pages"));

        SyncSummary summary = orchestrator.runSync(request(SyncMode.INCREMENTAL));

        assertEquals(0, summary.getTenantsProcessed());
        assertEquals(1, summary.getTenantsWithErrors());
        assertEquals(lastSync, localStore.integration("tenant-a", Provider.CALENDLY).getLastSync());
        assertEquals(0.0, localStore.metrics(MetricType.SYNC_RUN).get(0).getValue());
    }

    @Test
    void runSync_unknownProvider_isRejected() {
        SyncRequest request = request(SyncMode.DEFAULT);
        request.setProvider(Provider.FACEBOOK);

        assertThrows(IllegalArgumentException.class, () -> orchestrator.runSync(request));
    }

    private static SyncRequest request(SyncMode mode) {
        return SyncRequest.builder()
                .provider(Provider.CALENDLY)
                .mode(mode)
                .daysBack(7)
                .trigger(SyncTrigger.MANUAL)
                .build();
    }
}
