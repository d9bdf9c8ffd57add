package com.company.bookingsync.service.sync;

import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.RunOutcome;
import com.company.bookingsync.event.SyncRunCompletedEvent;
import com.company.bookingsync.exception.LocalStoreUnavailableException;
import com.company.bookingsync.exception.NoConnectedIntegrationsException;
import com.company.bookingsync.exception.SyncAlreadyRunningException;
import com.company.bookingsync.exception.SyncCancelledException;
import com.company.bookingsync.remote.RateLimitedException;
import com.company.bookingsync.remote.RemoteEventClient;
import com.company.bookingsync.repository.LocalStore;
import com.company.bookingsync.service.ratelimit.RateLimitCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one sync pass over every connected tenant of a provider.
 *
 * <p>Tenants are processed one at a time through the rate limit coordinator. Any failure
 * inside a tenant becomes a failed run and the batch moves on; only an unreachable local
 * store aborts the batch.
 */
@Service
@Slf4j
public class SyncOrchestrator {

    private final LocalStore localStore;
    private final SyncWindowPlanner planner;
    private final GapReconciler reconciler;
    private final RateLimitCoordinator rateLimitCoordinator;
    private final Map<Provider, RemoteEventClient> clients;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ReentrantLock batchLock = new ReentrantLock();
    private volatile CancellationToken activeToken;
    private volatile SyncSummary lastSummary;

    public SyncOrchestrator(LocalStore localStore,
                            SyncWindowPlanner planner,
                            GapReconciler reconciler,
                            RateLimitCoordinator rateLimitCoordinator,
                            List<RemoteEventClient> remoteClients,
                            ApplicationEventPublisher eventPublisher,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        this.localStore = localStore;
        this.planner = planner;
        this.reconciler = reconciler;
        this.rateLimitCoordinator = rateLimitCoordinator;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.clients = new EnumMap<>(Provider.class);
        for (RemoteEventClient client : remoteClients) {
            this.clients.put(client.provider(), client);
        }
    }

    /**
     * Run one batch.
     *
     * @throws NoConnectedIntegrationsException when no connected tenant matches the request
     * @throws SyncAlreadyRunningException      when another batch is in progress
     * @throws LocalStoreUnavailableException   when the local store cannot be reached
     */
    public SyncSummary runSync(SyncRequest request) {
        RemoteEventClient client = clients.get(request.getProvider());
        if (client == null) {
            throw new IllegalArgumentException("No remote client for provider " + request.getProvider().getCode());
        }

        if (!batchLock.tryLock()) {
            throw new SyncAlreadyRunningException();
        }

        CancellationToken token = new CancellationToken();
        activeToken = token;
        Timer.Sample batchTimer = Timer.start(meterRegistry);
        try {
            return runBatch(request, client, token);
        } finally {
            batchTimer.stop(meterRegistry.timer("sync.batch.duration",
                    "provider", request.getProvider().getCode(),
                    "mode", request.getMode().getCode()));
            activeToken = null;
            batchLock.unlock();
        }
    }

    /**
     * Ask the running batch to stop before its next tenant.
     *
     * @return false when no batch is running
     */
    public boolean cancelCurrentRun() {
        CancellationToken token = activeToken;
        if (token == null) {
            return false;
        }
        token.cancel();
        log.warn("Cancellation requested for the running sync batch");
        return true;
    }

    public boolean isRunning() {
        return batchLock.isLocked();
    }

    public SyncSummary getLastSummary() {
        return lastSummary;
    }

    private SyncSummary runBatch(SyncRequest request, RemoteEventClient client, CancellationToken token) {
        Provider provider = request.getProvider();
        List<Integration> integrations = localStore.listConnectedIntegrations(provider, request.getTenantId());
        if (integrations.isEmpty()) {
            throw new NoConnectedIntegrationsException(provider.getCode(), request.getTenantId());
        }

        SyncSummary summary = SyncSummary.builder()
                .totalTenants(integrations.size())
                .syncMode(request.getMode())
                .startedAt(clock.instant())
                .build();

        log.info("Starting {} {} sync for {} tenant(s) ({})",
                request.getMode().getCode(), provider.getCode(), integrations.size(),
                request.getTrigger().getCode());

        for (Integration integration : integrations) {
            if (token.isCancelled()) {
                summary.setCancelled(true);
                log.warn("Sync batch cancelled, {} of {} tenant(s) not attempted",
                        summary.getTotalTenants() - summary.getTenantsProcessed() - summary.getTenantsWithErrors(),
                        summary.getTotalTenants());
                break;
            }

            MDC.put("tenantId", integration.getTenantId());
            try {
                SyncRun run = syncTenant(integration, request, client, token);
                summary.getResults().add(TenantSyncResult.from(run));
                if (run.isSuccessful()) {
                    summary.setTenantsProcessed(summary.getTenantsProcessed() + 1);
                } else {
                    summary.setTenantsWithErrors(summary.getTenantsWithErrors() + 1);
                }
            } finally {
                MDC.remove("tenantId");
            }
        }

        summary.setCompletedAt(clock.instant());
        lastSummary = summary;

        log.info("Sync batch completed: {} succeeded, {} failed, {} total{}",
                summary.getTenantsProcessed(), summary.getTenantsWithErrors(), summary.getTotalTenants(),
                summary.isCancelled() ? " (cancelled)" : "");

        return summary;
    }

    private SyncRun syncTenant(Integration integration, SyncRequest request,
                               RemoteEventClient client, CancellationToken token) {
        String tenantId = integration.getTenantId();
        Instant startedAt = clock.instant();
        SyncRun.SyncRunBuilder run = SyncRun.builder()
                .tenantId(tenantId)
                .provider(integration.getProvider())
                .mode(request.getMode())
                .trigger(request.getTrigger())
                .startedAt(startedAt);

        try {
            rateLimitCoordinator.acquire(tenantId);

            SyncWindow window = planner.plan(integration, request.getMode(), request.getDaysBack(), clock.instant());
            run.windowStart(window.start()).windowEnd(window.end()).mode(window.mode());

            ReconciliationResult result = reconciler.reconcile(tenantId, window, client);

            localStore.updateLastSync(tenantId, integration.getProvider(), window.end());

            run.outcome(RunOutcome.SUCCESS)
                    .remoteSeen(result.getRemoteSeen())
                    .gapsFound(result.getGapsFound())
                    .eventsSynced(result.getSynced())
                    .statusUpdated(result.getStatusUpdated())
                    .errors(result.getFailed())
                    .rateLimitHit(result.isRateLimitHit());

        } catch (LocalStoreUnavailableException e) {
            throw e;
        } catch (SyncCancelledException e) {
            token.cancel();
            run.outcome(RunOutcome.FAILED).errors(1).errorMessage(e.getMessage());
            log.warn("Sync for tenant {} interrupted", tenantId);
        } catch (RateLimitedException e) {
            rateLimitCoordinator.reportUsage(e.getSignal());
            run.outcome(RunOutcome.FAILED).errors(1).rateLimitHit(true).errorMessage(e.getMessage());
            log.warn("Sync for tenant {} stopped by provider rate limit: {}", tenantId, e.getMessage());
        } catch (Exception e) {
            run.outcome(RunOutcome.FAILED).errors(1).errorMessage(e.getMessage());
            log.error("Sync failed for tenant {}: {}", tenantId, e.getMessage(), e);
        }

        SyncRun completed = run.durationMs(Duration.between(startedAt, clock.instant()).toMillis()).build();
        recordRun(completed);
        return completed;
    }

    private void recordRun(SyncRun run) {
        try {
            localStore.recordMetric(run.getTenantId(), run.getProvider(), MetricType.SYNC_RUN,
                    run.isSuccessful() ? 1.0 : 0.0, run.toMetadata());
        } catch (LocalStoreUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to record sync run for tenant {}: {}", run.getTenantId(), e.getMessage());
        }

        meterRegistry.counter("sync.tenant.runs",
                "provider", run.getProvider().getCode(),
                "outcome", run.getOutcome().name().toLowerCase()
        ).increment();
        if (run.getEventsSynced() > 0) {
            meterRegistry.counter("sync.events.synced",
                    "provider", run.getProvider().getCode()
            ).increment(run.getEventsSynced());
        }

        eventPublisher.publishEvent(new SyncRunCompletedEvent(run));
    }
}
