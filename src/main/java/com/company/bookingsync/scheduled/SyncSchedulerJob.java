package com.company.bookingsync.scheduled;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.SyncMode;
import com.company.bookingsync.domain.enums.SyncTrigger;
import com.company.bookingsync.exception.NoConnectedIntegrationsException;
import com.company.bookingsync.exception.SyncAlreadyRunningException;
import com.company.bookingsync.repository.LocalStore;
import com.company.bookingsync.service.sync.SyncOrchestrator;
import com.company.bookingsync.service.sync.SyncRequest;
import com.company.bookingsync.service.sync.SyncSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Component
@Slf4j
@ConditionalOnProperty(
        value = "booking-sync.jobs.sync.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SyncSchedulerJob {

    private final SyncOrchestrator orchestrator;
    private final LocalStore localStore;
    private final Clock clock;
    private final SyncProperties.Scheduler settings;

    public SyncSchedulerJob(SyncOrchestrator orchestrator,
                            LocalStore localStore,
                            Clock clock,
                            SyncProperties properties) {
        this.orchestrator = orchestrator;
        this.localStore = localStore;
        this.clock = clock;
        this.settings = properties.getScheduler();
    }

    /**
     * Daily incremental sync of every connected Calendly tenant.
     */
    @Scheduled(cron = "${booking-sync.jobs.sync.cron:0 0 3 * * *}")
    public void runScheduledSync() {
        int daysBack = chooseDaysBack();
        log.info("Starting scheduled incremental sync with a {} day fallback window", daysBack);

        run(SyncRequest.builder()
                .provider(Provider.CALENDLY)
                .mode(SyncMode.INCREMENTAL)
                .daysBack(daysBack)
                .trigger(SyncTrigger.SCHEDULED)
                .build());
    }

    /**
     * Weekly wide-window reconciliation.
     */
    @Scheduled(cron = "${booking-sync.jobs.deep-sync.cron:0 0 4 * * SUN}")
    public void runDeepReconciliation() {
        log.info("Starting scheduled deep reconciliation");

        run(SyncRequest.builder()
                .provider(Provider.CALENDLY)
                .mode(SyncMode.DEEP)
                .trigger(SyncTrigger.SCHEDULED)
                .build());
    }

    /**
     * Smaller look-back when the previous scheduled run succeeded recently.
     */
    int chooseDaysBack() {
        Instant recentCutoff = clock.instant().minus(settings.getRecentRunWindow());
        try {
            Optional<SyncRun> lastRun = localStore.findLatestSyncRun(Provider.CALENDLY, SyncTrigger.SCHEDULED);
            boolean recentSuccess = lastRun
                    .filter(SyncRun::isSuccessful)
                    .filter(run -> run.getStartedAt() != null && run.getStartedAt().isAfter(recentCutoff))
                    .isPresent();
            return recentSuccess ? settings.getRecentDaysBack() : settings.getStaleDaysBack();
        } catch (Exception e) {
            log.warn("Could not read the last scheduled run, using the wide window: {}", e.getMessage());
            return settings.getStaleDaysBack();
        }
    }

    private void run(SyncRequest request) {
        long started = System.currentTimeMillis();
        try {
            SyncSummary summary = orchestrator.runSync(request);
            log.info("Scheduled {} sync finished in {}: {} succeeded, {} failed, {} total",
                    request.getMode().getCode(),
                    Duration.ofMillis(System.currentTimeMillis() - started),
                    summary.getTenantsProcessed(), summary.getTenantsWithErrors(), summary.getTotalTenants());
        } catch (NoConnectedIntegrationsException e) {
            log.info("Scheduled sync skipped: {}", e.getMessage());
        } catch (SyncAlreadyRunningException e) {
            log.warn("Scheduled {} sync skipped, a batch is already running", request.getMode().getCode());
        } catch (Exception e) {
            log.error("Scheduled {} sync aborted", request.getMode().getCode(), e);
        }
    }
}
