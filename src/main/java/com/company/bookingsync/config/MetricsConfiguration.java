package com.company.bookingsync.config;

import com.company.bookingsync.service.ratelimit.RateLimitCoordinator;
import com.company.bookingsync.service.sync.SyncOrchestrator;
import com.company.bookingsync.service.sync.SyncRunTracker;
import com.company.bookingsync.service.sync.SyncSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final SyncOrchestrator orchestrator;
    private final RateLimitCoordinator rateLimitCoordinator;
    private final SyncRunTracker syncRunTracker;

    @Bean
    public MeterBinder syncMetrics() {
        return (reg) -> {
            Gauge.builder("sync.batch.last.tenants_failed", orchestrator, o -> {
                        SyncSummary summary = o.getLastSummary();
                        return summary != null ? summary.getTenantsWithErrors() : 0;
                    })
                    .description("Tenants that failed in the last completed sync batch")
                    .register(reg);

            Gauge.builder("sync.batch.last.tenants_total", orchestrator, o -> {
                        SyncSummary summary = o.getLastSummary();
                        return summary != null ? summary.getTotalTenants() : 0;
                    })
                    .description("Tenants in the last completed sync batch")
                    .register(reg);

            Gauge.builder("sync.batch.running", orchestrator, o -> o.isRunning() ? 1 : 0)
                    .description("1 while a sync batch is in progress")
                    .register(reg);

            Gauge.builder("sync.ratelimit.cooldown.remaining_ms", rateLimitCoordinator,
                            RateLimitCoordinator::cooldownRemainingMs)
                    .description("Time left in the global provider cooldown")
                    .register(reg);

            Gauge.builder("sync.tenants.failing", syncRunTracker, SyncRunTracker::failingTenants)
                    .description("Tenants whose latest sync run failed")
                    .register(reg);

            log.info("Sync metrics registered");
        };
    }
}
