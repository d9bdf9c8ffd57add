package com.company.bookingsync.scheduled;

import com.company.bookingsync.service.health.HealthCheckReport;
import com.company.bookingsync.service.health.HealthMonitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "booking-sync.jobs.health-check.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class HealthCheckJob {

    private final HealthMonitorService healthMonitorService;

    /**
     * Score every connected integration hourly.
     */
    @Scheduled(cron = "${booking-sync.jobs.health-check.cron:0 15 * * * *}")
    public void checkAllIntegrations() {
        try {
            HealthCheckReport report = healthMonitorService.checkHealth(null, null);
            if (report.getSummary().getUnhealthy() > 0) {
                log.warn("{} of {} integration(s) unhealthy",
                        report.getSummary().getUnhealthy(), report.getSummary().getTotalChecked());
            }
        } catch (Exception e) {
            log.error("Scheduled health check failed", e);
        }
    }
}
