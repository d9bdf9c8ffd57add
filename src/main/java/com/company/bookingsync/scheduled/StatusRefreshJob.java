package com.company.bookingsync.scheduled;

import com.company.bookingsync.service.sync.EventStatusRefreshService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "booking-sync.jobs.status-refresh.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class StatusRefreshJob {

    private final EventStatusRefreshService statusRefreshService;

    @Scheduled(cron = "${booking-sync.jobs.status-refresh.cron:0 30 */6 * * *}")
    public void refreshRecentEventStatuses() {
        log.info("Starting status refresh of recently passed events");
        try {
            statusRefreshService.refreshAll();
        } catch (Exception e) {
            log.error("Status refresh aborted", e);
        }
    }
}
