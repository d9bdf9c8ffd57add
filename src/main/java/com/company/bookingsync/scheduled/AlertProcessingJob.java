package com.company.bookingsync.scheduled;

import com.company.bookingsync.domain.SyncAlert;
import com.company.bookingsync.domain.enums.DispatchStatus;
import com.company.bookingsync.repository.SyncAlertRepository;
import com.company.bookingsync.service.alert.AlertDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Retries alerts whose immediate dispatch did not go through.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "booking-sync.jobs.alert-retry.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AlertProcessingJob {

    private static final int BATCH_SIZE = 100;

    private final SyncAlertRepository alertRepository;
    private final AlertDispatcher alertDispatcher;

    @Scheduled(fixedDelayString = "${booking-sync.jobs.alert-retry.delay-ms:300000}", initialDelay = 60000)
    public void processPendingAlerts() {
        List<SyncAlert> pending = alertRepository.findUndispatched(BATCH_SIZE);

        if (pending.isEmpty()) {
            log.debug("No pending alerts to process");
            return;
        }

        log.info("Processing {} pending alerts", pending.size());

        int successCount = 0;
        int failureCount = 0;

        for (SyncAlert alert : pending) {
            try {
                alertDispatcher.dispatch(alert);
                if (alert.getDispatchStatus() == DispatchStatus.SENT) {
                    successCount++;
                } else {
                    failureCount++;
                }
            } catch (Exception e) {
                log.error("Failed to dispatch alert {}", alert.getAlertId(), e);
                failureCount++;
            }
        }

        log.info("Alert processing completed: {} succeeded, {} failed", successCount, failureCount);
    }
}
