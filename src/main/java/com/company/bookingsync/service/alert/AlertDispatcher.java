package com.company.bookingsync.service.alert;

import com.company.bookingsync.domain.SyncAlert;
import com.company.bookingsync.domain.enums.DispatchStatus;
import com.company.bookingsync.repository.SyncAlertRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Sends a stored alert and tracks its dispatch state. Alerts left PENDING or FAILED are
 * picked up again by {@link com.company.bookingsync.scheduled.AlertProcessingJob}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertDispatcher {

    private final AlertSender alertSender;
    private final SyncAlertRepository alertRepository;
    private final MeterRegistry meterRegistry;

    @Retry(name = "alertDispatch", fallbackMethod = "dispatchFallback")
    @CircuitBreaker(name = "alertDispatch")
    public void dispatch(SyncAlert alert) {
        if (alert.getDispatchStatus() != null && alert.getDispatchStatus().isFinal()) {
            log.debug("Alert {} already sent", alert.getAlertId());
            return;
        }

        try {
            alertSender.send(alert);

            alert.setDispatchStatus(DispatchStatus.SENT);
            alert.setDispatchedAt(Instant.now());
            alert.setLastError(null);
            alertRepository.updateDispatch(alert);

            meterRegistry.counter("sync.alerts.sent",
                    "severity", alert.getSeverity().name()
            ).increment();

        } catch (RuntimeException e) {
            log.error("Failed to send alert {}", alert.getAlertId(), e);

            alert.setDispatchStatus(DispatchStatus.FAILED);
            alert.setRetryCount(retries(alert) + 1);
            alert.setLastError(e.getMessage());
            alertRepository.updateDispatch(alert);

            meterRegistry.counter("sync.alerts.failed",
                    "severity", alert.getSeverity().name()
            ).increment();

            throw e;
        }
    }

    /**
     * Retries exhausted or circuit open: keep the alert for the batch job.
     */
    private void dispatchFallback(SyncAlert alert, Exception e) {
        log.error("Alert sink unavailable for alert {}, leaving it for retry: {}",
                alert.getAlertId(), e.getMessage());

        alert.setDispatchStatus(DispatchStatus.PENDING);
        alert.setLastError("Dispatch deferred: " + e.getMessage());
        alertRepository.updateDispatch(alert);

        meterRegistry.counter("sync.alerts.deferred").increment();
    }

    private static int retries(SyncAlert alert) {
        return alert.getRetryCount() != null ? alert.getRetryCount() : 0;
    }
}
