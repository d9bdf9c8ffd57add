package com.company.bookingsync.service.sync;

import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.event.SyncRunCompletedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Consecutive failed runs per tenant, fed by completed sync runs.
 */
@Component
@Slf4j
public class SyncRunTracker {

    private static final int WARN_AFTER_FAILURES = 3;

    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();

    @EventListener
    public void onSyncRunCompleted(SyncRunCompletedEvent event) {
        SyncRun run = event.getRun();
        if (run.isSuccessful()) {
            Integer previous = consecutiveFailures.remove(run.getTenantId());
            if (previous != null) {
                log.info("Tenant {} recovered after {} failed sync run(s)", run.getTenantId(), previous);
            }
            return;
        }

        int failures = consecutiveFailures.merge(run.getTenantId(), 1, Integer::sum);
        if (failures >= WARN_AFTER_FAILURES) {
            log.warn("Tenant {} has failed {} sync runs in a row, last error: {}",
                    run.getTenantId(), failures, run.getErrorMessage());
        }
    }

    public int consecutiveFailures(String tenantId) {
        return consecutiveFailures.getOrDefault(tenantId, 0);
    }

    public int failingTenants() {
        return consecutiveFailures.size();
    }
}
