package com.company.bookingsync.service.sync;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.enums.SyncMode;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Chooses the time window for a tenant's next sync. Pure function of its inputs.
 *
 * <ol>
 *   <li>deep: {@code [now - deepLookback, now]}</li>
 *   <li>incremental with a cursor: {@code [lastSync - overlap, now]}</li>
 *   <li>otherwise: {@code [now - daysBack, now]}</li>
 * </ol>
 */
@Component
public class SyncWindowPlanner {

    private final Duration deepLookback;
    private final Duration incrementalOverlap;
    private final int defaultDaysBack;

    public SyncWindowPlanner(SyncProperties properties) {
        SyncProperties.Planner planner = properties.getPlanner();
        this.deepLookback = planner.getDeepLookback();
        this.incrementalOverlap = planner.getIncrementalOverlap();
        this.defaultDaysBack = planner.getDefaultDaysBack();
    }

    public SyncWindow plan(Integration integration, SyncMode modeHint, Integer daysBack, Instant now) {
        SyncMode mode = modeHint != null ? modeHint : SyncMode.DEFAULT;

        if (mode == SyncMode.DEEP) {
            return new SyncWindow(now.minus(deepLookback), now, SyncMode.DEEP);
        }

        Instant lastSync = integration != null ? integration.getLastSync() : null;
        if (mode == SyncMode.INCREMENTAL && lastSync != null) {
            Instant start = lastSync.minus(incrementalOverlap);
            // A cursor in the future (clock skew) still yields a non-empty window
            if (start.isAfter(now)) {
                start = now.minus(incrementalOverlap);
            }
            return new SyncWindow(start, now, SyncMode.INCREMENTAL);
        }

        int days = daysBack != null && daysBack > 0 ? daysBack : defaultDaysBack;
        return new SyncWindow(now.minus(Duration.ofDays(days)), now, SyncMode.DEFAULT);
    }
}
