package com.company.bookingsync.service.health;

import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.Provider;

import java.time.Instant;
import java.util.List;

/**
 * Provider-specific scoring rules. What counts as worrying inactivity differs between a
 * high-traffic booking provider and a low-traffic one.
 */
public interface ProviderHealthStrategy {

    boolean supports(Provider provider);

    /**
     * @param recentRuns sync runs of this integration inside the health lookback, newest first
     */
    HealthEvaluation evaluate(Integration integration, List<SyncRun> recentRuns, Instant now);
}
