package com.company.bookingsync.service.health;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.SyncRun;

import java.util.List;
import java.util.Map;

/**
 * Health penalties derived from recent sync runs, shared by the concrete strategies.
 */
public abstract class RunBasedHealthStrategy implements ProviderHealthStrategy {

    protected static final int MAX_SCORE = 100;

    protected final SyncProperties.Health settings;

    protected RunBasedHealthStrategy(SyncProperties properties) {
        this.settings = properties.getHealth();
    }

    /**
     * Penalty applied when the lookback holds no runs at all.
     */
    protected abstract int noRecentRunsPenalty();

    protected int scoreRuns(List<SyncRun> recentRuns, Map<String, Object> metrics) {
        int score = MAX_SCORE;
        metrics.put("recent_syncs", recentRuns.size());

        if (recentRuns.isEmpty()) {
            metrics.put("warning", "No recent sync activity");
            return floor(score - noRecentRunsPenalty());
        }

        long successful = recentRuns.stream().filter(SyncRun::isSuccessful).count();
        double ratio = (double) successful / recentRuns.size();
        metrics.put("success_rate", Math.round(ratio * 1000.0) / 10.0);
        metrics.put("rate_limited_runs", recentRuns.stream().filter(SyncRun::isRateLimitHit).count());

        if (ratio < settings.getLowSuccessRatio()) {
            score -= settings.getLowSuccessPenalty();
        }
        if (ratio < settings.getVeryLowSuccessRatio()) {
            score -= settings.getVeryLowSuccessPenalty();
        }
        return floor(score);
    }

    protected static int floor(int score) {
        return Math.max(0, Math.min(MAX_SCORE, score));
    }
}
