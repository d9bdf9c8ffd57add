package com.company.bookingsync.service.health;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.repository.LocalStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calendly is expected to sync daily; a quiet day is a problem. Active events whose slot
 * passed long ago mean a status change was missed.
 */
@Component
public class CalendlyHealthStrategy extends RunBasedHealthStrategy {

    private final LocalStore localStore;

    public CalendlyHealthStrategy(SyncProperties properties, LocalStore localStore) {
        super(properties);
        this.localStore = localStore;
    }

    @Override
    public boolean supports(Provider provider) {
        return provider == Provider.CALENDLY;
    }

    @Override
    protected int noRecentRunsPenalty() {
        return settings.getNoRecentRunsPenalty();
    }

    @Override
    public HealthEvaluation evaluate(Integration integration, List<SyncRun> recentRuns, Instant now) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        int healthScore = scoreRuns(recentRuns, metrics);

        metrics.put("recent_events",
                localStore.countEventsCreatedSince(integration.getTenantId(), now.minus(settings.getLookback())));

        int dataQuality = MAX_SCORE;
        long stale = localStore.countStaleActiveEvents(integration.getTenantId(), now.minus(settings.getStaleness()));
        if (stale > 0) {
            dataQuality = floor(dataQuality - settings.getStaleEventsPenalty());
            metrics.put("stale_events", stale);
        }

        return HealthEvaluation.builder()
                .healthScore(healthScore)
                .dataQualityScore(dataQuality)
                .metrics(metrics)
                .build();
    }
}
