package com.company.bookingsync.service.health;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.Provider;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Low-traffic providers: only run outcomes count, and silence is penalized lightly.
 */
@Component
public class SyncRunOnlyHealthStrategy extends RunBasedHealthStrategy {

    private static final Set<Provider> SUPPORTED = EnumSet.of(Provider.FACEBOOK, Provider.GOHIGHLEVEL);

    public SyncRunOnlyHealthStrategy(SyncProperties properties) {
        super(properties);
    }

    @Override
    public boolean supports(Provider provider) {
        return SUPPORTED.contains(provider);
    }

    @Override
    protected int noRecentRunsPenalty() {
        return settings.getLowTrafficNoRunsPenalty();
    }

    @Override
    public HealthEvaluation evaluate(Integration integration, List<SyncRun> recentRuns, Instant now) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        return HealthEvaluation.builder()
                .healthScore(scoreRuns(recentRuns, metrics))
                .dataQualityScore(MAX_SCORE)
                .metrics(metrics)
                .build();
    }
}
