package com.company.bookingsync.service.health;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.repository.LocalStore;
import com.company.bookingsync.service.alert.AlertThresholdService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scores every connected integration from its recent sync runs and stored event state,
 * persists the scores and hands them to the threshold check.
 */
@Service
@Slf4j
public class HealthMonitorService {

    private static final int UNKNOWN_PROVIDER_SCORE = 50;

    private final LocalStore localStore;
    private final List<ProviderHealthStrategy> strategies;
    private final AlertThresholdService alertThresholdService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final SyncProperties.Health settings;

    public HealthMonitorService(LocalStore localStore,
                                List<ProviderHealthStrategy> strategies,
                                AlertThresholdService alertThresholdService,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                SyncProperties properties) {
        this.localStore = localStore;
        this.strategies = strategies;
        this.alertThresholdService = alertThresholdService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.settings = properties.getHealth();
    }

    /**
     * @param tenantFilter   null checks every tenant
     * @param providerFilter provider code, null checks every provider
     */
    public HealthCheckReport checkHealth(String tenantFilter, String providerFilter) {
        Provider provider = providerFilter != null && !providerFilter.isBlank()
                ? Provider.fromCode(providerFilter)
                : null;

        List<Integration> integrations = localStore.listAllConnectedIntegrations(provider, tenantFilter);
        log.info("Checking health for {} integration(s)", integrations.size());

        List<TenantHealthResult> results = new ArrayList<>();
        for (Integration integration : integrations) {
            MDC.put("tenantId", integration.getTenantId());
            try {
                results.add(checkIntegration(integration));
            } finally {
                MDC.remove("tenantId");
            }
        }

        HealthCheckReport report = HealthCheckReport.of(clock.instant(), results);
        log.info("Health check summary: checked={}, healthy={}, unhealthy={}, average={}",
                report.getSummary().getTotalChecked(), report.getSummary().getHealthy(),
                report.getSummary().getUnhealthy(), report.getSummary().getAverageHealthScore());
        return report;
    }

    private TenantHealthResult checkIntegration(Integration integration) {
        String tenantId = integration.getTenantId();
        Provider provider = integration.getProvider();
        Instant started = clock.instant();

        try {
            HealthEvaluation evaluation = evaluate(integration, started);
            long durationMs = Duration.between(started, clock.instant()).toMillis();

            recordScores(integration, evaluation.getHealthScore(), evaluation.getDataQualityScore(),
                    evaluation.getMetrics(), durationMs);

            alertThresholdService.evaluate(tenantId, provider, MetricType.HEALTH_SCORE, evaluation.getHealthScore());
            alertThresholdService.evaluate(tenantId, provider, MetricType.DATA_QUALITY, evaluation.getDataQualityScore());

            localStore.updateHealthScores(tenantId, provider,
                    evaluation.getHealthScore(), evaluation.getDataQualityScore(), started);

            String status = evaluation.getHealthScore() < settings.getUnhealthyBelow()
                    ? TenantHealthResult.UNHEALTHY
                    : TenantHealthResult.HEALTHY;

            meterRegistry.counter("sync.health.checks",
                    "provider", provider.getCode(), "status", status).increment();
            log.debug("Health for tenant {} ({}): score={}, quality={}",
                    tenantId, provider.getCode(), evaluation.getHealthScore(), evaluation.getDataQualityScore());

            return TenantHealthResult.builder()
                    .tenantId(tenantId)
                    .provider(provider.getCode())
                    .status(status)
                    .healthScore(evaluation.getHealthScore())
                    .dataQuality(evaluation.getDataQualityScore())
                    .metrics(evaluation.getMetrics())
                    .checkDurationMs(durationMs)
                    .build();

        } catch (Exception e) {
            long durationMs = Duration.between(started, clock.instant()).toMillis();
            log.error("Health check failed for tenant {} ({}): {}", tenantId, provider.getCode(), e.getMessage(), e);

            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("error", e.getMessage());
            try {
                recordScores(integration, 0, 0, metrics, durationMs);
            } catch (Exception recordFailure) {
                log.warn("Could not record failed health check for tenant {}: {}", tenantId, recordFailure.getMessage());
            }

            meterRegistry.counter("sync.health.checks",
                    "provider", provider.getCode(), "status", TenantHealthResult.UNHEALTHY).increment();

            return TenantHealthResult.builder()
                    .tenantId(tenantId)
                    .provider(provider.getCode())
                    .status(TenantHealthResult.UNHEALTHY)
                    .healthScore(0)
                    .dataQuality(0)
                    .metrics(metrics)
                    .checkDurationMs(durationMs)
                    .error(e.getMessage())
                    .build();
        }
    }

    private HealthEvaluation evaluate(Integration integration, Instant now) {
        ProviderHealthStrategy strategy = strategies.stream()
                .filter(candidate -> candidate.supports(integration.getProvider()))
                .findFirst()
                .orElse(null);

        if (strategy == null) {
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("warning", "No health rules for provider " + integration.getProvider().getCode());
            return HealthEvaluation.builder()
                    .healthScore(UNKNOWN_PROVIDER_SCORE)
                    .dataQualityScore(UNKNOWN_PROVIDER_SCORE)
                    .metrics(metrics)
                    .build();
        }

        List<SyncRun> recentRuns = localStore.listRecentMetrics(integration.getTenantId(), now.minus(settings.getLookback()))
                .stream()
                .filter(metric -> metric.getMetricType() == MetricType.SYNC_RUN)
                .filter(metric -> metric.getProvider() == integration.getProvider())
                .map(SyncRun::fromMetric)
                .collect(Collectors.toList());

        return strategy.evaluate(integration, recentRuns, now);
    }

    private void recordScores(Integration integration, int healthScore, int dataQuality,
                              Map<String, Object> metrics, long durationMs) {
        String tenantId = integration.getTenantId();
        Provider provider = integration.getProvider();

        localStore.recordMetric(tenantId, provider, MetricType.HEALTH_SCORE, healthScore, metrics);
        localStore.recordMetric(tenantId, provider, MetricType.DATA_QUALITY, dataQuality, metrics);
        localStore.recordMetric(tenantId, provider, MetricType.HEALTH_CHECK_DURATION, durationMs, Map.of());
    }
}
