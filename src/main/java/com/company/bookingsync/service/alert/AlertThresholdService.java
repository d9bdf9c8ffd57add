package com.company.bookingsync.service.alert;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.AlertThreshold;
import com.company.bookingsync.domain.SyncAlert;
import com.company.bookingsync.domain.enums.AlertStatus;
import com.company.bookingsync.domain.enums.DispatchStatus;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.Severity;
import com.company.bookingsync.event.AlertRaisedEvent;
import com.company.bookingsync.repository.AlertThresholdRepository;
import com.company.bookingsync.repository.SyncAlertRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Compares a computed score with the configured (metric, min value) pairs and raises an
 * alert on breach. A breach already alerted inside the cooldown window is not raised again.
 */
@Service
@Slf4j
public class AlertThresholdService {

    private final AlertThresholdRepository thresholdRepository;
    private final SyncAlertRepository alertRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final SyncProperties.Alerts settings;

    public AlertThresholdService(AlertThresholdRepository thresholdRepository,
                                 SyncAlertRepository alertRepository,
                                 ApplicationEventPublisher eventPublisher,
                                 MeterRegistry meterRegistry,
                                 Clock clock,
                                 SyncProperties properties) {
        this.thresholdRepository = thresholdRepository;
        this.alertRepository = alertRepository;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.settings = properties.getAlerts();
    }

    /**
     * @return the newly raised alert, empty when nothing was breached or the breach is already alerted
     */
    public Optional<SyncAlert> evaluate(String tenantId, Provider provider, MetricType metricType, double value) {
        Optional<AlertThreshold> breached = resolveThresholds(tenantId, provider, metricType).stream()
                .filter(threshold -> threshold.isBreachedBy(value))
                .findFirst();

        if (breached.isEmpty()) {
            return Optional.empty();
        }
        AlertThreshold threshold = breached.get();

        Instant now = clock.instant();
        Instant cooldownStart = now.minus(Duration.ofMinutes(threshold.getCooldownMinutes()));
        if (alertRepository.existsActiveSince(tenantId, provider, metricType, cooldownStart)) {
            log.debug("{} alert for tenant {} already raised within {} minutes, skipping",
                    metricType.getCode(), tenantId, threshold.getCooldownMinutes());
            meterRegistry.counter("sync.alerts.suppressed", "metric", metricType.getCode()).increment();
            return Optional.empty();
        }

        SyncAlert alert = SyncAlert.builder()
                .tenantId(tenantId)
                .provider(provider)
                .metricType(metricType)
                .metricValue(value)
                .thresholdValue(threshold.getMinValue())
                .severity(threshold.getSeverity())
                .status(AlertStatus.ACTIVE)
                .dispatchStatus(DispatchStatus.PENDING)
                .retryCount(0)
                .triggeredAt(now)
                .build();

        SyncAlert saved = alertRepository.save(alert);

        log.warn("{} alert for tenant {} ({}): {} below {}",
                threshold.getSeverity(), tenantId, metricType.getCode(), value, threshold.getMinValue());
        meterRegistry.counter("sync.alerts.raised",
                "metric", metricType.getCode(),
                "severity", threshold.getSeverity().name()
        ).increment();

        eventPublisher.publishEvent(new AlertRaisedEvent(saved));
        return Optional.of(saved);
    }

    /**
     * Tenant-specific thresholds win over provider-wide rows, which win over configured defaults.
     */
    List<AlertThreshold> resolveThresholds(String tenantId, Provider provider, MetricType metricType) {
        List<AlertThreshold> stored = thresholdRepository.findApplicable(tenantId, provider, metricType);

        List<AlertThreshold> tenantSpecific = stored.stream()
                .filter(threshold -> tenantId != null && tenantId.equals(threshold.getTenantId()))
                .collect(Collectors.toList());
        if (!tenantSpecific.isEmpty()) {
            return tenantSpecific;
        }
        if (!stored.isEmpty()) {
            return stored;
        }

        return settings.getDefaults().stream()
                .filter(candidate -> metricType.getCode().equalsIgnoreCase(candidate.getMetricType()))
                .map(candidate -> AlertThreshold.builder()
                        .provider(provider)
                        .metricType(metricType)
                        .minValue(candidate.getMinValue())
                        .severity(Severity.fromString(candidate.getSeverity()))
                        .cooldownMinutes(settings.getDefaultCooldownMinutes())
                        .enabled(true)
                        .build())
                .collect(Collectors.toList());
    }
}
