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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertThresholdServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    private AlertThresholdRepository thresholdRepository;
    @Mock
    private SyncAlertRepository alertRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private AlertThresholdService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new AlertThresholdService(thresholdRepository, alertRepository, eventPublisher,
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC), new SyncProperties());
    }

    @Test
    void evaluate_breach_savesAndPublishesAlert() {
        when(thresholdRepository.findApplicable("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE))
                .thenReturn(List.of(threshold(null, 70, Severity.HIGH, 30)));
        when(alertRepository.save(any(SyncAlert.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Optional<SyncAlert> raised = service.evaluate("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE, 45);

        assertTrue(raised.isPresent());
        SyncAlert alert = raised.get();
        assertEquals(45.0, alert.getMetricValue());
        assertEquals(70.0, alert.getThresholdValue());
        assertEquals(Severity.HIGH, alert.getSeverity());
        assertEquals(AlertStatus.ACTIVE, alert.getStatus());
        assertEquals(DispatchStatus.PENDING, alert.getDispatchStatus());
        verify(alertRepository).existsActiveSince("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE,
                NOW.minus(Duration.ofMinutes(30)));
        verify(eventPublisher).publishEvent(any(AlertRaisedEvent.class));
        assertEquals(1.0, meterRegistry.counter("sync.alerts.raised",
                "metric", "health_score", "severity", "HIGH").count());
    }

    @Test
    void evaluate_valueAtOrAboveMinimum_raisesNothing() {
        when(thresholdRepository.findApplicable("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE))
                .thenReturn(List.of(threshold(null, 70, Severity.HIGH, 30)));

        assertTrue(service.evaluate("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE, 70).isEmpty());
        verify(alertRepository, never()).save(any());
    }

    @Test
    void evaluate_alreadyAlertedWithinCooldown_isSuppressed() {
        when(thresholdRepository.findApplicable("tenant-a", Provider.CALENDLY, MetricType.DATA_QUALITY))
                .thenReturn(List.of(threshold(null, 70, Severity.MEDIUM, 60)));
        when(alertRepository.existsActiveSince("tenant-a", Provider.CALENDLY, MetricType.DATA_QUALITY,
                NOW.minus(Duration.ofMinutes(60)))).thenReturn(true);

        assertTrue(service.evaluate("tenant-a", Provider.CALENDLY, MetricType.DATA_QUALITY, 20).isEmpty());
        verify(alertRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any());
        assertEquals(1.0, meterRegistry.counter("sync.alerts.suppressed", "metric", "data_quality").count());
    }

    @Test
    void evaluate_withoutStoredThresholds_usesConfiguredDefaults() {
        when(thresholdRepository.findApplicable("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE))
                .thenReturn(List.of());
        when(alertRepository.save(any(SyncAlert.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SyncAlert alert = service.evaluate("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE, 55).orElseThrow();

        assertEquals(60.0, alert.getThresholdValue());
        assertEquals(Severity.HIGH, alert.getSeverity());
    }

    @Test
    void resolveThresholds_tenantRowsWinOverProviderDefaults() {
        AlertThreshold tenantRow = threshold("tenant-a", 40, Severity.CRITICAL, 15);
        AlertThreshold providerRow = threshold(null, 70, Severity.HIGH, 60);
        when(thresholdRepository.findApplicable("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE))
                .thenReturn(List.of(tenantRow, providerRow));

        List<AlertThreshold> resolved =
                service.resolveThresholds("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE);

        assertEquals(List.of(tenantRow), resolved);
        assertTrue(service.evaluate("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE, 55).isEmpty());
    }

    private static AlertThreshold threshold(String tenantId, double minValue, Severity severity, int cooldownMinutes) {
        return AlertThreshold.builder()
                .tenantId(tenantId)
                .provider(Provider.CALENDLY)
                .metricType(MetricType.HEALTH_SCORE)
                .minValue(minValue)
                .severity(severity)
                .cooldownMinutes(cooldownMinutes)
                .enabled(true)
                .build();
    }
}
