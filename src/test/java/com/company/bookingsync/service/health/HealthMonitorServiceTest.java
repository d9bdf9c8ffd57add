package com.company.bookingsync.service.health;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.SyncMetric;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.repository.LocalStore;
import com.company.bookingsync.service.alert.AlertThresholdService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthMonitorServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    private LocalStore localStore;
    @Mock
    private AlertThresholdService alertThresholdService;

    private HealthMonitorService service;

    @BeforeEach
    void setUp() {
        SyncProperties properties = new SyncProperties();
        service = new HealthMonitorService(
                localStore,
                List.of(new CalendlyHealthStrategy(properties, localStore)),
                alertThresholdService,
                new SimpleMeterRegistry(),
                Clock.fixed(NOW, ZoneOffset.UTC),
                properties);
    }

    @Test
    void checkHealth_scoresRecordsAndPersists() {
        when(localStore.listAllConnectedIntegrations(null, null)).thenReturn(List.of(integration("tenant-a", Provider.CALENDLY)));
        when(localStore.listRecentMetrics(eq("tenant-a"), any())).thenReturn(List.of(
                run("tenant-a", "SUCCESS"), run("tenant-a", "SUCCESS"), healthMetric("tenant-a")));

        HealthCheckReport report = service.checkHealth(null, null);

        TenantHealthResult result = report.getResults().get(0);
        assertEquals(TenantHealthResult.HEALTHY, result.getStatus());
        assertEquals(100, result.getHealthScore());
        assertEquals(2, result.getMetrics().get("recent_syncs"));
        assertEquals(1, report.getSummary().getHealthy());

        verify(localStore).recordMetric(eq("tenant-a"), eq(Provider.CALENDLY), eq(MetricType.HEALTH_SCORE), eq(100.0), anyMap());
        verify(localStore).recordMetric(eq("tenant-a"), eq(Provider.CALENDLY), eq(MetricType.DATA_QUALITY), eq(100.0), anyMap());
        verify(localStore).recordMetric(eq("tenant-a"), eq(Provider.CALENDLY), eq(MetricType.HEALTH_CHECK_DURATION), anyDouble(), anyMap());
        verify(localStore).updateHealthScores("tenant-a", Provider.CALENDLY, 100, 100, NOW);
        verify(alertThresholdService).evaluate("tenant-a", Provider.CALENDLY, MetricType.HEALTH_SCORE, 100);
        verify(alertThresholdService).evaluate("tenant-a", Provider.CALENDLY, MetricType.DATA_QUALITY, 100);
    }

    @Test
    void checkHealth_scoreAtThreshold_isStillHealthy() {
        when(localStore.listAllConnectedIntegrations(null, "tenant-a"))
                .thenReturn(List.of(integration("tenant-a", Provider.CALENDLY)));
        when(localStore.listRecentMetrics(eq("tenant-a"), any())).thenReturn(List.of(
                run("tenant-a", "FAILED"), run("tenant-a", "FAILED"), run("tenant-a", "SUCCESS")));

        TenantHealthResult result = service.checkHealth("tenant-a", null).getResults().get(0);

        assertEquals(50, result.getHealthScore());
        assertTrue(result.isHealthy());
    }

    @Test
    void checkHealth_scoreBelowThreshold_isUnhealthy() {
        SyncProperties strict = new SyncProperties();
        strict.getHealth().setUnhealthyBelow(60);
        HealthMonitorService strictService = new HealthMonitorService(
                localStore,
                List.of(new CalendlyHealthStrategy(strict, localStore)),
                alertThresholdService,
                new SimpleMeterRegistry(),
                Clock.fixed(NOW, ZoneOffset.UTC),
                strict);
        when(localStore.listAllConnectedIntegrations(null, null))
                .thenReturn(List.of(integration("tenant-a", Provider.CALENDLY)));
        when(localStore.listRecentMetrics(eq("tenant-a"), any())).thenReturn(List.of(run("tenant-a", "FAILED")));

        HealthCheckReport report = strictService.checkHealth(null, null);

        assertEquals(TenantHealthResult.UNHEALTHY, report.getResults().get(0).getStatus());
        assertEquals(1, report.getSummary().getUnhealthy());
        verify(localStore).updateHealthScores("tenant-a", Provider.CALENDLY, 50, 100, NOW);
    }

    @Test
    void checkHealth_failingTenant_isReportedAndOthersStillChecked() {
        when(localStore.listAllConnectedIntegrations(null, null)).thenReturn(List.of(
                integration("tenant-a", Provider.CALENDLY), integration("tenant-b", Provider.CALENDLY)));
        when(localStore.listRecentMetrics(eq("tenant-a"), any())).thenThrow(new IllegalStateException("metrics table locked"));
        when(localStore.listRecentMetrics(eq("tenant-b"), any())).thenReturn(List.of(run("tenant-b", "SUCCESS")));

        HealthCheckReport report = service.checkHealth(null, null);

        TenantHealthResult failed = report.getResults().get(0);
        assertFalse(failed.isHealthy());
        assertEquals(0, failed.getHealthScore());
        assertEquals("metrics table locked", failed.getError());
        assertTrue(report.getResults().get(1).isHealthy());
        assertEquals(1, report.getSummary().getUnhealthy());
        verify(localStore, never()).updateHealthScores(eq("tenant-a"), any(), anyInt(), anyInt(), any());
        verify(localStore).recordMetric(eq("tenant-a"), eq(Provider.CALENDLY), eq(MetricType.HEALTH_SCORE), eq(0.0), anyMap());
    }

    @Test
    void checkHealth_providerWithoutRules_getsNeutralScore() {
        when(localStore.listAllConnectedIntegrations(Provider.FACEBOOK, null))
                .thenReturn(List.of(integration("tenant-f", Provider.FACEBOOK)));

        HealthCheckReport report = service.checkHealth(null, "facebook");

        TenantHealthResult result = report.getResults().get(0);
        assertEquals(50, result.getHealthScore());
        assertEquals(50, result.getDataQuality());
        assertEquals("facebook", result.getProvider());
    }

    @Test
    void checkHealth_unknownProviderFilter_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.checkHealth(null, "zoom"));
    }

    private static Integration integration(String tenantId, Provider provider) {
        return Integration.builder().tenantId(tenantId).provider(provider).connected(true).build();
    }

    private static SyncMetric run(String tenantId, String outcome) {
        return SyncMetric.builder()
                .tenantId(tenantId)
                .provider(Provider.CALENDLY)
                .metricType(MetricType.SYNC_RUN)
                .value("SUCCESS".equals(outcome) ? 1.0 : 0.0)
                .metadata(Map.of("outcome", outcome, "trigger", "scheduled"))
                .recordedAt(NOW.minusSeconds(3600))
                .build();
    }

    private static SyncMetric healthMetric(String tenantId) {
        return SyncMetric.builder()
                .tenantId(tenantId)
                .provider(Provider.CALENDLY)
                .metricType(MetricType.HEALTH_SCORE)
                .value(40)
                .metadata(Map.of())
                .recordedAt(NOW.minusSeconds(1800))
                .build();
    }
}
