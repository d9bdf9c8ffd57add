package com.company.bookingsync.domain;

import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * (metric, min-value) pair. A null tenant makes it the provider-wide default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertThreshold {
    private Long thresholdId;
    private String tenantId;
    private Provider provider;
    private MetricType metricType;
    private double minValue;
    private Severity severity;
    private int cooldownMinutes;
    private boolean enabled;

    public boolean isBreachedBy(double value) {
        return value < minValue;
    }
}
