package com.company.bookingsync.domain;

import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncMetric {
    private Long metricId;
    private String tenantId;
    private Provider provider;
    private MetricType metricType;
    private double value;
    private Map<String, Object> metadata;
    private Instant recordedAt;
}
