package com.company.bookingsync.domain;

import com.company.bookingsync.domain.enums.AlertStatus;
import com.company.bookingsync.domain.enums.DispatchStatus;
import com.company.bookingsync.domain.enums.MetricType;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncAlert {
    private Long alertId;
    private String tenantId;
    private Provider provider;
    private MetricType metricType;
    private double metricValue;
    private double thresholdValue;
    private Severity severity;
    private AlertStatus status;
    private DispatchStatus dispatchStatus;
    private Integer retryCount;
    private String lastError;
    private Instant triggeredAt;
    private Instant dispatchedAt;
}
