package com.company.bookingsync.service.health;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckReport {
    private Instant timestamp;
    private List<TenantHealthResult> results;
    private Summary summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalChecked;
        private int healthy;
        private int unhealthy;
        private double averageHealthScore;
    }

    public static HealthCheckReport of(Instant timestamp, List<TenantHealthResult> results) {
        int healthy = (int) results.stream().filter(TenantHealthResult::isHealthy).count();
        double average = results.stream().mapToInt(TenantHealthResult::getHealthScore).average().orElse(0.0);

        return HealthCheckReport.builder()
                .timestamp(timestamp)
                .results(results)
                .summary(Summary.builder()
                        .totalChecked(results.size())
                        .healthy(healthy)
                        .unhealthy(results.size() - healthy)
                        .averageHealthScore(Math.round(average * 10.0) / 10.0)
                        .build())
                .build();
    }
}
