package com.company.bookingsync.service.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TenantHealthResult {
    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    private String tenantId;
    private String provider;
    private String status;
    private int healthScore;
    private int dataQuality;
    private Map<String, Object> metrics;
    private long checkDurationMs;
    private String error;

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
