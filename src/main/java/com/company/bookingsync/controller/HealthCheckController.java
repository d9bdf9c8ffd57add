package com.company.bookingsync.controller;

import com.company.bookingsync.dto.request.HealthCheckRequest;
import com.company.bookingsync.security.TenantContext;
import com.company.bookingsync.service.health.HealthCheckReport;
import com.company.bookingsync.service.health.HealthMonitorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health-checks")
@Tag(name = "Sync Health", description = "Score sync health and data quality per tenant")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearer-jwt")
public class HealthCheckController {

    private final HealthMonitorService healthMonitorService;
    private final TenantContext tenantContext;

    @PostMapping
    @Operation(summary = "Run a health check",
            description = "Scores each matching integration, records the scores and raises threshold alerts")
    @PreAuthorize("hasAnyRole('UI_READER', 'SCHEDULER', 'ADMIN')")
    public ResponseEntity<HealthCheckReport> runHealthCheck(@RequestBody(required = false) HealthCheckRequest body) {
        HealthCheckRequest request = body != null ? body : new HealthCheckRequest();
        String tenantFilter = tenantContext.resolveTenantFilter(request.getTenantId());

        return ResponseEntity.ok(healthMonitorService.checkHealth(tenantFilter, request.getProvider()));
    }
}
