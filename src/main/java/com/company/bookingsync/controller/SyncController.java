package com.company.bookingsync.controller;

import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.SyncMode;
import com.company.bookingsync.domain.enums.SyncTrigger;
import com.company.bookingsync.dto.request.SyncTriggerRequest;
import com.company.bookingsync.dto.response.SyncResponse;
import com.company.bookingsync.security.TenantContext;
import com.company.bookingsync.service.sync.SyncOrchestrator;
import com.company.bookingsync.service.sync.SyncRequest;
import com.company.bookingsync.service.sync.SyncSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sync")
@Tag(name = "Sync", description = "Trigger and cancel booking event sync batches")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class SyncController {

    private final SyncOrchestrator orchestrator;
    private final TenantContext tenantContext;
    private final MeterRegistry meterRegistry;

    /**
     * Runs the batch synchronously and answers with its summary. Individual tenant failures
     * still yield 200; they are reported in the stats.
     */
    @PostMapping
    @Operation(summary = "Run a sync batch",
            description = "Modes: incremental (from the last cursor), deep (90 days), default (daysBack)")
    @ApiResponse(responseCode = "200", description = "Batch completed, possibly with tenant failures")
    @ApiResponse(responseCode = "404", description = "No connected tenant matched")
    @ApiResponse(responseCode = "409", description = "A batch is already running")
    @PreAuthorize("hasAnyRole('SCHEDULER', 'ADMIN')")
    public ResponseEntity<SyncResponse> triggerSync(@Valid @RequestBody(required = false) SyncTriggerRequest body) {
        SyncTriggerRequest request = body != null ? body : new SyncTriggerRequest();

        SyncRequest syncRequest = SyncRequest.builder()
                .provider(request.getProvider() != null ? Provider.fromCode(request.getProvider()) : Provider.CALENDLY)
                .mode(SyncMode.fromString(request.getMode()))
                .tenantId(request.getTenantId())
                .daysBack(request.getDaysBack())
                .trigger(SyncTrigger.MANUAL)
                .build();

        log.info("Manual {} sync requested by {} for {}", syncRequest.getMode().getCode(),
                tenantContext.getCurrentUserId(),
                syncRequest.getTenantId() != null ? "tenant " + syncRequest.getTenantId() : "all tenants");

        meterRegistry.counter("api.sync.requests", "mode", syncRequest.getMode().getCode()).increment();

        SyncSummary summary = orchestrator.runSync(syncRequest);
        return ResponseEntity.ok(SyncResponse.from(summary));
    }

    @PostMapping("/cancel")
    @Operation(summary = "Stop the running batch before its next tenant")
    @PreAuthorize("hasAnyRole('SCHEDULER', 'ADMIN')")
    public ResponseEntity<Map<String, Object>> cancelSync() {
        boolean cancelled = orchestrator.cancelCurrentRun();

        Map<String, Object> response = new HashMap<>();
        response.put("cancelled", cancelled);
        response.put("message", cancelled ? "Cancellation requested" : "No sync batch is running");
        return ResponseEntity.ok(response);
    }
}
