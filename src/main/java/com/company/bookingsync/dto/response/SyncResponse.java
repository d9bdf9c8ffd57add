package com.company.bookingsync.dto.response;

import com.company.bookingsync.service.sync.SyncSummary;
import com.company.bookingsync.service.sync.TenantSyncResult;
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
public class SyncResponse {
    private boolean success;
    private String message;
    private Stats stats;
    private List<TenantSyncResult> results;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private int tenantsProcessed;
        private int tenantsWithErrors;
        private int totalTenants;
        private String syncMode;
        private boolean cancelled;
        private Instant completedAt;
    }

    public static SyncResponse from(SyncSummary summary) {
        return SyncResponse.builder()
                .success(true)
                .message(summary.isCancelled() ? "Sync cancelled" : "Sync completed")
                .stats(Stats.builder()
                        .tenantsProcessed(summary.getTenantsProcessed())
                        .tenantsWithErrors(summary.getTenantsWithErrors())
                        .totalTenants(summary.getTotalTenants())
                        .syncMode(summary.getSyncMode() != null ? summary.getSyncMode().getCode() : null)
                        .cancelled(summary.isCancelled())
                        .completedAt(summary.getCompletedAt())
                        .build())
                .results(summary.getResults())
                .build();
    }
}
