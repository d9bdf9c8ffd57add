package com.company.bookingsync.service.sync;

import com.company.bookingsync.domain.enums.SyncMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one orchestrator batch. {@code tenantsProcessed} counts tenants that synced
 * successfully; {@code tenantsWithErrors} those whose run failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncSummary {
    private int tenantsProcessed;
    private int tenantsWithErrors;
    private int totalTenants;
    private SyncMode syncMode;
    private boolean cancelled;
    private Instant startedAt;
    private Instant completedAt;
    @Builder.Default
    private List<TenantSyncResult> results = new ArrayList<>();
}
