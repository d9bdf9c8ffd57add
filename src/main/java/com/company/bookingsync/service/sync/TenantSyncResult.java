package com.company.bookingsync.service.sync;

import com.company.bookingsync.domain.SyncRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One tenant's line in a batch summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantSyncResult {
    private String tenantId;
    private boolean success;
    private int gapsFound;
    private int eventsSynced;
    private int statusUpdated;
    private int errors;
    private boolean rateLimitHit;
    private String error;

    public static TenantSyncResult from(SyncRun run) {
        return TenantSyncResult.builder()
                .tenantId(run.getTenantId())
                .success(run.isSuccessful())
                .gapsFound(run.getGapsFound())
                .eventsSynced(run.getEventsSynced())
                .statusUpdated(run.getStatusUpdated())
                .errors(run.getErrors())
                .rateLimitHit(run.isRateLimitHit())
                .error(run.getErrorMessage())
                .build();
    }
}
