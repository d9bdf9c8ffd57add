package com.company.bookingsync.service.sync;

import lombok.Builder;
import lombok.Data;

/**
 * Counts produced by one reconciliation of a tenant window.
 */
@Data
@Builder
public class ReconciliationResult {
    private int remoteSeen;
    private int gapsFound;
    private int synced;
    private int failed;
    private int statusUpdated;
    private boolean rateLimitHit;
}
