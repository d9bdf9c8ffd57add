package com.company.bookingsync.exception;

/**
 * A tenant cannot be synced this run (missing token, no tracked event types).
 * The tenant is skipped and the batch continues.
 */
public class TenantSyncException extends RuntimeException {
    private final String tenantId;

    public TenantSyncException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
