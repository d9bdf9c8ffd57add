package com.company.bookingsync.exception;

public class TenantAccessDeniedException extends RuntimeException {
    public TenantAccessDeniedException(String callerTenantId, String requestedTenantId) {
        super("Tenant " + callerTenantId + " does not have access to tenant " + requestedTenantId);
    }
}
