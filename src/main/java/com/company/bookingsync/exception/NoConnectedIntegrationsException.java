package com.company.bookingsync.exception;

public class NoConnectedIntegrationsException extends RuntimeException {
    public NoConnectedIntegrationsException(String provider, String tenantFilter) {
        super(tenantFilter == null
                ? "No connected " + provider + " integrations found"
                : "No connected " + provider + " integration found for tenant " + tenantFilter);
    }
}
