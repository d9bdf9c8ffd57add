package com.company.bookingsync.remote;

import java.time.Instant;

/**
 * Provider credentials for one tenant. {@code ownerUri} identifies the provider account
 * whose events are listed (the Calendly user URI).
 */
public record AccessToken(String token, String ownerUri, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
