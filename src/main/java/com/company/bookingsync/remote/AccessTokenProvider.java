package com.company.bookingsync.remote;

import com.company.bookingsync.domain.enums.Provider;

import java.util.Optional;

/**
 * Boundary to the OAuth flow that owns provider tokens. Tokens are only read here.
 */
public interface AccessTokenProvider {

    Optional<AccessToken> findAccessToken(String tenantId, Provider provider);
}
