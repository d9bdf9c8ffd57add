package com.company.bookingsync.security;

import com.company.bookingsync.exception.TenantAccessDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Caller identity from the JWT. Scheduler and admin callers act across tenants;
 * everyone else is confined to the tenant in their token.
 */
@Component
@Slf4j
public class TenantContext {

    private static final Set<String> CROSS_TENANT_ROLES = Set.of("ROLE_SCHEDULER", "ROLE_ADMIN");

    /**
     * Tenant claim of the caller, null when the token carries none.
     */
    public String getCurrentTenantId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return null;
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            String tenantId = jwt.getClaimAsString("tenant_id");
            if (tenantId == null) {
                tenantId = jwt.getClaimAsString("extension_TenantId");
            }
            return tenantId;
        }

        return null;
    }

    public String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.getPrincipal() instanceof Jwt jwt) {
            return jwt.getClaimAsString("sub");
        }

        return "anonymous";
    }

    public boolean isCrossTenantCaller() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null) {
            // No security context: internal call
            return true;
        }
        return authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(CROSS_TENANT_ROLES::contains);
    }

    /**
     * Tenant a request may act on. Confined callers default to, and are limited to, their own tenant.
     *
     * @throws TenantAccessDeniedException when a confined caller asks for another tenant
     */
    public String resolveTenantFilter(String requestedTenantId) {
        if (isCrossTenantCaller()) {
            return requestedTenantId;
        }

        String callerTenant = getCurrentTenantId();
        if (callerTenant == null) {
            log.warn("Caller {} has no tenant claim", getCurrentUserId());
            throw new TenantAccessDeniedException("unknown", requestedTenantId != null ? requestedTenantId : "all");
        }
        if (requestedTenantId != null && !requestedTenantId.equals(callerTenant)) {
            throw new TenantAccessDeniedException(callerTenant, requestedTenantId);
        }
        return callerTenant;
    }
}
