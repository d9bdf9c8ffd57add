package com.company.bookingsync.domain;

import com.company.bookingsync.domain.enums.Provider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One connection between a tenant and a provider.
 * {@code lastSync} is the incremental cursor and only ever moves forward.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Integration {
    private Long id;
    private String tenantId;
    private Provider provider;
    private boolean connected;

    // Cursor of the last successful sync
    private Instant lastSync;

    // Written by the health monitor
    private Integer syncHealthScore;
    private Integer dataQualityScore;
    private Instant lastHealthCheck;

    private Instant createdAt;
    private Instant updatedAt;
}
