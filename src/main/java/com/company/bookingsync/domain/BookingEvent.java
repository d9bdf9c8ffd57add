package com.company.bookingsync.domain;

import com.company.bookingsync.domain.enums.EventStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Local copy of a remote booking.
 * Natural key is (tenantId, providerEventId); the surrogate id is never used for dedup.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BookingEvent {
    private Long id;
    private String tenantId;
    private String providerEventId;
    private String providerEventTypeId;
    private String eventTypeName;
    private Instant scheduledAt;
    private Instant createdAt;
    private EventStatus status;

    // Best-effort enrichment, may be null
    private String inviteeName;
    private String inviteeEmail;

    private Instant cancelledAt;
    private Instant updatedAt;
}
