package com.company.bookingsync.remote;

import com.company.bookingsync.domain.enums.EventStatus;

import java.time.Instant;

/**
 * A booking event as reported by a provider, already normalized.
 */
public record RemoteEvent(
        String eventId,
        String eventTypeId,
        String name,
        Instant scheduledAt,
        Instant createdAt,
        EventStatus status
) {

    /**
     * Validate provider fields and normalize the raw status.
     *
     * @throws RemoteApiException when the id, event type or start time is missing
     */
    public static RemoteEvent of(String eventId,
                                 String eventTypeId,
                                 String name,
                                 Instant scheduledAt,
                                 Instant createdAt,
                                 String rawStatus) {
        if (eventId == null || eventId.isBlank()) {
            throw new RemoteApiException(0, "Remote event without an id");
        }
        if (eventTypeId == null || eventTypeId.isBlank()) {
            throw new RemoteApiException(0, "Remote event " + eventId + " has no event type");
        }
        if (scheduledAt == null) {
            throw new RemoteApiException(0, "Remote event " + eventId + " has no start time");
        }
        return new RemoteEvent(eventId, eventTypeId, name, scheduledAt, createdAt, EventStatus.normalize(rawStatus));
    }

    public boolean createdBetween(Instant start, Instant end) {
        return createdAt != null && !createdAt.isBefore(start) && !createdAt.isAfter(end);
    }

    public boolean scheduledBetween(Instant start, Instant end) {
        return !scheduledAt.isBefore(start) && !scheduledAt.isAfter(end);
    }
}
