package com.company.bookingsync.remote;

import com.company.bookingsync.domain.enums.Provider;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authenticated, paginated read access to a provider's booking events.
 *
 * <p>Every method may throw {@link RateLimitedException} when the provider throttles us,
 * or {@link RemoteApiException} for any other failure. Listings never return a partial result:
 * when not every page can be read they throw {@link PageLimitExceededException}.
 */
public interface RemoteEventClient {

    Provider provider();

    /**
     * Events whose start time falls in {@code [windowStart, windowEnd]}.
     */
    List<RemoteEvent> listEvents(String tenantId, Instant windowStart, Instant windowEnd);

    /**
     * Events whose creation time falls in {@code [windowStart, windowEnd]}, whenever they are scheduled.
     */
    List<RemoteEvent> listEventsCreatedBetween(String tenantId, Instant windowStart, Instant windowEnd);

    /**
     * Events scheduled in the window or created in it, deduplicated by id. Providers that can
     * answer both shapes with one listing override this.
     */
    default List<RemoteEvent> listWindowEvents(String tenantId, Instant windowStart, Instant windowEnd) {
        Map<String, RemoteEvent> merged = new LinkedHashMap<>();
        for (RemoteEvent event : listEvents(tenantId, windowStart, windowEnd)) {
            merged.putIfAbsent(event.eventId(), event);
        }
        for (RemoteEvent event : listEventsCreatedBetween(tenantId, windowStart, windowEnd)) {
            merged.putIfAbsent(event.eventId(), event);
        }
        return new ArrayList<>(merged.values());
    }

    /**
     * Best-effort invitee lookup for one event.
     */
    RemoteEventDetail getEventDetail(String tenantId, String eventId);

    /**
     * Current state of one event, empty when the provider no longer knows it.
     */
    Optional<RemoteEvent> fetchEvent(String tenantId, String eventId);
}
