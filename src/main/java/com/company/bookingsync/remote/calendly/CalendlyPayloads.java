package com.company.bookingsync.remote.calendly;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Wire shapes of the Calendly v2 API. Only the fields we read are mapped.
 */
final class CalendlyPayloads {

    private CalendlyPayloads() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EventPage(List<EventResource> collection, Pagination pagination) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Pagination(@JsonProperty("next_page") String nextPage) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EventEnvelope(EventResource resource) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EventResource(
            String uri,
            String name,
            String status,
            @JsonProperty("start_time") Instant startTime,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("event_type") String eventType
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InviteePage(List<Invitee> collection) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Invitee(String name, String email) {
    }
}
