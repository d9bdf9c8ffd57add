package com.company.bookingsync.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Calendly webhook delivery ({@code invitee.created} / {@code invitee.canceled}).
 * Invitee fields are read from {@code payload} itself or from a nested {@code payload.invitee}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalendlyWebhookRequest {

    public static final String INVITEE_CREATED = "invitee.created";
    public static final String INVITEE_CANCELED = "invitee.canceled";

    private String event;

    @JsonProperty("created_at")
    private Instant createdAt;

    private Payload payload;

    public boolean isCancellation() {
        return INVITEE_CANCELED.equals(event);
    }

    public ScheduledEvent scheduledEvent() {
        return payload != null ? payload.getScheduledEvent() : null;
    }

    public String inviteeName() {
        if (payload == null) {
            return null;
        }
        return payload.getInvitee() != null ? payload.getInvitee().getName() : payload.getName();
    }

    public String inviteeEmail() {
        if (payload == null) {
            return null;
        }
        return payload.getInvitee() != null ? payload.getInvitee().getEmail() : payload.getEmail();
    }

    /**
     * When the booking was made: the invitee's creation time, else the delivery time.
     */
    public Instant bookedAt() {
        if (payload != null) {
            if (payload.getInvitee() != null && payload.getInvitee().getCreatedAt() != null) {
                return payload.getInvitee().getCreatedAt();
            }
            if (payload.getCreatedAt() != null) {
                return payload.getCreatedAt();
            }
        }
        return createdAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private String name;
        private String email;

        @JsonProperty("created_at")
        private Instant createdAt;

        private Invitee invitee;

        @JsonProperty("scheduled_event")
        private ScheduledEvent scheduledEvent;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Invitee {
        private String name;
        private String email;

        @JsonProperty("created_at")
        private Instant createdAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScheduledEvent {
        private String uri;
        private String name;
        private String status;

        @JsonProperty("start_time")
        private Instant startTime;

        @JsonProperty("event_type")
        private String eventType;

        @JsonProperty("created_at")
        private Instant createdAt;
    }
}
