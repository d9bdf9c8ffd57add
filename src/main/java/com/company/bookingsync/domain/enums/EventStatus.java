package com.company.bookingsync.domain.enums;

/**
 * Canonical lifecycle of a booking event. Provider spellings are normalized
 * on ingestion so derived metrics only ever see these four values.
 */
public enum EventStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    NO_SHOW("no_show");

    private final String code;

    EventStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    /**
     * Normalize a provider or stored status string.
     * Unknown or missing values are treated as {@link #ACTIVE}.
     */
    public static EventStatus normalize(String status) {
        if (status == null) {
            return ACTIVE;
        }
        String value = status.trim().toLowerCase().replace('-', '_').replace(' ', '_');
        switch (value) {
            case "canceled":
            case "cancelled":
                return CANCELLED;
            case "completed":
                return COMPLETED;
            case "no_show":
            case "noshow":
                return NO_SHOW;
            default:
                return ACTIVE;
        }
    }
}
