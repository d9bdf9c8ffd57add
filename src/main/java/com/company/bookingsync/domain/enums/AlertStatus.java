package com.company.bookingsync.domain.enums;

public enum AlertStatus {
    ACTIVE("Threshold breached, awaiting acknowledgement"),
    ACKNOWLEDGED("Acknowledged by an operator");

    private final String description;

    AlertStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static AlertStatus fromString(String status) {
        if (status == null) {
            return ACTIVE;
        }
        try {
            return AlertStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return ACTIVE;
        }
    }
}
