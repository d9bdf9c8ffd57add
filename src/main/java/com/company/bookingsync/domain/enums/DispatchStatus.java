package com.company.bookingsync.domain.enums;

public enum DispatchStatus {
    PENDING("Alert is pending to be sent"),
    SENT("Alert has been sent successfully"),
    FAILED("Alert sending failed");

    private final String description;

    DispatchStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinal() {
        return this == SENT;
    }

    public static DispatchStatus fromString(String status) {
        if (status == null) {
            return PENDING;
        }
        try {
            return DispatchStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
