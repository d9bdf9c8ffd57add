package com.company.bookingsync.domain.enums;

public enum SyncMode {
    INCREMENTAL("Window starts just before the last successful cursor"),
    DEEP("Wide-window full reconciliation"),
    DEFAULT("Fixed look-back window");

    private final String description;

    SyncMode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public String getCode() {
        return name().toLowerCase();
    }

    public static SyncMode fromString(String mode) {
        if (mode == null || mode.isBlank()) {
            return DEFAULT;
        }
        try {
            return SyncMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return DEFAULT;
        }
    }
}
