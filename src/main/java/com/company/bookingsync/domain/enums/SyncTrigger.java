package com.company.bookingsync.domain.enums;

/**
 * What started a sync batch.
 */
public enum SyncTrigger {
    SCHEDULED,
    MANUAL;

    public String getCode() {
        return name().toLowerCase();
    }

    public static SyncTrigger fromString(String trigger) {
        if (trigger == null) {
            return MANUAL;
        }
        try {
            return SyncTrigger.valueOf(trigger.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return MANUAL;
        }
    }
}
