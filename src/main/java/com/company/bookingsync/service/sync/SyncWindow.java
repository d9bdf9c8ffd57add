package com.company.bookingsync.service.sync;

import com.company.bookingsync.domain.enums.SyncMode;

import java.time.Duration;
import java.time.Instant;

/**
 * Planned {@code [start, end]} window and the mode that produced it.
 */
public record SyncWindow(Instant start, Instant end, SyncMode mode) {

    public Duration length() {
        return Duration.between(start, end);
    }
}
