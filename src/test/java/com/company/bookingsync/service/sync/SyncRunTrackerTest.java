package com.company.bookingsync.service.sync;

import com.company.bookingsync.domain.SyncRun;
import com.company.bookingsync.domain.enums.RunOutcome;
import com.company.bookingsync.event.SyncRunCompletedEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SyncRunTrackerTest {

    private final SyncRunTracker tracker = new SyncRunTracker();

    @Test
    void countsConsecutiveFailuresAndResetsOnSuccess() {
        tracker.onSyncRunCompleted(event("tenant-a", RunOutcome.FAILED));
        tracker.onSyncRunCompleted(event("tenant-a", RunOutcome.FAILED));
        tracker.onSyncRunCompleted(event("tenant-a", RunOutcome.FAILED));
        tracker.onSyncRunCompleted(event("tenant-b", RunOutcome.FAILED));

        assertEquals(3, tracker.consecutiveFailures("tenant-a"));
        assertEquals(2, tracker.failingTenants());

        tracker.onSyncRunCompleted(event("tenant-a", RunOutcome.SUCCESS));

        assertEquals(0, tracker.consecutiveFailures("tenant-a"));
        assertEquals(1, tracker.failingTenants());
    }

    private static SyncRunCompletedEvent event(String tenantId, RunOutcome outcome) {
        return new SyncRunCompletedEvent(SyncRun.builder().tenantId(tenantId).outcome(outcome).build());
    }
}
