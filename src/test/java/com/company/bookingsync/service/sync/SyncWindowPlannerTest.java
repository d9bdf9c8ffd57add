package com.company.bookingsync.service.sync;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.Integration;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.SyncMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncWindowPlannerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    private SyncWindowPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new SyncWindowPlanner(new SyncProperties());
    }

    @Test
    void deepMode_coversNinetyDaysWhateverTheCursor() {
        Integration integration = integration(NOW.minus(Duration.ofHours(3)));

        SyncWindow window = planner.plan(integration, SyncMode.DEEP, 2, NOW);

        assertEquals(NOW.minus(Duration.ofDays(90)), window.start());
        assertEquals(NOW, window.end());
        assertEquals(SyncMode.DEEP, window.mode());
    }

    @Test
    void incrementalMode_startsOneHourBeforeTheCursor() {
        Instant lastSync = NOW.minus(Duration.ofHours(20));

        SyncWindow window = planner.plan(integration(lastSync), SyncMode.INCREMENTAL, 7, NOW);

        assertEquals(lastSync.minus(Duration.ofHours(1)), window.start());
        assertEquals(NOW, window.end());
        assertEquals(SyncMode.INCREMENTAL, window.mode());
        assertFalse(window.start().isAfter(lastSync));
    }

    @Test
    void incrementalMode_withoutCursor_fallsBackToDaysBack() {
        SyncWindow window = planner.plan(integration(null), SyncMode.INCREMENTAL, 7, NOW);

        assertEquals(NOW.minus(Duration.ofDays(7)), window.start());
        assertEquals(NOW, window.end());
        assertEquals(SyncMode.DEFAULT, window.mode());
    }

    @Test
    void incrementalMode_cursorInTheFuture_stillYieldsNonEmptyWindow() {
        SyncWindow window = planner.plan(integration(NOW.plus(Duration.ofHours(5))), SyncMode.INCREMENTAL, 7, NOW);

        assertTrue(window.start().isBefore(window.end()));
        assertEquals(NOW.minus(Duration.ofHours(1)), window.start());
    }

    @Test
    void defaultMode_usesRequestedDaysBack() {
        SyncWindow window = planner.plan(integration(NOW.minus(Duration.ofHours(2))), SyncMode.DEFAULT, 3, NOW);

        assertEquals(NOW.minus(Duration.ofDays(3)), window.start());
        assertEquals(SyncMode.DEFAULT, window.mode());
    }

    @Test
    void nonPositiveOrMissingDaysBack_usesSevenDays() {
        assertEquals(NOW.minus(Duration.ofDays(7)), planner.plan(integration(null), SyncMode.DEFAULT, 0, NOW).start());
        assertEquals(NOW.minus(Duration.ofDays(7)), planner.plan(integration(null), SyncMode.DEFAULT, -4, NOW).start());
        assertEquals(NOW.minus(Duration.ofDays(7)), planner.plan(integration(null), null, null, NOW).start());
    }

    @Test
    void windowStartNeverAfterEnd() {
        for (SyncMode mode : SyncMode.values()) {
            for (Integer daysBack : new Integer[]{null, -1, 0, 1, 30, 365}) {
                SyncWindow window = planner.plan(integration(NOW.minus(Duration.ofMinutes(5))), mode, daysBack, NOW);
                assertFalse(window.start().isAfter(window.end()), mode + "/" + daysBack);
            }
        }
    }

    private static Integration integration(Instant lastSync) {
        return Integration.builder()
                .tenantId("tenant-1")
                .provider(Provider.CALENDLY)
                .connected(true)
                .lastSync(lastSync)
                .build();
    }
}
