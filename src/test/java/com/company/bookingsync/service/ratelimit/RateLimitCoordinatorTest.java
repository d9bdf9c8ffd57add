package com.company.bookingsync.service.ratelimit;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.exception.SyncCancelledException;
import com.company.bookingsync.support.MutableClock;
import com.company.bookingsync.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimitCoordinatorTest {

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private SimpleMeterRegistry meterRegistry;
    private RateLimitCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-10T12:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        meterRegistry = new SimpleMeterRegistry();
        coordinator = new RateLimitCoordinator(clock, sleeper, meterRegistry, new SyncProperties());
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void acquire_firstTenantGoesImmediately() {
        coordinator.acquire("tenant-a");

        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void acquire_spacesConsecutiveTenants() {
        coordinator.acquire("tenant-a");
        coordinator.acquire("tenant-b");
        clock.advance(Duration.ofSeconds(5));
        coordinator.acquire("tenant-c");

        assertEquals(1, sleeper.getSleeps().size());
        assertEquals(Duration.ofSeconds(2), sleeper.getSleeps().get(0));
    }

    @Test
    void acquireSubRequest_usesItsOwnShorterSpacing() {
        coordinator.acquireSubRequest();
        coordinator.acquireSubRequest();

        assertEquals(Duration.ofMillis(200), sleeper.total());
    }

    @Test
    void hardLimit_makesEveryCallerWaitOutTheCooldown() {
        coordinator.reportUsage(UsageSignal.hardLimit());

        assertTrue(coordinator.isCoolingDown());
        assertEquals(60_000L, coordinator.cooldownRemainingMs());

        coordinator.acquire("tenant-a");

        assertEquals(Duration.ofSeconds(60), sleeper.total());
        assertFalse(coordinator.isCoolingDown());
        assertEquals(1.0, meterRegistry.counter("sync.ratelimit.cooldowns", "reason", "hard_limit").count());
    }

    @Test
    void hardLimit_alsoDelaysSubRequests() {
        coordinator.reportUsage(new UsageSignal(403, null, true));

        coordinator.acquireSubRequest();

        assertEquals(Duration.ofSeconds(60), sleeper.total());
    }

    @Test
    void highUsage_startsCooldownOnlyAboveThreshold() {
        coordinator.reportUsage(UsageSignal.ok(50.0));
        assertFalse(coordinator.isCoolingDown());

        coordinator.reportUsage(UsageSignal.ok(85.0));
        assertTrue(coordinator.isCoolingDown());
        assertEquals(1.0, meterRegistry.counter("sync.ratelimit.cooldowns", "reason", "high_usage").count());
    }

    @Test
    void okSignalWithoutUsageHeaders_changesNothing() {
        coordinator.reportUsage(UsageSignal.ok(null));
        coordinator.reportUsage(null);

        assertFalse(coordinator.isCoolingDown());
        assertEquals(0L, coordinator.cooldownRemainingMs());
    }

    @Test
    void laterLimitSignal_extendsTheCooldown() {
        coordinator.reportUsage(UsageSignal.hardLimit());
        clock.advance(Duration.ofSeconds(30));
        coordinator.reportUsage(UsageSignal.hardLimit());

        assertEquals(60_000L, coordinator.cooldownRemainingMs());
    }

    @Test
    void interruptedWait_cancelsAndKeepsInterruptFlag() {
        RateLimitCoordinator interrupted = new RateLimitCoordinator(clock, duration -> {
            throw new InterruptedException("stop");
        }, meterRegistry, new SyncProperties());
        interrupted.acquire("tenant-a");

        assertThrows(SyncCancelledException.class, () -> interrupted.acquire("tenant-b"));
        assertTrue(Thread.currentThread().isInterrupted());
    }
}
