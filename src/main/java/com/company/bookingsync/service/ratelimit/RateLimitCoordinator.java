package com.company.bookingsync.service.ratelimit;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.exception.SyncCancelledException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-wide pacing of outbound provider calls.
 *
 * <p>Tenants are spaced by a fixed minimum interval. Once a provider reports a hard
 * limit (or usage above the configured percentage) every caller waits out a global
 * cooldown, because provider limits are account-wide rather than per tenant.
 */
@Component
@Slf4j
public class RateLimitCoordinator {

    private final Clock clock;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;
    private final Duration minSpacing;
    private final Duration subRequestSpacing;
    private final Duration cooldown;
    private final double highUsagePercent;

    private Instant lastTenantGrant;
    private Instant lastSubRequestGrant;
    private Instant cooldownUntil;

    public RateLimitCoordinator(Clock clock,
                                Sleeper sleeper,
                                MeterRegistry meterRegistry,
                                SyncProperties properties) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
        SyncProperties.RateLimit rateLimit = properties.getRateLimit();
        this.minSpacing = rateLimit.getMinSpacing();
        this.subRequestSpacing = rateLimit.getSubRequestSpacing();
        this.cooldown = rateLimit.getCooldown();
        this.highUsagePercent = rateLimit.getHighUsagePercent();
    }

    /**
     * Block until the next tenant may start talking to the provider.
     */
    public void acquire(String tenantId) {
        Duration waited = waitFor(nextTenantSlot());
        synchronized (this) {
            lastTenantGrant = clock.instant();
        }
        if (!waited.isZero()) {
            log.debug("Tenant {} waited {}ms for a rate limit slot", tenantId, waited.toMillis());
        }
        meterRegistry.timer("sync.ratelimit.wait", "kind", "tenant").record(waited);
    }

    /**
     * Block until the next sub-request within a tenant may be issued.
     */
    public void acquireSubRequest() {
        Duration waited = waitFor(nextSubRequestSlot());
        synchronized (this) {
            lastSubRequestGrant = clock.instant();
        }
        meterRegistry.timer("sync.ratelimit.wait", "kind", "sub_request").record(waited);
    }

    /**
     * Inspect a provider usage signal. A hard limit or high usage starts (or extends) the global cooldown.
     */
    public void reportUsage(UsageSignal signal) {
        if (signal == null) {
            return;
        }
        boolean hardLimit = signal.isHardLimit();
        if (!hardLimit && !signal.isHighUsage(highUsagePercent)) {
            return;
        }

        Instant until = clock.instant().plus(cooldown);
        synchronized (this) {
            if (cooldownUntil != null && !until.isAfter(cooldownUntil)) {
                return;
            }
            cooldownUntil = until;
        }

        if (hardLimit) {
            log.warn("Provider rate limit hit (status {}), cooling down all callers until {}",
                    signal.statusCode(), until);
        } else {
            log.warn("Provider usage at {}%, cooling down all callers until {}",
                    String.format("%.1f", signal.usagePercent()), until);
        }
        meterRegistry.counter("sync.ratelimit.cooldowns",
                "reason", hardLimit ? "hard_limit" : "high_usage"
        ).increment();
    }

    public synchronized boolean isCoolingDown() {
        return cooldownUntil != null && clock.instant().isBefore(cooldownUntil);
    }

    public synchronized long cooldownRemainingMs() {
        if (cooldownUntil == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(clock.instant(), cooldownUntil).toMillis());
    }

    private synchronized Instant nextTenantSlot() {
        Instant spacingSlot = lastTenantGrant != null ? lastTenantGrant.plus(minSpacing) : null;
        return latest(spacingSlot, cooldownUntil);
    }

    private synchronized Instant nextSubRequestSlot() {
        Instant spacingSlot = lastSubRequestGrant != null ? lastSubRequestGrant.plus(subRequestSpacing) : null;
        return latest(spacingSlot, cooldownUntil);
    }

    private Duration waitFor(Instant slot) {
        if (slot == null) {
            return Duration.ZERO;
        }
        Duration wait = Duration.between(clock.instant(), slot);
        if (wait.isNegative() || wait.isZero()) {
            return Duration.ZERO;
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncCancelledException("Interrupted while waiting for a rate limit slot", e);
        }
        return wait;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
