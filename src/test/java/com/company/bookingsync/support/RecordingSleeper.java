package com.company.bookingsync.support;

import com.company.bookingsync.service.ratelimit.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records requested waits and advances the clock instead of blocking.
 */
public class RecordingSleeper implements Sleeper {

    private final MutableClock clock;
    private final List<Duration> sleeps = new ArrayList<>();

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        clock.advance(duration);
    }

    public List<Duration> getSleeps() {
        return sleeps;
    }

    public Duration total() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
