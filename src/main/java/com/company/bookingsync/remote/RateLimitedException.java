package com.company.bookingsync.remote;

import com.company.bookingsync.service.ratelimit.UsageSignal;

/**
 * The provider refused a call because the request budget is exhausted.
 */
public class RateLimitedException extends RemoteApiException {
    private final UsageSignal signal;

    public RateLimitedException(UsageSignal signal, String message) {
        super(signal.statusCode(), message);
        this.signal = signal;
    }

    public UsageSignal getSignal() {
        return signal;
    }
}
