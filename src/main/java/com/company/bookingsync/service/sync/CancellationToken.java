package com.company.bookingsync.service.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for a sync batch, checked between tenants.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
