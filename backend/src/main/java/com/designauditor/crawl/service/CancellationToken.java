package com.designauditor.crawl.service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop signal shared between a job and the thread running it.
 */
public final class CancellationToken {
    private final AtomicReference<Instant> cancelledAt = new AtomicReference<>();
    private final Clock clock;

    public CancellationToken(Clock clock) {
        this.clock = clock;
    }

    public CancellationToken() {
        this(Clock.systemUTC());
    }

    /**
     * @return true when this call flipped the token
     */
    public boolean cancel() {
        return cancelledAt.compareAndSet(null, clock.instant());
    }

    /**
     * Re-applies a cancellation that happened before a restart.
     */
    public void restoreCancelledAt(Instant at) {
        if (at != null) {
            cancelledAt.compareAndSet(null, at);
        }
    }

    public boolean isCancelled() {
        return cancelledAt.get() != null;
    }

    public Instant cancelledAt() {
        return cancelledAt.get();
    }

    public void throwIfCancelled(String where) {
        if (isCancelled()) {
            throw new AnalysisCancelledException("Analysis cancelled " + where);
        }
    }
}
