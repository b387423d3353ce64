package com.hrsearch.ratelimit.clock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven clock for tests. Safe to read from many threads while one thread advances it.
 */
public final class ManualClock implements Clock {

    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public void advanceNanos(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta < 0");
        }
        now.addAndGet(delta);
    }
}
