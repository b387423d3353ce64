package com.hrsearch.ratelimit.clock;

/**
 * Monotonic time source for the rate limiter.
 * <p>
 * Injected so that window arithmetic can be tested deterministically with {@link ManualClock}.
 */
@FunctionalInterface
public interface Clock {

    /** Current monotonic time in nanoseconds. Only differences between readings are meaningful. */
    long nowNanos();
}
