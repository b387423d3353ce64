package com.hrsearch.ratelimit;

/**
 * Per-client admission control.
 * <p>
 * Two protocols are offered:
 * <ul>
 *   <li>{@link #tryAcquire(String)}: check and record in one atomic step (hard limit).</li>
 *   <li>{@link #admit(String)} followed by {@link #record(String)}: check-then-act. Two concurrent
 *       callers may both be admitted before either records, so the quota can be exceeded
 *       transiently (soft limit).</li>
 * </ul>
 * No I/O, no threads: implementations only touch in-memory state.
 */
public interface ClientRateLimiter {

    /**
     * Returns true iff the client has fewer than the quota of requests inside the current window.
     * Does not record anything.
     */
    boolean admit(String clientKey);

    /** Records a request for the client at the current time, unconditionally. */
    void record(String clientKey);

    /** Admits and records in one step, or rejects with a retry-after hint. */
    RateLimitDecision tryAcquire(String clientKey);

    RateLimiterConfig config();
}
