package com.hrsearch.ratelimit;

/**
 * Outcome of an atomic admission attempt.
 *
 * @param allowed         whether the request was admitted and recorded
 * @param retryAfterNanos time until the oldest recorded request leaves the window; 0 when allowed
 */
public record RateLimitDecision(boolean allowed, long retryAfterNanos) {

    private static final RateLimitDecision ALLOW = new RateLimitDecision(true, 0L);

    public static RateLimitDecision allow() {
        return ALLOW;
    }

    public static RateLimitDecision reject(long retryAfterNanos) {
        return new RateLimitDecision(false, Math.max(0L, retryAfterNanos));
    }

    /** Retry-after rounded up to whole seconds, never below one for a rejection. */
    public long retryAfterSeconds() {
        if (allowed) {
            return 0L;
        }
        long seconds = (retryAfterNanos + 999_999_999L) / 1_000_000_000L;
        return Math.max(1L, seconds);
    }
}
