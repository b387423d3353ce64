package com.hrsearch.ratelimit;

import java.time.Duration;

/**
 * Quota and window shared by every client key of a limiter.
 *
 * @param maxRequests requests admitted per key inside one window (must be > 0)
 * @param window      length of the trailing window (must be positive)
 */
public record RateLimiterConfig(int maxRequests, Duration window) {

    /** 5 requests per 60 seconds. */
    public static final RateLimiterConfig DEFAULT = new RateLimiterConfig(5, Duration.ofSeconds(60));

    public RateLimiterConfig {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0, got: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
    }

    public long windowNanos() {
        return window.toNanos();
    }

    /** Window length in whole seconds, rounded up so a sub-second window reads as 1. */
    public long windowSeconds() {
        long seconds = window.toSeconds();
        return window.toNanosPart() == 0 ? seconds : seconds + 1;
    }
}
