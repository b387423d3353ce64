package com.hrsearch.ratelimit;

import com.hrsearch.ratelimit.clock.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window-log rate limiter keyed by client.
 * <p>
 * Each key owns a deque of admission timestamps guarded by its own {@code ReentrantLock}, so
 * distinct keys never contend. A request is admitted when fewer than
 * {@link RateLimiterConfig#maxRequests()} timestamps remain after pruning everything at or older
 * than {@code now - window}.
 * <p>
 * Memory is bounded by {@link #evictIdle()}, which drops keys whose whole window has expired.
 * Eviction marks the entry retired under its lock before removing it from the map; writers that
 * observe a retired entry start over with a fresh one, so no admission is ever recorded into a
 * window that has left the map.
 *
 * <pre>
 * SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
 *         SystemClock.instance(), new RateLimiterConfig(5, Duration.ofSeconds(60)));
 *
 * RateLimitDecision decision = limiter.tryAcquire("10.0.0.7");
 * if (!decision.allowed()) {
 *     // reject, retry after decision.retryAfterSeconds()
 * }
 * </pre>
 */
public final class SlidingWindowRateLimiter implements ClientRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final Clock clock;
    private final RateLimiterConfig config;
    private final long windowNanos;
    private final Map<String, KeyWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(Clock clock, RateLimiterConfig config) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.windowNanos = config.windowNanos();
    }

    @Override
    public boolean admit(String clientKey) {
        requireKey(clientKey);
        KeyWindow window = windows.get(clientKey);
        if (window == null) {
            return true;
        }
        window.lock.lock();
        try {
            window.prune(clock.nowNanos(), windowNanos);
            return window.size() < config.maxRequests();
        } finally {
            window.lock.unlock();
        }
    }

    @Override
    public void record(String clientKey) {
        requireKey(clientKey);
        while (true) {
            KeyWindow window = windows.computeIfAbsent(clientKey, k -> new KeyWindow());
            window.lock.lock();
            try {
                if (window.retired) {
                    continue;
                }
                long now = clock.nowNanos();
                window.prune(now, windowNanos);
                window.append(now);
                return;
            } finally {
                window.lock.unlock();
            }
        }
    }

    @Override
    public RateLimitDecision tryAcquire(String clientKey) {
        requireKey(clientKey);
        while (true) {
            KeyWindow window = windows.computeIfAbsent(clientKey, k -> new KeyWindow());
            window.lock.lock();
            try {
                if (window.retired) {
                    continue;
                }
                long now = clock.nowNanos();
                window.prune(now, windowNanos);
                if (window.size() < config.maxRequests()) {
                    window.append(now);
                    return RateLimitDecision.allow();
                }
                long retryAfter = window.oldest() + windowNanos - now;
                log.debug("Rejected client {}: {} requests in window, retry after {} ns",
                        clientKey, window.size(), retryAfter);
                return RateLimitDecision.reject(retryAfter);
            } finally {
                window.lock.unlock();
            }
        }
    }

    /**
     * Removes every key whose window holds no timestamp younger than the window length.
     * Keys whose lock is currently held are skipped and picked up by a later sweep.
     *
     * @return number of keys removed
     */
    public int evictIdle() {
        int evicted = 0;
        for (Map.Entry<String, KeyWindow> entry : windows.entrySet()) {
            KeyWindow window = entry.getValue();
            if (!window.lock.tryLock()) {
                continue;
            }
            try {
                window.prune(clock.nowNanos(), windowNanos);
                if (window.isEmpty() && !window.retired) {
                    window.retired = true;
                    windows.remove(entry.getKey(), window);
                    evicted++;
                }
            } finally {
                window.lock.unlock();
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit keys, {} remain", evicted, windows.size());
        }
        return evicted;
    }

    /** Number of client keys currently holding a window. */
    public int trackedKeys() {
        return windows.size();
    }

    /** Timestamps currently held for a key, without pruning. 0 for an untracked key. */
    int windowCount(String clientKey) {
        KeyWindow window = windows.get(clientKey);
        if (window == null) {
            return 0;
        }
        window.lock.lock();
        try {
            return window.size();
        } finally {
            window.lock.unlock();
        }
    }

    @Override
    public RateLimiterConfig config() {
        return config;
    }

    private static void requireKey(String clientKey) {
        if (clientKey == null) {
            throw new IllegalArgumentException("clientKey cannot be null");
        }
    }
}
