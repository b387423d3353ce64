package com.hrsearch.ratelimit;

import java.util.ArrayDeque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Timestamp log for one client key plus the lock that guards it.
 * <p>
 * All fields except {@link #lock} are only touched while the lock is held. Once
 * {@link #retired} is set the entry has been (or is about to be) removed from the owning map
 * and must not receive new timestamps.
 */
final class KeyWindow {

    final ReentrantLock lock = new ReentrantLock();

    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

    boolean retired;

    /** Drops every timestamp at least {@code windowNanos} old. Compares differences only. */
    void prune(long now, long windowNanos) {
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowNanos) {
            timestamps.pollFirst();
        }
    }

    void append(long now) {
        timestamps.addLast(now);
    }

    int size() {
        return timestamps.size();
    }

    boolean isEmpty() {
        return timestamps.isEmpty();
    }

    long oldest() {
        Long first = timestamps.peekFirst();
        return first == null ? 0L : first;
    }
}
