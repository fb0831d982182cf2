package com.streamfirst.dbsync.application;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission control for writes to the primary. Writes are counted in one-second windows; once a
 * window holds more than the configured maximum, every further caller in that window is delayed
 * by a short backoff. Nothing is rejected: bursts above the cap are smoothed, not dropped.
 */
@Slf4j
public final class WriteRateLimiter {

    static final Duration WINDOW = Duration.ofSeconds(1);

    private final int maxWriteRate;
    private final Duration backoff;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong throttled = new AtomicLong();
    private Instant windowStart;
    private long count;
    private long lastCompletedCount = -1;

    public WriteRateLimiter(int maxWriteRate, Duration backoff, Clock clock) {
        if (maxWriteRate < 1) {
            throw new IllegalArgumentException("Max write rate must be positive: " + maxWriteRate);
        }
        this.maxWriteRate = maxWriteRate;
        this.backoff = backoff;
        this.clock = clock;
        this.windowStart = clock.instant();
    }

    /**
     * Counts one write and delays the caller if the current window is over the cap.
     *
     * @return whether the caller was delayed
     */
    public boolean admitWrite() {
        long observed;
        lock.lock();
        try {
            Instant now = clock.instant();
            if (Duration.between(windowStart, now).compareTo(WINDOW) >= 0) {
                lastCompletedCount = count;
                windowStart = now;
                count = 0;
            }
            observed = ++count;
        } finally {
            lock.unlock();
        }
        if (observed <= maxWriteRate) {
            return false;
        }
        throttled.incrementAndGet();
        log.debug("Write rate {} over limit {}, delaying caller by {}", observed, maxWriteRate, backoff);
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return true;
    }

    /**
     * Writes counted in the last completed window, or in the current one while the first window is
     * still open. Observability only; does not roll the window.
     */
    public long currentRate() {
        lock.lock();
        try {
            Duration age = Duration.between(windowStart, clock.instant());
            if (age.compareTo(WINDOW) < 0) {
                return lastCompletedCount < 0 ? count : lastCompletedCount;
            }
            // the current window is over; it is the last completed one unless a whole window passed idle
            return age.compareTo(WINDOW.multipliedBy(2)) < 0 ? count : 0;
        } finally {
            lock.unlock();
        }
    }

    public long throttledCount() {
        return throttled.get();
    }

    public int getMaxWriteRate() {
        return maxWriteRate;
    }
}
