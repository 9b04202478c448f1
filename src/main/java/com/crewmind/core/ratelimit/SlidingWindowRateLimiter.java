package com.crewmind.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Sliding-window limiter: at most {@code maxCalls} grants in any rolling window.
 * <p>
 * Each caller reserves the earliest slot that keeps the window constraint under a
 * fair lock, then sleeps outside the lock until its slot. Reservations are handed
 * out in arrival order, so callers are served first-come first-served.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    @FunctionalInterface
    interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    private final int maxCalls;
    private final long windowNanos;
    private final long maxWaitNanos;
    private final Duration maxWait;
    private final LongSupplier ticker;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock(true);
    /** Grant times in nanos, non-decreasing; may include future reservations. */
    private final List<Long> grants = new ArrayList<>();

    public SlidingWindowRateLimiter(int maxCalls, Duration window, Duration maxWait) {
        this(maxCalls, window, maxWait, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    SlidingWindowRateLimiter(int maxCalls, Duration window, Duration maxWait,
                             LongSupplier ticker, Sleeper sleeper) {
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be at least 1, got " + maxCalls);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxCalls = maxCalls;
        this.windowNanos = window.toNanos();
        this.maxWait = maxWait;
        this.maxWaitNanos = maxWait.toNanos();
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    @Override
    public Duration acquire(String caller) {
        long waitNanos;
        lock.lock();
        try {
            long now = ticker.getAsLong();
            prune(now);
            long slot = now;
            int size = grants.size();
            if (size >= maxCalls) {
                slot = Math.max(slot, grants.get(size - maxCalls) + windowNanos);
            }
            if (size > 0) {
                slot = Math.max(slot, grants.get(size - 1));
            }
            waitNanos = slot - now;
            if (waitNanos > maxWaitNanos) {
                throw new RateLimitTimeoutException(caller, Duration.ofNanos(waitNanos), maxWait);
            }
            grants.add(slot);
        } finally {
            lock.unlock();
        }

        if (waitNanos > 0) {
            log.debug("Rate limit: '{}' waits {}ms for its slot", caller, TimeUnit.NANOSECONDS.toMillis(waitNanos));
            try {
                sleeper.sleepNanos(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitTimeoutException(caller, Duration.ofNanos(waitNanos), maxWait);
            }
        }
        return Duration.ofNanos(Math.max(0, waitNanos));
    }

    /** Number of grants (past or reserved) still inside the window ending now. */
    int outstandingGrants() {
        lock.lock();
        try {
            prune(ticker.getAsLong());
            return grants.size();
        } finally {
            lock.unlock();
        }
    }

    private void prune(long now) {
        // grants older than one window can no longer constrain a slot at or after now
        while (!grants.isEmpty() && grants.get(0) <= now - windowNanos) {
            grants.remove(0);
        }
    }
}
