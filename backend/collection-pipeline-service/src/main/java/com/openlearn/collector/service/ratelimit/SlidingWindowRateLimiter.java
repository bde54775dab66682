package com.openlearn.collector.service.ratelimit;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Sliding-window limiter: at most {@code limit} permits in any window of the given length.
 */
public class SlidingWindowRateLimiter implements SourceRateLimiter {

    private final int limit;
    private final long windowNanos;
    private final LongSupplier nanoTime;

    private final Deque<Long> grants = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition released = lock.newCondition();

    public SlidingWindowRateLimiter(int limit, Duration window) {
        this(limit, window, System::nanoTime);
    }

    SlidingWindowRateLimiter(int limit, Duration window, LongSupplier nanoTime) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.limit = limit;
        this.windowNanos = window.toNanos();
        this.nanoTime = nanoTime;
    }

    public static SlidingWindowRateLimiter perMinute(int requestsPerMinute) {
        return new SlidingWindowRateLimiter(requestsPerMinute, Duration.ofMinutes(1));
    }

    @Override
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                long wait = waitNanos(nanoTime.getAsLong());
                if (wait <= 0) {
                    grants.addLast(nanoTime.getAsLong());
                    return;
                }
                released.awaitNanos(wait);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean tryAcquire(Duration timeout) throws InterruptedException {
        long deadline = nanoTime.getAsLong() + Math.max(0, timeout.toNanos());
        if (!lock.tryLock(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS)) {
            return false;
        }
        try {
            while (true) {
                long now = nanoTime.getAsLong();
                long wait = waitNanos(now);
                if (wait <= 0) {
                    grants.addLast(now);
                    return true;
                }
                long remaining = deadline - now;
                if (wait > remaining) {
                    return false;
                }
                released.awaitNanos(wait);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Duration timeUntilNextPermit() {
        lock.lock();
        try {
            return Duration.ofNanos(Math.max(0, waitNanos(nanoTime.getAsLong())));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getRequestsPerWindow() {
        return limit;
    }

    @Override
    public Duration getWindow() {
        return Duration.ofNanos(windowNanos);
    }

    /**
     * Evicts grants outside the window and returns how long until a permit is free.
     * Caller holds the lock.
     */
    private long waitNanos(long now) {
        while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
            grants.pollFirst();
        }
        if (grants.size() < limit) {
            return 0;
        }
        return grants.peekFirst() + windowNanos - now;
    }
}
