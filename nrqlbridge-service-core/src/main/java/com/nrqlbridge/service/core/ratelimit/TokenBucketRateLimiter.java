package com.nrqlbridge.service.core.ratelimit;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token bucket with continuous refill. The bucket starts full; each admitted caller takes one
 * token. Waiters park on a condition so the lock is free while they sleep.
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);
    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final double rate;
    private final double capacity;
    private final LongSupplier nanoTime;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition refilled = lock.newCondition();

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double rate, int capacity) {
        this(rate, capacity, System::nanoTime);
    }

    public TokenBucketRateLimiter(double rate, int capacity, LongSupplier nanoTime) {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("rate must be a positive finite number, got " + rate);
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.rate = rate;
        this.capacity = capacity;
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    @Override
    public void acquire() {
        lock.lock();
        try {
            while (true) {
                refill();
                if (tokens >= 1d) {
                    tokens -= 1d;
                    return;
                }
                refilled.awaitNanos(nanosUntilNextToken());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RateLimitCancelledException("Interrupted while waiting for a rate limit token", ex);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void acquire(Duration maxWait) {
        Objects.requireNonNull(maxWait, "maxWait");
        long deadline = nanoTime.getAsLong() + Math.max(0L, maxWait.toNanos());
        lock.lock();
        try {
            while (true) {
                refill();
                if (tokens >= 1d) {
                    tokens -= 1d;
                    return;
                }
                long remaining = deadline - nanoTime.getAsLong();
                if (remaining <= 0L) {
                    log.debug("Rate limit wait of {} expired", maxWait);
                    throw new RateLimitCancelledException("No rate limit token within " + maxWait);
                }
                refilled.awaitNanos(Math.min(remaining, nanosUntilNextToken()));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RateLimitCancelledException("Interrupted while waiting for a rate limit token", ex);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1d) {
                tokens -= 1d;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Current token count after refill, for diagnostics. */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0L) {
            return;
        }
        tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * rate);
        lastRefillNanos = now;
    }

    private long nanosUntilNextToken() {
        double missing = 1d - tokens;
        return Math.max(1L, (long) Math.ceil(missing / rate * NANOS_PER_SECOND));
    }
}
