package com.nrqlbridge.service.core.ratelimit;

import java.time.Duration;

/** Admission gate in front of the upstream query API. */
public interface RateLimiter {

    /** Limiter that admits every caller immediately. */
    RateLimiter UNLIMITED = new RateLimiter() {
        @Override
        public void acquire() {}

        @Override
        public void acquire(Duration maxWait) {}

        @Override
        public boolean tryAcquire() {
            return true;
        }
    };

    /**
     * Blocks until a permit is available.
     *
     * @throws RateLimitCancelledException if the calling thread is interrupted while waiting
     */
    void acquire();

    /**
     * Blocks until a permit is available or {@code maxWait} elapses.
     *
     * @throws RateLimitCancelledException on interruption or timeout; no permit is consumed
     */
    void acquire(Duration maxWait);

    boolean tryAcquire();
}
