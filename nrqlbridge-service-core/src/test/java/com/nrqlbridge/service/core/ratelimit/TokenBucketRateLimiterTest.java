package com.nrqlbridge.service.core.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class TokenBucketRateLimiterTest {

    private final AtomicLong clock = new AtomicLong();

    @Test
    void startsFullAndRejectsOnceDrained() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1.0, 2, clock::get);

        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    void refillsContinuouslyAndCapsAtCapacity() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(2.0, 2, clock::get);
        limiter.tryAcquire();
        limiter.tryAcquire();

        advance(Duration.ofMillis(500));
        assertThat(limiter.availableTokens()).isCloseTo(1.0, within(1e-9));
        assertThat(limiter.tryAcquire()).isTrue();

        advance(Duration.ofSeconds(10));
        assertThat(limiter.availableTokens()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void acquireBlocksUntilATokenRefills() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(20.0, 1);
        assertThat(limiter.tryAcquire()).isTrue();

        long started = System.nanoTime();
        limiter.acquire();
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(waitedMillis).isGreaterThanOrEqualTo(25L);
    }

    @Test
    void interruptedWaiterGetsCancelledAndConsumesNothing() throws Exception {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1.0, 1, clock::get);
        limiter.tryAcquire();
        advance(Duration.ofMillis(500));

        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                limiter.acquire();
            } catch (RateLimitCancelledException ex) {
                failure.set(ex);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        awaitParked(waiter);
        waiter.interrupt();
        waiter.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(waiter.isAlive()).isFalse();
        assertThat(failure.get()).isInstanceOf(RateLimitCancelledException.class);
        assertThat(interruptFlag.get()).isTrue();
        assertThat(limiter.availableTokens()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void boundedAcquireGivesUpWithoutConsuming() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(0.001, 1);
        limiter.tryAcquire();

        assertThatThrownBy(() -> limiter.acquire(Duration.ofMillis(50)))
                .isInstanceOf(RateLimitCancelledException.class)
                .hasMessageContaining("PT0.05S");
        assertThat(limiter.availableTokens()).isLessThan(1.0);
    }

    @Test
    void boundedAcquireSucceedsWhenTokenAvailable() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1.0, 1, clock::get);

        limiter.acquire(Duration.ZERO);

        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucketRateLimiter(Double.NaN, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucketRateLimiter(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unlimitedAlwaysAdmits() {
        for (int i = 0; i < 1_000; i++) {
            assertThat(RateLimiter.UNLIMITED.tryAcquire()).isTrue();
        }
        RateLimiter.UNLIMITED.acquire();
        RateLimiter.UNLIMITED.acquire(Duration.ZERO);
    }

    private void advance(Duration duration) {
        clock.addAndGet(duration.toNanos());
    }

    private static void awaitParked(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.TIMED_WAITING && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(thread.getState()).isEqualTo(Thread.State.TIMED_WAITING);
    }
}
