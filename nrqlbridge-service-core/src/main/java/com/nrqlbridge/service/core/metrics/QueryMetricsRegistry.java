package com.nrqlbridge.service.core.metrics;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

public class QueryMetricsRegistry implements QueryMetrics {
    private final LongAdder queryCount = new LongAdder();
    private final LongAdder errorCount = new LongAdder();
    private final LongAdder totalQueryNanos = new LongAdder();
    private final AtomicLong lastQueryNanos = new AtomicLong();
    private final AtomicLong concurrentQueries = new AtomicLong();

    @Override
    public void queryStarted() {
        concurrentQueries.incrementAndGet();
    }

    @Override
    public void queryFinished(Duration elapsed, boolean failed) {
        concurrentQueries.updateAndGet(current -> current > 0 ? current - 1 : 0);
        long nanos = elapsed == null || elapsed.isNegative() ? 0L : elapsed.toNanos();
        queryCount.increment();
        totalQueryNanos.add(nanos);
        lastQueryNanos.set(nanos);
        if (failed) {
            errorCount.increment();
        }
    }

    @Override
    public Snapshot snapshot() {
        long count = queryCount.sum();
        long total = totalQueryNanos.sum();
        return new Snapshot(
                count,
                errorCount.sum(),
                Duration.ofNanos(total),
                count == 0 ? Duration.ZERO : Duration.ofNanos(total / count),
                Duration.ofNanos(lastQueryNanos.get()),
                concurrentQueries.get());
    }

    public void reset() {
        queryCount.reset();
        errorCount.reset();
        totalQueryNanos.reset();
        lastQueryNanos.set(0L);
        concurrentQueries.set(0L);
    }
}
