package com.nrqlbridge.service.core.metrics;

import java.time.Duration;

public interface QueryMetrics {

    QueryMetrics NOOP = new QueryMetrics() {
        @Override
        public void queryStarted() {}

        @Override
        public void queryFinished(Duration elapsed, boolean failed) {}

        @Override
        public Snapshot snapshot() {
            return Snapshot.EMPTY;
        }
    };

    void queryStarted();

    void queryFinished(Duration elapsed, boolean failed);

    Snapshot snapshot();

    /**
     * Point-in-time view of the counters. {@code averageQueryTime} is {@link Duration#ZERO} until a
     * query has finished; {@code lastQueryTime} is the duration of the most recent one.
     */
    record Snapshot(
            long queryCount,
            long errorCount,
            Duration totalQueryTime,
            Duration averageQueryTime,
            Duration lastQueryTime,
            long concurrentQueries) {

        public static final Snapshot EMPTY = new Snapshot(0, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO, 0);
    }
}
