package com.nrqlbridge.service.core.time;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Externally supplied {@code [from, to]} bound a query is rewritten to respect. */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Time window start " + from + " is after end " + to);
        }
    }

    public static TimeWindow ofMillis(long fromMs, long toMs) {
        return new TimeWindow(Instant.ofEpochMilli(fromMs), Instant.ofEpochMilli(toMs));
    }

    public long fromMillis() {
        return from.toEpochMilli();
    }

    public long toMillis() {
        return to.toEpochMilli();
    }

    public Duration span() {
        return Duration.between(from, to);
    }
}
