package com.nrqlbridge.service.core.time;

import java.time.Duration;

/**
 * TIMESERIES bucket widths, ordered from finest to coarsest. Each bucket covers spans up to and
 * including {@link #maxSpan()}.
 */
public enum IntervalBucket {
    AUTO("AUTO", Duration.ofHours(1)),
    M5("5m", Duration.ofHours(6)),
    M15("15m", Duration.ofHours(24)),
    H1("1h", Duration.ofDays(7)),
    D1("1d", null);

    private final String token;
    private final Duration maxSpan;

    IntervalBucket(String token, Duration maxSpan) {
        this.token = token;
        this.maxSpan = maxSpan;
    }

    public String token() {
        return token;
    }

    /** Largest span served by this bucket, or {@code null} for the open-ended last bucket. */
    public Duration maxSpan() {
        return maxSpan;
    }

    boolean covers(Duration span) {
        return maxSpan == null || span.compareTo(maxSpan) <= 0;
    }
}
