package com.nrqlbridge.controller.rest.grafana;

import com.nrqlbridge.service.core.time.TimeWindow;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Millisecond bounds win over ISO strings; a missing or partial range means the last hour. */
public final class GrafanaRangeResolver {

    static final Duration DEFAULT_SPAN = Duration.ofHours(1);

    private GrafanaRangeResolver() {}

    public static TimeWindow resolve(GrafanaQueryModels.Range range) {
        return resolve(range, Clock.systemUTC());
    }

    static TimeWindow resolve(GrafanaQueryModels.Range range, Clock clock) {
        if (range != null && range.fromMs() != null && range.toMs() != null) {
            return TimeWindow.ofMillis(range.fromMs(), range.toMs());
        }
        if (range != null && range.from() != null && range.to() != null) {
            return new TimeWindow(Instant.parse(range.from()), Instant.parse(range.to()));
        }
        Instant now = clock.instant();
        return new TimeWindow(now.minus(DEFAULT_SPAN), now);
    }
}
