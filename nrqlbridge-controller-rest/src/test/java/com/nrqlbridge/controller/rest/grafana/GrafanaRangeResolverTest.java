package com.nrqlbridge.controller.rest.grafana;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.Range;
import com.nrqlbridge.service.core.time.TimeWindow;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import org.junit.jupiter.api.Test;

class GrafanaRangeResolverTest {

    private static final Instant NOW = Instant.parse("2026-01-30T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void prefersMillisRangeWhenPresent() {
        Instant fromIso = Instant.parse("2026-01-30T09:00:00Z");
        Instant toIso = Instant.parse("2026-01-30T10:00:00Z");
        Range range = new Range(fromIso.toString(), toIso.toString(), 1000L, 2000L);

        TimeWindow window = GrafanaRangeResolver.resolve(range, CLOCK);

        assertEquals(1000L, window.fromMillis());
        assertEquals(2000L, window.toMillis());
    }

    @Test
    void fallsBackToIsoBounds() {
        Range range = new Range("2026-01-30T09:00:00Z", "2026-01-30T10:00:00Z", 1000L, null);

        TimeWindow window = GrafanaRangeResolver.resolve(range, CLOCK);

        assertEquals(Instant.parse("2026-01-30T09:00:00Z"), window.from());
        assertEquals(Instant.parse("2026-01-30T10:00:00Z"), window.to());
    }

    @Test
    void defaultsToLastHour() {
        TimeWindow missing = GrafanaRangeResolver.resolve(null, CLOCK);
        TimeWindow partial = GrafanaRangeResolver.resolve(new Range(null, "2026-01-30T10:00:00Z", null, null), CLOCK);

        assertEquals(new TimeWindow(NOW.minusSeconds(3600), NOW), missing);
        assertEquals(missing, partial);
    }

    @Test
    void rejectsInvertedAndMalformedRanges() {
        assertThrows(
                IllegalArgumentException.class,
                () -> GrafanaRangeResolver.resolve(new Range(null, null, 2000L, 1000L), CLOCK));
        assertThrows(
                DateTimeParseException.class,
                () -> GrafanaRangeResolver.resolve(new Range("yesterday", "today", null, null), CLOCK));
    }
}
