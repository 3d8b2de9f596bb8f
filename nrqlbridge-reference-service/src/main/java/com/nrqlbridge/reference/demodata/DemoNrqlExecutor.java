package com.nrqlbridge.reference.demodata;

import com.nrqlbridge.service.core.query.NrqlExecutor;
import com.nrqlbridge.service.core.result.ResultFields;
import com.nrqlbridge.service.core.result.ResultSet;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Answers NRQL with synthetic rows so dashboards can be built without a New Relic account. The
 * response shape follows the query: {@code FACET} gives faceted counts, {@code TIMESERIES} gives
 * bucketed counts, {@code count(} gives a single count and anything else gives sample events.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "demo-data.nrql", name = "enabled", havingValue = "true")
class DemoNrqlExecutor implements NrqlExecutor {

    private static final Pattern WINDOW = Pattern.compile(
            "timestamp\\s*>=\\s*(\\d+)\\s+AND\\s+timestamp\\s*<=\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FACET = Pattern.compile("\\bFACET\\s+([\\w.]+)", Pattern.CASE_INSENSITIVE);
    private static final List<String> TRANSACTION_NAMES =
            List.of("WebTransaction/checkout", "WebTransaction/search", "OtherTransaction/cron");

    private final DemoNrqlProperties properties;
    private final Clock clock;

    @Autowired
    DemoNrqlExecutor(DemoNrqlProperties properties) {
        this(properties, Clock.systemUTC());
    }

    DemoNrqlExecutor(DemoNrqlProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ResultSet execute(String nrql, long accountId) {
        String upper = nrql.toUpperCase(Locale.ROOT);
        Random random = properties.getSeed() == null ? new Random() : new Random(properties.getSeed() ^ accountId);
        Window window = window(nrql);
        log.debug("Demo executor answering for account {}: {}", accountId, nrql);

        Matcher facet = FACET.matcher(nrql);
        if (facet.find()) {
            return faceted(facet.group(1), random);
        }
        if (upper.contains("TIMESERIES")) {
            return timeseries(window, random);
        }
        if (upper.contains("COUNT(")) {
            return ResultSet.of(List.of(Map.of(ResultFields.COUNT, 100 + random.nextInt(900))));
        }
        return samples(window, random);
    }

    private ResultSet faceted(String attribute, Random random) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String value : properties.getFacetValues()) {
            rows.add(Map.of(ResultFields.FACET, List.of(value), ResultFields.COUNT, 10 + random.nextInt(500)));
        }
        return new ResultSet(rows, List.of(attribute));
    }

    private ResultSet timeseries(Window window, Random random) {
        Instant from = window.from();
        int buckets = properties.getTimeseriesBuckets();
        long width = Math.max(1L, Duration.between(from, window.to()).getSeconds() / buckets);
        List<Map<String, Object>> rows = new ArrayList<>(buckets);
        for (int i = 0; i < buckets; i++) {
            long begin = from.getEpochSecond() + i * width;
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ResultFields.BEGIN_TIME_SECONDS, begin);
            row.put(ResultFields.END_TIME_SECONDS, begin + width);
            row.put(ResultFields.COUNT, 20 + random.nextInt(80));
            rows.add(row);
        }
        return ResultSet.of(rows);
    }

    private ResultSet samples(Window window, Random random) {
        Instant from = window.from();
        int count = properties.getSampleRows();
        long spanMillis = Math.max(1L, Duration.between(from, window.to()).toMillis());
        List<Map<String, Object>> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ResultFields.TIMESTAMP, from.toEpochMilli() + (spanMillis * i) / count);
            row.put("name", TRANSACTION_NAMES.get(random.nextInt(TRANSACTION_NAMES.size())));
            row.put("duration", Math.round(random.nextDouble() * 2000d) / 1000d);
            row.put("error", random.nextInt(10) == 0);
            rows.add(row);
        }
        return ResultSet.of(rows);
    }

    private Window window(String nrql) {
        Matcher matcher = WINDOW.matcher(nrql);
        if (matcher.find()) {
            return new Window(
                    Instant.ofEpochMilli(Long.parseLong(matcher.group(1))),
                    Instant.ofEpochMilli(Long.parseLong(matcher.group(2))));
        }
        Instant now = clock.instant();
        return new Window(now.minus(Duration.ofHours(1)), now);
    }

    private record Window(Instant from, Instant to) {}
}
