package com.nrqlbridge.service.core.time;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TimeRewriterTest {

    private static final TimeWindow WINDOW = TimeWindow.ofMillis(1_700_000_000_000L, 1_700_003_600_000L);
    private static final String CONDITION = "timestamp >= 1700000000000 AND timestamp <= 1700003600000";

    @Test
    void replacesRelativeSinceWithWhereCondition() {
        String rewritten = TimeRewriter.rewrite("SELECT count(*) FROM Transaction SINCE 1 hour ago", WINDOW);

        assertThat(rewritten).isEqualTo("SELECT count(*) FROM Transaction WHERE " + CONDITION);
        assertThat(rewritten).doesNotContainIgnoringCase("SINCE");
    }

    @Test
    void injectsIntoExistingWhere() {
        String rewritten = TimeRewriter.rewrite(
                "SELECT count(*) FROM Transaction WHERE appName = 'api' SINCE 1 day ago", WINDOW);

        assertThat(rewritten).isEqualTo("SELECT count(*) FROM Transaction WHERE " + CONDITION + " AND appName = 'api'");
    }

    @Test
    void placesNewWhereWhereTheRelativeClauseWas() {
        String rewritten =
                TimeRewriter.rewrite("SELECT count(*) FROM Transaction SINCE 3 hours ago FACET appName", WINDOW);

        assertThat(rewritten).isEqualTo("SELECT count(*) FROM Transaction WHERE " + CONDITION + " FACET appName");
    }

    @Test
    void removesSinceUntilPair() {
        String rewritten = TimeRewriter.rewrite(
                "SELECT count(*) FROM Transaction SINCE 2 hours ago UNTIL 1 hour ago TIMESERIES", WINDOW);

        assertThat(rewritten).isEqualTo("SELECT count(*) FROM Transaction WHERE " + CONDITION + " TIMESERIES");
    }

    @Test
    void matchesKeywordsCaseInsensitively() {
        String rewritten = TimeRewriter.rewrite("select count(*) from Transaction since 30 minutes ago", WINDOW);

        assertThat(rewritten).isEqualTo("select count(*) from Transaction WHERE " + CONDITION);
    }

    @Test
    void appendsWhereWhenNoTimeClausePresent() {
        String rewritten = TimeRewriter.rewrite("SELECT average(duration) FROM Transaction", WINDOW);

        assertThat(rewritten).isEqualTo("SELECT average(duration) FROM Transaction WHERE " + CONDITION);
    }

    @Test
    void substitutesPlaceholdersOnly() {
        String rewritten = TimeRewriter.rewrite(
                "SELECT count(*) FROM Transaction WHERE $__timeFilter() TIMESERIES $__interval", WINDOW);

        assertThat(rewritten).isEqualTo("SELECT count(*) FROM Transaction WHERE " + CONDITION + " TIMESERIES AUTO");
    }

    @Test
    void substitutesMillisAndIsoPlaceholders() {
        String rewritten = TimeRewriter.rewrite(
                "SELECT count(*) FROM Log WHERE timestamp >= $__from AND timestamp <= $__to"
                        + " AND label IN ('$__fromISOString', '$__toISOString')",
                WINDOW);

        assertThat(rewritten)
                .isEqualTo("SELECT count(*) FROM Log WHERE timestamp >= 1700000000000 AND timestamp <= 1700003600000"
                        + " AND label IN ('2023-11-14T22:13:20Z', '2023-11-14T23:13:20Z')");
    }

    @Test
    void placeholderQueriesAreLeftStructurallyAlone() {
        String query = "SELECT count(*) FROM Transaction WHERE timestamp >= $__from SINCE 1 hour ago";

        assertThat(TimeRewriter.rewrite(query, WINDOW))
                .isEqualTo("SELECT count(*) FROM Transaction WHERE timestamp >= 1700000000000 SINCE 1 hour ago");
    }

    @Test
    void rewriteIsIdempotentForPlaceholderQueries() {
        String once = TimeRewriter.rewrite("SELECT count(*) FROM Transaction WHERE $__timeFilter()", WINDOW);

        assertThat(TimeRewriter.rewrite(once, WINDOW)).isEqualTo(once);
    }

    @Test
    void rewriteIsIdempotentForRelativeQueries() {
        String once = TimeRewriter.rewrite("SELECT count(*) FROM Transaction SINCE 1 hour ago FACET host", WINDOW);

        assertThat(TimeRewriter.rewrite(once, WINDOW)).isEqualTo(once);
    }

    @Test
    void rewritingForAnotherWindowAddsConditionInFrontOfTheOldOne() {
        String once = TimeRewriter.rewrite("SELECT count(*) FROM Transaction SINCE 1 hour ago", WINDOW);
        TimeWindow later = TimeWindow.ofMillis(1_700_010_000_000L, 1_700_020_000_000L);

        String again = TimeRewriter.rewrite(once, later);

        assertThat(again)
                .isEqualTo("SELECT count(*) FROM Transaction WHERE timestamp >= 1700010000000"
                        + " AND timestamp <= 1700020000000 AND " + CONDITION);
    }

    @Test
    void stripsRelativeClauseEvenWhenTimestampFilterPresent() {
        String rewritten = TimeRewriter.rewrite(
                "SELECT count(*) FROM Transaction WHERE timestamp >= 1 AND timestamp <= 2 SINCE 1 hour ago", WINDOW);

        assertThat(rewritten).doesNotContainIgnoringCase("SINCE");
        assertThat(rewritten)
                .isEqualTo("SELECT count(*) FROM Transaction WHERE " + CONDITION
                        + " AND timestamp >= 1 AND timestamp <= 2");
    }

    @Test
    void keepsUserTimestampFilterAndAddsWindow() {
        String rewritten = TimeRewriter.rewrite(
                "SELECT count(*) FROM Transaction WHERE timestamp >= 1700000100000 AND timestamp <= 1700000200000",
                WINDOW);

        assertThat(rewritten)
                .isEqualTo("SELECT count(*) FROM Transaction WHERE " + CONDITION
                        + " AND timestamp >= 1700000100000 AND timestamp <= 1700000200000");
    }

    @Test
    void leavesIntervalMsTokenAlone() {
        String query = "SELECT count(*) FROM Transaction WHERE $__timeFilter() TIMESERIES $__interval_ms";

        assertThat(TimeRewriter.rewrite(query, WINDOW))
                .isEqualTo("SELECT count(*) FROM Transaction WHERE " + CONDITION + " TIMESERIES $__interval_ms");
        assertThat(TimeRewriter.hasPlaceholders("SELECT count(*) FROM Transaction TIMESERIES $__interval_ms"))
                .isFalse();
    }

    @Test
    void ignoresKeywordsInsideStringLiterals() {
        String rewritten =
                TimeRewriter.rewrite("SELECT count(*) FROM Log WHERE message = 'SINCE 1 hour ago'", WINDOW);

        assertThat(rewritten)
                .isEqualTo("SELECT count(*) FROM Log WHERE " + CONDITION + " AND message = 'SINCE 1 hour ago'");
    }

    @Test
    void leavesAbsoluteSinceUntouched() {
        String absolute = "SELECT count(*) FROM Transaction SINCE '2024-01-01 00:00:00' UNTIL '2024-01-02 00:00:00'";
        String epoch = "SELECT count(*) FROM Transaction SINCE 1700000000000";

        assertThat(TimeRewriter.rewrite(absolute, WINDOW)).isEqualTo(absolute);
        assertThat(TimeRewriter.rewrite(epoch, WINDOW)).isEqualTo(epoch);
    }

    @Test
    void returnsBlankInputUnchanged() {
        assertThat(TimeRewriter.rewrite("", WINDOW)).isEmpty();
        assertThat(TimeRewriter.rewrite("   ", WINDOW)).isEqualTo("   ");
        assertThat(TimeRewriter.rewrite(null, WINDOW)).isNull();
    }

    @Test
    void detectsPlaceholders() {
        assertThat(TimeRewriter.hasPlaceholders("SELECT 1 WHERE x > $__from")).isTrue();
        assertThat(TimeRewriter.hasPlaceholders("SELECT count(*) FROM Transaction")).isFalse();
        assertThat(TimeRewriter.hasPlaceholders(null)).isFalse();
    }
}
