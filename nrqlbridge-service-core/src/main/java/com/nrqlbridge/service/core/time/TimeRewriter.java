package com.nrqlbridge.service.core.time;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Binds NRQL text to a dashboard time window.
 *
 * <p>Three paths, tried in order:
 *
 * <ol>
 *   <li>Placeholder tokens ({@code $__from}, {@code $__to}, {@code $__fromISOString}, {@code
 *       $__toISOString}, {@code $__timeFilter()}, {@code $__interval}) are substituted in place and
 *       nothing else changes.
 *   <li>Relative clauses ({@code SINCE 1 hour ago [UNTIL 10 minutes ago]}) are removed and a {@code
 *       timestamp} range condition is injected into the existing {@code WHERE}, or written as a new
 *       {@code WHERE} where the clause used to be.
 *   <li>Text without any time clause gets the condition appended as a {@code WHERE}.
 * </ol>
 *
 * <p>Text that already opens its {@code WHERE} with this window's condition is returned unchanged.
 * Existing {@code timestamp} filters are never rewritten: a new window is ANDed in front of them.
 * Absolute or unrecognised {@code SINCE}/{@code UNTIL} clauses leave the text untouched. Keywords
 * inside string literals and backtick identifiers are ignored.
 */
public final class TimeRewriter {

    public static final String FROM = "$__from";
    public static final String TO = "$__to";
    public static final String FROM_ISO = "$__fromISOString";
    public static final String TO_ISO = "$__toISOString";
    public static final String TIME_FILTER = "$__timeFilter()";
    public static final String INTERVAL = "$__interval";

    // longest names first; the lookahead keeps $__from out of $__fromX and $__interval out of $__interval_ms
    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\$__(?:timeFilter\\(\\)|(?:fromISOString|toISOString|from|to|interval)(?![A-Za-z0-9_]))");

    private static final DateTimeFormatter RFC_3339 =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX").withZone(ZoneOffset.UTC);

    private static final String RELATIVE_POINT = "\\d+(?:\\.\\d+)?\\s*[A-Z]+\\s+AGO\\b";
    private static final Pattern RELATIVE_CLAUSE = Pattern.compile(
            "\\bSINCE\\s+" + RELATIVE_POINT + "(?:\\s+UNTIL\\s+(?:" + RELATIVE_POINT + "|NOW\\b))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME_KEYWORD = Pattern.compile("\\b(?:SINCE|UNTIL)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHERE = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);

    private TimeRewriter() {}

    public static String rewrite(String query, TimeWindow window) {
        if (query == null || query.isBlank()) {
            return query;
        }
        if (hasPlaceholders(query)) {
            return substitutePlaceholders(query, window);
        }

        String condition = timeCondition(window);
        List<MatchResult> relative = findAll(RELATIVE_CLAUSE, QueryScanner.mask(query));
        if (!relative.isEmpty()) {
            Removal removal = removeClauses(query, relative);
            return injectCondition(removal.text(), removal.insertAt(), condition);
        }

        if (TIME_KEYWORD.matcher(QueryScanner.mask(query)).find() || opensWhereWith(query, condition)) {
            return query;
        }
        return injectCondition(query, query.length(), condition);
    }

    public static boolean hasPlaceholders(String query) {
        if (query == null) {
            return false;
        }
        return PLACEHOLDER.matcher(query).find();
    }

    public static String timeCondition(TimeWindow window) {
        return "timestamp >= " + window.fromMillis() + " AND timestamp <= " + window.toMillis();
    }

    static String substitutePlaceholders(String query, TimeWindow window) {
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder out = new StringBuilder(query.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(valueOf(matcher.group(), window)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String valueOf(String placeholder, TimeWindow window) {
        return switch (placeholder) {
            case TIME_FILTER -> timeCondition(window);
            case FROM_ISO -> RFC_3339.format(window.from());
            case TO_ISO -> RFC_3339.format(window.to());
            case INTERVAL -> IntervalPolicy.bucketWidth(window);
            case FROM -> Long.toString(window.fromMillis());
            case TO -> Long.toString(window.toMillis());
            default -> throw new IllegalStateException("Unknown placeholder " + placeholder);
        };
    }

    /** True when the first {@code WHERE} starts with exactly this condition, as a previous rewrite leaves it. */
    private static boolean opensWhereWith(String query, String condition) {
        Matcher where = WHERE.matcher(QueryScanner.mask(query));
        if (!where.find()) {
            return false;
        }
        String tail = query.substring(where.end()).stripLeading();
        return tail.startsWith(condition)
                && (tail.length() == condition.length() || Character.isWhitespace(tail.charAt(condition.length())));
    }

    /**
     * Places the condition inside the first {@code WHERE} when there is one, otherwise writes a new
     * {@code WHERE} clause at {@code insertAt}.
     */
    private static String injectCondition(String query, int insertAt, String condition) {
        Matcher where = WHERE.matcher(QueryScanner.mask(query));
        if (where.find()) {
            String head = query.substring(0, where.end());
            String tail = query.substring(where.end()).strip();
            return tail.isEmpty() ? head + " " + condition : head + " " + condition + " AND " + tail;
        }
        String head = query.substring(0, insertAt).stripTrailing();
        String tail = query.substring(insertAt).strip();
        String clause = "WHERE " + condition;
        String rewritten = head.isEmpty() ? clause : head + " " + clause;
        return tail.isEmpty() ? rewritten : rewritten + " " + tail;
    }

    private static Removal removeClauses(String query, List<MatchResult> clauses) {
        StringBuilder out = new StringBuilder(query.length());
        int cursor = 0;
        int insertAt = -1;
        for (MatchResult clause : clauses) {
            appendSegment(out, query.substring(cursor, clause.start()));
            while (out.length() > 0 && Character.isWhitespace(out.charAt(out.length() - 1))) {
                out.setLength(out.length() - 1);
            }
            if (insertAt < 0) {
                insertAt = out.length();
            }
            cursor = clause.end();
        }
        appendSegment(out, query.substring(cursor));
        return new Removal(out.toString(), insertAt);
    }

    private static void appendSegment(StringBuilder out, String segment) {
        String trimmed = segment.stripLeading();
        if (trimmed.isEmpty()) {
            return;
        }
        if (out.length() > 0 && !Character.isWhitespace(out.charAt(out.length() - 1))) {
            out.append(' ');
        }
        out.append(trimmed);
    }

    private static List<MatchResult> findAll(Pattern pattern, String masked) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(masked);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    private record Removal(String text, int insertAt) {}
}
