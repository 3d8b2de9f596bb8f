package com.nrqlbridge.service.core.result;

import java.util.Map;

/**
 * Picks the frame layout for a result set by looking at its first row. Unrecognised shapes fall
 * through to {@link ResultShape#GENERIC}.
 */
public final class ResultClassifier {

    private ResultClassifier() {}

    public static ResultShape classify(ResultSet resultSet) {
        if (resultSet == null || resultSet.isEmpty()) {
            return ResultShape.EMPTY;
        }
        Map<String, Object> first = resultSet.firstRow();
        if (first == null) {
            return ResultShape.GENERIC;
        }
        // TIMESERIES buckets carry count too, but need a real time axis
        if (first.containsKey(ResultFields.BEGIN_TIME_SECONDS) || first.containsKey(ResultFields.END_TIME_SECONDS)) {
            return ResultShape.GENERIC;
        }
        boolean hasCount = isScalar(first.get(ResultFields.COUNT));
        boolean hasFacet = first.get(ResultFields.FACET) != null;
        if (hasCount && !hasFacet) {
            return ResultShape.SIMPLE_SCALAR;
        }
        if (hasCount) {
            return ResultShape.FACETED_SCALAR;
        }
        return ResultShape.GENERIC;
    }

    private static boolean isScalar(Object value) {
        return value != null && !(value instanceof Iterable<?>) && !(value instanceof Map<?, ?>);
    }
}
