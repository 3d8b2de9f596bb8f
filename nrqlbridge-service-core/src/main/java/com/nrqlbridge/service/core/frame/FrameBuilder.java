package com.nrqlbridge.service.core.frame;

import com.nrqlbridge.service.core.result.ResultClassifier;
import com.nrqlbridge.service.core.result.ResultFields;
import com.nrqlbridge.service.core.result.ResultSet;
import com.nrqlbridge.service.core.result.ResultShape;
import com.nrqlbridge.service.core.time.TimeWindow;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a classified result set into Grafana frames.
 *
 * <ul>
 *   <li>{@link ResultShape#SIMPLE_SCALAR}: a one-row table plus a flat two-point line spanning the
 *       window.
 *   <li>{@link ResultShape#FACETED_SCALAR}: a table with one text column per facet and a trailing
 *       count, plus the same columns behind a time axis pinned to the window start.
 *   <li>{@link ResultShape#GENERIC}: a single frame with a time axis and one inferred column per
 *       distinct row key.
 * </ul>
 *
 * Row order always follows the result set. Malformed values degrade to zero values, never errors.
 */
public final class FrameBuilder {

    public static final String TIME_FIELD = "time";

    /** Column name used for facet values when the response carries no facet metadata. */
    static final String DEFAULT_FACET_NAME = "facet";

    private static final Set<String> TIME_KEYS =
            Set.of(ResultFields.TIMESTAMP, ResultFields.BEGIN_TIME_SECONDS, ResultFields.END_TIME_SECONDS);

    private static final Logger log = LoggerFactory.getLogger(FrameBuilder.class);

    private FrameBuilder() {}

    public static FrameSet build(ResultSet resultSet, TimeWindow window) {
        return build(resultSet, ResultClassifier.classify(resultSet), window);
    }

    public static FrameSet build(ResultSet resultSet, ResultShape shape, TimeWindow window) {
        if (resultSet == null || resultSet.isEmpty()) {
            return FrameSet.empty();
        }
        FrameSet frames = switch (shape) {
            case EMPTY -> FrameSet.empty();
            case SIMPLE_SCALAR -> simpleScalar(resultSet, window);
            case FACETED_SCALAR -> facetedScalar(resultSet, window);
            case GENERIC -> generic(resultSet, window);
        };
        if (log.isDebugEnabled()) {
            log.debug("Built {} frame(s) for {} row(s) as {}", frames.size(), resultSet.size(), shape);
        }
        return frames;
    }

    private static FrameSet simpleScalar(ResultSet resultSet, TimeWindow window) {
        Map<String, Object> first = resultSet.firstRow() != null ? resultSet.firstRow() : Map.of();
        double count = (Double) TypeInferencer.coerce(first.get(ResultFields.COUNT), FieldType.NUMERIC);

        Frame table = new Frame(
                Frame.COUNT, List.of(Column.numeric(ResultFields.COUNT, List.of(count))), VisualizationHint.TABLE);
        Frame graph = new Frame(
                Frame.COUNT_TIME_SERIES,
                List.of(
                        Column.time(TIME_FIELD, List.of(window.from(), window.to())),
                        Column.numeric(ResultFields.COUNT, List.of(count, count))),
                VisualizationHint.GRAPH);
        return new FrameSet(ResultShape.SIMPLE_SCALAR, List.of(table, graph));
    }

    private static FrameSet facetedScalar(ResultSet resultSet, TimeWindow window) {
        List<String> facetNames =
                resultSet.facetNames().isEmpty() ? List.of(DEFAULT_FACET_NAME) : resultSet.facetNames();
        int rows = resultSet.size();

        List<List<String>> facetValues = new ArrayList<>(facetNames.size());
        for (int i = 0; i < facetNames.size(); i++) {
            facetValues.add(new ArrayList<>(rows));
        }
        List<Double> counts = new ArrayList<>(rows);

        for (Map<String, Object> row : resultSet.rows()) {
            Map<String, Object> safeRow = row != null ? row : Map.of();
            counts.add((Double) TypeInferencer.coerce(safeRow.get(ResultFields.COUNT), FieldType.NUMERIC));
            List<String> unpacked = unpackFacet(safeRow.get(ResultFields.FACET), facetNames.size());
            for (int i = 0; i < facetNames.size(); i++) {
                facetValues.get(i).add(unpacked.get(i));
            }
        }

        List<Column> facetColumns = new ArrayList<>(facetNames.size());
        for (int i = 0; i < facetNames.size(); i++) {
            facetColumns.add(Column.text(facetNames.get(i), facetValues.get(i)));
        }
        Column countColumn = Column.numeric(ResultFields.COUNT, counts);

        List<Column> tableColumns = new ArrayList<>(facetColumns);
        tableColumns.add(countColumn);

        List<Column> graphColumns = new ArrayList<>();
        graphColumns.add(Column.time(TIME_FIELD, Collections.nCopies(rows, window.from())));
        graphColumns.addAll(facetColumns);
        graphColumns.add(countColumn);

        return new FrameSet(
                ResultShape.FACETED_SCALAR,
                List.of(
                        new Frame(Frame.FACETED, tableColumns, VisualizationHint.TABLE),
                        new Frame(Frame.FACETED_TIME_SERIES, graphColumns, VisualizationHint.GRAPH)));
    }

    /** Positional facet values; a bare scalar fills the first facet, missing positions are blank. */
    private static List<String> unpackFacet(Object facet, int width) {
        List<String> values = new ArrayList<>(Collections.nCopies(width, ""));
        if (facet instanceof List<?> parts) {
            for (int i = 0; i < parts.size() && i < width; i++) {
                values.set(i, TypeInferencer.render(parts.get(i)));
            }
        } else if (facet != null && width > 0) {
            values.set(0, TypeInferencer.render(facet));
        }
        return values;
    }

    private static FrameSet generic(ResultSet resultSet, TimeWindow window) {
        List<Instant> times = new ArrayList<>(resultSet.size());
        Set<String> fieldNames = new LinkedHashSet<>();
        for (Map<String, Object> row : resultSet.rows()) {
            Map<String, Object> safeRow = row != null ? row : Map.of();
            times.add(rowTime(safeRow, window));
            for (String key : safeRow.keySet()) {
                if (!TIME_KEYS.contains(key)) {
                    fieldNames.add(key);
                }
            }
        }

        List<Column> columns = new ArrayList<>(fieldNames.size() + 1);
        columns.add(Column.time(TIME_FIELD, times));
        for (String fieldName : fieldNames) {
            columns.add(TypeInferencer.inferAndCoerce(fieldName, resultSet));
        }

        return new FrameSet(ResultShape.GENERIC, List.of(new Frame(Frame.RESPONSE, columns, VisualizationHint.GRAPH)));
    }

    private static Instant rowTime(Map<String, Object> row, TimeWindow window) {
        if (row.get(ResultFields.TIMESTAMP) instanceof Number millis) {
            return Instant.ofEpochMilli(millis.longValue());
        }
        if (row.get(ResultFields.BEGIN_TIME_SECONDS) instanceof Number seconds) {
            return Instant.ofEpochMilli(Math.round(seconds.doubleValue() * 1000d));
        }
        return window.from();
    }
}
