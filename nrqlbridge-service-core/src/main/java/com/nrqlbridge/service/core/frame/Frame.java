package com.nrqlbridge.service.core.frame;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Frame(String name, List<Column> columns, VisualizationHint visualizationHint) {

    /** Frame name used by {@link FrameBuilder} for a single aggregate value. */
    public static final String COUNT = "count";

    public static final String COUNT_TIME_SERIES = "count_time_series";
    public static final String FACETED = "";
    public static final String FACETED_TIME_SERIES = "facet_time_series";
    public static final String RESPONSE = "response";

    public Frame {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visualizationHint, "visualizationHint");
        columns = List.copyOf(columns);
        if (!columns.isEmpty()) {
            int rows = columns.get(0).size();
            for (Column column : columns) {
                if (column.size() != rows) {
                    throw new IllegalArgumentException("Frame " + name + " has ragged column " + column.name());
                }
            }
        }
    }

    public int rowCount() {
        return columns.isEmpty() ? 0 : columns.get(0).size();
    }

    public Optional<Column> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }
}
