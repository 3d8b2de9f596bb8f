package com.nrqlbridge.service.core.frame;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Named, typed column. Every value is an instance of {@link FieldType#valueType()}; missing source
 * values have already been replaced by the type's zero value.
 */
public record Column(String name, FieldType type, List<Object> values) {

    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        values = List.copyOf(values);
        for (Object value : values) {
            if (!type.valueType().isInstance(value)) {
                throw new IllegalArgumentException(
                        "Column " + name + " of type " + type + " cannot hold " + value.getClass().getSimpleName());
            }
        }
    }

    public static Column numeric(String name, List<Double> values) {
        return new Column(name, FieldType.NUMERIC, List.copyOf(values));
    }

    public static Column text(String name, List<String> values) {
        return new Column(name, FieldType.TEXT, List.copyOf(values));
    }

    public static Column time(String name, List<Instant> values) {
        return new Column(name, FieldType.TIME, List.copyOf(values));
    }

    public int size() {
        return values.size();
    }
}
