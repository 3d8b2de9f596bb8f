package com.nrqlbridge.service.core.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nrqlbridge.service.core.result.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-row-wins column typing. The type of a column is decided once from the first row's value;
 * every row is then coerced to it independently.
 */
public final class TypeInferencer {

    private static final Logger log = LoggerFactory.getLogger(TypeInferencer.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private TypeInferencer() {}

    public static Column inferAndCoerce(String columnName, ResultSet resultSet) {
        FieldType type = inferType(valueOf(resultSet.firstRow(), columnName));
        List<Object> values = new ArrayList<>(resultSet.size());
        for (Map<String, Object> row : resultSet.rows()) {
            values.add(coerce(valueOf(row, columnName), type));
        }
        return new Column(columnName, type, values);
    }

    public static FieldType inferType(Object value) {
        if (value instanceof Number) {
            return FieldType.NUMERIC;
        }
        if (value instanceof Boolean) {
            return FieldType.BOOLEAN;
        }
        return FieldType.TEXT;
    }

    public static Object coerce(Object value, FieldType type) {
        if (value == null) {
            return type.zeroValue();
        }
        return switch (type) {
            case NUMERIC -> value instanceof Number number ? number.doubleValue() : type.zeroValue();
            case BOOLEAN -> value instanceof Boolean ? value : type.zeroValue();
            case TEXT -> render(value);
            case TIME -> throw new IllegalArgumentException("Time columns are not inferred from row values");
        };
    }

    /** String form of a row value; arrays and objects are rendered as compact JSON. */
    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Iterable<?> || value instanceof Map<?, ?> || value.getClass().isArray()) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                log.debug("Falling back to toString for unserialisable value of type {}", value.getClass(), ex);
                return String.valueOf(value);
            }
        }
        if (value instanceof Double d && d == Math.rint(d) && Math.abs(d) < 1e15) {
            // whole doubles print without a fraction: 42.0 -> "42"
            return Long.toString(d.longValue());
        }
        return String.valueOf(value);
    }

    private static Object valueOf(Map<String, Object> row, String columnName) {
        return row == null ? null : row.get(columnName);
    }
}
