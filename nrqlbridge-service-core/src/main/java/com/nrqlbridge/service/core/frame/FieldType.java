package com.nrqlbridge.service.core.frame;

import java.time.Instant;

/**
 * Closed set of column types. {@link #NUMERIC}, {@link #BOOLEAN} and {@link #TEXT} are inferred
 * from row values; {@link #TIME} is only used for the time axis of a frame.
 */
public enum FieldType {
    NUMERIC("number", Double.class, 0.0d),
    BOOLEAN("boolean", Boolean.class, Boolean.FALSE),
    TEXT("string", String.class, ""),
    TIME("time", Instant.class, Instant.EPOCH);

    private final String wireName;
    private final Class<?> valueType;
    private final Object zeroValue;

    FieldType(String wireName, Class<?> valueType, Object zeroValue) {
        this.wireName = wireName;
        this.valueType = valueType;
        this.zeroValue = zeroValue;
    }

    /** Name used for this type on the Grafana wire. */
    public String wireName() {
        return wireName;
    }

    public Class<?> valueType() {
        return valueType;
    }

    public Object zeroValue() {
        return zeroValue;
    }
}
