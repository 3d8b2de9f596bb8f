package com.nrqlbridge.controller.rest.grafana;

import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.Field;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.Frame;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.FrameData;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.FrameMeta;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.Schema;
import com.nrqlbridge.service.core.frame.Column;
import com.nrqlbridge.service.core.frame.FieldType;
import com.nrqlbridge.service.core.frame.FrameSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Writes core frames in Grafana's data frame JSON layout: a schema plus column-major values. */
final class GrafanaFrameMapper {

    private static final Map<String, String> TIME_TYPE_INFO = Map.of("frame", "time.Time");
    private static final Map<String, String> NUMBER_TYPE_INFO = Map.of("frame", "float64");
    private static final Map<String, String> BOOLEAN_TYPE_INFO = Map.of("frame", "bool");
    private static final Map<String, String> STRING_TYPE_INFO = Map.of("frame", "string");

    private GrafanaFrameMapper() {}

    static List<Frame> toWire(String refId, FrameSet frameSet) {
        List<Frame> frames = new ArrayList<>(frameSet.size());
        for (com.nrqlbridge.service.core.frame.Frame frame : frameSet.frames()) {
            frames.add(toWire(refId, frame));
        }
        return frames;
    }

    static Frame toWire(String refId, com.nrqlbridge.service.core.frame.Frame frame) {
        List<Field> fields = new ArrayList<>(frame.columns().size());
        List<List<Object>> values = new ArrayList<>(frame.columns().size());
        for (Column column : frame.columns()) {
            fields.add(new Field(column.name(), column.type().wireName(), typeInfo(column.type())));
            values.add(columnValues(column));
        }
        FrameMeta meta = new FrameMeta(frame.visualizationHint().wireName());
        return new Frame(new Schema(refId, frame.name(), fields, meta), new FrameData(values));
    }

    private static List<Object> columnValues(Column column) {
        List<Object> values = new ArrayList<>(column.size());
        for (Object value : column.values()) {
            values.add(value instanceof Instant instant ? instant.toEpochMilli() : value);
        }
        return values;
    }

    private static Map<String, String> typeInfo(FieldType type) {
        return switch (type) {
            case TIME -> TIME_TYPE_INFO;
            case NUMERIC -> NUMBER_TYPE_INFO;
            case BOOLEAN -> BOOLEAN_TYPE_INFO;
            case TEXT -> STRING_TYPE_INFO;
        };
    }
}
