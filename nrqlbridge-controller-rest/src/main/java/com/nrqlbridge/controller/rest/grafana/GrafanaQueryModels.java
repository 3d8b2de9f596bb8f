package com.nrqlbridge.controller.rest.grafana;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.List;
import java.util.Map;

public final class GrafanaQueryModels {

    private GrafanaQueryModels() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GrafanaQueryRequest(Range range, List<GrafanaSubQuery> queries) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Range(
            String from,
            String to,
            @JsonDeserialize(using = FlexibleLongDeserializer.class) Long fromMs,
            @JsonDeserialize(using = FlexibleLongDeserializer.class) Long toMs) {}

    /**
     * One panel target. {@code useGrafanaTime} defaults to {@code false}; {@code accountId} falls
     * back to the configured connection when absent or not positive.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GrafanaSubQuery(
            String refId,
            String queryText,
            @JsonDeserialize(using = FlexibleBooleanDeserializer.class) Boolean useGrafanaTime,
            @JsonDeserialize(using = FlexibleLongDeserializer.class) Long accountId) {}

    public record GrafanaQueryResponse(Map<String, GrafanaResult> results) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GrafanaResult(List<Frame> frames, String error, String errorCode) {

        static GrafanaResult ok(List<Frame> frames) {
            return new GrafanaResult(frames, null, null);
        }

        static GrafanaResult failed(String error, String errorCode) {
            return new GrafanaResult(List.of(), error, errorCode);
        }
    }

    public record Frame(Schema schema, FrameData data) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Schema(String refId, String name, List<Field> fields, FrameMeta meta) {}

    public record FrameMeta(String preferredVisualisationType) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Field(String name, String type, Map<String, String> typeInfo) {}

    public record FrameData(List<List<Object>> values) {}

    public record HealthResponse(String status, String message) {}
}
