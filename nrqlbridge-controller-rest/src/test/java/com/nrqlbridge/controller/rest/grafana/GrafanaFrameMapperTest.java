package com.nrqlbridge.controller.rest.grafana;

import static org.assertj.core.api.Assertions.assertThat;

import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.Field;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.Frame;
import com.nrqlbridge.service.core.frame.FrameBuilder;
import com.nrqlbridge.service.core.frame.FrameSet;
import com.nrqlbridge.service.core.result.ResultSet;
import com.nrqlbridge.service.core.time.TimeWindow;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GrafanaFrameMapperTest {

    private static final TimeWindow WINDOW = TimeWindow.ofMillis(1_000L, 61_000L);

    @Test
    void writesSchemaAndColumnMajorValues() {
        ResultSet rs = new ResultSet(
                List.of(Map.of("facet", List.of("svc1"), "count", 42), Map.of("facet", List.of("svc2"), "count", 24)),
                List.of("service"));
        FrameSet frames = FrameBuilder.build(rs, WINDOW);

        List<Frame> wire = GrafanaFrameMapper.toWire("A", frames);

        assertThat(wire).hasSize(2);
        Frame table = wire.get(0);
        assertThat(table.schema().refId()).isEqualTo("A");
        assertThat(table.schema().name()).isEmpty();
        assertThat(table.schema().meta().preferredVisualisationType()).isEqualTo("table");
        assertThat(table.schema().fields()).extracting(Field::name).containsExactly("service", "count");
        assertThat(table.schema().fields()).extracting(Field::type).containsExactly("string", "number");
        assertThat(table.data().values()).containsExactly(List.of("svc1", "svc2"), List.of(42.0, 24.0));

        Frame graph = wire.get(1);
        assertThat(graph.schema().name()).isEqualTo("facet_time_series");
        assertThat(graph.schema().meta().preferredVisualisationType()).isEqualTo("graph");
        assertThat(graph.schema().fields().get(0).type()).isEqualTo("time");
        assertThat(graph.schema().fields().get(0).typeInfo()).containsEntry("frame", "time.Time");
        assertThat(graph.data().values().get(0)).containsExactly(1_000L, 1_000L);
    }

    @Test
    void emptyFrameSetWritesNoFrames() {
        assertThat(GrafanaFrameMapper.toWire("B", FrameSet.empty())).isEmpty();
    }
}
