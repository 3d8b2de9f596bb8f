package com.nrqlbridge.controller.rest.grafana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.GrafanaQueryRequest;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.GrafanaQueryResponse;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.GrafanaResult;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.GrafanaSubQuery;
import com.nrqlbridge.controller.rest.grafana.GrafanaQueryModels.HealthResponse;
import com.nrqlbridge.service.core.frame.FrameSet;
import com.nrqlbridge.service.core.health.HealthCheckResult;
import com.nrqlbridge.service.core.health.HealthCheckService;
import com.nrqlbridge.service.core.metrics.QueryMetrics;
import com.nrqlbridge.service.core.query.NrqlQueryService;
import com.nrqlbridge.service.core.query.QueryExecutionException;
import com.nrqlbridge.service.core.query.QueryModel;
import com.nrqlbridge.service.core.settings.ConnectionSettings;
import com.nrqlbridge.service.core.time.TimeWindow;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping(path = "/api/grafana", produces = MediaType.APPLICATION_JSON_VALUE)
public class GrafanaQueryController {

    private static final String DEFAULT_REF_ID = "A";
    private static final int DEFAULT_MAX_QUERIES = 25;

    private final NrqlQueryService queryService;
    private final HealthCheckService healthCheckService;
    private final QueryMetrics queryMetrics;
    private final ConnectionSettings connectionSettings;
    private final ObjectMapper objectMapper;
    private final int maxQueries;

    public GrafanaQueryController(
            NrqlQueryService queryService,
            HealthCheckService healthCheckService,
            QueryMetrics queryMetrics,
            ConnectionSettings connectionSettings,
            ObjectMapper objectMapper,
            @Value("${nrqlbridge.grafana.max-queries-per-request:25}") int maxQueries) {
        this.queryService = queryService;
        this.healthCheckService = healthCheckService;
        this.queryMetrics = queryMetrics;
        this.connectionSettings = connectionSettings;
        this.objectMapper = objectMapper;
        this.maxQueries = maxQueries > 0 ? maxQueries : DEFAULT_MAX_QUERIES;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public GrafanaQueryResponse query(@RequestBody JsonNode requestBody) {
        GrafanaQueryRequest request = parseRequest(requestBody);
        if (request.queries() == null || request.queries().isEmpty()) {
            return new GrafanaQueryResponse(Map.of());
        }
        if (request.queries().size() > maxQueries) {
            throw new IllegalArgumentException(
                    "At most " + maxQueries + " queries per request, got " + request.queries().size());
        }
        TimeWindow window = GrafanaRangeResolver.resolve(request.range());

        Map<String, GrafanaResult> results = new LinkedHashMap<>();
        for (GrafanaSubQuery query : request.queries()) {
            if (query == null) {
                continue;
            }
            String refId = query.refId() == null || query.refId().isBlank() ? DEFAULT_REF_ID : query.refId();
            results.put(refId, runQuery(refId, query, window));
        }
        return new GrafanaQueryResponse(results);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        HealthCheckResult result = healthCheckService.check(connectionSettings);
        return new HealthResponse(result.status().name(), result.message());
    }

    @GetMapping("/metrics")
    public QueryMetrics.Snapshot metrics() {
        return queryMetrics.snapshot();
    }

    private GrafanaResult runQuery(String refId, GrafanaSubQuery query, TimeWindow window) {
        QueryModel model = new QueryModel(
                query.queryText(),
                Boolean.TRUE.equals(query.useGrafanaTime()),
                query.accountId() != null ? query.accountId() : 0L);
        try {
            FrameSet frames = queryService.handle(model, connectionSettings, window);
            return GrafanaResult.ok(GrafanaFrameMapper.toWire(refId, frames));
        } catch (QueryExecutionException ex) {
            log.warn("Query {} failed with {}: {}", refId, ex.getReason(), ex.getMessage());
            return GrafanaResult.failed(ex.getMessage(), ex.getReason().name());
        }
    }

    private GrafanaQueryRequest parseRequest(JsonNode requestBody) {
        if (requestBody == null || requestBody.isNull()) {
            return new GrafanaQueryRequest(null, null);
        }
        GrafanaQueryRequest request = objectMapper.convertValue(requestBody, GrafanaQueryRequest.class);
        if ((request.queries() == null || request.queries().isEmpty()) && requestBody.hasNonNull("queryText")) {
            // single-target body: the query fields sit next to the range
            GrafanaSubQuery single = objectMapper.convertValue(requestBody, GrafanaSubQuery.class);
            request = new GrafanaQueryRequest(request.range(), List.of(single));
        }
        return request;
    }
}
