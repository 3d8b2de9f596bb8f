package com.nrqlbridge.service.core.query;

import com.nrqlbridge.service.core.frame.FrameBuilder;
import com.nrqlbridge.service.core.frame.FrameSet;
import com.nrqlbridge.service.core.metrics.QueryMetrics;
import com.nrqlbridge.service.core.query.QueryExecutionException.Reason;
import com.nrqlbridge.service.core.ratelimit.RateLimitCancelledException;
import com.nrqlbridge.service.core.ratelimit.RateLimiter;
import com.nrqlbridge.service.core.result.ResultClassifier;
import com.nrqlbridge.service.core.result.ResultSet;
import com.nrqlbridge.service.core.result.ResultShape;
import com.nrqlbridge.service.core.settings.ConnectionSettings;
import com.nrqlbridge.service.core.time.TimeRewriter;
import com.nrqlbridge.service.core.time.TimeWindow;
import java.time.Duration;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Runs one panel query end to end: normalise, bind to the dashboard window, execute through the
 * rate limiter and turn the response into frames.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NrqlQueryService {

    private final ObjectProvider<NrqlExecutor> executorProvider;
    private final RateLimiter rateLimiter;
    private final QueryMetrics queryMetrics;

    public FrameSet handle(QueryModel query, ConnectionSettings settings, TimeWindow window) {
        Objects.requireNonNull(window, "window");
        if (query == null || query.queryText() == null || query.queryText().isBlank()) {
            throw new QueryExecutionException(Reason.EMPTY_QUERY, "Query text is empty");
        }

        String nrql = QueryNormalizer.normalize(query.queryText());
        if (nrql.isEmpty()) {
            throw new QueryExecutionException(Reason.EMPTY_QUERY, "Query text has no statements");
        }
        if (query.useGrafanaTime()) {
            String bound = TimeRewriter.rewrite(nrql, window);
            if (!bound.equals(nrql)) {
                log.info("Rewrote query for window {} - {}: {}", window.from(), window.to(), bound);
            }
            nrql = bound;
        }

        long accountId = resolveAccount(query, settings);
        NrqlExecutor executor = executorProvider.getIfAvailable();
        if (executor == null) {
            throw new QueryExecutionException(Reason.EXECUTOR_MISSING, "No NRQL executor is configured");
        }

        try {
            rateLimiter.acquire();
        } catch (RateLimitCancelledException ex) {
            log.warn("Query cancelled while waiting for the rate limiter: {}", nrql);
            throw new QueryExecutionException(Reason.CANCELLED, "Query cancelled while rate limited", ex);
        }

        log.debug("Executing NRQL for account {}: {}", accountId, nrql);
        ResultSet resultSet = execute(executor, nrql, accountId);

        ResultShape shape = ResultClassifier.classify(resultSet);
        log.debug("Query returned {} row(s) classified as {}", resultSet.size(), shape);
        return FrameBuilder.build(resultSet, shape, window);
    }

    private ResultSet execute(NrqlExecutor executor, String nrql, long accountId) {
        boolean failed = true;
        long started = System.nanoTime();
        queryMetrics.queryStarted();
        try {
            ResultSet resultSet = executor.execute(nrql, accountId);
            failed = false;
            return resultSet != null ? resultSet : ResultSet.empty();
        } catch (QueryExecutionException ex) {
            log.warn("NRQL execution failed ({}) for account {}: {}", ex.getReason(), accountId, nrql);
            throw ex;
        } catch (RuntimeException ex) {
            log.error("NRQL execution failed for account {}: {}", accountId, nrql, ex);
            throw new QueryExecutionException(Reason.UPSTREAM_FAILURE, "Query failed: " + ex.getMessage(), ex);
        } finally {
            queryMetrics.queryFinished(Duration.ofNanos(System.nanoTime() - started), failed);
        }
    }

    private static long resolveAccount(QueryModel query, ConnectionSettings settings) {
        if (query.accountId() > 0) {
            return query.accountId();
        }
        long accountId = settings != null ? settings.accountId() : 0L;
        if (accountId <= 0) {
            throw new QueryExecutionException(Reason.INVALID_ACCOUNT, "Account ID must be positive, got " + accountId);
        }
        return accountId;
    }
}
