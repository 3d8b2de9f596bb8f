package com.nrqlbridge.service.core.query;

/**
 * One panel query.
 *
 * @param queryText raw NRQL as typed by the user
 * @param useGrafanaTime bind the query to the dashboard window
 * @param accountId per-query account override; values {@code <= 0} defer to the connection
 */
public record QueryModel(String queryText, boolean useGrafanaTime, long accountId) {

    public static QueryModel of(String queryText) {
        return new QueryModel(queryText, true, 0L);
    }
}
