package com.nrqlbridge.service.core.query;

import com.nrqlbridge.service.core.result.ResultSet;

/**
 * Runs NRQL against NRDB. Implementations are supplied by the host application.
 *
 * <p>Authentication failures should surface as {@link QueryExecutionException} with {@link
 * QueryExecutionException.Reason#UNAUTHORIZED}; everything else the caller wraps as {@link
 * QueryExecutionException.Reason#UPSTREAM_FAILURE}.
 */
public interface NrqlExecutor {

    ResultSet execute(String nrql, long accountId);
}
