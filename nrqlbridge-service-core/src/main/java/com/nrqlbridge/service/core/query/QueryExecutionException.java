package com.nrqlbridge.service.core.query;

import java.util.Objects;

public class QueryExecutionException extends RuntimeException {

    public enum Reason {
        EXECUTOR_MISSING,
        EMPTY_QUERY,
        INVALID_ACCOUNT,
        UNAUTHORIZED,
        UPSTREAM_FAILURE,
        CANCELLED
    }

    private final Reason reason;

    public QueryExecutionException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public QueryExecutionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason getReason() {
        return reason;
    }
}
