package com.nrqlbridge.service.core.result;

public enum ResultShape {
    /** No rows. */
    EMPTY,
    /** One aggregate, e.g. {@code SELECT count(*) FROM Transaction}. */
    SIMPLE_SCALAR,
    /** One aggregate per facet group, e.g. {@code ... FACET appName}. */
    FACETED_SCALAR,
    /** Anything else: detail rows, TIMESERIES buckets, multi-aggregate rows. */
    GENERIC
}
