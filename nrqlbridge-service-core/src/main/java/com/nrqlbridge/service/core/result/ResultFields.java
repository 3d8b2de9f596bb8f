package com.nrqlbridge.service.core.result;

/** Well-known NRDB row keys. */
public final class ResultFields {

    public static final String COUNT = "count";
    public static final String FACET = "facet";
    public static final String TIMESTAMP = "timestamp";
    public static final String BEGIN_TIME_SECONDS = "beginTimeSeconds";
    public static final String END_TIME_SECONDS = "endTimeSeconds";

    private ResultFields() {}
}
