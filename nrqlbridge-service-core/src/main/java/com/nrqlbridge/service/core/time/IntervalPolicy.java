package com.nrqlbridge.service.core.time;

import java.time.Duration;

public final class IntervalPolicy {

    private IntervalPolicy() {}

    public static String bucketWidth(TimeWindow window) {
        return bucketFor(window.span()).token();
    }

    public static IntervalBucket bucketFor(Duration span) {
        Duration effective = span.isNegative() ? Duration.ZERO : span;
        for (IntervalBucket bucket : IntervalBucket.values()) {
            if (bucket.covers(effective)) {
                return bucket;
            }
        }
        return IntervalBucket.D1;
    }
}
