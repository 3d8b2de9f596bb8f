package com.nrqlbridge.service.core.ratelimit;

public class RateLimitCancelledException extends RuntimeException {

    public RateLimitCancelledException(String message) {
        super(message);
    }

    public RateLimitCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
