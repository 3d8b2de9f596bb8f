package com.nrqlbridge.service.core.health;

public record HealthCheckResult(Status status, String message) {

    public enum Status {
        OK,
        ERROR
    }

    public static HealthCheckResult ok(String message) {
        return new HealthCheckResult(Status.OK, message);
    }

    public static HealthCheckResult error(String message) {
        return new HealthCheckResult(Status.ERROR, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
