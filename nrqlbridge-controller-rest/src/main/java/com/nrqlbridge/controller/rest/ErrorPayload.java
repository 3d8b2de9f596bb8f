package com.nrqlbridge.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.springframework.http.HttpStatus;

/** Body of a rejected request; {@code path} is omitted when the request URI is unknown. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {

    static ErrorPayload of(HttpStatus status, String message, String path) {
        return new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
    }
}
