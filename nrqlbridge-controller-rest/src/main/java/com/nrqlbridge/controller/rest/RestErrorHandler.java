package com.nrqlbridge.controller.rest;

import com.nrqlbridge.service.core.settings.InvalidSettingsException;
import java.time.format.DateTimeParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/** Turns bad Grafana payloads into 400 responses with an {@link ErrorPayload} body. */
@Slf4j
@ControllerAdvice
public class RestErrorHandler {

    @ExceptionHandler({
        IllegalArgumentException.class,
        IllegalStateException.class,
        DateTimeParseException.class,
        InvalidSettingsException.class
    })
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        log.debug("Rejecting request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed JSON request body", request);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        return ResponseEntity.status(status).body(ErrorPayload.of(status, message, path));
    }
}
