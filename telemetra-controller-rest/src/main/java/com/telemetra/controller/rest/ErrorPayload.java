package com.telemetra.controller.rest;

import java.time.Instant;
import org.springframework.http.HttpStatus;

/**
 * JSON body of every client-visible error. {@code message} is safe to show to the tenant; driver
 * and stack details only go to the log.
 */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {

    static ErrorPayload of(HttpStatus status, String message, String path) {
        return new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
    }
}
