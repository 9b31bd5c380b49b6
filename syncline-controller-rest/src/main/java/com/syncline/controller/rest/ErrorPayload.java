package com.syncline.controller.rest;

import java.time.Instant;
import org.springframework.http.HttpStatus;

/**
 * Error body of the sync endpoints. {@code code} is stable for clients to branch on, {@code message} is
 * for humans.
 */
public record ErrorPayload(Instant timestamp, int status, String code, String message, String path) {

    static ErrorPayload of(HttpStatus status, String code, String message, String path) {
        return new ErrorPayload(Instant.now(), status.value(), code, message, path);
    }
}
