package com.example.storyextractor.interfaces.api.error;

import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * JSON error envelope returned by the REST endpoints.
 *
 * @param timestamp moment the error was produced
 * @param status    HTTP status code
 * @param error     stable error code such as {@code DOCUMENT_NOT_FOUND}
 * @param message   human readable explanation
 * @param path      request path that produced the error
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status.value(), error, message, path);
    }
}
