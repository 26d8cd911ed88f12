package com.example.mediacatalog_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Error kinds reported by the catalog core. Each maps to the HTTP status used at the request boundary.
 */
public enum ErrorKind {
    PARSE_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    OVERLAP_CONFLICT(HttpStatus.CONFLICT),
    READ_ONLY_FLOW(HttpStatus.FORBIDDEN),
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR),
    // logged only, never returned to the caller that triggered the event
    DELIVERY_EXHAUSTED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
