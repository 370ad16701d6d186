package com.openforge.gazetranslate.error;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable error codes shared by the REST API and the WebSocket
 * {@code ERROR} events. Each code carries the HTTP status it maps to.
 */
public enum ErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONCURRENCY_CONFLICT(HttpStatus.CONFLICT),

    OCR_ERROR(HttpStatus.BAD_GATEWAY),
    TRANSLATION_ERROR(HttpStatus.BAD_GATEWAY),
    TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),

    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
