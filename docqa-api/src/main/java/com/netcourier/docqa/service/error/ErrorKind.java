package com.netcourier.docqa.service.error;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    INVALID_PARAMETERS(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    QUOTA_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    EMBEDDING_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INDEX_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    GENERATION_BACKEND_FAILURE(HttpStatus.BAD_GATEWAY),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }

    /**
     * Infrastructure failures are retried once with backoff before they surface.
     */
    public boolean retryable() {
        return this == EMBEDDING_UNAVAILABLE || this == INDEX_UNAVAILABLE;
    }
}
