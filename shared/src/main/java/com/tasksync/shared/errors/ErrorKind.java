package com.tasksync.shared.errors;

import org.springframework.http.HttpStatus;

/**
 * Stable, client-visible error kinds.
 * The wire name is part of the API contract: clients branch on it to decide whether to retry.
 */
public enum ErrorKind {

    VALIDATION("validation_error", HttpStatus.BAD_REQUEST, false),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND, false),
    CONCURRENCY_CONFLICT("concurrency_conflict", HttpStatus.CONFLICT, true),
    AUTHORIZATION("authorization_error", HttpStatus.FORBIDDEN, false),
    CORRUPT_STREAM("corrupt_stream", HttpStatus.INTERNAL_SERVER_ERROR, false),
    TRANSIENT_INFRASTRUCTURE("transient_infrastructure", HttpStatus.SERVICE_UNAVAILABLE, true);

    private final String wireName;
    private final HttpStatus status;
    private final boolean retryable;

    ErrorKind(String wireName, HttpStatus status, boolean retryable) {
        this.wireName = wireName;
        this.status = status;
        this.retryable = retryable;
    }

    public String wireName() {
        return wireName;
    }

    public HttpStatus status() {
        return status;
    }

    public boolean retryable() {
        return retryable;
    }
}
