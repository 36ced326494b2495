package com.vcc.copilot.error;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes surfaced to callers and stored on failed usage rows.
 */
public enum ErrorKind {
    AUTH(HttpStatus.UNAUTHORIZED, false),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, false),
    QUOTA_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, false),
    VALIDATION(HttpStatus.BAD_REQUEST, false),
    COPILOT_DISABLED(HttpStatus.SERVICE_UNAVAILABLE, false),
    UPSTREAM_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, true),
    UPSTREAM_RATE_LIMITED(HttpStatus.SERVICE_UNAVAILABLE, true),
    UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    UPSTREAM_MALFORMED(HttpStatus.INTERNAL_SERVER_ERROR, false),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus status;
    private final boolean retryable;

    ErrorKind(HttpStatus status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus status() {
        return status;
    }

    public boolean retryable() {
        return retryable;
    }
}
