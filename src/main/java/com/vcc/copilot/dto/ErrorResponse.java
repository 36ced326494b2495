package com.vcc.copilot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body shared by every copilot endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        boolean success,
        ErrorBody error,
        RateLimitInfo rateLimit,
        Instant blockedUntil,
        String upgradeUrl
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(String code, String message, Boolean retryable) {
    }

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(false, new ErrorBody(code, message, null), null, null, null);
    }

    public static ErrorResponse of(String code, String message, boolean retryable) {
        return new ErrorResponse(false, new ErrorBody(code, message, retryable), null, null, null);
    }

    public static ErrorResponse quota(String code, String message, RateLimitInfo rateLimit, String upgradeUrl) {
        return new ErrorResponse(false, new ErrorBody(code, message, false), rateLimit,
                rateLimit.resetAt(), upgradeUrl);
    }
}
