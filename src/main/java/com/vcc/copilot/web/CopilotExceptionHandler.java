package com.vcc.copilot.web;

import com.vcc.copilot.dto.ErrorResponse;
import com.vcc.copilot.dto.RateLimitInfo;
import com.vcc.copilot.error.AuthException;
import com.vcc.copilot.error.CopilotException;
import com.vcc.copilot.error.QuotaExceededException;
import com.vcc.copilot.model.QuotaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.Locale;

/**
 * Renders every copilot failure in the shared error body.
 */
@RestControllerAdvice
public class CopilotExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(CopilotExceptionHandler.class);

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ErrorResponse> handleQuotaExceeded(QuotaExceededException ex, ServerWebExchange exchange) {
        QuotaStatus status = ex.getQuotaStatus();
        HttpHeaders headers = CopilotController.rateLimitHeaders(status.limit(), 0, status.resetAt());

        RateLimitInfo rateLimit = new RateLimitInfo(status.tier().wireName(), status.used(), status.limit(),
                0, status.resetAt());
        log.info("requestId={} quota exceeded (tier={}, used={})",
                RequestIdFilter.requestId(exchange), status.tier().wireName(), status.used());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers)
                .body(ErrorResponse.quota(ex.getCode(), ex.getReason(), rateLimit, ex.getUpgradeUrl()));
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuth(AuthException ex, ServerWebExchange exchange) {
        log.info("requestId={} unauthenticated: {}", RequestIdFilter.requestId(exchange), ex.getAuthReason());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorResponse.of(AuthException.CODE, AuthException.PUBLIC_MESSAGE));
    }

    @ExceptionHandler(CopilotException.class)
    public ResponseEntity<ErrorResponse> handleCopilot(CopilotException ex, ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        if (status.is5xxServerError()) {
            log.warn("requestId={} {} ({}): {}", RequestIdFilter.requestId(exchange), ex.getCode(),
                    status.value(), ex.getReason());
        } else {
            log.info("requestId={} {} ({}): {}", RequestIdFilter.requestId(exchange), ex.getCode(),
                    status.value(), ex.getReason());
        }
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(ex.getCode(), ex.getReason(), ex.isRetryable()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.info("requestId={} invalid input: {}", RequestIdFilter.requestId(exchange), ex.getReason());
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request";
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.name().toUpperCase(Locale.ROOT), message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, ServerWebExchange exchange) {
        log.error("requestId={} unhandled error", RequestIdFilter.requestId(exchange), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "An internal error occurred", false));
    }
}
