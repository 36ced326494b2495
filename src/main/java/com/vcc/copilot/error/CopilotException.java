package com.vcc.copilot.error;

import org.springframework.web.server.ResponseStatusException;

/**
 * Base of all failures the gateway reports to portal callers.
 */
public class CopilotException extends ResponseStatusException {

    private final ErrorKind kind;
    private final String code;

    public CopilotException(ErrorKind kind, String code, String message) {
        this(kind, code, message, null);
    }

    public CopilotException(ErrorKind kind, String code, String message, Throwable cause) {
        super(kind.status(), message, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("CopilotException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }

    /**
     * Map any throwable from the request pipeline onto an error kind.
     */
    public static ErrorKind kindOf(Throwable error) {
        if (error instanceof CopilotException copilotException) {
            return copilotException.getKind();
        }
        return ErrorKind.INTERNAL;
    }
}
