package com.vcc.copilot.error;

/**
 * Language model provider failure. Never retried here; {@link #isRetryable()} tells callers whether
 * a retry may succeed.
 */
public class UpstreamException extends CopilotException {

    public UpstreamException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public UpstreamException(ErrorKind kind, String message, Throwable cause) {
        super(kind, kind.name(), message, cause);
    }
}
