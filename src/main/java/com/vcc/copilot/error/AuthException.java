package com.vcc.copilot.error;

/**
 * Credential could not be verified. The reason is kept for logs only; callers always see 401.
 */
public class AuthException extends CopilotException {

    public enum Reason {
        MISSING_CREDENTIAL,
        MALFORMED,
        INVALID_SIGNATURE,
        EXPIRED,
        MISSING_CLAIM
    }

    public static final String CODE = "UNAUTHORIZED";
    public static final String PUBLIC_MESSAGE = "Authentication required";

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        this(reason, message, null);
    }

    public AuthException(Reason reason, String message, Throwable cause) {
        super(ErrorKind.AUTH, CODE, message, cause);
        this.reason = reason;
    }

    public Reason getAuthReason() {
        return reason;
    }
}
