package com.vcc.copilot.error;

public class AccessDeniedException extends CopilotException {

    public AccessDeniedException(String code, String message) {
        super(ErrorKind.ACCESS_DENIED, code, message);
    }
}
