package com.vcc.copilot.error;

public class ValidationException extends CopilotException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, "VALIDATION_ERROR", message);
    }
}
