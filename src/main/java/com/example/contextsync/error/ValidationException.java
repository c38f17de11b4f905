package com.example.contextsync.error;

public class ValidationException extends ContextServiceException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorType.VALIDATION_ERROR, message, cause);
    }
}
