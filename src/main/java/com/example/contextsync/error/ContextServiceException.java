package com.example.contextsync.error;

/**
 * Base of every failure the context service reports to a caller.
 * The message router turns these into {@code error} responses.
 */
public abstract class ContextServiceException extends RuntimeException {

    private final ErrorType errorType;

    protected ContextServiceException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected ContextServiceException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
