package com.example.contextsync.error;

/**
 * A credential was missing, malformed, unverifiable or expired.
 */
public class AuthenticationException extends ContextServiceException {

    public enum Reason {
        MISSING,
        INVALID,
        /** Retryable: the client may present a fresh token. */
        EXPIRED
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String message) {
        super(ErrorType.AUTHENTICATION_ERROR, message);
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, String message, Throwable cause) {
        super(ErrorType.AUTHENTICATION_ERROR, message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
