package com.example.contextsync.error;

public class TransportException extends ContextServiceException {

    public TransportException(String message) {
        super(ErrorType.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorType.TRANSPORT_ERROR, message, cause);
    }
}
