package com.example.contextsync.error;

public class PermissionDeniedException extends ContextServiceException {

    public PermissionDeniedException(String message) {
        super(ErrorType.PERMISSION_DENIED, message);
    }
}
