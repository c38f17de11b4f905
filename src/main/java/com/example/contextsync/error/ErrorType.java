package com.example.contextsync.error;

public enum ErrorType {
    VALIDATION_ERROR("validation_error"),
    PERMISSION_DENIED("permission_denied"),
    AUTHENTICATION_ERROR("authentication_error"),
    TRANSPORT_ERROR("transport_error"),
    INTERNAL_ERROR("internal_error");

    private final String wireName;

    ErrorType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
