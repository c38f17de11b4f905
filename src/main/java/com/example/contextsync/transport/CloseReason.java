package com.example.contextsync.transport;

/**
 * WebSocket close codes used by the server. Codes in the 4000 range are
 * application specific; {@link #EXPIRED_CREDENTIAL} tells the client that
 * reconnecting with a fresh token will succeed.
 */
public enum CloseReason {
    NORMAL(1000, "Closed"),
    SERVER_SHUTDOWN(1001, "Server shutting down"),
    SEND_FAILED(1011, "Delivery failed"),
    MISSING_CREDENTIAL(4001, "Authentication token required"),
    INVALID_CREDENTIAL(4001, "Invalid authentication token"),
    IDLE_TIMEOUT(4002, "Connection timeout"),
    EXPIRED_CREDENTIAL(4003, "Authentication token expired"),
    AUTHENTICATION_TIMEOUT(4008, "Authentication timeout");

    private final int code;
    private final String reason;

    CloseReason(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }
}
