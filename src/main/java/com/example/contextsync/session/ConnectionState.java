package com.example.contextsync.session;

public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    /** Terminal: the credential was refused. */
    REJECTED,
    CLOSED
}
