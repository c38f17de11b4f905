package com.example.contextsync.model;

import lombok.Value;

import java.time.Instant;

/**
 * Result of a successful token verification. {@code expiresAt} is null for
 * tokens without an {@code exp} claim.
 */
@Value
public class VerifiedCredential {

    ClientPrincipal principal;
    Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
