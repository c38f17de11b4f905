package com.example.contextsync.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jwt.SignedJWT;

/**
 * Key material used to check token signatures.
 */
public interface VerificationKeySource {

    /**
     * @return true if one of the known keys verifies the token's signature
     */
    boolean verify(SignedJWT token) throws JOSEException;

    /**
     * Reloads key material from its origin. Implementations may decline
     * when reloads are rate limited.
     *
     * @return true if the keys may have changed, so a failed verification is worth retrying
     */
    default boolean refresh() {
        return false;
    }
}
