package com.example.contextsync.auth;

import com.example.contextsync.error.AuthenticationException;
import com.example.contextsync.model.VerifiedCredential;

public interface Authenticator {

    /**
     * Verifies a bearer token and resolves its principal.
     *
     * @throws AuthenticationException if the token is missing, invalid or expired
     */
    VerifiedCredential authenticate(String bearerToken);
}
