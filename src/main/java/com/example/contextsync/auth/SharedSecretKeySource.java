package com.example.contextsync.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.SignedJWT;

import java.nio.charset.StandardCharsets;

/**
 * Verifies HMAC-signed tokens (HS256 and stronger) against one shared secret.
 */
public class SharedSecretKeySource implements VerificationKeySource {

    private final MACVerifier verifier;

    public SharedSecretKeySource(String secret) {
        try {
            this.verifier = new MACVerifier(secret.getBytes(StandardCharsets.UTF_8));
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Shared secret must be at least 256 bits long", e);
        }
    }

    @Override
    public boolean verify(SignedJWT token) throws JOSEException {
        JWSAlgorithm algorithm = token.getHeader().getAlgorithm();
        if (!verifier.supportedJWSAlgorithms().contains(algorithm)) {
            return false;
        }
        return token.verify(verifier);
    }
}
