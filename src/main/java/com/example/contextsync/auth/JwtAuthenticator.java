package com.example.contextsync.auth;

import com.example.contextsync.error.AuthenticationException;
import com.example.contextsync.error.AuthenticationException.Reason;
import com.example.contextsync.model.ClientPrincipal;
import com.example.contextsync.model.VerifiedCredential;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

public class JwtAuthenticator implements Authenticator {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticator.class);

    private final VerificationKeySource keySource;
    private final Clock clock;
    private final String roleClaim;
    private final String defaultRole;

    public JwtAuthenticator(VerificationKeySource keySource, Clock clock, String roleClaim, String defaultRole) {
        this.keySource = keySource;
        this.clock = clock;
        this.roleClaim = roleClaim;
        this.defaultRole = defaultRole;
    }

    @Override
    public VerifiedCredential authenticate(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new AuthenticationException(Reason.MISSING, "Authentication token required");
        }

        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(bearerToken.trim());
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new AuthenticationException(Reason.INVALID, "Malformed authentication token", e);
        }

        if (!verifySignature(jwt)) {
            logger.warn("Rejected token with unverifiable signature (kid: {})", jwt.getHeader().getKeyID());
            throw new AuthenticationException(Reason.INVALID, "Invalid authentication token");
        }

        Instant now = clock.instant();
        Date expiration = claims.getExpirationTime();
        if (expiration != null && !now.isBefore(expiration.toInstant())) {
            throw new AuthenticationException(Reason.EXPIRED, "Authentication token expired");
        }
        Date notBefore = claims.getNotBeforeTime();
        if (notBefore != null && now.isBefore(notBefore.toInstant())) {
            throw new AuthenticationException(Reason.INVALID, "Authentication token not yet valid");
        }

        String userId = resolveUserId(claims);
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationException(Reason.INVALID, "Authentication token has no subject");
        }
        ClientPrincipal principal = new ClientPrincipal(userId, resolveRole(claims), claims.getClaims());
        return new VerifiedCredential(principal, expiration == null ? null : expiration.toInstant());
    }

    private boolean verifySignature(SignedJWT jwt) {
        try {
            if (keySource.verify(jwt)) {
                return true;
            }
            // Signing keys may have rotated since the last fetch.
            return keySource.refresh() && keySource.verify(jwt);
        } catch (JOSEException e) {
            logger.warn("Signature verification error: {}", e.getMessage());
            return false;
        }
    }

    private String resolveUserId(JWTClaimsSet claims) {
        if (claims.getSubject() != null) {
            return claims.getSubject();
        }
        Object userId = claims.getClaim("user_id");
        return userId == null ? null : userId.toString();
    }

    private String resolveRole(JWTClaimsSet claims) {
        Object role = claims.getClaim(roleClaim);
        return role == null ? defaultRole : role.toString();
    }
}
