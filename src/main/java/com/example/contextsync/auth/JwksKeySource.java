package com.example.contextsync.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.KeySourceException;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKMatcher;
import com.nimbusds.jose.jwk.JWKSelector;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.source.CachingJWKSetSource;
import com.nimbusds.jose.jwk.source.JWKSetCacheRefreshEvaluator;
import com.nimbusds.jose.jwk.source.JWKSetSource;
import com.nimbusds.jose.jwk.source.RateLimitReachedException;
import com.nimbusds.jose.jwk.source.RateLimitedJWKSetSource;
import com.nimbusds.jose.jwk.source.URLBasedJWKSetSource;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jose.util.DefaultResourceRetriever;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Verifies tokens against a JWK set fetched from a URL. The fetched set is
 * cached for a fixed time and can be reloaded on demand when a token fails to
 * verify, so rotated keys are picked up without waiting for the cache to age.
 * Fetches are rate limited to two per {@code minRefreshInterval}; tokens
 * presented beyond that are checked against the cached set only.
 */
public class JwksKeySource implements VerificationKeySource {

    private static final Logger logger = LoggerFactory.getLogger(JwksKeySource.class);

    private static final int CONNECT_TIMEOUT_MS = 2_000;
    private static final int READ_TIMEOUT_MS = 2_000;
    private static final int SIZE_LIMIT_BYTES = 512 * 1024;
    private static final long CACHE_REFRESH_TIMEOUT_MS = 5_000L;

    private final JWKSetSource<SecurityContext> keySetSource;
    private final Clock clock;
    private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    public JwksKeySource(URL jwkSetUrl, Duration cacheTtl, Duration minRefreshInterval, Clock clock) {
        this(new URLBasedJWKSetSource<>(jwkSetUrl,
                        new DefaultResourceRetriever(CONNECT_TIMEOUT_MS, READ_TIMEOUT_MS, SIZE_LIMIT_BYTES)),
                cacheTtl, minRefreshInterval, clock);
    }

    public JwksKeySource(JWKSetSource<SecurityContext> origin, Duration cacheTtl, Duration minRefreshInterval,
                         Clock clock) {
        this.keySetSource = new CachingJWKSetSource<>(
                new RateLimitedJWKSetSource<>(origin, minRefreshInterval.toMillis(), null),
                cacheTtl.toMillis(), CACHE_REFRESH_TIMEOUT_MS, null);
        this.clock = clock;
    }

    @Override
    public boolean verify(SignedJWT token) throws JOSEException {
        JWKSet keys;
        try {
            keys = keySetSource.getJWKSet(JWKSetCacheRefreshEvaluator.noRefresh(), clock.millis(), null);
        } catch (KeySourceException e) {
            logFetchFailure(e);
            return false;
        }
        JWSHeader header = token.getHeader();
        List<JWK> candidates = new JWKSelector(JWKMatcher.forJWSHeader(header)).select(keys);
        for (JWK candidate : candidates) {
            Key key = toVerificationKey(candidate);
            if (key == null) {
                continue;
            }
            JWSVerifier verifier = verifierFactory.createJWSVerifier(header, key);
            if (token.verify(verifier)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean refresh() {
        try {
            JWKSet keys = keySetSource.getJWKSet(JWKSetCacheRefreshEvaluator.forceRefresh(), clock.millis(), null);
            logger.info("Reloaded JWK set with {} key(s)", keys.getKeys().size());
            return true;
        } catch (KeySourceException e) {
            logFetchFailure(e);
            return false;
        }
    }

    private static void logFetchFailure(KeySourceException e) {
        if (e instanceof RateLimitReachedException) {
            logger.debug("JWK set refresh skipped, rate limit reached");
        } else {
            logger.warn("Fetching JWK set failed: {}", e.getMessage());
        }
    }

    private static Key toVerificationKey(JWK jwk) throws JOSEException {
        if (jwk instanceof RSAKey rsaKey) {
            return rsaKey.toRSAPublicKey();
        }
        if (jwk instanceof ECKey ecKey) {
            return ecKey.toECPublicKey();
        }
        if (jwk instanceof OctetSequenceKey octetKey) {
            return octetKey.toSecretKey();
        }
        return null;
    }
}
