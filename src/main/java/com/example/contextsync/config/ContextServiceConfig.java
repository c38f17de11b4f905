package com.example.contextsync.config;

import com.example.contextsync.auth.Authenticator;
import com.example.contextsync.auth.JwksKeySource;
import com.example.contextsync.auth.JwtAuthenticator;
import com.example.contextsync.auth.SharedSecretKeySource;
import com.example.contextsync.auth.VerificationKeySource;
import com.example.contextsync.store.ContextMutationListener;
import com.example.contextsync.store.ContextStore;
import com.example.contextsync.tokens.SerializedSizeTokenEstimator;
import com.example.contextsync.tokens.TokenAccountant;
import com.example.contextsync.tokens.TokenEstimator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.MalformedURLException;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ContextServiceConfig {

    private static final Logger logger = LoggerFactory.getLogger(ContextServiceConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenEstimator tokenEstimator(ContextServiceProperties properties) {
        return new SerializedSizeTokenEstimator(properties.getBytesPerToken());
    }

    @Bean
    public TokenAccountant tokenAccountant(ObjectMapper objectMapper, TokenEstimator tokenEstimator) {
        return new TokenAccountant(objectMapper, tokenEstimator);
    }

    @Bean
    public ContextStore contextStore(ContextServiceProperties properties, TokenAccountant tokenAccountant,
                                     Clock clock, List<ContextMutationListener> listeners) {
        logger.info("Context store budget: {} tokens ({} bytes per token)",
                properties.getMaxTokens(), properties.getBytesPerToken());
        return new ContextStore(properties.getMaxTokens(), tokenAccountant, clock, listeners);
    }

    @Bean
    public VerificationKeySource verificationKeySource(ContextServiceProperties properties, Clock clock) {
        ContextServiceProperties.Auth auth = properties.getAuth();
        boolean hasJwks = auth.getJwkSetUri() != null && !auth.getJwkSetUri().isBlank();
        boolean hasSecret = auth.getSharedSecret() != null && !auth.getSharedSecret().isBlank();
        if (hasJwks == hasSecret) {
            throw new IllegalStateException(
                    "Configure exactly one of app.context.auth.jwk-set-uri or app.context.auth.shared-secret");
        }
        if (hasSecret) {
            logger.info("Verifying tokens with the configured shared secret");
            return new SharedSecretKeySource(auth.getSharedSecret());
        }
        try {
            logger.info("Verifying tokens against JWK set {}", auth.getJwkSetUri());
            return new JwksKeySource(URI.create(auth.getJwkSetUri()).toURL(), auth.getJwkCacheTtl(),
                    auth.getJwkRefreshMinInterval(), clock);
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid app.context.auth.jwk-set-uri: " + auth.getJwkSetUri(), e);
        }
    }

    @Bean
    public Authenticator authenticator(VerificationKeySource verificationKeySource, Clock clock,
                                       ContextServiceProperties properties) {
        return new JwtAuthenticator(verificationKeySource, clock,
                properties.getAuth().getRoleClaim(), properties.getAuth().getDefaultRole());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService broadcastExecutor(ContextServiceProperties properties) {
        int threadCount = Math.max(1, properties.getBroadcast().getThreads());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "broadcast-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
