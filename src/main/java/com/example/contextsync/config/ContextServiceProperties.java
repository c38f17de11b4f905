package com.example.contextsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the context sync server, bound from {@code app.context.*}.
 *
 * <p>Every value has a default so the server starts with nothing but a
 * verification key source configured.</p>
 */
@Data
@ConfigurationProperties(prefix = "app.context")
public class ContextServiceProperties {

    /** Token budget shared by all entries of the store. */
    private long maxTokens = 128_000L;

    /** Serialized payload bytes counted as one token. */
    private int bytesPerToken = 4;

    /** Path of the WebSocket endpoint. */
    private String websocketPath = "/ws/context";

    private Auth auth = new Auth();

    private Session session = new Session();

    private Broadcast broadcast = new Broadcast();

    @Data
    public static class Auth {

        /** URL of the JWK set used to verify bearer tokens. */
        private String jwkSetUri = "";

        /** HMAC secret, used only when no JWK set URL is configured. */
        private String sharedSecret = "";

        /** How long a fetched JWK set is trusted before it is fetched again. */
        private Duration jwkCacheTtl = Duration.ofMinutes(10);

        /** Window in which at most two JWK set fetches are made. */
        private Duration jwkRefreshMinInterval = Duration.ofSeconds(30);

        /** Claim holding the principal's role. */
        private String roleClaim = "role";

        /** Role assumed when the token carries none. */
        private String defaultRole = "student";

        /** Roles allowed to clear the whole store. */
        private List<String> elevatedRoles = new ArrayList<>(List.of("admin", "teacher"));

        /** Window in which a new connection must authenticate. */
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Session {

        private Duration idleTimeout = Duration.ofHours(24);

        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Broadcast {

        /** Per-recipient send timeout; exceeding it counts as a failed send. */
        private Duration sendTimeout = Duration.ofSeconds(2);

        private int threads = 8;

        /** Outbound frames queued per connection before sends start failing. */
        private int outboundBuffer = 256;
    }
}
