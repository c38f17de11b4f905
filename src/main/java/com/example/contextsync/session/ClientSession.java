package com.example.contextsync.session;

import com.example.contextsync.model.ClientPrincipal;
import com.example.contextsync.model.VerifiedCredential;
import com.example.contextsync.transport.ConnectionTransport;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracked state of one client connection. The principal is fixed once the
 * connection authenticates; only activity and credential expiry change later.
 */
@Getter
public class ClientSession {

    private final String clientId;
    private final ConnectionTransport transport;
    private final Instant connectedAt;

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile ClientPrincipal principal;
    private volatile Instant authenticatedAt;
    private volatile Instant lastActivity;
    private volatile Instant credentialExpiresAt;

    @Getter(AccessLevel.NONE)
    private final AtomicLong lastDeliveredVersion = new AtomicLong(-1L);

    /** Orders snapshot frames. State transitions never take it. */
    @Getter(AccessLevel.NONE)
    private final Object deliveryLock = new Object();

    public ClientSession(String clientId, ConnectionTransport transport, Instant connectedAt) {
        this.clientId = clientId;
        this.transport = transport;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public synchronized void authenticate(VerifiedCredential credential, Instant now) {
        if (state != ConnectionState.CONNECTING) {
            throw new IllegalStateException("Session " + clientId + " cannot authenticate from state " + state);
        }
        this.principal = credential.getPrincipal();
        this.credentialExpiresAt = credential.getExpiresAt();
        this.authenticatedAt = now;
        this.lastActivity = now;
        this.state = ConnectionState.AUTHENTICATED;
    }

    public synchronized void reject() {
        if (state == ConnectionState.CONNECTING) {
            state = ConnectionState.REJECTED;
        }
    }

    /**
     * @return true if this call moved the session to {@link ConnectionState#CLOSED}
     */
    public synchronized boolean markClosed() {
        if (state == ConnectionState.CLOSED || state == ConnectionState.REJECTED) {
            return false;
        }
        state = ConnectionState.CLOSED;
        return true;
    }

    /**
     * Replaces the credential expiry after a successful token refresh.
     * The principal must stay the same; callers check that first.
     */
    public void refreshCredential(VerifiedCredential credential) {
        this.credentialExpiresAt = credential.getExpiresAt();
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public boolean isAuthenticated() {
        return state == ConnectionState.AUTHENTICATED;
    }

    public boolean isCredentialExpired(Instant now) {
        return credentialExpiresAt != null && !now.isBefore(credentialExpiresAt);
    }

    public Duration idleTime(Instant now) {
        return Duration.between(lastActivity, now);
    }

    /**
     * Reserves delivery of snapshot {@code version}. Fails when this session
     * already received the same or a newer version.
     */
    public boolean claimDelivery(long version) {
        long previous = lastDeliveredVersion.getAndAccumulate(version, Math::max);
        return version > previous;
    }

    /**
     * Sends a full snapshot frame unless this session already received the
     * same or a newer version. Frames of one session leave in version order.
     *
     * @return a future completing with false when the frame was skipped as stale
     */
    public CompletableFuture<Boolean> deliverSnapshot(long version, String frame) {
        synchronized (deliveryLock) {
            if (!claimDelivery(version)) {
                return CompletableFuture.completedFuture(false);
            }
            return transport.send(frame).thenApply(ignored -> true);
        }
    }

    public long getLastDeliveredVersion() {
        return lastDeliveredVersion.get();
    }
}
