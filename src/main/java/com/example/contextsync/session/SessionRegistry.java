package com.example.contextsync.session;

import com.example.contextsync.config.ContextServiceProperties;
import com.example.contextsync.transport.CloseReason;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the authenticated sessions. Guarded independently of the context
 * store; callers that enumerate sessions get a momentary copy.
 */
@Component
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleTimeout;

    public SessionRegistry(ContextServiceProperties properties, Clock clock) {
        this.clock = clock;
        this.idleTimeout = properties.getSession().getIdleTimeout();
    }

    public void register(ClientSession session) {
        if (!session.isAuthenticated()) {
            throw new IllegalStateException("Only authenticated sessions can be registered: " + session.getClientId());
        }
        ClientSession replaced = sessions.put(session.getClientId(), session);
        if (replaced != null && replaced != session) {
            logger.warn("Client id {} reused, closing the previous session", session.getClientId());
            closeQuietly(replaced, CloseReason.NORMAL);
        }
        logger.info("Client {} registered (user: {}, role: {})",
                session.getClientId(), session.getPrincipal().getUserId(), session.getPrincipal().getRole());
    }

    public Optional<ClientSession> find(String clientId) {
        return Optional.ofNullable(sessions.get(clientId));
    }

    public void touch(ClientSession session) {
        session.touch(clock.instant());
    }

    /**
     * Removes the session and closes its transport with {@code reason}.
     *
     * @return false if the session was not registered
     */
    public boolean remove(String clientId, CloseReason reason) {
        ClientSession session = sessions.remove(clientId);
        if (session == null) {
            return false;
        }
        closeQuietly(session, reason);
        logger.info("Client {} removed ({})", clientId, reason.getReason());
        return true;
    }

    public List<ClientSession> sessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Closes and removes every session idle for longer than the timeout.
     *
     * @return ids of the removed sessions
     */
    public List<String> sweepIdle(Instant now) {
        List<String> removed = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            if (session.idleTime(now).compareTo(idleTimeout) > 0 && remove(session.getClientId(), CloseReason.IDLE_TIMEOUT)) {
                removed.add(session.getClientId());
            }
        }
        return removed;
    }

    public List<Map<String, Object>> describe() {
        List<Map<String, Object>> summaries = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("client_id", session.getClientId());
            summary.put("user_id", session.getPrincipal().getUserId());
            summary.put("role", session.getPrincipal().getRole());
            summary.put("authenticated_at", String.valueOf(session.getAuthenticatedAt()));
            summary.put("last_activity", String.valueOf(session.getLastActivity()));
            summaries.add(summary);
        }
        return summaries;
    }

    @PreDestroy
    public void closeAll() {
        for (String clientId : List.copyOf(sessions.keySet())) {
            remove(clientId, CloseReason.SERVER_SHUTDOWN);
        }
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    private void closeQuietly(ClientSession session, CloseReason reason) {
        session.markClosed();
        try {
            session.getTransport().close(reason);
        } catch (RuntimeException e) {
            logger.warn("Closing transport of client {} failed: {}", session.getClientId(), e.getMessage());
        }
    }
}
