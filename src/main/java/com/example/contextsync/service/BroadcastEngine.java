package com.example.contextsync.service;

import com.example.contextsync.config.ContextServiceProperties;
import com.example.contextsync.model.ContextSnapshot;
import com.example.contextsync.session.ClientSession;
import com.example.contextsync.session.SessionRegistry;
import com.example.contextsync.store.ContextMutationListener;
import com.example.contextsync.transport.CloseReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Pushes the store snapshot to every registered session after each mutation.
 *
 * <p>Each cycle serializes the snapshot once and sends it to all sessions in
 * parallel on a dedicated pool. A recipient whose send fails or exceeds the
 * send timeout is removed from the registry; other recipients are unaffected
 * and the mutating caller never sees the failure. Cycles for snapshots older
 * than one already being broadcast are dropped, since the newer snapshot
 * already contains their changes.</p>
 */
@Component
public class BroadcastEngine implements ContextMutationListener {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastEngine.class);

    private enum Delivery { DELIVERED, FAILED, SKIPPED }

    private final SessionRegistry sessionRegistry;
    private final ObjectMapper objectMapper;
    private final ExecutorService broadcastExecutor;
    private final Clock clock;
    private final Duration sendTimeout;
    private final AtomicLong latestVersion = new AtomicLong(-1L);

    public BroadcastEngine(SessionRegistry sessionRegistry,
                           ObjectMapper objectMapper,
                           @Qualifier("broadcastExecutor") ExecutorService broadcastExecutor,
                           Clock clock,
                           ContextServiceProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.objectMapper = objectMapper;
        this.broadcastExecutor = broadcastExecutor;
        this.clock = clock;
        this.sendTimeout = properties.getBroadcast().getSendTimeout();
    }

    @Override
    public void onMutation(ContextSnapshot snapshot) {
        broadcast(snapshot);
    }

    public CompletableFuture<BroadcastReport> broadcast(ContextSnapshot snapshot) {
        long version = snapshot.getVersion();
        if (latestVersion.accumulateAndGet(version, Math::max) > version) {
            logger.debug("Skipping broadcast of version {}, a newer snapshot is on its way", version);
            return CompletableFuture.completedFuture(BroadcastReport.superseded(version));
        }

        List<ClientSession> recipients = sessionRegistry.sessions();
        if (recipients.isEmpty()) {
            return CompletableFuture.completedFuture(new BroadcastReport(version, 0, 0, 0, 0, false));
        }

        String frame;
        try {
            frame = objectMapper.writeValueAsString(
                    ProtocolMessages.snapshot(ProtocolMessages.CONTEXT_UPDATE, snapshot, clock.instant()));
        } catch (JsonProcessingException e) {
            logger.error("Serializing snapshot version {} failed, broadcast dropped", version, e);
            return CompletableFuture.completedFuture(new BroadcastReport(version, recipients.size(), 0, 0, recipients.size(), false));
        }

        List<CompletableFuture<Delivery>> deliveries = new ArrayList<>(recipients.size());
        for (ClientSession session : recipients) {
            deliveries.add(deliver(session, version, frame));
        }
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> summarize(version, deliveries));
    }

    private CompletableFuture<Delivery> deliver(ClientSession session, long version, String frame) {
        return CompletableFuture
                .supplyAsync(() -> session.deliverSnapshot(version, frame), broadcastExecutor)
                .thenCompose(Function.identity())
                .orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)
                // timeouts complete on the shared JDK timer thread; removal closes sockets, so hop off it
                .handleAsync((sent, error) -> {
                    if (error == null) {
                        return Boolean.TRUE.equals(sent) ? Delivery.DELIVERED : Delivery.SKIPPED;
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        logger.warn("Broadcast of version {} to client {} timed out after {}ms",
                                version, session.getClientId(), sendTimeout.toMillis());
                    } else {
                        logger.warn("Broadcast of version {} to client {} failed: {}",
                                version, session.getClientId(), cause.getMessage());
                    }
                    sessionRegistry.remove(session.getClientId(), CloseReason.SEND_FAILED);
                    return Delivery.FAILED;
                }, broadcastExecutor);
    }

    private BroadcastReport summarize(long version, List<CompletableFuture<Delivery>> deliveries) {
        int delivered = 0;
        int failed = 0;
        int skipped = 0;
        for (CompletableFuture<Delivery> delivery : deliveries) {
            switch (delivery.join()) {
                case DELIVERED:
                    delivered++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    skipped++;
            }
        }
        if (failed > 0) {
            logger.info("Broadcast of version {}: {} delivered, {} failed, {} skipped", version, delivered, failed, skipped);
        }
        return new BroadcastReport(version, deliveries.size(), delivered, failed, skipped, false);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
