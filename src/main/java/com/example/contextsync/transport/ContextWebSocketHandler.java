package com.example.contextsync.transport;

import com.example.contextsync.auth.Authenticator;
import com.example.contextsync.config.ContextServiceProperties;
import com.example.contextsync.error.AuthenticationException;
import com.example.contextsync.model.ContextSnapshot;
import com.example.contextsync.model.VerifiedCredential;
import com.example.contextsync.service.MessageRouter;
import com.example.contextsync.service.ProtocolMessages;
import com.example.contextsync.session.ClientSession;
import com.example.contextsync.session.SessionRegistry;
import com.example.contextsync.store.ContextStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Connection lifecycle: authenticate within the configured window, register
 * the session, send the greeting and a full snapshot, then route inbound
 * frames in arrival order until the client goes away.
 */
@Component
public class ContextWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ContextWebSocketHandler.class);

    private final Authenticator authenticator;
    private final SessionRegistry sessionRegistry;
    private final MessageRouter messageRouter;
    private final ContextStore contextStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration authTimeout;
    private final int outboundBuffer;

    public ContextWebSocketHandler(Authenticator authenticator, SessionRegistry sessionRegistry,
                                   MessageRouter messageRouter, ContextStore contextStore,
                                   ObjectMapper objectMapper, Clock clock, ContextServiceProperties properties) {
        this.authenticator = authenticator;
        this.sessionRegistry = sessionRegistry;
        this.messageRouter = messageRouter;
        this.contextStore = contextStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.authTimeout = properties.getAuth().getTimeout();
        this.outboundBuffer = properties.getBroadcast().getOutboundBuffer();
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        WebSocketTransport transport = new WebSocketTransport(webSocketSession, outboundBuffer);
        ClientSession session = new ClientSession(webSocketSession.getId(), transport, clock.instant());
        HandshakeInfo handshake = webSocketSession.getHandshakeInfo();
        String token = BearerTokens.extract(handshake.getHeaders(), handshake.getUri());

        return Mono.fromCallable(() -> authenticator.authenticate(token))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(authTimeout)
                .flatMap(credential -> serve(webSocketSession, transport, session, credential))
                .onErrorResume(AuthenticationException.class, e -> reject(webSocketSession, session, closeReasonFor(e), e.getMessage()))
                .onErrorResume(TimeoutException.class, e -> reject(webSocketSession, session, CloseReason.AUTHENTICATION_TIMEOUT,
                        "no credential resolved within " + authTimeout.toMillis() + "ms"));
    }

    private Mono<Void> serve(WebSocketSession webSocketSession, WebSocketTransport transport,
                             ClientSession session, VerifiedCredential credential) {
        session.authenticate(credential, clock.instant());
        sessionRegistry.register(session);

        reply(session, messageRouter.authSuccess(session));
        ContextSnapshot snapshot = contextStore.get();
        session.deliverSnapshot(snapshot.getVersion(),
                        toJson(ProtocolMessages.snapshot(ProtocolMessages.CONTEXT, snapshot, clock.instant())))
                .whenComplete((sent, error) -> {
                    if (error != null) {
                        logger.warn("Initial snapshot to client {} failed: {}", session.getClientId(), error.getMessage());
                    }
                });

        Mono<Void> input = webSocketSession.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> Mono.fromCallable(() -> messageRouter.route(session, text))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doOnNext(response -> reply(session, response))
                .then()
                .doFinally(signal -> {
                    if (sessionRegistry.remove(session.getClientId(), CloseReason.NORMAL)) {
                        logger.info("Client {} disconnected ({})", session.getClientId(), signal);
                    }
                });
        Mono<Void> output = webSocketSession.send(transport.outbound());
        return Mono.when(input, output);
    }

    private Mono<Void> reject(WebSocketSession webSocketSession, ClientSession session, CloseReason reason, String detail) {
        session.reject();
        logger.warn("Rejected connection {}: {}", session.getClientId(), detail);
        return webSocketSession.close(new CloseStatus(reason.getCode(), reason.getReason()));
    }

    private void reply(ClientSession session, Map<String, Object> message) {
        session.getTransport().send(toJson(message)).whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("Reply to client {} failed: {}", session.getClientId(), error.getMessage());
            }
        });
    }

    private String toJson(Map<String, Object> message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Response not serializable", e);
        }
    }

    static CloseReason closeReasonFor(AuthenticationException e) {
        switch (e.getReason()) {
            case MISSING:
                return CloseReason.MISSING_CREDENTIAL;
            case EXPIRED:
                return CloseReason.EXPIRED_CREDENTIAL;
            default:
                return CloseReason.INVALID_CREDENTIAL;
        }
    }
}
