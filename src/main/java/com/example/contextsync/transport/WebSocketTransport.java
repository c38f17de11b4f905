package com.example.contextsync.transport;

import com.example.contextsync.error.TransportException;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.concurrent.CompletableFuture;

/**
 * {@link ConnectionTransport} over a reactive WebSocket session. Outbound
 * frames go through a bounded queue drained by the session's send pipeline;
 * a full queue means the client is not keeping up and the send fails.
 */
public class WebSocketTransport implements ConnectionTransport {

    private final WebSocketSession session;
    private final Sinks.Many<String> outbound;
    private volatile boolean closed;

    public WebSocketTransport(WebSocketSession session, int bufferSize) {
        this.session = session;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    @Override
    public String id() {
        return session.getId();
    }

    /**
     * Frames to hand to {@link WebSocketSession#send}; completes when the transport closes.
     */
    public Flux<WebSocketMessage> outbound() {
        return outbound.asFlux().map(session::textMessage);
    }

    @Override
    public synchronized CompletableFuture<Void> send(String message) {
        if (closed) {
            return CompletableFuture.failedFuture(new TransportException("Connection " + id() + " is closed"));
        }
        Sinks.EmitResult result = outbound.tryEmitNext(message);
        if (result.isFailure()) {
            return CompletableFuture.failedFuture(
                    new TransportException("Connection " + id() + " rejected frame: " + result));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized void close(CloseReason reason) {
        if (closed) {
            return;
        }
        closed = true;
        session.close(new CloseStatus(reason.getCode(), reason.getReason())).subscribe();
        outbound.tryEmitComplete();
    }

    @Override
    public boolean isOpen() {
        return !closed && session.isOpen();
    }
}
