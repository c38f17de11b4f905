package com.example.contextsync.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional channel to one client, as seen by the rest of the server.
 * Inbound frames are delivered by the transport's owner; this interface only
 * covers the outbound side.
 */
public interface ConnectionTransport {

    String id();

    /**
     * Queues a text frame. The future fails with a
     * {@link com.example.contextsync.error.TransportException} when the frame
     * cannot be delivered.
     */
    CompletableFuture<Void> send(String message);

    void close(CloseReason reason);

    boolean isOpen();
}
