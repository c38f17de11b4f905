package com.example.contextsync.service;

import com.example.contextsync.config.ContextServiceProperties;
import com.example.contextsync.model.ContextSnapshot;
import com.example.contextsync.session.ClientSession;
import com.example.contextsync.session.SessionRegistry;
import com.example.contextsync.store.ContextStore;
import com.example.contextsync.support.MutableClock;
import com.example.contextsync.support.RecordingTransport;
import com.example.contextsync.support.TestSessions;
import com.example.contextsync.tokens.SerializedSizeTokenEstimator;
import com.example.contextsync.tokens.TokenAccountant;
import com.example.contextsync.transport.CloseReason;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private SessionRegistry sessionRegistry;
    private ExecutorService executor;
    private BroadcastEngine broadcastEngine;
    private ContextStore contextStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-01T08:00:00Z"));
        ContextServiceProperties properties = new ContextServiceProperties();
        properties.getBroadcast().setSendTimeout(Duration.ofMillis(200));
        sessionRegistry = new SessionRegistry(properties, clock);
        executor = Executors.newFixedThreadPool(4);
        broadcastEngine = new BroadcastEngine(sessionRegistry, objectMapper, executor, clock, properties);
        // the engine is driven explicitly so each test controls which cycles run
        contextStore = new ContextStore(10_000, new TokenAccountant(objectMapper, new SerializedSizeTokenEstimator(1)),
                clock, List.of());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RecordingTransport connect(RecordingTransport transport, String userId) {
        sessionRegistry.register(TestSessions.authenticated(transport, userId, "student", clock.instant(), null));
        return transport;
    }

    @Test
    void testBroadcast_DeliversSnapshotMatchingStoreToEverySession() throws Exception {
        // Given
        RecordingTransport first = connect(new RecordingTransport("c1"), "u1");
        RecordingTransport second = connect(new RecordingTransport("c2"), "u2");
        contextStore.update("lesson", Map.of("topic", "fractions"), "quiz", 4);
        ContextSnapshot snapshot = contextStore.update("hint", Map.of("text", "common denominator"), "quiz", 2)
                .getSnapshot();

        // When
        BroadcastReport report = broadcastEngine.broadcast(snapshot).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(2, report.getRecipients());
        assertEquals(2, report.getDelivered());
        assertEquals(0, report.getFailed());
        for (RecordingTransport transport : List.of(first, second)) {
            assertEquals(1, transport.getFrames().size());
            JsonNode frame = objectMapper.readTree(transport.getFrames().get(0));
            assertEquals("context_update", frame.get("type").asText());
            assertEquals(contextStore.get().getTotalTokens(), frame.path("metadata").path("total_tokens").asLong());
            assertEquals(2, frame.path("metadata").path("entry_count").asInt());
            assertEquals(10_000L, frame.path("metadata").path("max_tokens").asLong());
            assertEquals("fractions", frame.path("data").path("lesson").path("content").path("topic").asText());
            assertEquals(4, frame.path("data").path("lesson").path("priority").asInt());
        }
    }

    @Test
    void testBroadcast_FailedRecipientIsRemovedOthersStillDelivered() throws Exception {
        // Given
        RecordingTransport healthy = connect(new RecordingTransport("c1"), "u1");
        RecordingTransport broken = connect(new RecordingTransport("c2").failingSends(), "u2");
        ContextSnapshot snapshot = contextStore.update("k", Map.of("v", 1), "s", 1).getSnapshot();

        // When
        BroadcastReport report = broadcastEngine.broadcast(snapshot).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(1, report.getDelivered());
        assertEquals(1, report.getFailed());
        assertEquals(1, healthy.getFrames().size());
        assertEquals(CloseReason.SEND_FAILED, broken.getCloseReason());
        assertTrue(sessionRegistry.find("c2").isEmpty());
        assertTrue(sessionRegistry.find("c1").isPresent());
    }

    @Test
    void testBroadcast_SlowRecipientTimesOutWithoutDelayingOthers() throws Exception {
        // Given
        RecordingTransport healthy = connect(new RecordingTransport("c1"), "u1");
        RecordingTransport stalled = connect(new RecordingTransport("c2").blockingSends(), "u2");
        ContextSnapshot snapshot = contextStore.update("k", Map.of("v", 1), "s", 1).getSnapshot();

        try {
            // When
            long started = System.nanoTime();
            BroadcastReport report = broadcastEngine.broadcast(snapshot).get(5, TimeUnit.SECONDS);
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            // Then
            assertEquals(1, report.getDelivered());
            assertEquals(1, report.getFailed());
            assertTrue(elapsedMillis < 4_000, "broadcast waited " + elapsedMillis + "ms");
            assertEquals(1, healthy.getFrames().size());
            assertEquals(CloseReason.SEND_FAILED, stalled.getCloseReason());
            assertTrue(sessionRegistry.find("c2").isEmpty());
        } finally {
            stalled.releaseBlockedSends();
        }
    }

    @Test
    void testBroadcast_OlderVersionIsSuperseded() throws Exception {
        // Given
        RecordingTransport transport = connect(new RecordingTransport("c1"), "u1");
        ContextSnapshot older = contextStore.update("a", Map.of("v", 1), "s", 1).getSnapshot();
        ContextSnapshot newer = contextStore.update("b", Map.of("v", 2), "s", 1).getSnapshot();

        // When
        BroadcastReport newerReport = broadcastEngine.broadcast(newer).get(5, TimeUnit.SECONDS);
        BroadcastReport olderReport = broadcastEngine.broadcast(older).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(1, newerReport.getDelivered());
        assertTrue(olderReport.isSuperseded());
        assertEquals(1, transport.getFrames().size());
        assertEquals(2, objectMapper.readTree(transport.getFrames().get(0)).path("metadata").path("entry_count").asInt());
    }

    @Test
    void testBroadcast_SessionNeverReceivesOlderVersionThanDelivered() throws Exception {
        // Given
        RecordingTransport transport = connect(new RecordingTransport("c1"), "u1");
        ClientSession session = sessionRegistry.find("c1").orElseThrow();
        session.deliverSnapshot(7, "{\"type\":\"context\"}").get(1, TimeUnit.SECONDS);
        ContextSnapshot stale = new ContextSnapshot(Map.of(), 0, 10_000, 5, clock.instant());

        // When
        BroadcastReport report = broadcastEngine.broadcast(stale).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(0, report.getDelivered());
        assertEquals(1, report.getSkipped());
        assertEquals(1, transport.getFrames().size());
        assertEquals(7, session.getLastDeliveredVersion());
    }

    @Test
    void testBroadcast_IdleSweptSessionReceivesNothing() throws Exception {
        // Given
        RecordingTransport idle = connect(new RecordingTransport("c1"), "u1");
        clock.advance(Duration.ofHours(25));
        RecordingTransport active = connect(new RecordingTransport("c2"), "u2");
        sessionRegistry.sweepIdle(clock.instant());
        ContextSnapshot snapshot = contextStore.update("k", Map.of("v", 1), "s", 1).getSnapshot();

        // When
        BroadcastReport report = broadcastEngine.broadcast(snapshot).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(1, report.getRecipients());
        assertEquals(CloseReason.IDLE_TIMEOUT, idle.getCloseReason());
        assertTrue(idle.getFrames().isEmpty());
        assertEquals(1, active.getFrames().size());
    }

    @Test
    void testBroadcast_NoSessionsCompletesImmediately() throws Exception {
        ContextSnapshot snapshot = contextStore.update("k", Map.of("v", 1), "s", 1).getSnapshot();

        BroadcastReport report = broadcastEngine.broadcast(snapshot).get(1, TimeUnit.SECONDS);

        assertEquals(0, report.getRecipients());
        assertFalse(report.isSuperseded());
    }

    @Test
    void testOnMutation_WiredAsStoreListenerBroadcastsEveryMutation() throws Exception {
        // Given
        RecordingTransport transport = connect(new RecordingTransport("c1"), "u1");
        ContextStore wired = new ContextStore(10_000,
                new TokenAccountant(objectMapper, new SerializedSizeTokenEstimator(1)), clock, List.of(broadcastEngine));

        // When
        wired.update("k", Map.of("v", 1), "s", 1);

        // Then
        long deadline = System.currentTimeMillis() + 5_000;
        while (transport.getFrames().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, transport.getFrames().size());
    }
}
