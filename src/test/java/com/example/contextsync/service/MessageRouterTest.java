package com.example.contextsync.service;

import com.example.contextsync.auth.AccessPolicy;
import com.example.contextsync.auth.Authenticator;
import com.example.contextsync.config.ContextServiceProperties;
import com.example.contextsync.error.AuthenticationException;
import com.example.contextsync.model.ClientPrincipal;
import com.example.contextsync.model.ContextSnapshot;
import com.example.contextsync.model.VerifiedCredential;
import com.example.contextsync.session.ClientSession;
import com.example.contextsync.session.SessionRegistry;
import com.example.contextsync.store.ContextMutationListener;
import com.example.contextsync.store.ContextStore;
import com.example.contextsync.support.MutableClock;
import com.example.contextsync.support.RecordingTransport;
import com.example.contextsync.support.TestSessions;
import com.example.contextsync.tokens.SerializedSizeTokenEstimator;
import com.example.contextsync.tokens.TokenAccountant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageRouterTest {

    @Mock
    private Authenticator authenticator;

    @Mock
    private ContextMutationListener broadcastListener;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private ContextStore contextStore;
    private SessionRegistry sessionRegistry;
    private MessageRouter router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-01T08:00:00Z"));
        ContextServiceProperties properties = new ContextServiceProperties();
        contextStore = new ContextStore(10_000, new TokenAccountant(objectMapper, new SerializedSizeTokenEstimator(1)),
                clock, List.of(broadcastListener));
        sessionRegistry = new SessionRegistry(properties, clock);
        router = new MessageRouter(contextStore, sessionRegistry, authenticator, new AccessPolicy(properties),
                objectMapper, clock);
    }

    private ClientSession session(String clientId, String userId, String role) {
        ClientSession session = TestSessions.authenticated(clientId, userId, role, clock.instant());
        sessionRegistry.register(session);
        return session;
    }

    @Test
    void testUnauthenticatedUpdateIsRejectedWithoutSideEffects() {
        // Given
        ClientSession pending = new ClientSession("c0", new RecordingTransport("c0"), clock.instant());

        // When
        Map<String, Object> response = router.route(pending,
                "{\"type\":\"update_context\",\"context\":{\"x\":1},\"source\":\"agent\"}");

        // Then
        assertEquals("error", response.get("type"));
        assertEquals("authentication_error", response.get("error"));
        assertEquals(0, contextStore.get().getEntryCount());
        verify(broadcastListener, never()).onMutation(any());
    }

    @Test
    void testUpdateContext_StoresEntryAndBroadcastsOnce() {
        // Given
        ClientSession session = session("c1", "u1", "student");

        // When
        Map<String, Object> response = router.route(session,
                "{\"type\":\"update_context\",\"key\":\"lesson\",\"context\":{\"topic\":\"fractions\"},"
                        + "\"source\":\"quiz_agent\",\"priority\":7}");

        // Then
        assertEquals("context_updated", response.get("type"));
        assertEquals("lesson", response.get("key"));
        assertEquals(true, response.get("accepted"));
        assertEquals(1, response.get("entry_count"));
        ContextSnapshot snapshot = contextStore.get();
        assertEquals(snapshot.getTotalTokens(), response.get("total_tokens"));
        assertEquals(7, snapshot.getEntries().get("lesson").getPriority());
        assertEquals("quiz_agent", snapshot.getEntries().get("lesson").getSource());
        verify(broadcastListener, times(1)).onMutation(any());
    }

    @Test
    void testUpdateContext_DefaultsSourceAndGeneratesKey() {
        ClientSession session = session("c1", "u1", "student");

        Map<String, Object> response = router.route(session, "{\"type\":\"update_context\",\"context\":{\"a\":true}}");

        String key = (String) response.get("key");
        assertTrue(key.startsWith("u1_c1_"), key);
        assertEquals("u1_c1", contextStore.get().getEntries().get(key).getSource());
        assertEquals(1, contextStore.get().getEntries().get(key).getPriority());
    }

    @Test
    void testUpdateContext_RequiresObjectPayload() {
        ClientSession session = session("c1", "u1", "student");

        Map<String, Object> missing = router.route(session, "{\"type\":\"update_context\"}");
        Map<String, Object> scalar = router.route(session, "{\"type\":\"update_context\",\"context\":5}");
        Map<String, Object> badPriority = router.route(session,
                "{\"type\":\"update_context\",\"context\":{},\"priority\":\"high\"}");

        assertEquals("validation_error", missing.get("error"));
        assertEquals("validation_error", scalar.get("error"));
        assertEquals("validation_error", badPriority.get("error"));
        assertEquals(0, contextStore.get().getEntryCount());
        verify(broadcastListener, never()).onMutation(any());
    }

    @Test
    void testMalformedMessagesProduceValidationErrors() {
        ClientSession session = session("c1", "u1", "student");

        assertEquals("validation_error", router.route(session, "{not json").get("error"));
        assertEquals("validation_error", router.route(session, "[1,2]").get("error"));
        assertEquals("validation_error", router.route(session, "{\"no_type\":1}").get("error"));
        Map<String, Object> unknown = router.route(session, "{\"type\":\"teleport\"}");
        assertEquals("validation_error", unknown.get("error"));
        assertEquals("Unknown message type: teleport", unknown.get("message"));
        assertTrue(session.isAuthenticated());
    }

    @Test
    void testGetContext_ReturnsSnapshotWithMetadata() {
        ClientSession session = session("c1", "u1", "student");
        contextStore.update("k", Map.of("v", 1), "s", 2);

        Map<String, Object> response = router.route(session, "{\"type\":\"get_context\"}");

        assertEquals("context", response.get("type"));
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) response.get("data");
        assertEquals(Set.of("k"), data.keySet());
        @SuppressWarnings("unchecked")
        Map<String, Object> metadata = (Map<String, Object>) response.get("metadata");
        assertEquals(1, metadata.get("entry_count"));
        assertEquals(10_000L, metadata.get("max_tokens"));
        verify(broadcastListener, times(1)).onMutation(any());
    }

    @Test
    void testQueryContext_FiltersBySourceAndPriority() {
        ClientSession session = session("c1", "u1", "student");
        contextStore.update("a", Map.of("v", 1), "quiz", 2);
        contextStore.update("b", Map.of("v", 2), "quiz", 8);
        contextStore.update("c", Map.of("v", 3), "terrain", 9);

        Map<String, Object> response = router.route(session,
                "{\"type\":\"query_context\",\"query\":{\"source\":\"quiz\",\"min_priority\":5}}");

        assertEquals("query_response", response.get("type"));
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) response.get("data");
        assertEquals(Set.of("b"), data.keySet());
        assertEquals(1, response.get("count"));
    }

    @Test
    void testClearContext_WholeStoreNeedsElevatedRole() {
        // Given
        ClientSession student = session("c1", "u1", "student");
        ClientSession teacher = session("c2", "t1", "teacher");
        contextStore.update("a", Map.of("v", 1), "quiz", 2);
        clearInvocations(broadcastListener);

        // When
        Map<String, Object> denied = router.route(student, "{\"type\":\"clear_context\"}");

        // Then
        assertEquals("permission_denied", denied.get("error"));
        assertEquals(1, contextStore.get().getEntryCount());
        verify(broadcastListener, never()).onMutation(any());

        // When
        Map<String, Object> cleared = router.route(teacher, "{\"type\":\"clear_context\"}");

        // Then
        assertEquals("context_cleared", cleared.get("type"));
        assertEquals(1, cleared.get("removed"));
        assertEquals(0, contextStore.get().getEntryCount());
        verify(broadcastListener, times(1)).onMutation(any());
    }

    @Test
    void testClearContext_KeysMustBeOwnedByStudent() {
        ClientSession student = session("c1", "u1", "student");
        contextStore.update("mine", Map.of("v", 1), "u1_c1", 1);
        contextStore.update("theirs", Map.of("v", 1), "u2_c9", 1);

        Map<String, Object> denied = router.route(student,
                "{\"type\":\"clear_context\",\"keys\":[\"mine\",\"theirs\"]}");
        Map<String, Object> allowed = router.route(student, "{\"type\":\"clear_context\",\"keys\":[\"mine\"]}");

        assertEquals("permission_denied", denied.get("error"));
        assertEquals("context_cleared", allowed.get("type"));
        assertEquals(List.of("mine"), allowed.get("removed_keys"));
        assertEquals(Set.of("theirs"), contextStore.get().getEntries().keySet());
    }

    @Test
    void testClearContext_BySource() {
        ClientSession student = session("c1", "u1", "student");
        contextStore.update("a", Map.of("v", 1), "u1_c1", 1);
        contextStore.update("b", Map.of("v", 1), "u1_c1", 1);
        contextStore.update("c", Map.of("v", 1), "quiz_agent", 1);

        Map<String, Object> own = router.route(student, "{\"type\":\"clear_context\",\"source\":\"u1_c1\"}");
        Map<String, Object> foreign = router.route(student, "{\"type\":\"clear_context\",\"source\":\"quiz_agent\"}");
        Map<String, Object> both = router.route(student,
                "{\"type\":\"clear_context\",\"source\":\"u1_c1\",\"keys\":[\"a\"]}");

        assertEquals(2, own.get("removed"));
        assertEquals("permission_denied", foreign.get("error"));
        assertEquals("validation_error", both.get("error"));
        assertEquals(Set.of("c"), contextStore.get().getEntries().keySet());
    }

    @Test
    void testSetPriority() {
        ClientSession session = session("c1", "u1", "student");
        contextStore.update("a", Map.of("v", 1), "s", 1);
        clearInvocations(broadcastListener);

        Map<String, Object> updated = router.route(session, "{\"type\":\"set_priority\",\"key\":\"a\",\"priority\":15}");
        Map<String, Object> unknown = router.route(session, "{\"type\":\"set_priority\",\"key\":\"zz\",\"priority\":3}");
        Map<String, Object> missing = router.route(session, "{\"type\":\"set_priority\",\"key\":\"a\"}");

        assertEquals("priority_updated", updated.get("type"));
        assertEquals(10, updated.get("priority"));
        assertEquals("validation_error", unknown.get("error"));
        assertEquals("validation_error", missing.get("error"));
        verify(broadcastListener, times(1)).onMutation(any());
    }

    @Test
    void testRefreshToken_ExtendsCredential() {
        ClientSession session = session("c1", "u1", "student");
        Instant newExpiry = clock.instant().plus(Duration.ofHours(2));
        when(authenticator.authenticate("fresh")).thenReturn(new VerifiedCredential(
                new ClientPrincipal("u1", "student", Map.of()), newExpiry));

        Map<String, Object> response = router.route(session, "{\"type\":\"refresh_token\",\"token\":\"fresh\"}");

        assertEquals("token_refreshed", response.get("type"));
        assertEquals(true, response.get("success"));
        assertEquals(newExpiry.toString(), response.get("expires_at"));
        assertEquals(newExpiry, session.getCredentialExpiresAt());
    }

    @Test
    void testRefreshToken_DifferentUserIsDenied() {
        ClientSession session = session("c1", "u1", "student");
        when(authenticator.authenticate("someone-else")).thenReturn(new VerifiedCredential(
                new ClientPrincipal("u2", "admin", Map.of()), null));

        Map<String, Object> response = router.route(session, "{\"type\":\"refresh_token\",\"token\":\"someone-else\"}");

        assertEquals("permission_denied", response.get("error"));
        assertEquals("u1", session.getPrincipal().getUserId());
    }

    @Test
    void testRefreshToken_InvalidTokenFailsOnlyTheRequest() {
        ClientSession session = session("c1", "u1", "student");
        when(authenticator.authenticate("bad")).thenThrow(
                new AuthenticationException(AuthenticationException.Reason.INVALID, "Invalid authentication token"));

        Map<String, Object> response = router.route(session, "{\"type\":\"refresh_token\",\"token\":\"bad\"}");

        assertEquals("authentication_error", response.get("error"));
        assertTrue(session.isAuthenticated());
        assertTrue(sessionRegistry.find("c1").isPresent());
    }

    @Test
    void testExpiredCredential_BlocksEverythingButRefresh() {
        // Given
        RecordingTransport transport = new RecordingTransport("c1");
        ClientSession session = TestSessions.authenticated(transport, "u1", "student",
                clock.instant(), clock.instant().plusSeconds(60));
        sessionRegistry.register(session);
        clock.advance(Duration.ofMinutes(5));
        when(authenticator.authenticate("renewed")).thenReturn(new VerifiedCredential(
                new ClientPrincipal("u1", "student", Map.of()), clock.instant().plusSeconds(600)));

        // When
        Map<String, Object> blocked = router.route(session, "{\"type\":\"get_context\"}");
        Map<String, Object> refreshed = router.route(session, "{\"type\":\"refresh_token\",\"token\":\"renewed\"}");
        Map<String, Object> allowed = router.route(session, "{\"type\":\"get_context\"}");

        // Then
        assertEquals("authentication_error", blocked.get("error"));
        assertEquals("token_refreshed", refreshed.get("type"));
        assertEquals("context", allowed.get("type"));
    }

    @Test
    void testEveryMessageUpdatesActivity() {
        ClientSession session = session("c1", "u1", "student");
        clock.advance(Duration.ofMinutes(30));

        router.route(session, "{\"type\":\"ping\"}");

        assertEquals(clock.instant(), session.getLastActivity());
    }

    @Test
    void testAuthSuccessGreeting() {
        ClientSession session = session("c1", "u1", "teacher");

        Map<String, Object> greeting = router.authSuccess(session);

        assertEquals("auth_success", greeting.get("type"));
        assertEquals("c1", greeting.get("client_id"));
        assertEquals("u1", greeting.get("user_id"));
        assertEquals("teacher", greeting.get("role"));
    }
}
