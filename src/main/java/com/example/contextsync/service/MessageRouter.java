package com.example.contextsync.service;

import com.example.contextsync.auth.AccessPolicy;
import com.example.contextsync.auth.Authenticator;
import com.example.contextsync.error.AuthenticationException;
import com.example.contextsync.error.AuthenticationException.Reason;
import com.example.contextsync.error.ContextServiceException;
import com.example.contextsync.error.ErrorType;
import com.example.contextsync.error.PermissionDeniedException;
import com.example.contextsync.error.ValidationException;
import com.example.contextsync.model.ClientPrincipal;
import com.example.contextsync.model.ContextEntry;
import com.example.contextsync.model.ContextSnapshot;
import com.example.contextsync.model.QueryFilter;
import com.example.contextsync.model.VerifiedCredential;
import com.example.contextsync.session.ClientSession;
import com.example.contextsync.session.SessionRegistry;
import com.example.contextsync.store.ContextStore;
import com.example.contextsync.store.MutationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Protocol boundary: parses one inbound frame, checks the connection state,
 * invokes the store and answers with a response envelope. Every failure is
 * turned into an {@code error} response here; none closes the connection.
 */
@Component
public class MessageRouter {

    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private final ContextStore contextStore;
    private final SessionRegistry sessionRegistry;
    private final Authenticator authenticator;
    private final AccessPolicy accessPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong keySequence = new AtomicLong();

    public MessageRouter(ContextStore contextStore, SessionRegistry sessionRegistry, Authenticator authenticator,
                         AccessPolicy accessPolicy, ObjectMapper objectMapper, Clock clock) {
        this.contextStore = contextStore;
        this.sessionRegistry = sessionRegistry;
        this.authenticator = authenticator;
        this.accessPolicy = accessPolicy;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Map<String, Object> route(ClientSession session, String rawMessage) {
        try {
            if (!session.isAuthenticated()) {
                throw new AuthenticationException(Reason.MISSING, "Client not authenticated");
            }
            sessionRegistry.touch(session);

            JsonNode message = parse(rawMessage);
            String type = requiredText(message, "type");
            logger.debug("Client {} sent {}", session.getClientId(), type);

            if (!"refresh_token".equals(type) && session.isCredentialExpired(clock.instant())) {
                throw new AuthenticationException(Reason.EXPIRED, "Authentication token expired, refresh required");
            }

            switch (type) {
                case "update_context":
                    return handleUpdateContext(session, message);
                case "get_context":
                    return handleGetContext();
                case "query_context":
                    return handleQueryContext(message);
                case "clear_context":
                    return handleClearContext(session, message);
                case "set_priority":
                    return handleSetPriority(message);
                case "refresh_token":
                    return handleRefreshToken(session, message);
                case "ping":
                    return response("pong");
                default:
                    throw new ValidationException("Unknown message type: " + type);
            }
        } catch (ContextServiceException e) {
            logger.debug("Request from client {} failed with {}: {}",
                    session.getClientId(), e.getErrorType(), e.getMessage());
            return ProtocolMessages.error(e.getErrorType(), e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling message from client {}", session.getClientId(), e);
            return ProtocolMessages.error(ErrorType.INTERNAL_ERROR, "Internal error", clock.instant());
        }
    }

    /**
     * First message on a freshly authenticated connection.
     */
    public Map<String, Object> authSuccess(ClientSession session) {
        Map<String, Object> message = response("auth_success");
        message.put("client_id", session.getClientId());
        message.put("user_id", session.getPrincipal().getUserId());
        message.put("role", session.getPrincipal().getRole());
        message.put("authenticated_at", session.getAuthenticatedAt().toString());
        message.put("server_info", Map.of(
                "version", "1.0.0",
                "max_tokens", contextStore.getMaxTokens(),
                "features", List.of("jwt_auth", "token_refresh", "context_management")
        ));
        return message;
    }

    private Map<String, Object> handleUpdateContext(ClientSession session, JsonNode message) {
        JsonNode context = message.get("context");
        if (context == null || !context.isObject()) {
            throw new ValidationException("'context' must be an object");
        }
        ClientPrincipal principal = session.getPrincipal();
        String source = optionalText(message, "source");
        if (source == null) {
            source = principal.getUserId() + "_" + session.getClientId();
        }
        Integer priority = optionalInt(message, "priority");
        String key = optionalText(message, "key");
        if (key == null) {
            key = source + "_" + clock.millis() + "_" + keySequence.incrementAndGet();
        }

        MutationResult result = contextStore.update(key, context, source, priority);
        logger.info("Context updated by user {} (client {}): key {}, {} evicted",
                principal.getUserId(), session.getClientId(), key, result.getRemovedKeys().size());

        Map<String, Object> response = response("context_updated");
        response.put("key", key);
        response.put("accepted", result.isAccepted());
        response.put("total_tokens", result.getTotalTokens());
        response.put("entry_count", result.getEntryCount());
        response.put("evicted", result.getRemovedKeys());
        return response;
    }

    private Map<String, Object> handleGetContext() {
        return ProtocolMessages.snapshot(ProtocolMessages.CONTEXT, contextStore.get(), clock.instant());
    }

    private Map<String, Object> handleQueryContext(JsonNode message) {
        JsonNode query = message.path("query");
        if (!query.isMissingNode() && !query.isNull() && !query.isObject()) {
            throw new ValidationException("'query' must be an object");
        }
        QueryFilter filter = QueryFilter.builder()
                .source(optionalText(query, "source"))
                .minPriority(optionalInt(query, "min_priority"))
                .build();

        Map<String, Object> data = new LinkedHashMap<>();
        for (ContextEntry entry : contextStore.query(filter).values()) {
            data.put(entry.getKey(), entry.toMap());
        }
        Map<String, Object> response = response("query_response");
        response.put("data", data);
        response.put("count", data.size());
        return response;
    }

    private Map<String, Object> handleClearContext(ClientSession session, JsonNode message) {
        ClientPrincipal principal = session.getPrincipal();
        List<String> keys = optionalTextList(message, "keys");
        String source = optionalText(message, "source");
        if (keys != null && source != null) {
            throw new ValidationException("Specify either 'keys' or 'source', not both");
        }

        MutationResult result;
        if (keys != null) {
            result = contextStore.clear(keys, entry -> accessPolicy.checkClearSource(principal, entry.getSource()));
        } else if (source != null) {
            accessPolicy.checkClearSource(principal, source);
            result = contextStore.clearSource(source);
        } else {
            accessPolicy.checkClearAll(principal);
            result = contextStore.clear(null);
        }
        logger.info("User {} cleared {} context entries", principal.getUserId(), result.getRemovedKeys().size());

        Map<String, Object> response = response("context_cleared");
        response.put("removed", result.getRemovedKeys().size());
        response.put("removed_keys", result.getRemovedKeys());
        response.put("total_tokens", result.getTotalTokens());
        response.put("entry_count", result.getEntryCount());
        return response;
    }

    private Map<String, Object> handleSetPriority(JsonNode message) {
        String key = requiredText(message, "key");
        Integer priority = optionalInt(message, "priority");
        if (priority == null) {
            throw new ValidationException("'priority' is required");
        }
        MutationResult result = contextStore.setPriority(key, priority);
        ContextSnapshot snapshot = result.getSnapshot();
        ContextEntry entry = snapshot.getEntries().get(key);

        Map<String, Object> response = response("priority_updated");
        response.put("key", key);
        response.put("priority", entry != null ? entry.getPriority() : ContextEntry.clampPriority(priority));
        response.put("total_tokens", result.getTotalTokens());
        response.put("entry_count", result.getEntryCount());
        return response;
    }

    private Map<String, Object> handleRefreshToken(ClientSession session, JsonNode message) {
        String token = requiredText(message, "token");
        VerifiedCredential credential = authenticator.authenticate(token);
        String currentUser = session.getPrincipal().getUserId();
        if (!currentUser.equals(credential.getPrincipal().getUserId())) {
            throw new PermissionDeniedException("Refreshed token belongs to a different user");
        }
        session.refreshCredential(credential);
        logger.info("Token refreshed for user {} (client {})", currentUser, session.getClientId());

        Map<String, Object> response = response("token_refreshed");
        response.put("success", true);
        response.put("expires_at", credential.getExpiresAt() == null ? null : credential.getExpiresAt().toString());
        return response;
    }

    private JsonNode parse(String rawMessage) {
        JsonNode message;
        try {
            message = objectMapper.readTree(rawMessage);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON: " + e.getOriginalMessage());
        }
        if (message == null || !message.isObject()) {
            throw new ValidationException("Message must be a JSON object");
        }
        return message;
    }

    private Map<String, Object> response(String type) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("type", type);
        response.put("timestamp", Instant.now(clock).toString());
        return response;
    }

    private static String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null || value.isBlank()) {
            throw new ValidationException("'" + field + "' is required");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ValidationException("'" + field + "' must be a string");
        }
        return value.asText();
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ValidationException("'" + field + "' must be an integer");
        }
        return value.intValue();
    }

    private static List<String> optionalTextList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new ValidationException("'" + field + "' must be an array of strings");
        }
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new ValidationException("'" + field + "' must be an array of strings");
            }
            items.add(item.asText());
        }
        return items;
    }
}
