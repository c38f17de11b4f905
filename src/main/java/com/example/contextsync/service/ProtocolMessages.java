package com.example.contextsync.service;

import com.example.contextsync.error.ErrorType;
import com.example.contextsync.model.ContextSnapshot;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound message envelopes shared by the router and the broadcast engine.
 */
public final class ProtocolMessages {

    public static final String CONTEXT = "context";
    public static final String CONTEXT_UPDATE = "context_update";
    public static final String ERROR = "error";

    private ProtocolMessages() {
    }

    public static Map<String, Object> snapshot(String type, ContextSnapshot snapshot, Instant now) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("data", snapshot.dataMap());
        message.put("metadata", snapshot.metadataMap());
        message.put("timestamp", now.toString());
        return message;
    }

    public static Map<String, Object> error(ErrorType errorType, String detail, Instant now) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", ERROR);
        message.put("error", errorType.wireName());
        message.put("message", detail);
        message.put("timestamp", now.toString());
        return message;
    }
}
