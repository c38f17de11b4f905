package com.example.contextsync.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One key-addressed unit of context. Instances are immutable; a write to an
 * existing key replaces the whole entry.
 */
@Value
@Builder(toBuilder = true)
public class ContextEntry {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 1;

    String key;
    JsonNode payload;
    long tokenCount;
    String source;
    int priority;
    Instant timestamp;

    /** Store-assigned write order; breaks ties between equal timestamps. */
    long sequence;

    public static int clampPriority(Integer requested) {
        if (requested == null) {
            return DEFAULT_PRIORITY;
        }
        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, requested));
    }

    /**
     * @return a copy of the payload; the stored tree is never handed out
     */
    public JsonNode getPayload() {
        return payload == null ? null : payload.deepCopy();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("key", key);
        map.put("content", getPayload());
        map.put("tokens", tokenCount);
        map.put("source", source);
        map.put("priority", priority);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
