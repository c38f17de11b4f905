package com.example.contextsync.model;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only copy of the store taken at one point of its mutation history.
 * {@code version} grows by one with every committed mutation.
 */
@Value
public class ContextSnapshot {

    Map<String, ContextEntry> entries;
    long totalTokens;
    long maxTokens;
    long version;
    Instant takenAt;

    public ContextSnapshot(Map<String, ContextEntry> entries, long totalTokens, long maxTokens,
                           long version, Instant takenAt) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.totalTokens = totalTokens;
        this.maxTokens = maxTokens;
        this.version = version;
        this.takenAt = takenAt;
    }

    public int getEntryCount() {
        return entries.size();
    }

    public Map<String, Object> dataMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        entries.forEach((key, entry) -> data.put(key, entry.toMap()));
        return data;
    }

    public Map<String, Object> metadataMap() {
        return Map.of(
                "total_tokens", totalTokens,
                "max_tokens", maxTokens,
                "entry_count", getEntryCount()
        );
    }
}
