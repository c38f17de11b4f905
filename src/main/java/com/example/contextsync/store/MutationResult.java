package com.example.contextsync.store;

import com.example.contextsync.model.ContextSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MutationResult {

    /** Key written or re-prioritized; null for clears. */
    String key;

    boolean accepted;

    long totalTokens;

    int entryCount;

    /** Keys dropped by this mutation, whether cleared or evicted. */
    List<String> removedKeys;

    ContextSnapshot snapshot;

    public long getVersion() {
        return snapshot.getVersion();
    }
}
