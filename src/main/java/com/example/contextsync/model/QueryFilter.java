package com.example.contextsync.model;

import lombok.Builder;
import lombok.Value;

/**
 * Conjunctive entry filter; a {@code null} field does not constrain.
 */
@Value
@Builder
public class QueryFilter {

    public static final QueryFilter ALL = QueryFilter.builder().build();

    String source;
    Integer minPriority;

    public boolean matches(ContextEntry entry) {
        if (source != null && !source.equals(entry.getSource())) {
            return false;
        }
        return minPriority == null || entry.getPriority() >= minPriority;
    }
}
