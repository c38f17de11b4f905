package com.example.contextsync.tokens;

import com.example.contextsync.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Assigns token costs to payloads. The same instance is used for the whole
 * lifetime of a store so eviction comparisons stay stable.
 */
public class TokenAccountant {

    private final ObjectMapper objectMapper;
    private final TokenEstimator estimator;

    public TokenAccountant(ObjectMapper objectMapper, TokenEstimator estimator) {
        this.objectMapper = objectMapper;
        this.estimator = estimator;
    }

    public long estimate(JsonNode payload) {
        if (payload == null || payload.isMissingNode()) {
            return 0L;
        }
        return estimator.estimate(serialize(payload));
    }

    /**
     * Converts a producer-supplied value into the opaque payload form.
     *
     * @throws ValidationException if the value cannot be serialized
     */
    public JsonNode toPayload(Object value) {
        if (value == null) {
            throw new ValidationException("Context payload is required");
        }
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Context payload is not serializable: " + e.getMessage(), e);
        }
    }

    private byte[] serialize(JsonNode payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Context payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
