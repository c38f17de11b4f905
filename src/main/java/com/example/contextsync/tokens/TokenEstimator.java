package com.example.contextsync.tokens;

/**
 * Converts a serialized payload into a token cost. Implementations must be
 * deterministic and monotonic in the payload size.
 */
public interface TokenEstimator {

    long estimate(byte[] serializedPayload);
}
