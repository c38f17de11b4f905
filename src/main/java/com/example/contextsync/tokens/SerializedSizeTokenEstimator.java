package com.example.contextsync.tokens;

/**
 * Charges one token per {@code bytesPerToken} bytes of serialized payload,
 * rounding up.
 */
public class SerializedSizeTokenEstimator implements TokenEstimator {

    private final int bytesPerToken;

    public SerializedSizeTokenEstimator(int bytesPerToken) {
        if (bytesPerToken < 1) {
            throw new IllegalArgumentException("bytesPerToken must be >= 1, was " + bytesPerToken);
        }
        this.bytesPerToken = bytesPerToken;
    }

    @Override
    public long estimate(byte[] serializedPayload) {
        long bytes = serializedPayload.length;
        return (bytes + bytesPerToken - 1) / bytesPerToken;
    }

    public int getBytesPerToken() {
        return bytesPerToken;
    }
}
