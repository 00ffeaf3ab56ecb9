package com.lbg.markets.turbosort.source;

/**
 * Listing or head metadata of a remote object.
 */
public record ObjectSummary(
        String key,
        long sizeBytes,
        long lastModifiedEpochMs,
        String eTag
) {
    public ObjectSummary {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be empty");
        }
        // S3 returns ETags quoted
        if (eTag != null && eTag.length() >= 2 && eTag.startsWith("\"") && eTag.endsWith("\"")) {
            eTag = eTag.substring(1, eTag.length() - 1);
        }
    }
}
