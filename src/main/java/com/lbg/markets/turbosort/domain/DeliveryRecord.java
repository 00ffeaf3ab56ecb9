package com.lbg.markets.turbosort.domain;

import java.time.Instant;

/**
 * Ledger record for a delivered source item. At most one exists per source key.
 */
public record DeliveryRecord(
        String sourceKey,
        String destinationPath,
        String identity,
        long sizeBytes,
        Instant deliveredAt
) {
    public DeliveryRecord {
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new IllegalArgumentException("sourceKey cannot be blank");
        }
        if (destinationPath == null || destinationPath.isBlank()) {
            throw new IllegalArgumentException("destinationPath cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }

    public boolean matches(String otherIdentity) {
        return identity != null && identity.equals(otherIdentity);
    }
}
