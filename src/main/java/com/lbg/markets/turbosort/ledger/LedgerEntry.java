package com.lbg.markets.turbosort.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.lbg.markets.turbosort.domain.DeliveryRecord;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Persisted shape of one ledger entry; the source key is the enclosing map key.
 * {@code identity} is absent in history files written before identities were recorded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerEntry(
        String destination,
        String timestamp,
        long size,
        String identity
) {

    public static LedgerEntry from(DeliveryRecord record) {
        return new LedgerEntry(
                record.destinationPath(),
                record.deliveredAt().toString(),
                record.sizeBytes(),
                record.identity()
        );
    }

    public DeliveryRecord toRecord(String sourceKey) {
        return new DeliveryRecord(sourceKey, destination, identity, size, parseTimestamp(timestamp));
    }

    static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            // Older history files carry local time without an offset
            return LocalDateTime.parse(timestamp).atZone(ZoneId.systemDefault()).toInstant();
        }
    }
}
