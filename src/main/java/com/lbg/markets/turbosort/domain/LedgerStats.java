package com.lbg.markets.turbosort.domain;

import java.util.Collection;

/**
 * Aggregate view over the ledger.
 */
public record LedgerStats(int totalFiles, long totalBytes) {

    public static LedgerStats of(Collection<DeliveryRecord> records) {
        long bytes = records.stream().mapToLong(DeliveryRecord::sizeBytes).sum();
        return new LedgerStats(records.size(), bytes);
    }

    public double totalMegabytes() {
        return Math.round(totalBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    }
}
