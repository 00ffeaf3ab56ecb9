package com.lbg.markets.turbosort.domain;

import java.util.List;

/**
 * Outcome of a full scan: reconciliation followed by every marker directory.
 */
public record ScanSummary(
        int directories,
        int pruned,
        int copied,
        int skipped,
        int vanished,
        int failed
) {
    public static ScanSummary of(int directories, int pruned, List<DeliveryResult> results) {
        return new ScanSummary(
                directories,
                pruned,
                count(results, DeliveryResult.Status.COPIED),
                count(results, DeliveryResult.Status.SKIPPED),
                count(results, DeliveryResult.Status.VANISHED),
                count(results, DeliveryResult.Status.FAILED)
        );
    }

    private static int count(List<DeliveryResult> results, DeliveryResult.Status status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }
}
