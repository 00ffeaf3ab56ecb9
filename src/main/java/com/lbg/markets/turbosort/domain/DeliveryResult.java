package com.lbg.markets.turbosort.domain;

/**
 * Result of considering a single source item during a directory pass.
 */
public record DeliveryResult(
        String sourceKey,
        String destPath,
        long bytesTransferred,
        Status status,
        String message
) {
    public enum Status {
        COPIED,
        SKIPPED,
        VANISHED,
        FAILED
    }

    public static DeliveryResult copied(String sourceKey, String destPath, long bytes) {
        return new DeliveryResult(sourceKey, destPath, bytes, Status.COPIED, null);
    }

    public static DeliveryResult skipped(String sourceKey, String reason) {
        return new DeliveryResult(sourceKey, null, 0, Status.SKIPPED, reason);
    }

    public static DeliveryResult vanished(String sourceKey) {
        return new DeliveryResult(sourceKey, null, 0, Status.VANISHED, "No longer exists at source");
    }

    public static DeliveryResult failed(String sourceKey, String error) {
        return new DeliveryResult(sourceKey, null, 0, Status.FAILED, error);
    }
}
