package com.lbg.markets.turbosort.domain;

/**
 * Describes a deliverable item found beside a marker, before any ledger lookup.
 * For local sources the key is the absolute path and there is no content tag;
 * for remote sources the key is the object key and the tag is its ETag.
 */
public record SourceItem(
        String sourceKey,
        String name,
        long sizeBytes,
        long mtimeEpochMs,
        String contentTag
) {
    public SourceItem {
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new IllegalArgumentException("sourceKey cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }

    public static SourceItem local(String absolutePath, String name, long sizeBytes, long mtimeEpochMs) {
        return new SourceItem(absolutePath, name, sizeBytes, mtimeEpochMs, null);
    }

    public static SourceItem remote(String key, String name, long sizeBytes, long mtimeEpochMs, String eTag) {
        return new SourceItem(key, name, sizeBytes, mtimeEpochMs, eTag);
    }

    public boolean hasContentTag() {
        return contentTag != null && !contentTag.isBlank();
    }
}
