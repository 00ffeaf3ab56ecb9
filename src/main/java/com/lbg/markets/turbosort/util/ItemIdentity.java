package com.lbg.markets.turbosort.util;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.lbg.markets.turbosort.domain.SourceItem;

import java.nio.charset.StandardCharsets;

/**
 * Utility for generating stable item identities.
 * Local files are identified by (path, size, mtime), remote objects by (key, ETag).
 * This is a change detector, so a fast 64-bit fingerprint is enough.
 */
public final class ItemIdentity {

    private static final HashFunction FINGERPRINT = Hashing.farmHashFingerprint64();

    private ItemIdentity() {
        // Utility class
    }

    /**
     * Generate the identity of an item as it was last observed.
     */
    public static String of(SourceItem item) {
        if (item.hasContentTag()) {
            return forObject(item.sourceKey(), item.contentTag());
        }
        return forFile(item.sourceKey(), item.sizeBytes(), item.mtimeEpochMs());
    }

    public static String forFile(String absolutePath, long sizeBytes, long mtimeEpochMs) {
        return fingerprint(absolutePath + ":" + sizeBytes + ":" + mtimeEpochMs);
    }

    public static String forObject(String key, String eTag) {
        return fingerprint(key + ":" + eTag);
    }

    private static String fingerprint(String identity) {
        return FINGERPRINT.hashString(identity, StandardCharsets.UTF_8).toString();
    }
}
