package com.lbg.markets.turbosort.domain;

import java.nio.file.Path;

/**
 * Concrete destination directory for one directory pass. Never persisted.
 *
 * @param directory absolute, normalized target directory
 * @param year      the year used as prefix, or {@code null} when no prefix was applied
 */
public record ResolvedTarget(Path directory, String year) {

    public ResolvedTarget {
        if (directory == null || !directory.isAbsolute()) {
            throw new IllegalArgumentException("directory must be absolute");
        }
    }

    public Path resolve(String itemName) {
        return directory.resolve(itemName);
    }
}
