package com.lbg.markets.turbosort.source;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * Minimal object storage operations the remote source relies on.
 */
public interface ObjectStore {

    /**
     * Every object under {@code prefix}, all pages included.
     */
    List<ObjectSummary> list(String prefix) throws IOException;

    /**
     * Objects directly under {@code prefix}: keys with no further {@code /} after it.
     */
    List<ObjectSummary> listChildren(String prefix) throws IOException;

    /**
     * Metadata of {@code key}, or empty if it does not exist.
     */
    Optional<ObjectSummary> head(String key) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException if {@code key} does not exist
     */
    InputStream open(String key) throws IOException;
}
