package com.lbg.markets.turbosort.source;

import com.lbg.markets.turbosort.domain.SourceItem;
import com.lbg.markets.turbosort.domain.SourceKind;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * A place markers and deliverable items are read from.
 * A location is a directory (local) or key prefix (remote) that may hold a marker.
 */
public interface SourceProvider {

    SourceKind kind();

    /**
     * Create whatever must exist before the source can be scanned.
     */
    default void prepare() throws IOException {
    }

    /**
     * Every location under the source root that currently holds a marker.
     */
    List<String> findMarkerLocations() throws IOException;

    /**
     * Raw content of the marker directly inside {@code location}, if there is one.
     */
    Optional<String> readMarker(String location) throws IOException;

    /**
     * Items directly inside {@code location}, excluding the marker itself. Not recursive.
     */
    List<SourceItem> enumerateChildren(String location) throws IOException;

    /**
     * Current state of an item, or empty if it no longer exists.
     */
    Optional<SourceItem> stat(String sourceKey) throws IOException;

    InputStream open(SourceItem item) throws IOException;

    boolean exists(String sourceKey) throws IOException;
}
