package com.lbg.markets.turbosort.source;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.domain.SourceItem;
import com.lbg.markets.turbosort.domain.SourceKind;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Source provider for an object storage bucket.
 * A location is a key prefix without trailing slash ({@code ""} for the bucket root);
 * source keys are object keys.
 */
public class S3Source implements SourceProvider {

    private static final int MAX_MARKER_BYTES = 64 * 1024;

    private final ObjectStore store;
    private final String prefix;
    private final String markerName;

    public S3Source(ObjectStore store, TurbosortConfig config) {
        this(store, config.source().s3().prefix().orElse(""), config.markerName());
    }

    public S3Source(ObjectStore store, String prefix, String markerName) {
        this.store = store;
        this.prefix = prefix == null ? "" : prefix;
        this.markerName = markerName;
    }

    public String prefix() {
        return prefix;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.S3;
    }

    /**
     * Full listing under the configured prefix.
     */
    public List<ObjectSummary> listAll() throws IOException {
        return store.list(prefix);
    }

    @Override
    public List<String> findMarkerLocations() throws IOException {
        return listAll().stream()
                .map(ObjectSummary::key)
                .filter(this::isMarker)
                .map(S3Source::parentOf)
                .distinct()
                .sorted()
                .toList();
    }

    @Override
    public Optional<String> readMarker(String location) throws IOException {
        try (InputStream in = store.open(childKey(location, markerName))) {
            byte[] content = in.readNBytes(MAX_MARKER_BYTES);
            return Optional.of(new String(content, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<SourceItem> enumerateChildren(String location) throws IOException {
        String childPrefix = location.isEmpty() ? prefix : location + "/";
        return store.listChildren(childPrefix).stream()
                .filter(object -> !object.key().endsWith("/"))
                .filter(object -> parentOf(object.key()).equals(location))
                .filter(object -> !isMarker(object.key()))
                .map(S3Source::toItem)
                .sorted(Comparator.comparing(SourceItem::name))
                .toList();
    }

    @Override
    public Optional<SourceItem> stat(String sourceKey) throws IOException {
        return store.head(sourceKey).map(S3Source::toItem);
    }

    @Override
    public InputStream open(SourceItem item) throws IOException {
        return store.open(item.sourceKey());
    }

    @Override
    public boolean exists(String sourceKey) throws IOException {
        return store.head(sourceKey).isPresent();
    }

    public boolean isMarker(String key) {
        return markerName.equals(nameOf(key));
    }

    /**
     * The prefix a key lives directly under, without trailing slash.
     */
    public static String parentOf(String key) {
        int lastSep = key.lastIndexOf('/');
        return lastSep >= 0 ? key.substring(0, lastSep) : "";
    }

    public static String nameOf(String key) {
        int lastSep = key.lastIndexOf('/');
        return lastSep >= 0 ? key.substring(lastSep + 1) : key;
    }

    static String childKey(String location, String name) {
        return location.isEmpty() ? name : location + "/" + name;
    }

    private static SourceItem toItem(ObjectSummary object) {
        return SourceItem.remote(
                object.key(),
                nameOf(object.key()),
                object.sizeBytes(),
                object.lastModifiedEpochMs(),
                object.eTag()
        );
    }
}
