package com.lbg.markets.turbosort.source;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.domain.SourceItem;
import com.lbg.markets.turbosort.domain.SourceKind;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Source provider for a local directory tree.
 * Locations and source keys are absolute paths.
 */
public class LocalFsSource implements SourceProvider {

    private static final Logger LOG = Logger.getLogger(LocalFsSource.class);

    private final Path root;
    private final String markerName;

    public LocalFsSource(TurbosortConfig config) {
        this(Paths.get(config.source().path()), config.markerName());
    }

    public LocalFsSource(Path root, String markerName) {
        this.root = root.toAbsolutePath().normalize();
        this.markerName = markerName;
    }

    public Path root() {
        return root;
    }

    public String markerName() {
        return markerName;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.LOCAL;
    }

    @Override
    public void prepare() throws IOException {
        Files.createDirectories(root);
    }

    @Override
    public List<String> findMarkerLocations() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Source path does not exist: " + root);
        }
        return markerDirectories(root, markerName).stream()
                .map(Path::toString)
                .toList();
    }

    /**
     * Walks {@code start} breadth-first with an explicit work queue and returns every
     * directory that holds a marker. Directories that vanish or cannot be read are skipped.
     */
    public static List<Path> markerDirectories(Path start, String markerName) {
        List<Path> found = new ArrayList<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.add(start);

        while (!pending.isEmpty()) {
            Path dir = pending.poll();
            if (Files.isRegularFile(dir.resolve(markerName))) {
                found.add(dir);
            }
            try (DirectoryStream<Path> children = Files.newDirectoryStream(dir)) {
                for (Path child : children) {
                    if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                        pending.add(child);
                    }
                }
            } catch (NoSuchFileException | NotDirectoryException e) {
                LOG.debugf("Directory vanished during scan: %s", dir);
            } catch (AccessDeniedException e) {
                LOG.warnf("Cannot read directory %s, skipping", dir);
            } catch (IOException e) {
                LOG.errorf(e, "Failed to list directory %s", dir);
            }
        }
        return found;
    }

    /**
     * The nearest directory between {@code path}'s parent and the root (inclusive)
     * that holds a marker.
     */
    public Optional<Path> nearestMarkerDirectory(Path path) {
        Path dir = path.toAbsolutePath().normalize().getParent();
        while (dir != null && dir.startsWith(root)) {
            if (Files.isRegularFile(dir.resolve(markerName))) {
                return Optional.of(dir);
            }
            dir = dir.getParent();
        }
        return Optional.empty();
    }

    public boolean isMarker(Path path) {
        return path.getFileName() != null && markerName.equals(path.getFileName().toString());
    }

    @Override
    public Optional<String> readMarker(String location) throws IOException {
        Path marker = Paths.get(location).resolve(markerName);
        if (!Files.isRegularFile(marker)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(marker, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<SourceItem> enumerateChildren(String location) throws IOException {
        List<SourceItem> items = new ArrayList<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(Paths.get(location))) {
            for (Path child : children) {
                if (isMarker(child)) {
                    continue;
                }
                toItem(child).ifPresent(items::add);
            }
        }
        items.sort(Comparator.comparing(SourceItem::name));
        return items;
    }

    @Override
    public Optional<SourceItem> stat(String sourceKey) throws IOException {
        return toItem(Paths.get(sourceKey));
    }

    @Override
    public InputStream open(SourceItem item) throws IOException {
        return Files.newInputStream(Paths.get(item.sourceKey()));
    }

    @Override
    public boolean exists(String sourceKey) {
        return Files.isRegularFile(Paths.get(sourceKey));
    }

    private Optional<SourceItem> toItem(Path file) throws IOException {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        if (!attrs.isRegularFile()) {
            return Optional.empty();
        }
        Path absolute = file.toAbsolutePath().normalize();
        return Optional.of(SourceItem.local(
                absolute.toString(),
                absolute.getFileName().toString(),
                attrs.size(),
                attrs.lastModifiedTime().toMillis()
        ));
    }
}
