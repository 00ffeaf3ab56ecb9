package com.lbg.markets.turbosort.orchestration;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.destination.DestinationResolver;
import com.lbg.markets.turbosort.destination.InvalidDestinationException;
import com.lbg.markets.turbosort.domain.DeliveryRecord;
import com.lbg.markets.turbosort.domain.DeliveryResult;
import com.lbg.markets.turbosort.domain.MarkerDirective;
import com.lbg.markets.turbosort.domain.ResolvedTarget;
import com.lbg.markets.turbosort.domain.ScanSummary;
import com.lbg.markets.turbosort.domain.SourceItem;
import com.lbg.markets.turbosort.ledger.Ledger;
import com.lbg.markets.turbosort.sink.Sink;
import com.lbg.markets.turbosort.source.SourceProvider;
import com.lbg.markets.turbosort.util.ItemIdentity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers the items beside each marker into the marker's destination, at most once per
 * unchanged item. Handles the main flow: marker → resolve → identify → skip or copy → record.
 * Not thread-safe; callers serialize all invocations.
 */
@ApplicationScoped
public class DeliveryEngine {

    private static final Logger LOG = Logger.getLogger(DeliveryEngine.class);

    private final SourceProvider sourceProvider;
    private final DestinationResolver resolver;
    private final Sink sink;
    private final Ledger ledger;
    private final boolean forceRecopy;

    private final AtomicLong copied = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    @Inject
    public DeliveryEngine(TurbosortConfig config, SourceProvider sourceProvider, DestinationResolver resolver,
                          Sink sink, Ledger ledger) {
        this.sourceProvider = sourceProvider;
        this.resolver = resolver;
        this.sink = sink;
        this.ledger = ledger;
        this.forceRecopy = config.forceRecopy();
    }

    public SourceProvider sourceProvider() {
        return sourceProvider;
    }

    public Ledger ledger() {
        return ledger;
    }

    /**
     * Reconcile the ledger, then process every directory that currently holds a marker.
     */
    public ScanSummary fullScan() {
        LOG.info("Scanning for marker files...");
        int pruned = reconcile();

        List<String> locations;
        try {
            locations = sourceProvider.findMarkerLocations();
        } catch (IOException e) {
            LOG.errorf(e, "Failed to list marker locations");
            return ScanSummary.of(0, pruned, List.of());
        }

        List<DeliveryResult> results = new ArrayList<>();
        for (String location : locations) {
            results.addAll(processDirectory(location));
        }

        ScanSummary summary = ScanSummary.of(locations.size(), pruned, results);
        LOG.infof("Scan complete: %d marker directories, %d copied, %d skipped, %d vanished, %d failed, %d pruned",
                summary.directories(), summary.copied(), summary.skipped(), summary.vanished(),
                summary.failed(), summary.pruned());
        return summary;
    }

    /**
     * Remove ledger entries whose source item no longer exists. An item whose existence
     * cannot be determined is kept.
     *
     * @return number of entries removed
     */
    public int reconcile() {
        int removed = ledger.prune(this::stillExists);
        if (removed > 0) {
            LOG.infof("Pruned %d history entries for files no longer at the source", removed);
        }
        return removed;
    }

    private boolean stillExists(String sourceKey) {
        try {
            return sourceProvider.exists(sourceKey);
        } catch (IOException e) {
            LOG.warnf("Could not check %s, keeping its history: %s", sourceKey, e.getMessage());
            return true;
        }
    }

    /**
     * Deliver the items directly inside {@code location} according to its marker.
     * A location without a marker, or with an unusable one, is a no-op.
     */
    public List<DeliveryResult> processDirectory(String location) {
        Optional<MarkerDirective> directive = readDirective(location);
        if (directive.isEmpty()) {
            return List.of();
        }
        LOG.infof("Processing %s with destination path: %s", location, directive.get().destination());

        ResolvedTarget target;
        try {
            target = resolver.resolve(directive.get());
        } catch (InvalidDestinationException e) {
            LOG.errorf("Invalid target directory for %s: %s", location, e.getMessage());
            return List.of();
        }

        try {
            Files.createDirectories(target.directory());
        } catch (IOException e) {
            LOG.errorf(e, "Cannot create target directory %s", target.directory());
            return List.of();
        }

        List<SourceItem> candidates;
        try {
            candidates = sourceProvider.enumerateChildren(location);
        } catch (NoSuchFileException e) {
            LOG.warnf("Directory vanished before processing: %s", location);
            return List.of();
        } catch (IOException e) {
            LOG.errorf(e, "Failed to list %s", location);
            return List.of();
        }

        List<DeliveryResult> results = new ArrayList<>(candidates.size());
        for (SourceItem candidate : candidates) {
            DeliveryResult result = deliver(candidate, target);
            count(result);
            results.add(result);
        }
        return results;
    }

    private Optional<MarkerDirective> readDirective(String location) {
        Optional<String> content;
        try {
            content = sourceProvider.readMarker(location);
        } catch (IOException e) {
            LOG.warnf("Unreadable marker in %s: %s", location, e.getMessage());
            return Optional.empty();
        }
        if (content.isEmpty()) {
            return Optional.empty();
        }

        Optional<MarkerDirective> directive = MarkerDirective.parse(content.get());
        if (directive.isEmpty()) {
            LOG.warnf("Empty destination in marker at %s", location);
        }
        return directive;
    }

    private DeliveryResult deliver(SourceItem candidate, ResolvedTarget target) {
        Optional<SourceItem> current;
        try {
            current = sourceProvider.stat(candidate.sourceKey());
        } catch (IOException e) {
            LOG.errorf(e, "Failed to read attributes of %s", candidate.sourceKey());
            return DeliveryResult.failed(candidate.sourceKey(), e.getMessage());
        }
        if (current.isEmpty()) {
            LOG.warnf("File vanished before it could be copied: %s", candidate.sourceKey());
            return DeliveryResult.vanished(candidate.sourceKey());
        }

        SourceItem item = current.get();
        String identity = ItemIdentity.of(item);

        if (!forceRecopy && ledger.shouldSkip(item.sourceKey(), identity)) {
            LOG.debugf("Skipping already copied file: %s", item.sourceKey());
            return DeliveryResult.skipped(item.sourceKey(), "Already copied");
        }

        Path destination = target.resolve(item.name());
        try {
            long bytesWritten = transfer(item, destination);

            ledger.put(new DeliveryRecord(
                    item.sourceKey(),
                    destination.toString(),
                    identity,
                    item.sizeBytes(),
                    Instant.now()
            ));

            LOG.infof("Copied: %s → %s (%d bytes)", item.name(), target.directory(), bytesWritten);
            return DeliveryResult.copied(item.sourceKey(), destination.toString(), bytesWritten);

        } catch (NoSuchFileException e) {
            LOG.warnf("File vanished while copying: %s", item.sourceKey());
            return DeliveryResult.vanished(item.sourceKey());
        } catch (IOException e) {
            LOG.errorf(e, "Failed to copy %s to %s", item.sourceKey(), destination);
            return DeliveryResult.failed(item.sourceKey(), e.getMessage());
        }
    }

    private long transfer(SourceItem item, Path destination) throws IOException {
        try (InputStream in = sourceProvider.open(item)) {
            return sink.write(destination, in, item.mtimeEpochMs());
        }
    }

    private void count(DeliveryResult result) {
        switch (result.status()) {
            case COPIED -> copied.incrementAndGet();
            case SKIPPED -> skipped.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
            default -> {
                // vanished items are not counted
            }
        }
    }

    public long copiedThisSession() {
        return copied.get();
    }

    public long skippedThisSession() {
        return skipped.get();
    }

    public long failedThisSession() {
        return failed.get();
    }
}
