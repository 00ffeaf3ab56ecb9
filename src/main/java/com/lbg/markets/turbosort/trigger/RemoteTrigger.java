package com.lbg.markets.turbosort.trigger;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.orchestration.DeliveryEngine;
import com.lbg.markets.turbosort.source.ObjectStore;
import com.lbg.markets.turbosort.source.ObjectSummary;
import com.lbg.markets.turbosort.source.S3Source;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls a remote source by diffing successive full listings, with an independent
 * periodic full rescan as a safety net for missed diffs.
 */
@ApplicationScoped
public class RemoteTrigger implements Trigger {

    private static final Logger LOG = Logger.getLogger(RemoteTrigger.class);

    private final DeliveryEngine engine;
    private final S3Source source;
    private final Duration pollInterval;
    private final Duration rescanInterval;

    private Map<String, ObjectSummary> lastKnownListing = Map.of();
    private ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> rescanTask;

    @Inject
    public RemoteTrigger(TurbosortConfig config, DeliveryEngine engine, ObjectStore store) {
        this(engine, new S3Source(store, config), config.remote().pollInterval(), config.remote().rescanInterval());
    }

    public RemoteTrigger(DeliveryEngine engine, S3Source source, Duration pollInterval, Duration rescanInterval) {
        this.engine = engine;
        this.source = source;
        this.pollInterval = pollInterval;
        this.rescanInterval = rescanInterval;
    }

    @Override
    public void start(ScheduledExecutorService loop) {
        long poll = Math.max(1, pollInterval.toMillis());
        long rescan = Math.max(1, rescanInterval.toMillis());
        seedListing();
        pollTask = loop.scheduleWithFixedDelay(this::poll, poll, poll, TimeUnit.MILLISECONDS);
        rescanTask = loop.scheduleWithFixedDelay(this::rescan, rescan, rescan, TimeUnit.MILLISECONDS);
        LOG.infof("Polling s3 prefix '%s' every %s, full rescan every %s", source.prefix(), pollInterval, rescanInterval);
    }

    @Override
    public void stop() {
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        if (rescanTask != null) {
            rescanTask.cancel(false);
        }
    }

    /**
     * Take the current listing as the baseline. The startup scan has already examined every
     * object, so the first poll only reacts to what changes after it. A failed listing
     * leaves the baseline empty and the first poll re-examines everything.
     */
    void seedListing() {
        Map<String, ObjectSummary> current = new HashMap<>();
        try {
            for (ObjectSummary object : source.listAll()) {
                current.put(object.key(), object);
            }
        } catch (Exception e) {
            LOG.warnf("Failed to list s3 prefix '%s' at startup, the first poll will examine everything: %s",
                    source.prefix(), e.getMessage());
            return;
        }
        lastKnownListing = Map.copyOf(current);
    }

    /**
     * One poll tick. A failed listing leaves the last known listing untouched so the
     * next successful tick diffs against it.
     */
    void poll() {
        Map<String, ObjectSummary> current = new HashMap<>();
        try {
            List<ObjectSummary> listing = source.listAll();
            for (ObjectSummary object : listing) {
                current.put(object.key(), object);
            }
        } catch (Exception e) {
            LOG.errorf(e, "Failed to list s3 prefix '%s', skipping this poll", source.prefix());
            return;
        }

        ListingDiff diff = ListingDiff.between(lastKnownListing, current);
        if (!diff.isEmpty()) {
            LOG.debugf("Listing changed: %d new, %d modified, %d deleted",
                    diff.added().size(), diff.modified().size(), diff.deleted().size());
        }

        Set<String> locations = diff.locationsToProcess();
        for (String location : locations) {
            try {
                engine.processDirectory(location);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to process s3 prefix '%s'", location);
            }
        }
        lastKnownListing = Map.copyOf(current);
    }

    void rescan() {
        try {
            engine.fullScan();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Full rescan failed");
        }
    }

    Map<String, ObjectSummary> lastKnownListing() {
        return lastKnownListing;
    }
}
