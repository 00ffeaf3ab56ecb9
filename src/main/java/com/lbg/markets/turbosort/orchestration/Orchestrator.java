package com.lbg.markets.turbosort.orchestration;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.destination.DestinationResolver;
import com.lbg.markets.turbosort.domain.LedgerStats;
import com.lbg.markets.turbosort.domain.ScanSummary;
import com.lbg.markets.turbosort.domain.SourceKind;
import com.lbg.markets.turbosort.trigger.LocalTrigger;
import com.lbg.markets.turbosort.trigger.RemoteTrigger;
import com.lbg.markets.turbosort.trigger.Trigger;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.event.Reception;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single event loop: the startup scan, the trigger for the configured source kind,
 * and periodic statistics all run on one thread, so delivery passes never overlap.
 */
@ApplicationScoped
public class Orchestrator {

    private static final Logger LOG = Logger.getLogger(Orchestrator.class);

    private final TurbosortConfig config;
    private final DeliveryEngine engine;
    private final DestinationResolver resolver;
    private final Instance<LocalTrigger> localTrigger;
    private final Instance<RemoteTrigger> remoteTrigger;

    private ScheduledExecutorService loop;
    private Trigger trigger;

    @Inject
    public Orchestrator(TurbosortConfig config, DeliveryEngine engine, DestinationResolver resolver,
                        Instance<LocalTrigger> localTrigger, Instance<RemoteTrigger> remoteTrigger) {
        this.config = config;
        this.engine = engine;
        this.resolver = resolver;
        this.localTrigger = localTrigger;
        this.remoteTrigger = remoteTrigger;
    }

    /**
     * Make sure the source and destination roots exist.
     */
    public void prepare() throws IOException {
        engine.sourceProvider().prepare();
        Files.createDirectories(resolver.root());
        LOG.infof("Files will be sorted to %s", resolver.root());
        if (config.destination().yearPrefix()) {
            LOG.info("Year prefix feature is enabled");
        }
    }

    /**
     * One full scan on the calling thread.
     */
    public ScanSummary scanOnce() throws IOException {
        prepare();
        ScanSummary summary = engine.fullScan();
        logStats();
        return summary;
    }

    /**
     * Start the loop and block until the application is asked to exit.
     */
    public void runUntilStopped() throws IOException {
        start();
        LOG.info("TurboSort running. Press Ctrl+C to stop.");
        Quarkus.waitForExit();
    }

    public synchronized void start() throws IOException {
        if (loop != null) {
            throw new IllegalStateException("Already started");
        }
        prepare();

        loop = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "turbosort-loop");
            thread.setDaemon(true);
            return thread;
        });

        try {
            loop.submit(() -> {
                engine.fullScan();
                logStats();
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during initial scan", e);
        } catch (ExecutionException e) {
            LOG.errorf(e.getCause(), "Initial scan failed");
        }

        trigger = config.source().kind() == SourceKind.S3 ? remoteTrigger.get() : localTrigger.get();
        try {
            trigger.start(loop);
        } catch (IOException e) {
            LOG.errorf(e, "Failed to start watching the source");
            stop();
            throw e;
        }

        long stats = Math.max(1, config.statsInterval().toMillis());
        loop.scheduleWithFixedDelay(this::logStats, stats, stats, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (loop == null) {
            return;
        }
        LOG.info("Stopping TurboSort...");
        if (trigger != null) {
            trigger.stop();
            trigger = null;
        }
        loop.shutdown();
        try {
            if (!loop.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Delivery loop did not finish within 30s");
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        loop = null;
        LOG.info("Final statistics:");
        logStats();
    }

    void onShutdown(@Observes(notifyObserver = Reception.IF_EXISTS) ShutdownEvent event) {
        stop();
    }

    /**
     * Log aggregate statistics, if anything has been delivered.
     */
    public void logStats() {
        LedgerStats stats = engine.ledger().stats();
        if (stats.totalFiles() == 0) {
            return;
        }
        LOG.info("=== TurboSort Copy Statistics ===");
        LOG.infof("Total files copied: %d", stats.totalFiles());
        LOG.infof("Total size: %.2f MB", stats.totalMegabytes());
        LOG.infof("This session: %d copied, %d skipped, %d failed",
                engine.copiedThisSession(), engine.skippedThisSession(), engine.failedThisSession());
        LOG.info("===============================");
    }
}
