package com.lbg.markets.turbosort.trigger;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.orchestration.DeliveryEngine;
import com.lbg.markets.turbosort.source.LocalFsSource;
import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryChangeEvent.EventType;
import io.methvin.watcher.DirectoryWatcher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Watches the local source tree and turns file events into delivery passes.
 * A marker create/modify is processed at once; any other file change queues its nearest
 * marker directory, and the queue is drained on a timer so bursts collapse into one pass.
 * Watch callbacks only post messages onto the loop; pending state is touched on the loop only.
 */
@ApplicationScoped
public class LocalTrigger implements Trigger {

    private static final Logger LOG = Logger.getLogger(LocalTrigger.class);

    private final DeliveryEngine engine;
    private final LocalFsSource source;
    private final Duration quietPeriod;
    private final Duration drainInterval;
    private final Duration rescanInterval;

    private final Set<Path> pending = new LinkedHashSet<>();
    private long lastDrainMillis;

    private ScheduledExecutorService loop;
    private ExecutorService watchThread;
    private DirectoryWatcher watcher;
    private ScheduledFuture<?> drainTask;
    private ScheduledFuture<?> rescanTask;
    private volatile boolean stopped;

    @Inject
    public LocalTrigger(TurbosortConfig config, DeliveryEngine engine) {
        this(engine, new LocalFsSource(config), config.local().quietPeriod(), config.local().drainInterval(),
                config.local().rescanInterval());
    }

    public LocalTrigger(DeliveryEngine engine, LocalFsSource source, Duration quietPeriod, Duration drainInterval,
                        Duration rescanInterval) {
        this.engine = engine;
        this.source = source;
        this.quietPeriod = quietPeriod;
        this.drainInterval = drainInterval;
        this.rescanInterval = rescanInterval;
    }

    @Override
    public void start(ScheduledExecutorService loop) throws IOException {
        this.loop = loop;
        this.lastDrainMillis = System.currentTimeMillis();
        this.stopped = false;

        watcher = DirectoryWatcher.builder()
                .path(source.root())
                .fileHashing(false)
                .listener(this::post)
                .build();
        watchThread = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "turbosort-watch");
            thread.setDaemon(true);
            return thread;
        });
        watcher.watchAsync(watchThread).whenComplete((ignored, error) -> {
            if (stopped) {
                return;
            }
            try {
                loop.execute(() -> onWatcherStopped(error));
            } catch (RejectedExecutionException e) {
                LOG.debugf("Watcher ended during shutdown");
            }
        });

        long drain = Math.max(1, drainInterval.toMillis());
        long rescan = Math.max(1, rescanInterval.toMillis());
        drainTask = loop.scheduleWithFixedDelay(() -> drain(System.currentTimeMillis()), drain, drain,
                TimeUnit.MILLISECONDS);
        rescanTask = loop.scheduleWithFixedDelay(this::rescan, rescan, rescan, TimeUnit.MILLISECONDS);
        LOG.infof("Watching %s", source.root());
    }

    @Override
    public void stop() {
        stopped = true;
        if (drainTask != null) {
            drainTask.cancel(false);
        }
        if (rescanTask != null) {
            rescanTask.cancel(false);
        }
        if (watcher != null) {
            try {
                watcher.close();
            } catch (IOException e) {
                LOG.warnf("Failed to close directory watcher: %s", e.getMessage());
            }
        }
        if (watchThread != null) {
            watchThread.shutdownNow();
        }
    }

    private void post(DirectoryChangeEvent event) {
        EventType kind = event.eventType();
        Path path = event.path();
        try {
            loop.execute(() -> onEvent(kind, path));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Dropping %s %s during shutdown", kind, path);
        }
    }

    /**
     * The watch loop ended without {@link #stop()}. Only the periodic rescan still notices
     * changes from here on, so catch up now. Runs on the loop.
     */
    void onWatcherStopped(Throwable error) {
        if (error != null) {
            LOG.errorf(error, "Watching %s failed; falling back to periodic rescans", source.root());
        } else {
            LOG.errorf("Watching %s ended unexpectedly; falling back to periodic rescans", source.root());
        }
        rescan();
    }

    /**
     * Handle one watch event. Runs on the loop.
     */
    void onEvent(EventType kind, Path path) {
        try {
            switch (kind) {
                case CREATE, MODIFY -> onChange(kind, path);
                case DELETE -> {
                    if (source.isMarker(path)) {
                        LOG.infof("Marker deleted: %s", path);
                    }
                }
                case OVERFLOW -> {
                    LOG.warn("Watch events overflowed, running a full scan");
                    rescan();
                }
                default -> LOG.debugf("Ignoring %s event for %s", kind, path);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to handle %s event for %s", kind, path);
        }
    }

    private void onChange(EventType kind, Path path) {
        if (path == null) {
            return;
        }
        if (source.isMarker(path)) {
            LOG.infof("%s marker file detected: %s", kind == EventType.CREATE ? "New" : "Modified", path);
            Path dir = path.toAbsolutePath().normalize().getParent();
            pending.remove(dir);
            engine.processDirectory(dir.toString());
            return;
        }

        if (kind == EventType.CREATE && Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            // A tree moved in wholesale may carry markers that never raise their own event
            List<Path> markerDirs = LocalFsSource.markerDirectories(path, source.markerName());
            pending.addAll(markerDirs);
        }
        source.nearestMarkerDirectory(path).ifPresent(pending::add);
    }

    /**
     * Process every pending directory once the quiet period has passed since the last drain.
     * Runs on the loop.
     */
    void drain(long nowMillis) {
        if (pending.isEmpty() || nowMillis - lastDrainMillis < quietPeriod.toMillis()) {
            return;
        }
        List<Path> batch = List.copyOf(pending);
        pending.clear();
        lastDrainMillis = nowMillis;

        LOG.debugf("Draining %d pending directories", batch.size());
        for (Path dir : batch) {
            try {
                engine.processDirectory(dir.toString());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to process %s", dir);
            }
        }
    }

    void rescan() {
        try {
            engine.fullScan();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Full rescan failed");
        }
    }

    Set<Path> pending() {
        return Set.copyOf(pending);
    }
}
