package org.tapline.watch;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.compiler.options.WatchOptions;
import org.tapline.fs.InputFileSystem;

/**
 * {@link WatchFileSystem} that polls modification times through an {@link InputFileSystem}.
 * <p>
 * Every watcher owns a single daemon thread that stats all watched paths once per poll
 * interval. The first change of a path is reported through the invalid callback right away;
 * the aggregated change set is reported once no further change arrived within the aggregate
 * timeout. After that the watcher stops reporting.
 */
public class PollingWatchFileSystem implements WatchFileSystem {

    private static final Logger log = LoggerFactory.getLogger(PollingWatchFileSystem.class);
    private static final AtomicInteger WATCHER_IDS = new AtomicInteger();

    private final InputFileSystem fileSystem;

    public PollingWatchFileSystem(InputFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    @Override
    public Watcher watch(Collection<String> files,
                         Collection<String> directories,
                         Collection<String> missing,
                         long startTime,
                         WatchOptions options,
                         ChangeCallback onChange,
                         InvalidCallback onInvalid) {
        Set<String> filePaths = new LinkedHashSet<>(files);
        filePaths.addAll(missing);
        PollingWatcher watcher = new PollingWatcher(filePaths, new LinkedHashSet<>(directories), startTime,
                options, onChange, onInvalid);
        watcher.start();
        return watcher;
    }

    private final class PollingWatcher implements Watcher {

        private final Set<String> files;
        private final Set<String> directories;
        private final long startTime;
        private final WatchOptions options;
        private final ChangeCallback onChange;
        private final InvalidCallback onInvalid;
        private final ScheduledExecutorService scheduler;

        private final Map<String, Long> fileTimes = new HashMap<>();
        private final Map<String, Long> directoryTimes = new HashMap<>();
        private final Set<String> changed = new LinkedHashSet<>();
        private final Set<String> removed = new LinkedHashSet<>();
        private ScheduledFuture<?> aggregate;
        private boolean paused;
        private boolean closed;

        PollingWatcher(Set<String> files, Set<String> directories, long startTime, WatchOptions options,
                       ChangeCallback onChange, InvalidCallback onInvalid) {
            this.files = files;
            this.directories = directories;
            this.startTime = startTime;
            this.options = options;
            this.onChange = onChange;
            this.onInvalid = onInvalid;
            int id = WATCHER_IDS.incrementAndGet();
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "tapline-watch-poll-" + id);
                t.setDaemon(true);
                return t;
            });
        }

        void start() {
            scheduler.execute(this::initialScan);
            long interval = Math.max(1L, options.poll().toMillis());
            scheduler.scheduleWithFixedDelay(this::poll, interval, interval, TimeUnit.MILLISECONDS);
            log.debug("Polling {} files and {} directories every {} ms",
                    files.size(), directories.size(), interval);
        }

        private void initialScan() {
            scan(files, fileTimes, true);
            scan(directories, directoryTimes, true);
        }

        private void poll() {
            scan(files, fileTimes, false);
            scan(directories, directoryTimes, false);
        }

        /**
         * Stats every path and records changes. On the initial scan only paths modified
         * after the start of the last build count as changed.
         */
        private synchronized void scan(Set<String> paths, Map<String, Long> known, boolean initial) {
            if (closed) {
                return;
            }
            for (String path : paths) {
                if (options.isIgnored(path)) {
                    continue;
                }
                Long current = statOrNull(path);
                Long previous = known.get(path);
                if (current != null) {
                    known.put(path, current);
                } else {
                    known.remove(path);
                }
                boolean isChange;
                if (initial) {
                    isChange = current != null && current > startTime;
                } else {
                    isChange = current == null ? previous != null : !current.equals(previous);
                }
                if (isChange) {
                    recordChange(path, current);
                }
            }
        }

        private void recordChange(String path, Long time) {
            if (paused) {
                return;
            }
            if (time == null) {
                removed.add(path);
                changed.remove(path);
            } else if (changed.add(path)) {
                removed.remove(path);
                onInvalid.onInvalid(path, time);
            }
            if (aggregate != null) {
                aggregate.cancel(false);
            }
            aggregate = scheduler.schedule(this::emitAggregated,
                    options.aggregateTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }

        private void emitAggregated() {
            ChangeSet changes;
            synchronized (this) {
                if (paused || closed) {
                    return;
                }
                paused = true;
                changes = new ChangeSet(changed, removed, fileTimes, directoryTimes);
                changed.clear();
                removed.clear();
            }
            onChange.onChange(null, changes);
        }

        private Long statOrNull(String path) {
            try {
                return fileSystem.stat(path);
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                log.warn("Failed to stat watched path {}: {}", path, e.getMessage());
                log.debug("Exception details:", e);
                return null;
            }
        }

        @Override
        public synchronized void pause() {
            paused = true;
            if (aggregate != null) {
                aggregate.cancel(false);
                aggregate = null;
            }
        }

        @Override
        public void close() {
            synchronized (this) {
                if (closed) {
                    return;
                }
                closed = true;
                paused = true;
            }
            scheduler.shutdownNow();
        }

        @Override
        public synchronized Map<String, Long> getFileTimestamps() {
            return Map.copyOf(fileTimes);
        }

        @Override
        public synchronized Map<String, Long> getContextTimestamps() {
            return Map.copyOf(directoryTimes);
        }
    }
}
