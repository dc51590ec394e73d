package org.tapline.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.compiler.options.WatchOptions;
import org.tapline.util.Futures;
import org.tapline.watch.ChangeSet;
import org.tapline.watch.WatchFileSystem;
import org.tapline.watch.Watcher;

/**
 * A watch session of a {@link Compiler}, created by {@link Compiler#watch}.
 * <p>
 * Each iteration runs {@code watchRun}, compile, emission and records, then subscribes to
 * the dependencies of the finished compilation. A change reported while a build is running
 * marks the session invalid; the running build is then discarded after its current stage
 * and a new iteration starts. Timestamp maps are carried over between iterations.
 * <p>
 * {@link #close()} stops scheduling new builds. A build already in flight is not aborted;
 * the session finishes closing when that build settles.
 */
public class Watching {

    private static final Logger log = LoggerFactory.getLogger(Watching.class);

    private final Compiler compiler;
    private final WatchOptions watchOptions;
    private final BuildHandler handler;
    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    private boolean running;
    private boolean invalid;
    private boolean closed;
    private long startTime;
    private Watcher watcher;
    private Watcher pausedWatcher;
    private Set<String> lastFiles = Set.of();
    private Set<String> lastDirectories = Set.of();
    private Set<String> lastMissing = Set.of();

    Watching(Compiler compiler, WatchOptions watchOptions, BuildHandler handler) {
        this.compiler = compiler;
        this.watchOptions = watchOptions;
        this.handler = handler;
    }

    /**
     * Reads the records once, then starts the first iteration.
     */
    void start() {
        synchronized (lock) {
            running = true;
        }
        compiler.readRecords().whenComplete((ignored, error) -> {
            if (error != null) {
                done(Futures.unwrap(error), null);
            } else {
                go();
            }
        });
    }

    private void go() {
        boolean stop;
        boolean finishClose = false;
        synchronized (lock) {
            stop = closed;
            if (closed) {
                // closed while handing over from a settled iteration
                finishClose = running;
                running = false;
            } else {
                startTime = System.currentTimeMillis();
                running = true;
                invalid = false;
            }
        }
        if (stop) {
            if (finishClose) {
                finishClose();
            }
            return;
        }
        log.debug("Watch iteration of {} started", compiler.describe());
        Futures.invoke(() -> compiler.hooks.watchRun.callAsync(compiler))
                .thenCompose(ignored -> compileIteration(0))
                .whenComplete((compilation, error) ->
                        done(error != null ? Futures.unwrap(error) : null, compilation));
    }

    /**
     * Compiles and emits; completes with {@code null} when the iteration was invalidated
     * before emission finished.
     */
    private CompletableFuture<Compilation> compileIteration(int additionalPasses) {
        return compiler.compile().thenCompose(compilation -> {
            if (isInvalid()) {
                return CompletableFuture.completedFuture(null);
            }
            if (Boolean.FALSE.equals(compiler.hooks.shouldEmit.call(compilation))) {
                return CompletableFuture.completedFuture(compilation);
            }
            return compiler.emitAssets(compilation).thenCompose(emitted -> {
                if (isInvalid()) {
                    return CompletableFuture.completedFuture(null);
                }
                return compiler.emitRecords().thenCompose(written -> {
                    if (compiler.requestsAdditionalPass(compilation, additionalPasses)) {
                        return compiler.reportDone(compilation, startTime)
                                .thenCompose(stats -> compiler.hooks.additionalPass.callAsync(null))
                                .thenCompose(passed -> compileIteration(additionalPasses + 1));
                    }
                    return CompletableFuture.completedFuture(compilation);
                });
            });
        });
    }

    /**
     * Finishes an iteration. The session counts as running until the {@code done} hook, the
     * handler, the re-subscription and the invalidation callbacks are through; only then may
     * the next iteration start.
     */
    private void done(Throwable error, Compilation compilation) {
        boolean discard;
        synchronized (lock) {
            discard = closed || invalid;
        }
        if (discard) {
            settle();
            return;
        }
        Stats stats = compilation != null ? new Stats(compilation, startTime, System.currentTimeMillis()) : null;
        if (error != null) {
            log.warn("Watch build of {} failed: {}", compiler.describe(), error.getMessage());
            log.debug("Exception details:", error);
            compiler.notifyFailed(error);
            // lastFiles still holds the dependencies of the last successful build
            report(error, stats);
            return;
        }
        Futures.invoke(() -> compiler.hooks.done.callAsync(stats)).whenComplete((ignored, doneError) -> {
            synchronized (lock) {
                lastFiles = Set.copyOf(compilation.getFileDependencies());
                lastDirectories = Set.copyOf(compilation.getContextDependencies());
                lastMissing = Set.copyOf(compilation.getMissingDependencies());
            }
            report(doneError != null ? Futures.unwrap(doneError) : null, stats);
        });
    }

    private void report(Throwable error, Stats stats) {
        notifyHandler(error, stats);
        try {
            watchDependencies();
            runCallbacks();
        } finally {
            settle();
        }
    }

    private void notifyHandler(Throwable error, Stats stats) {
        try {
            handler.handle(error, stats);
        } catch (RuntimeException e) {
            log.warn("Build handler of {} failed: {}", compiler.describe(), e.getMessage());
            log.debug("Exception details:", e);
        }
    }

    /**
     * Leaves the running state, then finishes a pending close or starts the iteration an
     * invalidation asked for.
     */
    private void settle() {
        boolean finishClose;
        boolean restart;
        synchronized (lock) {
            finishClose = closed;
            restart = !closed && invalid;
            if (!restart) {
                running = false;
            }
        }
        if (finishClose) {
            finishClose();
        } else if (restart) {
            go();
        }
    }

    private void watchDependencies() {
        WatchFileSystem watchFileSystem = compiler.getWatchFileSystem();
        if (watchFileSystem == null) {
            log.warn("No watch file system configured for {}, changes will not trigger rebuilds", compiler.describe());
            return;
        }
        Watcher previousActive;
        Watcher previousPaused;
        long since;
        Set<String> files;
        Set<String> directories;
        Set<String> missing;
        synchronized (lock) {
            if (closed || invalid) {
                return;
            }
            previousActive = watcher;
            previousPaused = pausedWatcher;
            watcher = null;
            pausedWatcher = null;
            since = startTime;
            files = lastFiles;
            directories = lastDirectories;
            missing = lastMissing;
        }
        if (previousActive != null) {
            previousActive.close();
        }
        if (previousPaused != null) {
            previousPaused.close();
        }
        Watcher created;
        try {
            created = watchFileSystem.watch(files, directories, missing, since, watchOptions,
                    this::onChange, this::onInvalid);
        } catch (RuntimeException e) {
            log.warn("Cannot watch the dependencies of {}: {}", compiler.describe(), e.getMessage());
            log.debug("Exception details:", e);
            return;
        }
        boolean closeNow;
        synchronized (lock) {
            closeNow = closed || invalid;
            if (!closeNow) {
                watcher = created;
            }
        }
        if (closeNow) {
            created.close();
        }
    }

    private void onChange(Throwable error, ChangeSet changes) {
        synchronized (lock) {
            pausedWatcher = watcher;
            watcher = null;
        }
        if (error != null) {
            log.warn("Watcher of {} failed: {}", compiler.describe(), error.getMessage());
            log.debug("Exception details:", error);
            notifyHandler(error, null);
            return;
        }
        log.debug("{} file(s) changed, {} removed", changes.changedFiles().size(), changes.removedFiles().size());
        compiler.setTimestamps(changes.fileTimestamps(), changes.contextTimestamps());
        scheduleBuild();
    }

    private void onInvalid(String fileName, long changeTime) {
        compiler.hooks.invalid.call(new InvalidEvent(fileName, changeTime));
    }

    /**
     * Marks the session dirty and schedules a rebuild without waiting for a change
     * notification. If a build is running it is discarded and restarted once it settles.
     */
    public void invalidate() {
        invalidate(null);
    }

    /**
     * Like {@link #invalidate()}; {@code callback} runs after the next build of the session
     * has been handed to the handler.
     */
    public void invalidate(Runnable callback) {
        Watcher current;
        synchronized (lock) {
            if (callback != null) {
                callbacks.add(callback);
            }
            current = watcher;
        }
        if (current != null) {
            compiler.setTimestamps(current.getFileTimestamps(), current.getContextTimestamps());
        }
        scheduleBuild();
    }

    private void scheduleBuild() {
        Watcher toPause;
        boolean startNow;
        synchronized (lock) {
            if (closed) {
                return;
            }
            toPause = watcher;
            if (watcher != null) {
                pausedWatcher = watcher;
                watcher = null;
            }
            if (running) {
                invalid = true;
                startNow = false;
            } else {
                running = true;
                startNow = true;
            }
        }
        if (toPause != null) {
            toPause.pause();
        }
        if (startNow) {
            go();
        }
    }

    /**
     * Stops the session. The returned future completes once a build in flight has settled and
     * the compiler has been released.
     */
    public CompletableFuture<Void> close() {
        boolean finishNow;
        Watcher active;
        Watcher paused;
        synchronized (lock) {
            if (closed) {
                return closeFuture;
            }
            closed = true;
            active = watcher;
            paused = pausedWatcher;
            watcher = null;
            pausedWatcher = null;
            if (running) {
                invalid = true;
            }
            finishNow = !running;
        }
        if (active != null) {
            active.close();
        }
        if (paused != null) {
            paused.close();
        }
        if (finishNow) {
            finishClose();
        }
        return closeFuture;
    }

    /**
     * @return a future completing once the session is closed, without closing it.
     */
    public CompletableFuture<Void> whenClosed() {
        return closeFuture;
    }

    private void finishClose() {
        try {
            compiler.hooks.watchClose.call(null);
        } catch (RuntimeException e) {
            log.warn("A watchClose hook tap of {} failed: {}", compiler.describe(), e.getMessage());
            log.debug("Exception details:", e);
        }
        compiler.releaseRunning();
        log.debug("Watch session of {} closed", compiler.describe());
        closeFuture.complete(null);
    }

    private void runCallbacks() {
        List<Runnable> pending;
        synchronized (lock) {
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : pending) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("An invalidation callback of {} failed: {}", compiler.describe(), e.getMessage());
                log.debug("Exception details:", e);
            }
        }
    }

    private boolean isInvalid() {
        synchronized (lock) {
            return invalid;
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * @return {@code true} while an iteration is building.
     */
    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }
}
