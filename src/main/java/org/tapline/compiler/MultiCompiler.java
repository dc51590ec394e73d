package org.tapline.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.util.Futures;

/**
 * Drives several independent compilers, one per build configuration.
 * <p>
 * {@link #run()} starts every compiler at once and completes with the stats of all of them.
 * {@link #watch(MultiBuildHandler)} opens one watch session per compiler, each with that
 * compiler's own watch options. The {@code done} hook of this class fires whenever every
 * compiler has a finished build that was not invalidated since.
 */
public class MultiCompiler {

    private static final Logger log = LoggerFactory.getLogger(MultiCompiler.class);

    public final MultiCompilerHooks hooks = new MultiCompilerHooks();

    private final List<Compiler> compilers;
    private final Object lock = new Object();
    private final Stats[] latest;

    /**
     * @throws IllegalArgumentException if {@code compilers} is empty.
     */
    public MultiCompiler(List<Compiler> compilers) {
        if (compilers.isEmpty()) {
            throw new IllegalArgumentException("A multi compiler needs at least one compiler");
        }
        this.compilers = List.copyOf(compilers);
        this.latest = new Stats[compilers.size()];
        for (int i = 0; i < this.compilers.size(); i++) {
            int index = i;
            Compiler compiler = this.compilers.get(i);
            compiler.hooks.done.tap("MultiCompiler", stats -> compilerDone(index, stats));
            compiler.hooks.invalid.tap("MultiCompiler", event -> compilerInvalid(index));
        }
    }

    private void compilerDone(int index, Stats stats) {
        MultiStats all;
        synchronized (lock) {
            latest[index] = stats;
            all = completedStats();
        }
        if (all != null) {
            hooks.done.call(all);
        }
    }

    private void compilerInvalid(int index) {
        boolean first;
        synchronized (lock) {
            first = Arrays.stream(latest).allMatch(stats -> stats != null);
            latest[index] = null;
        }
        if (first) {
            hooks.invalid.call(null);
        }
    }

    /**
     * @return the latest stats of every compiler, or {@code null} while one of them has none.
     */
    MultiStats completedStats() {
        synchronized (lock) {
            for (Stats stats : latest) {
                if (stats == null) {
                    return null;
                }
            }
            return new MultiStats(Arrays.asList(latest));
        }
    }

    /**
     * Runs every compiler once, all at the same time.
     * <p>
     * The returned future fails with the first failure in configuration order once every
     * compiler has settled, or with {@link ConcurrentCompilationException} without starting
     * anything if one of the compilers is already running.
     */
    public CompletableFuture<MultiStats> run() {
        if (compilers.stream().anyMatch(Compiler::isRunning)) {
            return CompletableFuture.failedFuture(new ConcurrentCompilationException());
        }
        synchronized (lock) {
            Arrays.fill(latest, null);
        }
        log.debug("Running {} compilers", compilers.size());
        List<CompletableFuture<Stats>> builds = new ArrayList<>(compilers.size());
        for (Compiler compiler : compilers) {
            builds.add(compiler.run());
        }
        return CompletableFuture.allOf(builds.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> {
                    List<Stats> results = new ArrayList<>(builds.size());
                    for (CompletableFuture<Stats> build : builds) {
                        if (build.isCompletedExceptionally()) {
                            Throwable cause = Futures.unwrap(build.handle((stats, e) -> e).join());
                            return CompletableFuture.<MultiStats>failedFuture(cause);
                        }
                        results.add(build.join());
                    }
                    return CompletableFuture.completedFuture(new MultiStats(results));
                })
                .thenCompose(result -> result);
    }

    /**
     * Starts one watch session per compiler with that compiler's configured watch options.
     *
     * @throws ConcurrentCompilationException if one of the compilers is already running; no
     *                                        session is left open in that case.
     */
    public MultiWatching watch(MultiBuildHandler handler) {
        if (compilers.stream().anyMatch(Compiler::isRunning)) {
            throw new ConcurrentCompilationException();
        }
        synchronized (lock) {
            Arrays.fill(latest, null);
        }
        List<Watching> watchings = new ArrayList<>(compilers.size());
        try {
            for (Compiler compiler : compilers) {
                watchings.add(compiler.watch(compiler.getOptions().watchOptions(), (error, stats) -> {
                    if (error != null) {
                        handler.handle(error, null);
                        return;
                    }
                    MultiStats all = completedStats();
                    if (all != null) {
                        handler.handle(null, all);
                    }
                }));
            }
        } catch (ConcurrentCompilationException e) {
            watchings.forEach(Watching::close);
            throw e;
        }
        log.debug("Watching with {} compilers", compilers.size());
        return new MultiWatching(this, watchings);
    }

    /**
     * Purges the input file system of every compiler.
     */
    public void purgeInputFileSystem() {
        compilers.forEach(Compiler::purgeInputFileSystem);
    }

    public List<Compiler> getCompilers() {
        return compilers;
    }

    public boolean isRunning() {
        return compilers.stream().anyMatch(Compiler::isRunning);
    }
}
