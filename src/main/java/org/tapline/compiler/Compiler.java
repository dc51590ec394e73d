package org.tapline.compiler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.compiler.options.CompilerOptions;
import org.tapline.compiler.options.WatchOptions;
import org.tapline.fs.InputFileSystem;
import org.tapline.fs.OutputFileSystem;
import org.tapline.records.Records;
import org.tapline.util.Futures;
import org.tapline.util.Identifiers;
import org.tapline.watch.WatchFileSystem;

import com.typesafe.config.Config;

/**
 * Drives builds through the fixed stage sequence and notifies plugins through
 * {@link #hooks}.
 * <p>
 * A compiler runs at most one build (or one watch session) at a time; the {@code running}
 * flag is the only mutual exclusion. A second {@link #run()} while running fails immediately
 * with {@link ConcurrentCompilationException} and changes nothing. Whatever the outcome of a
 * build, the flag is reset before the returned future completes.
 * <p>
 * One build attempt:
 * <ol>
 *   <li>{@code beforeRun}, {@code run}</li>
 *   <li>read records</li>
 *   <li>{@link #compile()}: {@code beforeCompile}, {@code compile}, new compilation,
 *       {@code make}, finish, seal, {@code afterCompile}</li>
 *   <li>{@code shouldEmit}; a {@code FALSE} veto jumps straight to {@code done}</li>
 *   <li>emit assets ({@code emit} ... {@code afterEmit})</li>
 *   <li>additional pass: interim {@code done}, {@code additionalPass}, back to compile</li>
 *   <li>emit records, {@code done}</li>
 * </ol>
 * The first failing stage aborts the remaining stages; the returned future then fails with
 * that stage's own exception and the {@code failed} hook is called.
 * <p>
 * Timestamp maps are shared by reference with the watch loop and with child compilers. Only
 * the build attempt currently in flight writes them.
 */
public class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    public final CompilerHooks hooks;

    private final CompilerOptions options;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, Long> fileTimestamps;
    private final Map<String, Long> contextTimestamps;
    private final ResolverFactory resolverFactory;
    private final Compilation parentCompilation;

    private String name;
    private String outputPath;
    private Records records = new Records();
    private InputFileSystem inputFileSystem;
    private OutputFileSystem outputFileSystem;
    private WatchFileSystem watchFileSystem;
    private ModuleFactory moduleFactory = ModuleFactory.unconfigured();
    private Executor executor = ForkJoinPool.commonPool();

    /**
     * Creates a top-level compiler. Filesystems and the module factory are installed by
     * plugins (see {@code LocalEnvironmentPlugin}) or set directly.
     */
    public Compiler(CompilerOptions options) {
        this(options, new ConcurrentHashMap<>(), new ConcurrentHashMap<>(), new ResolverFactory(), null);
        this.name = options.name();
    }

    private Compiler(CompilerOptions options,
                     Map<String, Long> fileTimestamps,
                     Map<String, Long> contextTimestamps,
                     ResolverFactory resolverFactory,
                     Compilation parentCompilation) {
        this.options = Objects.requireNonNull(options, "options");
        this.fileTimestamps = fileTimestamps;
        this.contextTimestamps = contextTimestamps;
        this.resolverFactory = resolverFactory;
        this.parentCompilation = parentCompilation;
        this.outputPath = options.output().path();
        this.hooks = new CompilerHooks(parentCompilation == null ? "Compiler" : "ChildCompiler");
    }

    /**
     * Runs one build.
     *
     * @return a future completing with the stats of the final compilation; failed with
     *         {@link ConcurrentCompilationException} if a build is already running, or with
     *         the exception of the first failing stage.
     */
    public CompletableFuture<Stats> run() {
        if (!running.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new ConcurrentCompilationException());
        }
        fileTimestamps.clear();
        contextTimestamps.clear();
        hooks.getRegistry().lock();
        long startTime = System.currentTimeMillis();
        log.debug("Starting build of {}", describe());

        CompletableFuture<Stats> build = Futures.invoke(() -> hooks.beforeRun.callAsync(this))
                .thenCompose(ignored -> hooks.run.callAsync(this))
                .thenCompose(ignored -> readRecords())
                .thenCompose(ignored -> runPass(startTime, 0));

        CompletableFuture<Stats> result = new CompletableFuture<>();
        build.whenComplete((stats, error) -> {
            hooks.getRegistry().unlock();
            running.set(false);
            if (error == null) {
                log.debug("Build of {} finished in {} ms", describe(), stats.getDuration());
                result.complete(stats);
                return;
            }
            Throwable cause = Futures.unwrap(error);
            log.warn("Build of {} failed: {}", describe(), cause.getMessage());
            log.debug("Exception details:", cause);
            notifyFailed(cause);
            result.completeExceptionally(cause);
        });
        return result;
    }

    /**
     * Starts a watch session: builds once, then rebuilds whenever the watch filesystem reports
     * a change. Timestamp maps are not reset, so each rebuild can tell what changed.
     * <p>
     * The compiler stays running for the whole session; {@link Watching#close()} releases it.
     *
     * @param watchOptions debounce, polling and ignore settings.
     * @param handler      receives the outcome of every build of the session.
     * @return the session handle.
     * @throws ConcurrentCompilationException if a build or watch session is already running.
     */
    public Watching watch(WatchOptions watchOptions, BuildHandler handler) {
        if (!running.compareAndSet(false, true)) {
            throw new ConcurrentCompilationException();
        }
        hooks.getRegistry().lock();
        log.debug("Starting watch session of {}", describe());
        Watching watching = new Watching(this, watchOptions, handler);
        watching.start();
        return watching;
    }

    /**
     * One compile pass followed by emission, looping while the compilation requests an
     * additional pass.
     *
     * @param additionalPasses number of additional passes already run in this build.
     */
    private CompletableFuture<Stats> runPass(long startTime, int additionalPasses) {
        return compile().thenCompose(compilation -> {
            if (Boolean.FALSE.equals(hooks.shouldEmit.call(compilation))) {
                log.debug("Emission vetoed for {}", describe());
                return reportDone(compilation, startTime);
            }
            return emitAssets(compilation).thenCompose(ignored -> {
                if (requestsAdditionalPass(compilation, additionalPasses)) {
                    return reportDone(compilation, startTime)
                            .thenCompose(stats -> hooks.additionalPass.callAsync(null))
                            .thenCompose(passed -> runPass(startTime, additionalPasses + 1));
                }
                return emitRecords().thenCompose(done -> reportDone(compilation, startTime));
            });
        });
    }

    /**
     * Asks the sealed compilation whether another pass is needed and marks it if so.
     *
     * @throws AdditionalPassLimitException if the configured cap is reached.
     */
    boolean requestsAdditionalPass(Compilation compilation, int additionalPasses) {
        if (!Boolean.TRUE.equals(compilation.hooks.needAdditionalPass.call(null))) {
            return false;
        }
        compilation.setNeedAdditionalPass(true);
        int limit = options.maxAdditionalPasses();
        if (limit > 0 && additionalPasses >= limit) {
            throw new AdditionalPassLimitException(limit);
        }
        log.debug("Additional pass {} requested for {}", additionalPasses + 1, describe());
        return true;
    }

    CompletableFuture<Stats> reportDone(Compilation compilation, long startTime) {
        Stats stats = new Stats(compilation, startTime, System.currentTimeMillis());
        return hooks.done.callAsync(stats).thenApply(ignored -> stats);
    }

    /**
     * Creates the parameters of a new compilation and lets plugins inspect the module factory.
     */
    public CompilationParams newCompilationParams() {
        hooks.moduleFactory.call(moduleFactory);
        return new CompilationParams(moduleFactory, ConcurrentHashMap.newKeySet());
    }

    /**
     * Creates a compilation and hands it to the {@code thisCompilation} and
     * {@code compilation} taps.
     */
    public Compilation newCompilation(CompilationParams params) {
        Compilation compilation = new Compilation(this, params);
        hooks.thisCompilation.call(compilation);
        hooks.compilation.call(compilation);
        return compilation;
    }

    /**
     * Runs the compile stage: builds the module graph and seals the compilation.
     *
     * @return a future for the sealed compilation.
     */
    public CompletableFuture<Compilation> compile() {
        return Futures.invoke(() -> {
            CompilationParams params = newCompilationParams();
            return hooks.beforeCompile.callAsync(params).thenCompose(ignored -> {
                hooks.compile.call(params);
                Compilation compilation = newCompilation(params);
                return hooks.make.callAsync(compilation)
                        .thenCompose(made -> {
                            compilation.finish();
                            return compilation.seal();
                        })
                        .thenCompose(sealed -> hooks.afterCompile.callAsync(compilation))
                        .thenApply(after -> compilation);
            });
        });
    }

    /**
     * Writes every asset of the compilation below the output path.
     * <p>
     * Writes run concurrently on the compiler's executor. An asset whose {@code existsAt}
     * already equals its target is skipped and marked as not emitted. A failing write fails
     * the stage once all writes have settled; files written by the other writes stay on disk.
     */
    public CompletableFuture<Void> emitAssets(Compilation compilation) {
        return Futures.invoke(() -> hooks.emit.callAsync(compilation))
                .thenCompose(ignored -> {
                    if (outputFileSystem == null) {
                        throw new IllegalStateException(String.format(
                                "No output file system configured for %s", describe()));
                    }
                    String targetDir = compilation.getPath(outputPath);
                    mkdirp(targetDir);
                    Map<String, Source> assets;
                    synchronized (compilation.getAssets()) {
                        assets = new LinkedHashMap<>(compilation.getAssets());
                    }
                    List<CompletableFuture<Void>> writes = new ArrayList<>(assets.size());
                    assets.forEach((file, source) -> writes.add(
                            CompletableFuture.runAsync(() -> writeAsset(targetDir, file, source), executor)));
                    return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]));
                })
                .thenCompose(ignored -> hooks.afterEmit.callAsync(compilation));
    }

    private void writeAsset(String targetDir, String file, Source source) {
        int query = file.indexOf('?');
        String targetFile = query >= 0 ? file.substring(0, query) : file;
        checkRelativeAssetName(targetFile);
        String targetPath = outputFileSystem.join(targetDir, targetFile);
        if (targetPath.equals(source.getExistsAt())) {
            source.setEmitted(false);
            return;
        }
        int separator = Math.max(targetFile.lastIndexOf('/'), targetFile.lastIndexOf('\\'));
        if (separator > 0) {
            mkdirp(outputFileSystem.join(targetDir, targetFile.substring(0, separator)));
        }
        try {
            outputFileSystem.writeFile(targetPath, source.buffer());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write asset " + targetPath, e);
        }
        source.setExistsAt(targetPath);
        source.setEmitted(true);
    }

    private static void checkRelativeAssetName(String targetFile) {
        String normalized = targetFile.replace('\\', '/');
        boolean escapes = normalized.startsWith("/") || normalized.matches("^[A-Za-z]:.*");
        for (String segment : normalized.split("/")) {
            escapes |= segment.equals("..");
        }
        if (escapes) {
            throw new IllegalArgumentException(String.format(
                    "Asset name '%s' resolves outside the output directory", targetFile));
        }
    }

    private void mkdirp(String dir) {
        try {
            outputFileSystem.mkdirp(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }

    /**
     * Loads the records from the configured input path. No path, or a path that does not
     * exist, yields empty records; a child compiler without a path keeps its view into the
     * parent's records. Content that cannot be parsed fails with a
     * {@link org.tapline.records.RecordsParseException} and leaves the current records
     * untouched.
     */
    public CompletableFuture<Void> readRecords() {
        String path = options.recordsInputPath();
        if (path == null) {
            if (!isChild()) {
                records = new Records();
            }
            return CompletableFuture.completedFuture(null);
        }
        if (inputFileSystem == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(String.format(
                    "No input file system configured for %s, cannot read records from %s", describe(), path)));
        }
        try {
            inputFileSystem.stat(path);
        } catch (NoSuchFileException e) {
            records = new Records();
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            log.debug("Records at {} are not accessible, starting with empty records", path, e);
            records = new Records();
            return CompletableFuture.completedFuture(null);
        }
        try {
            byte[] content = inputFileSystem.readFile(path);
            records = Records.parse(new String(content, StandardCharsets.UTF_8));
            log.debug("Read records from {}", path);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException("Failed to read records from " + path, e));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Writes the records to the configured output path, creating its parent directory.
     * Does nothing when no output path is configured.
     */
    public CompletableFuture<Void> emitRecords() {
        String path = options.recordsOutputPath();
        if (path == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (outputFileSystem == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(String.format(
                    "No output file system configured for %s, cannot write records to %s", describe(), path)));
        }
        try {
            int separator = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
            if (separator > 0) {
                outputFileSystem.mkdirp(path.substring(0, separator));
            }
            outputFileSystem.writeFile(path, records.toJson().getBytes(StandardCharsets.UTF_8));
            log.debug("Wrote records to {}", path);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException("Failed to write records to " + path, e));
        }
    }

    /**
     * Creates a child compiler for a compilation of this compiler. Use
     * {@link Compilation#createChildCompiler(String, Config, List)}, which assigns the index.
     * <p>
     * The child shares this compiler's timestamp maps, resolver factory, input file system,
     * module factory and executor. Its output options are this compiler's with
     * {@code outputOverrides} layered on top. It inherits the taps of every hook except those
     * in {@link CompilerHooks#NOT_INHERITED_BY_CHILDREN}, then the given plugins are applied.
     */
    Compiler createChildCompiler(Compilation compilation, String compilerName, int index,
                                 Config outputOverrides, List<Plugin> plugins) {
        Compiler child = new Compiler(options.withOutput(outputOverrides), fileTimestamps, contextTimestamps,
                resolverFactory, compilation);
        child.name = compilerName;
        child.inputFileSystem = inputFileSystem;
        child.moduleFactory = moduleFactory;
        child.executor = executor;

        String recordsName = Identifiers.makePathsRelative(options.context(), compilerName);
        child.records = records.childRecords(recordsName, index);

        child.hooks.getRegistry().inheritFrom(hooks.getRegistry(), CompilerHooks.NOT_INHERITED_BY_CHILDREN);
        for (Plugin plugin : plugins) {
            plugin.apply(child);
        }
        compilation.hooks.childCompiler.call(new ChildCompilerEvent(child, compilerName, index));
        log.debug("Created child compiler '{}' #{} of {}", compilerName, index, describe());
        return child;
    }

    /**
     * Compiles this child compiler and merges the result into the parent compilation: the
     * child compilation is registered as a child and its assets are copied into the parent's
     * asset map.
     *
     * @return a future for the child's entry modules and compilation.
     * @throws IllegalStateException (as a failed future) if this is not a child compiler.
     */
    public CompletableFuture<ChildCompilation> runAsChild() {
        if (parentCompilation == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(String.format(
                    "%s is not a child compiler", describe())));
        }
        if (!running.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new ConcurrentCompilationException());
        }
        CompletableFuture<ChildCompilation> build = compile().thenApply(compilation -> {
            parentCompilation.addChild(compilation);
            synchronized (compilation.getAssets()) {
                compilation.getAssets().forEach(parentCompilation::updateAsset);
            }
            return new ChildCompilation(List.copyOf(compilation.getEntrypoints().values()), compilation);
        });
        return Futures.unwrapped(build.whenComplete((result, error) -> running.set(false)));
    }

    /**
     * Drops cached state of the input file system, e.g. after an external change.
     */
    public void purgeInputFileSystem() {
        if (inputFileSystem != null) {
            inputFileSystem.purge();
        }
    }

    void notifyFailed(Throwable cause) {
        try {
            hooks.failed.call(cause);
        } catch (RuntimeException e) {
            log.warn("A failed hook tap threw while reporting a build failure: {}", e.getMessage());
            log.debug("Exception details:", e);
        }
    }

    void releaseRunning() {
        hooks.getRegistry().unlock();
        running.set(false);
    }

    /**
     * Replaces the content of the shared timestamp maps in place, keeping every holder of a
     * reference (watch loop, child compilers) in sync.
     */
    void setTimestamps(Map<String, Long> files, Map<String, Long> contexts) {
        fileTimestamps.clear();
        fileTimestamps.putAll(files);
        contextTimestamps.clear();
        contextTimestamps.putAll(contexts);
    }

    String describe() {
        return name != null ? "compiler '" + name + "'" : "compiler";
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return {@code true} for compilers created through
     *         {@link Compilation#createChildCompiler(String, Config, List)}.
     */
    public boolean isChild() {
        return parentCompilation != null;
    }

    /**
     * @return the compilation that created this child compiler, or {@code null}.
     */
    public Compilation getParentCompilation() {
        return parentCompilation;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Records getRecords() {
        return records;
    }

    public Map<String, Long> getFileTimestamps() {
        return fileTimestamps;
    }

    public Map<String, Long> getContextTimestamps() {
        return contextTimestamps;
    }

    public ResolverFactory getResolverFactory() {
        return resolverFactory;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public InputFileSystem getInputFileSystem() {
        return inputFileSystem;
    }

    public void setInputFileSystem(InputFileSystem inputFileSystem) {
        this.inputFileSystem = inputFileSystem;
    }

    public OutputFileSystem getOutputFileSystem() {
        return outputFileSystem;
    }

    public void setOutputFileSystem(OutputFileSystem outputFileSystem) {
        this.outputFileSystem = outputFileSystem;
    }

    public WatchFileSystem getWatchFileSystem() {
        return watchFileSystem;
    }

    public void setWatchFileSystem(WatchFileSystem watchFileSystem) {
        this.watchFileSystem = watchFileSystem;
    }

    public ModuleFactory getModuleFactory() {
        return moduleFactory;
    }

    public void setModuleFactory(ModuleFactory moduleFactory) {
        this.moduleFactory = Objects.requireNonNull(moduleFactory, "moduleFactory");
    }

    public Executor getExecutor() {
        return executor;
    }

    /**
     * Sets the executor used for concurrent asset writes. Defaults to the common pool.
     */
    public void setExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }
}
