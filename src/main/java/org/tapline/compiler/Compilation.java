package org.tapline.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.BuildException;
import org.tapline.records.Records;
import org.tapline.util.Futures;

import com.typesafe.config.Config;

/**
 * Mutable state of exactly one build attempt: the module graph contributed during
 * {@code make}, the assets produced during {@link #seal()}, errors and warnings, and the
 * dependencies a watcher has to observe.
 * <p>
 * A new compilation is created for every build attempt, including every additional pass and
 * every watch iteration. Collections written during {@code make} are thread-safe because
 * entry builders run concurrently.
 */
public class Compilation {

    private static final Logger log = LoggerFactory.getLogger(Compilation.class);

    public final CompilationHooks hooks;

    private final Compiler compiler;
    private final String name;
    private final CompilationParams params;
    private final Records records;
    private final Map<String, Long> fileTimestamps;
    private final Map<String, Long> contextTimestamps;

    private final Set<String> fileDependencies = ConcurrentHashMap.newKeySet();
    private final Set<String> contextDependencies = ConcurrentHashMap.newKeySet();
    private final Set<String> missingDependencies = ConcurrentHashMap.newKeySet();
    private final List<Module> modules = new CopyOnWriteArrayList<>();
    private final Map<String, Module> entrypoints = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Source> assets = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private final List<Throwable> warnings = new CopyOnWriteArrayList<>();
    private final List<Compilation> children = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> childrenCounters = new HashMap<>();

    private volatile boolean sealed;
    private volatile boolean needAdditionalPass;

    /**
     * Creates a compilation for the given compiler. Normally called through
     * {@link Compiler#newCompilation(CompilationParams)}, which also notifies the plugins.
     */
    public Compilation(Compiler compiler, CompilationParams params) {
        this.compiler = compiler;
        this.name = compiler.getName();
        this.params = params;
        this.records = compiler.getRecords();
        this.fileTimestamps = compiler.getFileTimestamps();
        this.contextTimestamps = compiler.getContextTimestamps();
        this.hooks = new CompilationHooks("Compilation(" + (name != null ? name : "main") + ")");
    }

    /**
     * Creates the module for an entry through the params' module factory and registers it
     * under {@code entryName}.
     *
     * @return a future for the created entry module; failed if creation fails or the entry
     *         name is already taken.
     */
    public CompletableFuture<Module> addEntry(String context, Dependency dependency, String entryName) {
        if (sealed) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Cannot add entry '" + entryName + "' to a sealed compilation"));
        }
        return Futures.invoke(() -> params.moduleFactory().create(context, dependency))
                .thenApply(module -> {
                    if (entrypoints.putIfAbsent(entryName, module) != null) {
                        throw new BuildException("Duplicate entry name '" + entryName + "'");
                    }
                    modules.add(module);
                    fileDependencies.addAll(module.fileDependencies());
                    log.debug("Added entry '{}' -> {}", entryName, module.identifier());
                    hooks.succeedEntry.call(module);
                    return module;
                });
    }

    /**
     * Adds a non-entry module contributed by a graph collaborator.
     */
    public void addModule(Module module) {
        modules.add(module);
        fileDependencies.addAll(module.fileDependencies());
    }

    /**
     * Completes the module graph; lets plugins resolve deferred work on the final module list.
     */
    public void finish() {
        hooks.finishModules.call(List.copyOf(modules));
    }

    /**
     * Seals the compilation: after {@code seal}, the asset producers tapped into
     * {@code additionalAssets} run, followed by {@code afterSeal}.
     *
     * @return a future completing when all assets are produced; failed if a producer fails.
     */
    public CompletableFuture<Void> seal() {
        return Futures.invoke(() -> {
            sealed = true;
            hooks.seal.call(this);
            return hooks.additionalAssets.callAsync(this)
                    .thenCompose(ignored -> hooks.afterSeal.callAsync(this));
        });
    }

    /**
     * Adds an asset. Emitting a different source under a name that is already taken is
     * recorded as an error and the first source is kept.
     */
    public void emitAsset(String file, Source source) {
        Source previous = assets.putIfAbsent(file, source);
        if (previous != null && previous != source) {
            errors.add(new BuildException("Conflict: Multiple assets emit different content to the same filename " + file));
        }
    }

    /**
     * Replaces or adds an asset without conflict checks.
     */
    public void updateAsset(String file, Source source) {
        assets.put(file, source);
    }

    /**
     * Creates a child compiler whose spawn index is the number of children created under the
     * same name by this compilation so far.
     *
     * @param compilerName    the child name; its records are stored under this name.
     * @param outputOverrides output keys that differ from the parent, may be empty.
     * @param plugins         plugins to apply to the child.
     */
    public Compiler createChildCompiler(String compilerName, Config outputOverrides, List<Plugin> plugins) {
        int index;
        synchronized (childrenCounters) {
            index = childrenCounters.getOrDefault(compilerName, 0);
            childrenCounters.put(compilerName, index + 1);
        }
        return compiler.createChildCompiler(this, compilerName, index, outputOverrides, plugins);
    }

    /**
     * Substitutes {@code [name]} in a path template with the compiler name.
     */
    public String getPath(String template) {
        if (template == null) {
            return null;
        }
        return template.replace("[name]", name != null ? name : "main");
    }

    void addChild(Compilation child) {
        children.add(child);
    }

    public Compiler getCompiler() {
        return compiler;
    }

    /**
     * @return the compiler name, {@code null} for an unnamed top-level compiler.
     */
    public String getName() {
        return name;
    }

    public CompilationParams getParams() {
        return params;
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

    public Set<String> getCompilationDependencies() {
        return params.compilationDependencies();
    }

    public Set<String> getFileDependencies() {
        return fileDependencies;
    }

    public Set<String> getContextDependencies() {
        return contextDependencies;
    }

    public Set<String> getMissingDependencies() {
        return missingDependencies;
    }

    public List<Module> getModules() {
        return Collections.unmodifiableList(modules);
    }

    /**
     * @return a snapshot of entry name to entry module, in insertion order.
     */
    public Map<String, Module> getEntrypoints() {
        synchronized (entrypoints) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(entrypoints));
        }
    }

    /**
     * @return the live asset map (asset name to source).
     */
    public Map<String, Source> getAssets() {
        return assets;
    }

    /**
     * @return names of the assets written by the last emission.
     */
    public List<String> getEmittedAssets() {
        List<String> emitted = new ArrayList<>();
        synchronized (assets) {
            assets.forEach((file, source) -> {
                if (source.isEmitted()) {
                    emitted.add(file);
                }
            });
        }
        return emitted;
    }

    public List<Throwable> getErrors() {
        return errors;
    }

    public List<Throwable> getWarnings() {
        return warnings;
    }

    public List<Compilation> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isSealed() {
        return sealed;
    }

    public boolean isNeedAdditionalPass() {
        return needAdditionalPass;
    }

    void setNeedAdditionalPass(boolean needAdditionalPass) {
        this.needAdditionalPass = needAdditionalPass;
    }
}
