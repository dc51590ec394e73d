package org.tapline.compiler;

import java.util.Set;

import org.tapline.hooks.AsyncParallelHook;
import org.tapline.hooks.AsyncSeriesHook;
import org.tapline.hooks.HookRegistry;
import org.tapline.hooks.SyncBailHook;
import org.tapline.hooks.SyncHook;

/**
 * The hooks of a {@link Compiler}, in the order a one-shot build calls them:
 * <pre>
 * beforeRun → run → (read records) → beforeCompile → compile → thisCompilation → compilation
 *   → make → (finish, seal) → afterCompile → shouldEmit → emit → afterEmit
 *   → [additionalPass → beforeCompile ...] → (emit records) → done
 * </pre>
 * Watch mode calls {@code watchRun} instead of {@code beforeRun}/{@code run}.
 */
public final class CompilerHooks {

    /** Hooks whose taps a child compiler does not inherit from its parent. */
    public static final Set<String> NOT_INHERITED_BY_CHILDREN = Set.of(
            "make", "compile", "emit", "afterEmit", "invalid", "done", "thisCompilation");

    private final HookRegistry registry;

    /** Returning {@code FALSE} skips emission and records for this build. */
    public final SyncBailHook<Compilation, Boolean> shouldEmit;
    public final AsyncSeriesHook<Stats> done;
    public final AsyncSeriesHook<Void> additionalPass;
    public final AsyncSeriesHook<Compiler> beforeRun;
    public final AsyncSeriesHook<Compiler> run;
    public final AsyncSeriesHook<Compilation> emit;
    public final AsyncSeriesHook<Compilation> afterEmit;
    public final SyncHook<Compilation> thisCompilation;
    public final SyncHook<Compilation> compilation;
    public final SyncHook<ModuleFactory> moduleFactory;
    public final AsyncSeriesHook<CompilationParams> beforeCompile;
    public final SyncHook<CompilationParams> compile;
    /** Entry builders; all taps run concurrently. */
    public final AsyncParallelHook<Compilation> make;
    public final AsyncSeriesHook<Compilation> afterCompile;
    public final AsyncSeriesHook<Compiler> watchRun;
    public final SyncHook<Throwable> failed;
    public final SyncHook<InvalidEvent> invalid;
    public final SyncHook<Void> watchClose;
    public final SyncHook<Void> environment;
    public final SyncHook<Void> afterEnvironment;
    public final SyncHook<Compiler> afterPlugins;
    public final SyncBailHook<EntryOption, Boolean> entryOption;

    CompilerHooks(String owner) {
        registry = new HookRegistry(owner);
        shouldEmit = registry.register(new SyncBailHook<>("shouldEmit", "compilation"));
        done = registry.register(new AsyncSeriesHook<>("done", "stats"));
        additionalPass = registry.register(new AsyncSeriesHook<>("additionalPass"));
        beforeRun = registry.register(new AsyncSeriesHook<>("beforeRun", "compiler"));
        run = registry.register(new AsyncSeriesHook<>("run", "compiler"));
        emit = registry.register(new AsyncSeriesHook<>("emit", "compilation"));
        afterEmit = registry.register(new AsyncSeriesHook<>("afterEmit", "compilation"));
        thisCompilation = registry.register(new SyncHook<>("thisCompilation", "compilation"));
        compilation = registry.register(new SyncHook<>("compilation", "compilation"));
        moduleFactory = registry.register(new SyncHook<>("moduleFactory", "moduleFactory"));
        beforeCompile = registry.register(new AsyncSeriesHook<>("beforeCompile", "params"));
        compile = registry.register(new SyncHook<>("compile", "params"));
        make = registry.register(new AsyncParallelHook<>("make", "compilation"));
        afterCompile = registry.register(new AsyncSeriesHook<>("afterCompile", "compilation"));
        watchRun = registry.register(new AsyncSeriesHook<>("watchRun", "compiler"));
        failed = registry.register(new SyncHook<>("failed", "error"));
        invalid = registry.register(new SyncHook<>("invalid", "filename", "changeTime"));
        watchClose = registry.register(new SyncHook<>("watchClose"));
        environment = registry.register(new SyncHook<>("environment"));
        afterEnvironment = registry.register(new SyncHook<>("afterEnvironment"));
        afterPlugins = registry.register(new SyncHook<>("afterPlugins", "compiler"));
        entryOption = registry.register(new SyncBailHook<>("entryOption", "context", "entry"));
    }

    public HookRegistry getRegistry() {
        return registry;
    }
}
