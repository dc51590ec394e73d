package org.tapline.compiler;

import java.util.List;

import org.tapline.hooks.AsyncSeriesHook;
import org.tapline.hooks.HookRegistry;
import org.tapline.hooks.SyncBailHook;
import org.tapline.hooks.SyncHook;

/**
 * The hooks of a {@link Compilation}. Plugins tap them from the compiler's
 * {@code thisCompilation}/{@code compilation} hooks, i.e. while the build is running; the
 * registry of a compilation is therefore never locked.
 */
public final class CompilationHooks {

    private final HookRegistry registry;

    /** Called for every entry module once it has been created. */
    public final SyncHook<Module> succeedEntry;
    /** Called by {@link Compilation#finish()} with all modules of the graph. */
    public final SyncHook<List<Module>> finishModules;
    /** Start of sealing; the graph is complete and no more entries may be added. */
    public final SyncHook<Compilation> seal;
    /** Asset producers (chunk graph and code generation collaborators) run here. */
    public final AsyncSeriesHook<Compilation> additionalAssets;
    public final AsyncSeriesHook<Compilation> afterSeal;
    /** Returning {@code TRUE} requests another make/seal pass after emission. */
    public final SyncBailHook<Void, Boolean> needAdditionalPass;
    public final SyncHook<ChildCompilerEvent> childCompiler;

    CompilationHooks(String owner) {
        registry = new HookRegistry(owner);
        succeedEntry = registry.register(new SyncHook<>("succeedEntry", "module"));
        finishModules = registry.register(new SyncHook<>("finishModules", "modules"));
        seal = registry.register(new SyncHook<>("seal", "compilation"));
        additionalAssets = registry.register(new AsyncSeriesHook<>("additionalAssets", "compilation"));
        afterSeal = registry.register(new AsyncSeriesHook<>("afterSeal", "compilation"));
        needAdditionalPass = registry.register(new SyncBailHook<>("needAdditionalPass"));
        childCompiler = registry.register(new SyncHook<>("childCompiler", "childCompiler", "compilerName", "compilerIndex"));
    }

    public HookRegistry getRegistry() {
        return registry;
    }
}
