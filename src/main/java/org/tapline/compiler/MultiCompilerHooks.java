package org.tapline.compiler;

import org.tapline.hooks.HookRegistry;
import org.tapline.hooks.SyncHook;

/**
 * The hooks of a {@link MultiCompiler}. Per-build hooks stay on the individual compilers.
 */
public final class MultiCompilerHooks {

    private final HookRegistry registry = new HookRegistry("MultiCompiler");

    /** Called each time every compiler has finished a build. */
    public final SyncHook<MultiStats> done = registry.register(new SyncHook<>("done", "stats"));
    /** Called when the first compiler of a finished set is invalidated. */
    public final SyncHook<Void> invalid = registry.register(new SyncHook<>("invalid"));
    public final SyncHook<Void> watchClose = registry.register(new SyncHook<>("watchClose"));

    MultiCompilerHooks() {
    }

    public HookRegistry getRegistry() {
        return registry;
    }
}
