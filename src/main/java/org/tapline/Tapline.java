package org.tapline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.compiler.BuildHandler;
import org.tapline.compiler.Compiler;
import org.tapline.compiler.EntryOption;
import org.tapline.compiler.MultiBuildHandler;
import org.tapline.compiler.MultiCompiler;
import org.tapline.compiler.MultiStats;
import org.tapline.compiler.MultiWatching;
import org.tapline.compiler.Plugin;
import org.tapline.compiler.Stats;
import org.tapline.compiler.Watching;
import org.tapline.compiler.options.CompilerOptions;
import org.tapline.compiler.plugins.EntryAssetPlugin;
import org.tapline.compiler.plugins.EntryOptionPlugin;
import org.tapline.compiler.plugins.FileModuleFactory;
import org.tapline.compiler.plugins.LocalEnvironmentPlugin;

/**
 * Entry point for embedding: creates fully wired compilers from options.
 */
public final class Tapline {

    private static final Logger log = LoggerFactory.getLogger(Tapline.class);

    private Tapline() {
    }

    /**
     * Creates a compiler for the local disk and applies the built-in and configured plugins.
     * <p>
     * Order: local environment, file module factory, entry assets, configured plugins,
     * {@code environment}, {@code afterEnvironment}, entries ({@code entryOption}),
     * {@code afterPlugins}.
     *
     * @throws IllegalArgumentException if a configured plugin cannot be instantiated.
     */
    public static Compiler create(CompilerOptions options) {
        Compiler compiler = new Compiler(options);
        new LocalEnvironmentPlugin().apply(compiler);
        compiler.setModuleFactory(new FileModuleFactory(compiler));
        new EntryAssetPlugin().apply(compiler);
        for (Plugin plugin : PluginLoader.load(options.plugins())) {
            plugin.apply(compiler);
        }
        compiler.hooks.environment.call(null);
        compiler.hooks.afterEnvironment.call(null);
        new EntryOptionPlugin().apply(compiler);
        compiler.hooks.entryOption.call(new EntryOption(options.context(), options.entry()));
        compiler.hooks.afterPlugins.call(compiler);
        log.debug("Created compiler for {} with {} entries and {} configured plugins",
                options.context(), options.entry().size(), options.plugins().size());
        return compiler;
    }

    /**
     * Creates a compiler and runs one build.
     */
    public static CompletableFuture<Stats> run(CompilerOptions options) {
        return create(options).run();
    }

    /**
     * Creates a compiler and starts a watch session with the configured watch options.
     */
    public static Watching watch(CompilerOptions options, BuildHandler handler) {
        return create(options).watch(options.watchOptions(), handler);
    }

    /**
     * Creates one compiler per configuration, each wired like {@link #create(CompilerOptions)},
     * and combines them.
     */
    public static MultiCompiler createAll(List<CompilerOptions> options) {
        List<Compiler> compilers = new ArrayList<>(options.size());
        for (CompilerOptions each : options) {
            compilers.add(create(each));
        }
        return new MultiCompiler(compilers);
    }

    /**
     * Runs every configuration once, all at the same time.
     */
    public static CompletableFuture<MultiStats> runAll(List<CompilerOptions> options) {
        return createAll(options).run();
    }

    /**
     * Starts a watch session per configuration, each with its own watch options.
     */
    public static MultiWatching watchAll(List<CompilerOptions> options, MultiBuildHandler handler) {
        return createAll(options).watch(handler);
    }
}
