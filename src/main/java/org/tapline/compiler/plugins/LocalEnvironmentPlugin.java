package org.tapline.compiler.plugins;

import java.util.concurrent.CompletableFuture;

import org.tapline.compiler.Compiler;
import org.tapline.compiler.Plugin;
import org.tapline.compiler.ResolverFactory;
import org.tapline.fs.LocalFileSystem;
import org.tapline.watch.PollingWatchFileSystem;

/**
 * Installs the local disk as input and output file system, a polling watch file system on
 * top of it, and a {@code normal} resolver that resolves requests against the request
 * context. Every one-shot build purges the input file system first, as long as it is still
 * the one installed here.
 */
public class LocalEnvironmentPlugin implements Plugin {

    private final LocalFileSystem fileSystem;

    public LocalEnvironmentPlugin() {
        this(new LocalFileSystem());
    }

    LocalEnvironmentPlugin(LocalFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    @Override
    public void apply(Compiler compiler) {
        compiler.setInputFileSystem(fileSystem);
        compiler.setOutputFileSystem(fileSystem);
        compiler.setWatchFileSystem(new PollingWatchFileSystem(fileSystem));
        compiler.getResolverFactory().resolver.tap("LocalEnvironmentPlugin", type -> {
            if (!ResolverFactory.NORMAL.equals(type)) {
                return null;
            }
            return (context, request) -> CompletableFuture.completedFuture(fileSystem.join(context, request));
        });
        compiler.hooks.beforeRun.tap("LocalEnvironmentPlugin", c -> {
            if (c.getInputFileSystem() == fileSystem) {
                c.purgeInputFileSystem();
            }
        });
    }
}
