package org.tapline.compiler.plugins;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;

import org.tapline.compiler.Compiler;
import org.tapline.compiler.Dependency;
import org.tapline.compiler.Module;
import org.tapline.compiler.ModuleFactory;
import org.tapline.compiler.ResolverFactory;

/**
 * Module factory that resolves a request with the compiler's {@code normal} resolver and
 * loads the resolved file through the compiler's input file system.
 */
public class FileModuleFactory implements ModuleFactory {

    private final Compiler compiler;

    public FileModuleFactory(Compiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public CompletableFuture<Module> create(String context, Dependency dependency) {
        return compiler.getResolverFactory().get(ResolverFactory.NORMAL)
                .resolve(context, dependency.request())
                .thenApply(this::load);
    }

    private Module load(String path) {
        try {
            return new FileModule(path, compiler.getInputFileSystem().readFile(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load module " + path, e);
        }
    }
}
