package org.tapline.compiler;

import java.util.concurrent.CompletableFuture;

/**
 * Creates modules for dependencies. Supplied by the module/graph collaborators; resolution
 * and loading are opaque to the compiler.
 */
@FunctionalInterface
public interface ModuleFactory {

    /**
     * @param context    the directory the request is relative to.
     * @param dependency the dependency to create a module for.
     * @return a future for the created module; failed if resolution or loading fails.
     */
    CompletableFuture<Module> create(String context, Dependency dependency);

    /**
     * @return a factory that fails every request; used until a real factory is configured.
     */
    static ModuleFactory unconfigured() {
        return (context, dependency) -> CompletableFuture.failedFuture(new IllegalStateException(
                "No module factory configured, cannot create module for '" + dependency.request() + "'"));
    }
}
