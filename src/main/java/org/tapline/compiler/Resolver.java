package org.tapline.compiler;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves a request to an absolute resource path. Supplied by collaborators.
 */
@FunctionalInterface
public interface Resolver {

    /**
     * @return a future for the resolved absolute path; failed if the request cannot be resolved.
     */
    CompletableFuture<String> resolve(String context, String request);
}
