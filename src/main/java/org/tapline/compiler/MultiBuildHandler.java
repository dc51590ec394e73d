package org.tapline.compiler;

/**
 * Receives the outcome of a {@link MultiWatching}: a failure of any compiler, or the stats
 * once every compiler has finished its current build.
 */
@FunctionalInterface
public interface MultiBuildHandler {

    void handle(Throwable error, MultiStats stats);
}
