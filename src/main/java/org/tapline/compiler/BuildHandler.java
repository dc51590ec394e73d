package org.tapline.compiler;

/**
 * Receives the outcome of each build of a watch session.
 */
@FunctionalInterface
public interface BuildHandler {

    /**
     * @param error the failure of the build, or {@code null} on success.
     * @param stats the stats of the finished compilation; {@code null} if the build failed
     *              before a compilation was sealed.
     */
    void handle(Throwable error, Stats stats);
}
