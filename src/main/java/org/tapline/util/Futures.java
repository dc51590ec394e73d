package org.tapline.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Small helpers around {@link CompletableFuture} used by the hook dispatchers and the
 * compiler pipeline.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips the {@link CompletionException} / {@link ExecutionException} wrappers that
     * completion stages add around the original failure.
     *
     * @param error the failure as observed by a stage callback.
     * @return the innermost meaningful cause, never null if {@code error} is not null.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Runs a stage factory, turning a synchronous exception into a failed future.
     *
     * @param action the code producing a completion stage.
     * @param <T>    the stage result type.
     * @return the produced stage as a future, or a failed future if {@code action} threw.
     */
    public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> action) {
        try {
            CompletionStage<T> stage = action.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException | Error e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Returns a future that completes like {@code stage}, except that a failure carries the
     * original exception instead of a {@link CompletionException} wrapper.
     */
    public static <T> CompletableFuture<T> unwrapped(CompletionStage<T> stage) {
        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }
}
