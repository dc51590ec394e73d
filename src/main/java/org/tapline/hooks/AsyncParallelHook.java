package org.tapline.hooks;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.tapline.util.Futures;

/**
 * Starts every tap without waiting for the others and completes once all of them have
 * completed. If taps fail, the first failure in completion order becomes the hook's
 * failure. Taps that are already running are never cancelled; the hook still waits for
 * them before reporting the failure.
 *
 * @param <T> the argument type.
 */
public class AsyncParallelHook<T> extends AsyncHook<T> {

    public AsyncParallelHook(String name, String... argNames) {
        super(name, HookType.ASYNC_PARALLEL, argNames);
    }

    @Override
    public CompletableFuture<Void> callAsync(T arg) {
        List<Tap<Function<T, CompletionStage<Void>>>> taps = getTaps();
        if (taps.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        CompletableFuture<?>[] running = new CompletableFuture<?>[taps.size()];
        for (int i = 0; i < taps.size(); i++) {
            // the derived future completes only after the failure has been recorded
            running[i] = invoke(taps.get(i), arg).whenComplete((ignored, error) -> {
                if (error != null) {
                    firstFailure.compareAndSet(null, Futures.unwrap(error));
                }
            });
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        CompletableFuture.allOf(running).whenComplete((ignored, error) -> {
            Throwable failure = firstFailure.get();
            if (failure != null) {
                result.completeExceptionally(failure);
            } else {
                result.complete(null);
            }
        });
        return result;
    }
}
