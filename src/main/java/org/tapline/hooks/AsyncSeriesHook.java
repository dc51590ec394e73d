package org.tapline.hooks;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import org.tapline.util.Futures;

/**
 * Runs taps strictly one after another. Each tap must complete before the next one is
 * started; the first failure skips the remaining taps and becomes the hook's failure.
 * Used for sequential lifecycle stages that may perform I/O.
 *
 * @param <T> the argument type; {@link Void} for hooks without arguments.
 */
public class AsyncSeriesHook<T> extends AsyncHook<T> {

    public AsyncSeriesHook(String name, String... argNames) {
        super(name, HookType.ASYNC_SERIES, argNames);
    }

    @Override
    public CompletableFuture<Void> callAsync(T arg) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Tap<Function<T, CompletionStage<Void>>> tap : getTaps()) {
            chain = chain.thenCompose(ignored -> invoke(tap, arg));
        }
        return Futures.unwrapped(chain);
    }
}
