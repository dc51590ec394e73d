package org.tapline.hooks;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

import org.tapline.util.Futures;

/**
 * Common registration API of the asynchronous disciplines.
 * <p>
 * Taps either complete synchronously ({@link #tap(String, Consumer)}) or return a
 * completion stage ({@link #tapAsync(String, Function)}). A tap that throws instead of
 * returning a failed stage is treated as a failed tap.
 *
 * @param <T> the argument type; {@link Void} for hooks without arguments.
 */
public abstract class AsyncHook<T> extends Hook<Function<T, CompletionStage<Void>>> {

    protected AsyncHook(String name, HookType type, String... argNames) {
        super(name, type, argNames);
    }

    public void tap(String tapName, Consumer<T> handler) {
        addTap(new Tap<>(tapName, arg -> {
            handler.accept(arg);
            return CompletableFuture.completedFuture(null);
        }));
    }

    public void tapAsync(String tapName, Function<T, CompletionStage<Void>> handler) {
        addTap(new Tap<>(tapName, handler));
    }

    /**
     * Dispatches the call according to the hook's discipline.
     *
     * @return a future completing when the dispatch has finished; failed with the tap's own
     *         exception when a tap fails.
     */
    public abstract CompletableFuture<Void> callAsync(T arg);

    protected static <T> CompletableFuture<Void> invoke(Tap<Function<T, CompletionStage<Void>>> tap, T arg) {
        return Futures.invoke(() -> tap.handler().apply(arg));
    }
}
