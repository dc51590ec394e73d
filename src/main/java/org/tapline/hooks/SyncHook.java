package org.tapline.hooks;

import java.util.function.Consumer;

/**
 * Calls every tap in registration order. An exception thrown by a tap propagates to the
 * caller and the remaining taps are not invoked.
 *
 * @param <T> the argument type; {@link Void} for hooks without arguments.
 */
public class SyncHook<T> extends Hook<Consumer<T>> {

    public SyncHook(String name, String... argNames) {
        super(name, HookType.SYNC, argNames);
    }

    public void tap(String tapName, Consumer<T> handler) {
        addTap(new Tap<>(tapName, handler));
    }

    public void call(T arg) {
        for (Tap<Consumer<T>> tap : getTaps()) {
            tap.handler().accept(arg);
        }
    }
}
