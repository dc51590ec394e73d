package org.tapline.hooks;

import java.util.function.Function;

/**
 * Calls taps in registration order until one returns a non-null value, which becomes the
 * result of the call. Taps after the bailing one are not invoked. Used for decisions with
 * veto semantics such as {@code shouldEmit}.
 *
 * @param <T> the argument type.
 * @param <R> the result type.
 */
public class SyncBailHook<T, R> extends Hook<Function<T, R>> {

    public SyncBailHook(String name, String... argNames) {
        super(name, HookType.SYNC_BAIL, argNames);
    }

    public void tap(String tapName, Function<T, R> handler) {
        addTap(new Tap<>(tapName, handler));
    }

    /**
     * @return the first non-null tap result, or {@code null} if every tap returned null.
     */
    public R call(T arg) {
        for (Tap<Function<T, R>> tap : getTaps()) {
            R result = tap.handler().apply(arg);
            if (result != null) {
                return result;
            }
        }
        return null;
    }
}
