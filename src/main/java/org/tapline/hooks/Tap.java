package org.tapline.hooks;

import java.util.Objects;

/**
 * A handler registered on a hook.
 *
 * @param name    the name of the plugin or component that registered the handler, used in logs.
 * @param handler the handler function; its shape depends on the hook discipline.
 * @param <F>     the handler function type.
 */
public record Tap<F>(String name, F handler) {

    public Tap {
        Objects.requireNonNull(name, "tap name");
        Objects.requireNonNull(handler, "tap handler");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Tap name must not be blank");
        }
    }
}
