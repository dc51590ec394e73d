package org.tapline.hooks;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of named hooks owned by one pluggable object (a compiler or a compilation).
 * <p>
 * Hooks are registered once at construction of the owning object. While the registry is
 * {@linkplain #lock() locked} no hook of this registry accepts new taps, which keeps the
 * tap order of a running build fixed.
 */
public final class HookRegistry {

    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    private final String owner;
    private final Map<String, Hook<?>> hooks = new LinkedHashMap<>();
    private volatile boolean locked;

    /**
     * @param owner a human readable owner description used in error messages.
     */
    public HookRegistry(String owner) {
        this.owner = owner;
    }

    public String getOwner() {
        return owner;
    }

    /**
     * Adds a hook to this registry.
     *
     * @param hook the hook to register.
     * @param <H>  the concrete hook type.
     * @return the same hook, for field initialization.
     * @throws IllegalArgumentException if a hook with the same name is already registered.
     */
    public synchronized <H extends Hook<?>> H register(H hook) {
        if (hooks.containsKey(hook.getName())) {
            throw new IllegalArgumentException("Hook '" + hook.getName() + "' is already registered in " + owner);
        }
        hook.attach(this);
        hooks.put(hook.getName(), hook);
        return hook;
    }

    /**
     * @throws IllegalArgumentException if no hook with that name exists.
     */
    public synchronized Hook<?> get(String name) {
        Hook<?> hook = hooks.get(name);
        if (hook == null) {
            throw new IllegalArgumentException("Unknown hook '" + name + "' in " + owner + ", known hooks: " + hooks.keySet());
        }
        return hook;
    }

    public synchronized Optional<Hook<?>> find(String name) {
        return Optional.ofNullable(hooks.get(name));
    }

    /**
     * @return the hook names in registration order.
     */
    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new java.util.LinkedHashSet<>(hooks.keySet()));
    }

    /**
     * Copies the taps of every hook of {@code parent} into the hook of the same name in this
     * registry, skipping the excluded names and names this registry does not have.
     *
     * @param parent   the registry to copy from.
     * @param excluded hook names that must keep their own taps.
     */
    public void inheritFrom(HookRegistry parent, Set<String> excluded) {
        for (String name : parent.names()) {
            if (excluded.contains(name)) {
                continue;
            }
            Optional<Hook<?>> own = find(name);
            if (own.isPresent()) {
                own.get().inheritTaps(parent.get(name));
            } else {
                log.debug("Hook '{}' of {} has no counterpart in {}", name, parent.owner, owner);
            }
        }
    }

    public void lock() {
        locked = true;
    }

    public void unlock() {
        locked = false;
    }

    public boolean isLocked() {
        return locked;
    }
}
