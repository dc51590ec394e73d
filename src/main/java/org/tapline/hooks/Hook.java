package org.tapline.hooks;

import java.util.ArrayList;
import java.util.List;

/**
 * A named event-dispatch point with an ordered list of taps.
 * <p>
 * The discipline is chosen by the concrete subclass ({@link SyncHook}, {@link SyncBailHook},
 * {@link AsyncSeriesHook}, {@link AsyncParallelHook}) and never changes. Taps are dispatched
 * in registration order. Every dispatch works on a snapshot of the tap list, so a tap added
 * while a call is in progress is only seen by later calls.
 * <p>
 * When the hook belongs to a locked {@link HookRegistry} (a build is running), new taps are
 * rejected with {@link IllegalStateException}.
 *
 * @param <F> the handler function type accepted by this hook.
 */
public abstract class Hook<F> {

    private final String name;
    private final HookType type;
    private final List<String> argNames;
    private final List<Tap<F>> taps = new ArrayList<>();
    private volatile HookRegistry registry;

    /**
     * @param name     the hook name, unique within its registry.
     * @param type     the dispatch discipline.
     * @param argNames the declared argument names; used for diagnostics only.
     */
    protected Hook(String name, HookType type, String... argNames) {
        this.name = name;
        this.type = type;
        this.argNames = List.of(argNames);
    }

    public String getName() {
        return name;
    }

    public HookType getType() {
        return type;
    }

    public List<String> getArgNames() {
        return argNames;
    }

    /**
     * @return {@code true} if at least one tap is registered.
     */
    public synchronized boolean isUsed() {
        return !taps.isEmpty();
    }

    /**
     * @return a snapshot of the registered taps in registration order.
     */
    public synchronized List<Tap<F>> getTaps() {
        return List.copyOf(taps);
    }

    /**
     * Replaces this hook's taps with a copy of another hook's taps. Used when a child
     * compiler inherits the registrations of its parent.
     *
     * @param other a hook of the same class.
     * @throws IllegalArgumentException if {@code other} uses a different discipline.
     */
    @SuppressWarnings("unchecked")
    public void inheritTaps(Hook<?> other) {
        if (other.getClass() != getClass()) {
            throw new IllegalArgumentException(String.format(
                    "Cannot inherit taps of %s into %s", other, this));
        }
        List<Tap<F>> inherited = ((Hook<F>) other).getTaps();
        checkOpen("<inherited>");
        synchronized (this) {
            taps.clear();
            taps.addAll(inherited);
        }
    }

    /**
     * Appends a tap, enforcing the registry lock.
     */
    protected void addTap(Tap<F> tap) {
        checkOpen(tap.name());
        synchronized (this) {
            taps.add(tap);
        }
    }

    void attach(HookRegistry owner) {
        if (this.registry != null && this.registry != owner) {
            throw new IllegalStateException("Hook '" + name + "' already belongs to registry " + this.registry.getOwner());
        }
        this.registry = owner;
    }

    private void checkOpen(String tapName) {
        HookRegistry owner = registry;
        if (owner != null && owner.isLocked()) {
            throw new IllegalStateException(String.format(
                    "Cannot tap '%s' into hook %s of %s while a build is running",
                    tapName, this, owner.getOwner()));
        }
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", argNames) + ")[" + type + "]";
    }
}
