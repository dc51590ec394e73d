package org.tapline.hooks;

/**
 * The dispatch discipline of a {@link Hook}. Fixed when the hook is constructed.
 */
public enum HookType {
    /** Every tap runs in registration order; no suspension. */
    SYNC(false),
    /** Taps run in order until one returns a non-null result. */
    SYNC_BAIL(false),
    /** Taps run one after another; the first failure stops the chain. */
    ASYNC_SERIES(true),
    /** Taps run concurrently; the hook completes when all of them have completed. */
    ASYNC_PARALLEL(true);

    private final boolean async;

    HookType(boolean async) {
        this.async = async;
    }

    /**
     * @return {@code true} if calling a hook of this type yields a completion stage.
     */
    public boolean isAsync() {
        return async;
    }
}
