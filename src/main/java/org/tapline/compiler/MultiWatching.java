package org.tapline.compiler;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The watch sessions of a {@link MultiCompiler}, one per compiler, handled as one.
 */
public class MultiWatching {

    private static final Logger log = LoggerFactory.getLogger(MultiWatching.class);

    private final MultiCompiler multiCompiler;
    private final List<Watching> watchings;
    private final AtomicBoolean closing = new AtomicBoolean();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    MultiWatching(MultiCompiler multiCompiler, List<Watching> watchings) {
        this.multiCompiler = multiCompiler;
        this.watchings = List.copyOf(watchings);
    }

    /**
     * Invalidates every session.
     */
    public void invalidate() {
        watchings.forEach(Watching::invalidate);
    }

    /**
     * Closes every session. The returned future completes once all of them are closed and
     * the {@code watchClose} hook of the multi compiler has run.
     */
    public CompletableFuture<Void> close() {
        if (!closing.compareAndSet(false, true)) {
            return closeFuture;
        }
        CompletableFuture<?>[] closed = watchings.stream().map(Watching::close).toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(closed).whenComplete((ignored, error) -> {
            try {
                multiCompiler.hooks.watchClose.call(null);
            } catch (RuntimeException e) {
                log.warn("A watchClose hook tap of the multi compiler failed: {}", e.getMessage());
                log.debug("Exception details:", e);
            }
            closeFuture.complete(null);
        });
        return closeFuture;
    }

    /**
     * @return a future completing once the sessions are closed, without closing them.
     */
    public CompletableFuture<Void> whenClosed() {
        return closeFuture;
    }

    public List<Watching> getWatchings() {
        return watchings;
    }
}
