package org.tapline.watch;

import java.util.Map;

/**
 * Subscription returned by {@link WatchFileSystem#watch}.
 */
public interface Watcher {

    /**
     * Stops reporting changes but keeps tracking timestamps.
     */
    void pause();

    /**
     * Releases the subscription. Idempotent.
     */
    void close();

    /**
     * @return the latest known modification time of every watched file that exists.
     */
    Map<String, Long> getFileTimestamps();

    /**
     * @return the latest known modification time of every watched directory that exists.
     */
    Map<String, Long> getContextTimestamps();
}
