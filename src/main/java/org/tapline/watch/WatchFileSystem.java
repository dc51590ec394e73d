package org.tapline.watch;

import java.util.Collection;

import org.tapline.compiler.options.WatchOptions;

/**
 * Change-notification source consumed by the watch loop.
 */
public interface WatchFileSystem {

    /**
     * Starts watching.
     *
     * @param files       files the last build read.
     * @param directories directories the last build listed.
     * @param missing     paths the last build looked for without finding them.
     * @param startTime   start of the last build in epoch milliseconds; paths modified after
     *                    it are reported as changed right away.
     * @param options     aggregate timeout, poll interval and ignore patterns.
     * @param onChange    called once with the aggregated changes, after which the watcher
     *                    stops reporting.
     * @param onInvalid   called for the first change of every path, before aggregation.
     * @return the subscription.
     */
    Watcher watch(Collection<String> files,
                  Collection<String> directories,
                  Collection<String> missing,
                  long startTime,
                  WatchOptions options,
                  ChangeCallback onChange,
                  InvalidCallback onInvalid);

    @FunctionalInterface
    interface ChangeCallback {

        /**
         * @param error   a failure of the watcher itself, or {@code null}.
         * @param changes the aggregated changes; {@code null} if {@code error} is set.
         */
        void onChange(Throwable error, ChangeSet changes);
    }

    @FunctionalInterface
    interface InvalidCallback {

        void onInvalid(String fileName, long changeTime);
    }
}
