package org.tapline.watch;

import java.util.Map;
import java.util.Set;

/**
 * Aggregated changes reported by a {@link Watcher} once the aggregate timeout has elapsed.
 *
 * @param changedFiles      files and directories whose modification time changed.
 * @param removedFiles      watched files that disappeared.
 * @param fileTimestamps    modification time of every watched file that exists.
 * @param contextTimestamps modification time of every watched directory that exists.
 */
public record ChangeSet(Set<String> changedFiles,
                        Set<String> removedFiles,
                        Map<String, Long> fileTimestamps,
                        Map<String, Long> contextTimestamps) {

    public ChangeSet {
        changedFiles = Set.copyOf(changedFiles);
        removedFiles = Set.copyOf(removedFiles);
        fileTimestamps = Map.copyOf(fileTimestamps);
        contextTimestamps = Map.copyOf(contextTimestamps);
    }
}
