package org.tapline.compiler.options;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.typesafe.config.Config;

/**
 * The {@code watchOptions} section.
 *
 * @param aggregateTimeout delay after the first change before a rebuild starts; further
 *                         changes within this window are folded into the same rebuild.
 * @param poll             interval between modification-time checks of the polling watcher.
 * @param ignored          path patterns that never trigger a rebuild.
 */
public record WatchOptions(Duration aggregateTimeout, Duration poll, List<Pattern> ignored) {

    public static WatchOptions fromConfig(Config config) {
        return new WatchOptions(
                config.getDuration("aggregateTimeout"),
                config.getDuration("poll"),
                config.getStringList("ignored").stream()
                        .map(Pattern::compile)
                        .collect(Collectors.toList()));
    }

    /**
     * @return {@code true} if the path matches one of the ignore patterns.
     */
    public boolean isIgnored(String path) {
        for (Pattern pattern : ignored) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }
}
