package org.tapline.compiler.options;

import java.nio.file.Paths;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;

/**
 * The {@code output} section of the compiler options.
 *
 * @param path     absolute output directory; may contain the {@code [name]} placeholder.
 * @param filename file name template for entry assets.
 * @param config   the raw section, kept so plugins can read their own output keys and so
 *                 child compilers can layer overrides on top of it.
 */
public record OutputOptions(String path, String filename, Config config) {

    static OutputOptions fromConfig(Config config, String context) {
        String path = config.getString("path");
        if (!isAbsolute(path)) {
            path = Paths.get(context).resolve(path).normalize().toString();
        }
        return new OutputOptions(path, config.getString("filename"), config);
    }

    /**
     * Returns output options where every key of {@code overrides} replaces the value of
     * this configuration; keys not overridden are inherited.
     */
    public OutputOptions withOverrides(Config overrides, String context) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Config layered = overrides.withFallback(config.withValue("path", ConfigValueFactory.fromAnyRef(path)));
        return fromConfig(layered.resolve(), context);
    }

    static boolean isAbsolute(String path) {
        return path.startsWith("/") || path.startsWith("\\") || path.matches("^[a-zA-Z]:[\\\\/].*");
    }
}
