package org.tapline.compiler.options;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;

/**
 * Immutable, validated view of one build configuration (the {@code tapline} section of the
 * HOCON configuration).
 * <p>
 * Missing keys fall back to the defaults in {@code reference.conf}. Relative paths are
 * resolved against {@link #context()}.
 * <p>
 * Configuration keys:
 * <ul>
 *   <li>{@code context} - project directory, default {@code "."}</li>
 *   <li>{@code name} - optional compiler name</li>
 *   <li>{@code entry} - map of entry name to request</li>
 *   <li>{@code output.path}, {@code output.filename}</li>
 *   <li>{@code records.path} (sets both), {@code records.inputPath}, {@code records.outputPath}</li>
 *   <li>{@code watch}, {@code watchOptions.*}</li>
 *   <li>{@code maxAdditionalPasses} - safety cap, {@code 0} means unbounded</li>
 *   <li>{@code plugins} - list of {@code { className, options }} blocks</li>
 *   <li>{@code compilers} - optional list of configurations, see {@link #listFromApplicationConfig}</li>
 * </ul>
 */
public final class CompilerOptions {

    private static final String ROOT = "tapline";

    private final Config config;
    private final String context;
    private final String name;
    private final Map<String, String> entry;
    private final OutputOptions output;
    private final String recordsInputPath;
    private final String recordsOutputPath;
    private final boolean watch;
    private final WatchOptions watchOptions;
    private final int maxAdditionalPasses;
    private final List<Config> plugins;

    private CompilerOptions(Config config, OutputOptions output) {
        this.config = config;
        this.context = Paths.get(config.getString("context")).toAbsolutePath().normalize().toString();
        this.name = config.hasPath("name") ? config.getString("name") : null;
        this.entry = readEntry(config);
        this.output = output != null ? output : OutputOptions.fromConfig(config.getConfig("output"), context);
        String recordsPath = config.hasPath("records.path") ? config.getString("records.path") : null;
        this.recordsInputPath = absolute(config.hasPath("records.inputPath")
                ? config.getString("records.inputPath") : recordsPath);
        this.recordsOutputPath = absolute(config.hasPath("records.outputPath")
                ? config.getString("records.outputPath") : recordsPath);
        this.watch = config.getBoolean("watch");
        this.watchOptions = WatchOptions.fromConfig(config.getConfig("watchOptions"));
        this.maxAdditionalPasses = config.getInt("maxAdditionalPasses");
        if (maxAdditionalPasses < 0) {
            throw new IllegalArgumentException("maxAdditionalPasses must not be negative: " + maxAdditionalPasses);
        }
        List<Config> pluginConfigs = new ArrayList<>();
        for (Config plugin : config.getConfigList("plugins")) {
            if (!plugin.hasPath("className")) {
                throw new IllegalArgumentException("Plugin entry without className: " + plugin.root().render());
            }
            pluginConfigs.add(plugin);
        }
        this.plugins = Collections.unmodifiableList(pluginConfigs);
    }

    /**
     * Builds options from a {@code tapline} section; absent keys take the classpath defaults.
     *
     * @param config the {@code tapline} section (not the application root).
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     * @throws IllegalArgumentException            if a value is out of range.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config merged = config.withFallback(ConfigFactory.defaultReference().getConfig(ROOT)).resolve();
        return new CompilerOptions(merged, null);
    }

    /**
     * Builds options from a full application configuration as returned by the config loader.
     */
    public static CompilerOptions fromApplicationConfig(Config applicationConfig) {
        return fromConfig(applicationConfig.hasPath(ROOT) ? applicationConfig.getConfig(ROOT) : ConfigFactory.empty());
    }

    /**
     * Builds one set of options per configuration. Without {@code tapline.compilers} this is
     * the single configuration of {@link #fromApplicationConfig}. Otherwise each element of
     * that list is one configuration; keys it leaves out are taken from the rest of the
     * {@code tapline} section, except {@code entry} and {@code name}.
     *
     * @throws IllegalArgumentException if the list is empty, or if two configurations write
     *                                  the same records file.
     */
    public static List<CompilerOptions> listFromApplicationConfig(Config applicationConfig) {
        Config section = applicationConfig.hasPath(ROOT) ? applicationConfig.getConfig(ROOT) : ConfigFactory.empty();
        if (!section.hasPath("compilers")) {
            return List.of(fromConfig(section));
        }
        List<? extends Config> configs = section.getConfigList("compilers");
        if (configs.isEmpty()) {
            throw new IllegalArgumentException("compilers must list at least one configuration");
        }
        Config shared = section.withoutPath("compilers").withoutPath("entry").withoutPath("name");
        List<CompilerOptions> result = new ArrayList<>(configs.size());
        Map<String, Integer> recordsOwners = new HashMap<>();
        for (Config config : configs) {
            CompilerOptions options = fromConfig(config.withFallback(shared));
            String records = options.recordsOutputPath();
            if (records != null) {
                Integer previous = recordsOwners.putIfAbsent(records, result.size());
                if (previous != null) {
                    throw new IllegalArgumentException(String.format(
                            "compilers %d and %d both write records to %s", previous, result.size(), records));
                }
            }
            result.add(options);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return options made only of the classpath defaults.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Returns a copy whose output section is layered: keys of {@code overrides} win, all other
     * output keys are inherited from these options. Used for child compilers, which keep
     * their records inside the parent's store and therefore get no records paths.
     */
    public CompilerOptions withOutput(Config overrides) {
        return new CompilerOptions(config.withoutPath("records"), output.withOverrides(overrides, context));
    }

    public Config config() {
        return config;
    }

    public String context() {
        return context;
    }

    /**
     * @return the configured compiler name, or {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * @return entry name to request, sorted by name.
     */
    public Map<String, String> entry() {
        return entry;
    }

    public OutputOptions output() {
        return output;
    }

    /**
     * @return absolute path of the records file to read, or {@code null}.
     */
    public String recordsInputPath() {
        return recordsInputPath;
    }

    /**
     * @return absolute path of the records file to write, or {@code null}.
     */
    public String recordsOutputPath() {
        return recordsOutputPath;
    }

    public boolean watch() {
        return watch;
    }

    public WatchOptions watchOptions() {
        return watchOptions;
    }

    /**
     * @return the additional-pass cap, {@code 0} for unbounded.
     */
    public int maxAdditionalPasses() {
        return maxAdditionalPasses;
    }

    public List<Config> plugins() {
        return plugins;
    }

    private String absolute(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        if (OutputOptions.isAbsolute(path)) {
            return path;
        }
        return Paths.get(context).resolve(path).normalize().toString();
    }

    private static Map<String, String> readEntry(Config config) {
        if (!config.hasPath("entry")) {
            return Map.of();
        }
        // ConfigObject does not keep declaration order
        Map<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, ConfigValue> e : config.getObject("entry").entrySet()) {
            sorted.put(e.getKey(), String.valueOf(e.getValue().unwrapped()));
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(sorted));
    }
}
