package org.tapline;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.compiler.Plugin;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Instantiates the plugins listed in the {@code plugins} configuration.
 * <p>
 * Each block names a {@code className} and optional {@code options}. A plugin class either
 * has a public constructor taking the options {@link Config}, or a public no-argument
 * constructor.
 */
public final class PluginLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    private PluginLoader() {
    }

    /**
     * @param pluginConfigs the configured plugin blocks, in application order.
     * @return the instantiated plugins in the same order.
     * @throws IllegalArgumentException if a plugin cannot be instantiated.
     */
    public static List<Plugin> load(List<? extends Config> pluginConfigs) {
        List<Plugin> plugins = new ArrayList<>(pluginConfigs.size());
        for (Config pluginConfig : pluginConfigs) {
            plugins.add(create(pluginConfig));
        }
        return plugins;
    }

    /**
     * Creates one plugin from its configuration block.
     *
     * @param pluginConfig a block with {@code className} and optional {@code options}.
     * @return the plugin instance.
     * @throws IllegalArgumentException if the class is missing, is not a {@link Plugin}, or
     *                                  cannot be instantiated.
     */
    public static Plugin create(Config pluginConfig) {
        if (!pluginConfig.hasPath("className")) {
            throw new IllegalArgumentException("Plugin configuration without className: " + pluginConfig.root().render());
        }
        String className = pluginConfig.getString("className");
        Config options = pluginConfig.hasPath("options")
                ? pluginConfig.getConfig("options")
                : ConfigFactory.empty();
        Class<?> clazz;
        try {
            clazz = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Plugin class not found: " + className, e);
        }
        if (!Plugin.class.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException("Class " + className + " does not implement " + Plugin.class.getName());
        }
        try {
            try {
                Plugin plugin = (Plugin) clazz.getConstructor(Config.class).newInstance(options);
                log.debug("Loaded plugin {} with options", className);
                return plugin;
            } catch (NoSuchMethodException e) {
                Plugin plugin = (Plugin) clazz.getConstructor().newInstance();
                log.debug("Loaded plugin {}", className);
                return plugin;
            }
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate plugin: " + className, e);
        }
    }
}
