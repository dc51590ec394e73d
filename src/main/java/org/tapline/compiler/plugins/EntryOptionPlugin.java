package org.tapline.compiler.plugins;

import java.util.Map;

import org.tapline.compiler.Compiler;
import org.tapline.compiler.Plugin;

/**
 * Turns the configured entries into one {@link EntryPlugin} each when {@code entryOption}
 * is called.
 */
public class EntryOptionPlugin implements Plugin {

    @Override
    public void apply(Compiler compiler) {
        compiler.hooks.entryOption.tap("EntryOptionPlugin", option -> {
            for (Map.Entry<String, String> entry : option.entry().entrySet()) {
                new EntryPlugin(option.context(), entry.getValue(), entry.getKey()).apply(compiler);
            }
            return Boolean.TRUE;
        });
    }
}
