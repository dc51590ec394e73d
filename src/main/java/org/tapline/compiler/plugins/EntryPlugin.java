package org.tapline.compiler.plugins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapline.compiler.Compiler;
import org.tapline.compiler.Dependency;
import org.tapline.compiler.Plugin;

/**
 * Adds one entry to every compilation during {@code make}.
 */
public class EntryPlugin implements Plugin {

    private static final Logger log = LoggerFactory.getLogger(EntryPlugin.class);

    private final String context;
    private final String request;
    private final String name;

    /**
     * @param context the directory the request is relative to.
     * @param request the entry request, e.g. {@code ./src/index.js}.
     * @param name    the entry name.
     */
    public EntryPlugin(String context, String request, String name) {
        this.context = context;
        this.request = request;
        this.name = name;
    }

    @Override
    public void apply(Compiler compiler) {
        compiler.hooks.make.tapAsync("EntryPlugin", compilation -> {
            log.debug("Adding entry '{}' ({})", name, request);
            return compilation.addEntry(context, new Dependency(request), name).thenApply(module -> null);
        });
    }
}
