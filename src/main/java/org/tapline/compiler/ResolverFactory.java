package org.tapline.compiler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.tapline.hooks.HookRegistry;
import org.tapline.hooks.SyncBailHook;

/**
 * Hands out resolvers by type ({@code normal}, {@code context}, {@code loader}, ...).
 * <p>
 * Resolvers are contributed by plugins through the {@code resolver} sync-bail hook; the
 * first tap returning a resolver for a type wins and the result is cached. A child compiler
 * shares its parent's factory instance.
 */
public class ResolverFactory {

    public static final String NORMAL = "normal";

    private final HookRegistry registry = new HookRegistry("ResolverFactory");

    /** Provides a resolver for the requested type. */
    public final SyncBailHook<String, Resolver> resolver = registry.register(new SyncBailHook<>("resolver", "type"));

    private final Map<String, Resolver> cache = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if no plugin provides a resolver of that type.
     */
    public Resolver get(String type) {
        return cache.computeIfAbsent(type, t -> {
            Resolver created = resolver.call(t);
            if (created == null) {
                throw new IllegalStateException("No resolver available for type '" + t + "'");
            }
            return created;
        });
    }

    public HookRegistry getRegistry() {
        return registry;
    }
}
