package org.tapline.compiler;

/**
 * Extension point: a plugin taps into the hooks of a compiler (and, through the
 * {@code compilation} hooks, of every compilation it creates).
 * <p>
 * Plugins are applied before the first build; taps added while a build is running are
 * rejected.
 */
@FunctionalInterface
public interface Plugin {

    void apply(Compiler compiler);
}
