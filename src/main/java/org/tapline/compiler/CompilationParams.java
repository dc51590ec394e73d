package org.tapline.compiler;

import java.util.Set;

/**
 * Parameters handed to {@code beforeCompile} and {@code compile} and used to construct the
 * compilation.
 *
 * @param moduleFactory           the factory the compilation uses for entries.
 * @param compilationDependencies paths the build depends on besides the module graph; mutable.
 */
public record CompilationParams(ModuleFactory moduleFactory, Set<String> compilationDependencies) {
}
