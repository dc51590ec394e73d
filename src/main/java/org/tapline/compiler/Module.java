package org.tapline.compiler;

import java.util.Set;

/**
 * A node of the module graph as produced by a {@link ModuleFactory}. The orchestrator only
 * needs a stable identifier; everything else is owned by the collaborators.
 */
public interface Module {

    /**
     * @return an identifier that is unique within one compilation and stable across builds.
     */
    String identifier();

    /**
     * @return files this module was built from; the watch loop observes them.
     */
    default Set<String> fileDependencies() {
        return Set.of();
    }
}
