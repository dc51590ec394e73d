package org.tapline.compiler;

import java.util.Objects;

/**
 * A request for a module, such as an entry point.
 *
 * @param request the unresolved request string, e.g. {@code ./src/index.js}.
 */
public record Dependency(String request) {

    public Dependency {
        Objects.requireNonNull(request, "request");
    }
}
