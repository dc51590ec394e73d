package org.tapline.compiler;

import java.util.List;

/**
 * Result of a child compiler run.
 *
 * @param entries     the entry modules the child produced, to be added to the parent's output.
 * @param compilation the child compilation, already registered with the parent.
 */
public record ChildCompilation(List<Module> entries, Compilation compilation) {
}
