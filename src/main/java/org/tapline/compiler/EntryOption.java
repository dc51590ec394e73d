package org.tapline.compiler;

import java.util.Map;

/**
 * Argument of the {@code entryOption} compiler hook.
 *
 * @param context the project directory.
 * @param entry   entry name to request.
 */
public record EntryOption(String context, Map<String, String> entry) {
}
