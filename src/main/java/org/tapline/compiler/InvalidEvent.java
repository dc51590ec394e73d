package org.tapline.compiler;

/**
 * Argument of the {@code invalid} compiler hook.
 *
 * @param fileName   the changed path.
 * @param changeTime its modification time in epoch milliseconds.
 */
public record InvalidEvent(String fileName, long changeTime) {
}
