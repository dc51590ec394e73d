package org.tapline.fs;

import java.io.IOException;

/**
 * Read side of the filesystem adapter used by the compiler.
 * <p>
 * Paths are plain strings in the adapter's own notation; callers obtain them through
 * {@link OutputFileSystem#join(String, String)} or configuration.
 */
public interface InputFileSystem {

    /**
     * Returns the modification time of a path.
     *
     * @param path the file or directory.
     * @return the last modification time in epoch milliseconds.
     * @throws java.nio.file.NoSuchFileException if the path does not exist.
     * @throws IOException on any other I/O failure.
     */
    long stat(String path) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException if the file does not exist.
     */
    byte[] readFile(String path) throws IOException;

    /**
     * Drops any cached file state. The default implementation has no cache.
     */
    default void purge() {
    }
}
