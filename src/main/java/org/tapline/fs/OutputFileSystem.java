package org.tapline.fs;

import java.io.IOException;

/**
 * Write side of the filesystem adapter used for asset and records emission.
 * <p>
 * Implementations must allow concurrent calls for different paths.
 */
public interface OutputFileSystem {

    /**
     * Writes (creates or replaces) a file. The parent directory must exist.
     */
    void writeFile(String path, byte[] content) throws IOException;

    /**
     * Creates a directory and all missing parents. Existing directories are not an error.
     */
    void mkdirp(String path) throws IOException;

    /**
     * Joins a base directory and a relative path using this filesystem's notation.
     */
    String join(String base, String relative);
}
