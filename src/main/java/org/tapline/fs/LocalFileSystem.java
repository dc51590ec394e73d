package org.tapline.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InputFileSystem} and {@link OutputFileSystem} backed by the local disk.
 * <p>
 * Writes go to a temporary sibling file first and are moved into place atomically, so a
 * failing write never leaves a truncated target behind.
 */
public class LocalFileSystem implements InputFileSystem, OutputFileSystem {

    private static final Logger log = LoggerFactory.getLogger(LocalFileSystem.class);

    @Override
    public long stat(String path) throws IOException {
        return Files.getLastModifiedTime(Paths.get(path)).toMillis();
    }

    @Override
    public byte[] readFile(String path) throws IOException {
        return Files.readAllBytes(Paths.get(path));
    }

    @Override
    public void writeFile(String path, byte[] content) throws IOException {
        Path file = Paths.get(path);
        Path parentDir = file.toAbsolutePath().getParent();
        if (parentDir == null || !Files.isDirectory(parentDir)) {
            throw new IOException("Parent directory does not exist for: " + file.toAbsolutePath());
        }

        // Use suffix .UUID.tmp so concurrent writers never share a temp file
        Path tempFile = parentDir.resolve(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tempFile, content);
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
    }

    @Override
    public void mkdirp(String path) throws IOException {
        Files.createDirectories(Paths.get(path));
    }

    @Override
    public String join(String base, String relative) {
        return Paths.get(base).resolve(relative).normalize().toString();
    }
}
