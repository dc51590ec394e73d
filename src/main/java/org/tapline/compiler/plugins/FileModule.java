package org.tapline.compiler.plugins;

import java.util.Set;

import org.tapline.compiler.Module;

/**
 * A module backed by a single file, carrying the file's raw content.
 *
 * @param path    absolute path of the file.
 * @param content the file content.
 */
public record FileModule(String path, byte[] content) implements Module {

    public FileModule {
        content = content.clone();
    }

    @Override
    public String identifier() {
        return path;
    }

    @Override
    public Set<String> fileDependencies() {
        return Set.of(path);
    }

    @Override
    public byte[] content() {
        return content.clone();
    }
}
