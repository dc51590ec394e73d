package org.tapline.fs;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory filesystem using {@code /} separated absolute paths.
 * <p>
 * Useful as an output target when the produced assets are consumed by the same process,
 * and as a deterministic filesystem in tests. Modification times are taken from a logical
 * clock that advances on every write.
 */
public class MemoryFileSystem implements InputFileSystem, OutputFileSystem {

    private final Map<String, byte[]> files = new ConcurrentHashMap<>();
    private final Map<String, Long> modified = new ConcurrentHashMap<>();
    private final Set<String> directories = ConcurrentHashMap.newKeySet();
    private final AtomicLong clock = new AtomicLong();

    public MemoryFileSystem() {
        directories.add("/");
    }

    @Override
    public long stat(String path) throws IOException {
        String normalized = normalize(path);
        Long time = modified.get(normalized);
        if (time != null) {
            return time;
        }
        if (directories.contains(normalized)) {
            return 0L;
        }
        throw new NoSuchFileException(normalized);
    }

    @Override
    public byte[] readFile(String path) throws IOException {
        String normalized = normalize(path);
        byte[] content = files.get(normalized);
        if (content == null) {
            throw new NoSuchFileException(normalized);
        }
        return content.clone();
    }

    @Override
    public void writeFile(String path, byte[] content) throws IOException {
        String normalized = normalize(path);
        String parent = parentOf(normalized);
        if (!directories.contains(parent)) {
            throw new NoSuchFileException(parent, null, "parent directory does not exist");
        }
        if (directories.contains(normalized)) {
            throw new IOException("Is a directory: " + normalized);
        }
        files.put(normalized, content.clone());
        modified.put(normalized, clock.incrementAndGet());
    }

    @Override
    public void mkdirp(String path) throws IOException {
        String normalized = normalize(path);
        Deque<String> missing = new ArrayDeque<>();
        for (String dir = normalized; !directories.contains(dir); dir = parentOf(dir)) {
            if (files.containsKey(dir)) {
                throw new IOException("Not a directory: " + dir);
            }
            missing.push(dir);
        }
        while (!missing.isEmpty()) {
            directories.add(missing.pop());
        }
    }

    @Override
    public String join(String base, String relative) {
        if (relative.startsWith("/")) {
            return normalize(relative);
        }
        return normalize(base + "/" + relative);
    }

    /**
     * @return {@code true} if a file (not a directory) exists at the path.
     */
    public boolean exists(String path) {
        return files.containsKey(normalize(path));
    }

    public boolean isDirectory(String path) {
        return directories.contains(normalize(path));
    }

    /**
     * @return the sorted set of all file paths.
     */
    public Set<String> listFiles() {
        return new TreeSet<>(files.keySet());
    }

    static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Path must not be empty");
        }
        String unified = path.replace('\\', '/');
        if (!unified.startsWith("/")) {
            throw new IllegalArgumentException("MemoryFileSystem only supports absolute paths: " + path);
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return "/" + String.join("/", segments);
    }

    private static String parentOf(String normalized) {
        int idx = normalized.lastIndexOf('/');
        return idx <= 0 ? "/" : normalized.substring(0, idx);
    }
}
