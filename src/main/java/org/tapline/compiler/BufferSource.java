package org.tapline.compiler;

import java.util.Objects;

/**
 * Binary asset content.
 */
public class BufferSource extends Source {

    private final byte[] content;

    public BufferSource(byte[] content) {
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    @Override
    public byte[] buffer() {
        return content.clone();
    }

    @Override
    public int size() {
        return content.length;
    }

    @Override
    public String toString() {
        return "BufferSource[" + content.length + " bytes]";
    }
}
