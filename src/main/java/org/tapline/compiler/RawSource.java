package org.tapline.compiler;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Textual asset content, written as UTF-8.
 */
public class RawSource extends Source {

    private final String text;

    public RawSource(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String text() {
        return text;
    }

    @Override
    public byte[] buffer() {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "RawSource[" + text.length() + " chars]";
    }
}
