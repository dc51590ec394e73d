package org.tapline.compiler;

/**
 * Content of an emitted asset plus its emission bookkeeping.
 * <p>
 * {@code existsAt} is the absolute path the content was last written to. A plugin that keeps
 * returning the same {@code Source} instance for unchanged output across rebuilds therefore
 * avoids rewriting the file: emission skips a source whose {@code existsAt} already equals
 * the target path and clears its {@code emitted} flag.
 */
public abstract class Source {

    private volatile String existsAt;
    private volatile boolean emitted;

    /**
     * @return the content as bytes, ready to be written.
     */
    public abstract byte[] buffer();

    /**
     * @return the content size in bytes.
     */
    public int size() {
        return buffer().length;
    }

    public String getExistsAt() {
        return existsAt;
    }

    public void setExistsAt(String existsAt) {
        this.existsAt = existsAt;
    }

    /**
     * @return {@code true} if the last emission wrote this source.
     */
    public boolean isEmitted() {
        return emitted;
    }

    public void setEmitted(boolean emitted) {
        this.emitted = emitted;
    }
}
