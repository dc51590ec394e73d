package org.tapline.compiler;

import java.util.List;

/**
 * Report of one finished compilation, handed to the {@code done} hook and to callers.
 * Formatting reports for humans is left to consumers.
 */
public class Stats {

    private final Compilation compilation;
    private final long startTime;
    private final long endTime;

    public Stats(Compilation compilation, long startTime, long endTime) {
        this.compilation = compilation;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public Compilation getCompilation() {
        return compilation;
    }

    /**
     * @return build start in epoch milliseconds.
     */
    public long getStartTime() {
        return startTime;
    }

    /**
     * @return build end in epoch milliseconds.
     */
    public long getEndTime() {
        return endTime;
    }

    public long getDuration() {
        return endTime - startTime;
    }

    public boolean hasErrors() {
        return !compilation.getErrors().isEmpty();
    }

    public boolean hasWarnings() {
        return !compilation.getWarnings().isEmpty();
    }

    /**
     * @return a one-line summary such as {@code main: 3 assets (2 emitted), 0 errors, 1 warnings in 42 ms}.
     */
    public String toSummary() {
        List<String> emitted = compilation.getEmittedAssets();
        String label = compilation.getName() != null ? compilation.getName() : "build";
        return String.format("%s: %d assets (%d emitted), %d errors, %d warnings in %d ms%s",
                label,
                compilation.getAssets().size(),
                emitted.size(),
                compilation.getErrors().size(),
                compilation.getWarnings().size(),
                getDuration(),
                compilation.isNeedAdditionalPass() ? " (additional pass pending)" : "");
    }

    @Override
    public String toString() {
        return toSummary();
    }
}
