package org.tapline.compiler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The stats of every compiler of a {@link MultiCompiler}, in configuration order.
 */
public class MultiStats {

    private final List<Stats> stats;

    public MultiStats(List<Stats> stats) {
        this.stats = List.copyOf(stats);
    }

    public List<Stats> getStats() {
        return stats;
    }

    public long getStartTime() {
        return stats.stream().mapToLong(Stats::getStartTime).min().orElse(0L);
    }

    public long getEndTime() {
        return stats.stream().mapToLong(Stats::getEndTime).max().orElse(0L);
    }

    public boolean hasErrors() {
        return stats.stream().anyMatch(Stats::hasErrors);
    }

    public boolean hasWarnings() {
        return stats.stream().anyMatch(Stats::hasWarnings);
    }

    /**
     * @return the summaries of all compilers, one per line.
     */
    public String toSummary() {
        return stats.stream().map(Stats::toSummary).collect(Collectors.joining(System.lineSeparator()));
    }

    @Override
    public String toString() {
        return toSummary();
    }
}
