package io.xdiff.format;

import java.util.Locale;

import io.xdiff.diff.DiffSummary;

/**
 * Human readable statistics of a finished diff.
 */
public class DiffStatsFormatter {

    public String format(DiffSummary summary) {
        long total = Math.max(summary.getLeftRowCount(), summary.getRightRowCount());
        double score = total <= 0 ? 0 : 100.0 * summary.getDifferences() / total;
        StringBuilder sb = new StringBuilder();
        line(sb, "%d rows in table A", summary.getLeftRowCount());
        line(sb, "%d rows in table B", summary.getRightRowCount());
        line(sb, "%d rows exclusive to table A (not present in B)", summary.getRemoved());
        line(sb, "%d rows exclusive to table B (not present in A)", summary.getAdded());
        line(sb, "%d rows updated", summary.getChanged());
        line(sb, "%d rows unchanged", unchanged(summary));
        line(sb, "%.2f%% difference score", score);
        sb.append(System.lineSeparator());
        line(sb, "%d segments compared, %d split, %d diffed exactly, %d failed", summary.getSegments(),
                summary.getSplitSegments(), summary.getExactDiffs(), summary.getFailedSegments());
        line(sb, "%d queries (%d left, %d right), %d retries", summary.getLeftQueries() + summary.getRightQueries(),
                summary.getLeftQueries(), summary.getRightQueries(), summary.getRetries());
        line(sb, "%d/%d rows downloaded (left/right), max depth %d", summary.getLeftRowsFetched(),
                summary.getRightRowsFetched(), summary.getMaxDepthReached());
        line(sb, "%s in %.3f seconds", summary.getStatus(), summary.getTimeElapsed() / 1000.0);
        return sb.toString();
    }

    /**
     * Rows present on the left with identical values on the right.
     */
    static long unchanged(DiffSummary summary) {
        return Math.max(0, summary.getLeftRowCount() - summary.getRemoved() - summary.getChanged());
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.ROOT, format, args)).append(System.lineSeparator());
    }
}
