package io.xdiff.diff;

import io.xdiff.model.KeyRange;
import io.xdiff.model.Segment;

/**
 * Outcome of comparing one key range across both sides.
 */
public class SegmentComparison {

    public enum Classification {
        /** Counts and checksums equal. */
        MATCH,
        /** Differs, and small enough to diff row by row. */
        SMALL_MISMATCH,
        /** Differs, and too large to fetch; split further. */
        LARGE_MISMATCH,
        /** Rows on exactly one side. */
        ONE_SIDED
    }

    private final KeyRange range;
    private final Segment left;
    private final Segment right;
    private final Classification classification;

    public SegmentComparison(KeyRange range, Segment left, Segment right, long exactDiffThreshold) {
        this.range = range;
        this.left = left;
        this.right = right;
        this.classification = classify(left, right, exactDiffThreshold);
    }

    static Classification classify(Segment left, Segment right, long exactDiffThreshold) {
        if (left.isEquivalent(right)) {
            return Classification.MATCH;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return Classification.ONE_SIDED;
        }
        if (Math.max(left.getCount(), right.getCount()) <= exactDiffThreshold) {
            return Classification.SMALL_MISMATCH;
        }
        return Classification.LARGE_MISMATCH;
    }

    public KeyRange getRange() {
        return range;
    }

    public Segment getLeft() {
        return left;
    }

    public Segment getRight() {
        return right;
    }

    public Classification getClassification() {
        return classification;
    }

    public boolean isMatch() {
        return classification == Classification.MATCH;
    }

    @Override
    public String toString() {
        return range + " " + classification + " counts=" + left.getCount() + "/" + right.getCount();
    }
}
