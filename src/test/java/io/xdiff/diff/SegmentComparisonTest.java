package io.xdiff.diff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import io.xdiff.diff.SegmentComparison.Classification;
import io.xdiff.model.KeyRange;
import io.xdiff.model.Segment;
import io.xdiff.model.Side;
import io.xdiff.partition.IntegerKeySpace;

public class SegmentComparisonTest {

    private final static KeyRange RANGE = KeyRange.bounded(0L, 1000L, new IntegerKeySpace());

    private static Segment left(long count, long checksum) {
        return new Segment(Side.LEFT, RANGE, count, BigInteger.valueOf(checksum));
    }

    private static Segment right(long count, long checksum) {
        return new Segment(Side.RIGHT, RANGE, count, BigInteger.valueOf(checksum));
    }

    @Test
    public void testMatch() {
        SegmentComparison c = new SegmentComparison(RANGE, left(100, 42), right(100, 42), 10);
        assertEquals(Classification.MATCH, c.getClassification());
        assertTrue(c.isMatch());
    }

    @Test
    public void testEmptyOnBothSidesMatches() {
        assertEquals(Classification.MATCH, SegmentComparison.classify(left(0, 0), right(0, 0), 10));
    }

    @Test
    public void testSameCountDifferentChecksum() {
        assertEquals(Classification.SMALL_MISMATCH, SegmentComparison.classify(left(10, 1), right(10, 2), 10));
        assertEquals(Classification.LARGE_MISMATCH, SegmentComparison.classify(left(11, 1), right(11, 2), 10));
    }

    @Test
    public void testLargerSideDecides() {
        assertEquals(Classification.LARGE_MISMATCH, SegmentComparison.classify(left(5, 1), right(50, 1), 10));
    }

    @Test
    public void testOneSided() {
        assertEquals(Classification.ONE_SIDED, SegmentComparison.classify(left(0, 0), right(5000, 9), 10));
        assertEquals(Classification.ONE_SIDED, SegmentComparison.classify(left(3, 9), right(0, 0), 10));
    }
}
