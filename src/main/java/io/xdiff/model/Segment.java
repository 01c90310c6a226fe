package io.xdiff.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Count and checksum of one side's rows inside a key range.
 */
public class Segment {

    private final Side side;
    private final KeyRange range;
    private final long count;
    private final BigInteger checksum;

    public Segment(Side side, KeyRange range, long count, BigInteger checksum) {
        this.side = side;
        this.range = range;
        this.count = count;
        this.checksum = checksum == null ? BigInteger.ZERO : checksum;
    }

    public boolean isEquivalent(Segment other) {
        return count == other.count && checksum.equals(other.checksum);
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public Side getSide() {
        return side;
    }

    public KeyRange getRange() {
        return range;
    }

    public long getCount() {
        return count;
    }

    public BigInteger getChecksum() {
        return checksum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Segment segment = (Segment) o;
        return count == segment.count && side == segment.side && range.equals(segment.range)
                && checksum.equals(segment.checksum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(side, range, count, checksum);
    }

    @Override
    public String toString() {
        return side.getName() + range + " count=" + count + " checksum=" + checksum;
    }
}
