package io.xdiff.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)} over the key domain.
 * <p>
 * An unbounded range matches every key {@code >= start}; its {@code end} is the largest key observed
 * when the range was created and only serves as the interpolation limit when the range is split.
 */
public class KeyRange {

    private final Object start;
    private final Object end;
    private final boolean unboundedEnd;

    private KeyRange(Object start, Object end, boolean unboundedEnd) {
        this.start = start;
        this.end = end;
        this.unboundedEnd = unboundedEnd;
    }

    public static KeyRange bounded(Object start, Object end, Comparator<Object> order) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (order.compare(start, end) >= 0) {
            throw new IllegalArgumentException("Degenerate key range [" + start + ", " + end + ")");
        }
        return new KeyRange(start, end, false);
    }

    public static KeyRange unbounded(Object start, Object observedMax, Comparator<Object> order) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(observedMax, "observedMax");
        if (order.compare(start, observedMax) > 0) {
            throw new IllegalArgumentException("Degenerate key range [" + start + ", .." + observedMax + "]");
        }
        return new KeyRange(start, observedMax, true);
    }

    public Object getStart() {
        return start;
    }

    /**
     * Exclusive end for bounded ranges, the observed maximum for unbounded ones.
     */
    public Object getEnd() {
        return end;
    }

    public boolean isUnboundedEnd() {
        return unboundedEnd;
    }

    public boolean contains(Object key, Comparator<Object> order) {
        if (order.compare(key, start) < 0) {
            return false;
        }
        return unboundedEnd || order.compare(key, end) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyRange other = (KeyRange) o;
        return unboundedEnd == other.unboundedEnd && start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, unboundedEnd);
    }

    @Override
    public String toString() {
        return unboundedEnd ? "[" + start + ", ..)" : "[" + start + ", " + end + ")";
    }
}
