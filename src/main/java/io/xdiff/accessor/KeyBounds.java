package io.xdiff.accessor;

/**
 * Minimum and maximum key of a table, both inclusive.
 */
public class KeyBounds {

    private final Object min;
    private final Object max;

    public KeyBounds(Object min, Object max) {
        this.min = min;
        this.max = max;
    }

    public Object getMin() {
        return min;
    }

    public Object getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "[" + min + " .. " + max + "]";
    }
}
