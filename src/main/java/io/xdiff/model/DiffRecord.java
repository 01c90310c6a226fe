package io.xdiff.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row-level difference. {@link Kind#REMOVED} rows exist only on the left, {@link Kind#ADDED} rows
 * only on the right, {@link Kind#CHANGED} rows on both sides with different values.
 */
public class DiffRecord {

    public enum Kind {
        ADDED("+"),
        REMOVED("-"),
        CHANGED("~");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Kind kind;
    private final Object key;
    private final Map<String, String> leftValues;
    private final Map<String, String> rightValues;

    private DiffRecord(Kind kind, Object key, Map<String, String> leftValues, Map<String, String> rightValues) {
        this.kind = kind;
        this.key = Objects.requireNonNull(key, "key");
        this.leftValues = leftValues == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(leftValues));
        this.rightValues = rightValues == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(rightValues));
    }

    public static DiffRecord added(Object key, Map<String, String> rightValues) {
        return new DiffRecord(Kind.ADDED, key, null, rightValues);
    }

    public static DiffRecord removed(Object key, Map<String, String> leftValues) {
        return new DiffRecord(Kind.REMOVED, key, leftValues, null);
    }

    public static DiffRecord changed(Object key, Map<String, String> leftValues, Map<String, String> rightValues) {
        return new DiffRecord(Kind.CHANGED, key, leftValues, rightValues);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The side holding the row for Added/Removed, {@code null} for Changed.
     */
    public Side getSide() {
        switch (kind) {
            case ADDED:
                return Side.RIGHT;
            case REMOVED:
                return Side.LEFT;
            default:
                return null;
        }
    }

    public Object getKey() {
        return key;
    }

    public Map<String, String> getLeftValues() {
        return leftValues;
    }

    public Map<String, String> getRightValues() {
        return rightValues;
    }

    /**
     * Values of the row as present on its side; the right side for Changed.
     */
    public Map<String, String> getValues() {
        return kind == Kind.REMOVED ? leftValues : rightValues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DiffRecord that = (DiffRecord) o;
        return kind == that.kind && key.equals(that.key)
                && Objects.equals(leftValues, that.leftValues)
                && Objects.equals(rightValues, that.rightValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, key, leftValues, rightValues);
    }

    @Override
    public String toString() {
        switch (kind) {
            case ADDED:
                return "Added(key=" + key + ", " + rightValues + ")";
            case REMOVED:
                return "Removed(key=" + key + ", " + leftValues + ")";
            default:
                return "Changed(key=" + key + ", left=" + leftValues + ", right=" + rightValues + ")";
        }
    }
}
