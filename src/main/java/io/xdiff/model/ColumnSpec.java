package io.xdiff.model;

import java.util.Objects;

/**
 * A compared column together with how its values are normalized: decimal scale for numeric columns,
 * fractional-second digits for timestamps.
 */
public class ColumnSpec {

    public static final int DEFAULT_FLOAT_SCALE = 6;
    public static final int MAX_TIMESTAMP_PRECISION = 6;

    private final String name;
    private final ColumnType type;
    private final int scale;
    private final int precision;

    public ColumnSpec(String name, ColumnType type, int scale, int precision) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.scale = Math.max(0, scale);
        this.precision = Math.max(0, Math.min(MAX_TIMESTAMP_PRECISION, precision));
    }

    public static ColumnSpec of(String name, ColumnType type) {
        int scale = type == ColumnType.FLOAT || type == ColumnType.DECIMAL ? DEFAULT_FLOAT_SCALE : 0;
        return new ColumnSpec(name, type, scale, MAX_TIMESTAMP_PRECISION);
    }

    public static ColumnSpec unknown(String name) {
        return of(name, ColumnType.UNKNOWN);
    }

    /**
     * Resolves the spec both sides use for this column: the common type with the lower scale and
     * timestamp precision of the two.
     */
    public ColumnSpec commonWith(ColumnSpec other) {
        ColumnType common = type.commonWith(other.type);
        int commonScale;
        if (type == ColumnType.UNKNOWN) {
            commonScale = other.scale;
        } else if (other.type == ColumnType.UNKNOWN) {
            commonScale = scale;
        } else {
            commonScale = Math.min(scale, other.scale);
        }
        return new ColumnSpec(name, common, commonScale, Math.min(precision, other.precision));
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public int getScale() {
        return scale;
    }

    public int getPrecision() {
        return precision;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnSpec that = (ColumnSpec) o;
        return scale == that.scale && precision == that.precision
                && name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, scale, precision);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(':').append(type);
        if (type == ColumnType.DECIMAL || type == ColumnType.FLOAT) {
            sb.append('(').append(scale).append(')');
        } else if (type == ColumnType.TIMESTAMP) {
            sb.append('(').append(precision).append(')');
        }
        return sb.toString();
    }
}
