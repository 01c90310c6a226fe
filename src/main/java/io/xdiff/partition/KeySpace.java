package io.xdiff.partition;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import io.xdiff.model.ColumnSpec;
import io.xdiff.model.ColumnType;
import io.xdiff.model.KeyType;

/**
 * Ordering and interpolation rules for one key type.
 * <p>
 * Keys are held in a canonical Java form ({@code Long}, {@code BigDecimal}, {@code UUID},
 * {@code LocalDateTime} in UTC, {@code String}, lower-case hex {@code String} for ObjectIds);
 * {@link #coerce(Object)} maps whatever a backend driver returns onto it. The comparator must agree
 * with the order the backends sort the key column in.
 */
public abstract class KeySpace implements Comparator<Object> {

    public static KeySpace forType(KeyType keyType) {
        switch (keyType) {
            case INTEGER:
                return new IntegerKeySpace();
            case DECIMAL:
                return new DecimalKeySpace();
            case UUID:
                return new UuidKeySpace();
            case TIMESTAMP:
                return new TimestampKeySpace();
            case STRING:
                return new StringKeySpace();
            case OBJECTID:
                return new ObjectIdKeySpace();
            default:
                throw new IllegalArgumentException("Unsupported key type: " + keyType);
        }
    }

    /**
     * Key space for a key column whose declared type is known on one or both sides. Decimal keys split
     * at the larger declared scale; the other key types have nothing to learn from the column.
     */
    public static KeySpace forKeyColumns(KeyType keyType, Collection<ColumnSpec> keyColumns) {
        if (keyType != KeyType.DECIMAL) {
            return forType(keyType);
        }
        int scale = 0;
        for (ColumnSpec c : keyColumns) {
            if (c != null && c.getType() == ColumnType.DECIMAL) {
                scale = Math.max(scale, c.getScale());
            }
        }
        return new DecimalKeySpace(scale);
    }

    public abstract KeyType getKeyType();

    /**
     * Converts a raw value from a driver (or a parsed literal) to the canonical key form.
     *
     * @throws IllegalArgumentException if the value cannot represent a key of this type
     */
    public abstract Object coerce(Object raw);

    /**
     * Returns at most {@code parts - 1} keys strictly between {@code lo} and {@code hi}, strictly
     * increasing, evenly spaced over the key domain. When fewer than {@code parts} representable keys
     * lie in {@code [lo, hi)} every one of them except {@code lo} is returned.
     */
    public abstract List<Object> splitPoints(Object lo, Object hi, int parts);

    public Object parse(String text) {
        return coerce(text);
    }

    public Object min(Object a, Object b) {
        return compare(a, b) <= 0 ? a : b;
    }

    public Object max(Object a, Object b) {
        return compare(a, b) >= 0 ? a : b;
    }
}
