package io.xdiff.partition;

import java.math.BigDecimal;
import java.math.BigInteger;

import io.xdiff.model.KeyType;

public class IntegerKeySpace extends OrdinalKeySpace {

    @Override
    public KeyType getKeyType() {
        return KeyType.INTEGER;
    }

    @Override
    public Object coerce(Object raw) {
        if (raw instanceof Long) {
            return raw;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        try {
            if (raw instanceof BigInteger) {
                return ((BigInteger) raw).longValueExact();
            }
            if (raw instanceof BigDecimal) {
                return ((BigDecimal) raw).longValueExact();
            }
            if (raw instanceof String) {
                return Long.parseLong(((String) raw).trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer key: " + raw, e);
        }
        throw new IllegalArgumentException("Not an integer key: " + raw
                + (raw == null ? "" : " (" + raw.getClass().getName() + ")"));
    }

    @Override
    protected BigInteger toOrdinal(Object key) {
        return BigInteger.valueOf((Long) key);
    }

    @Override
    protected Object fromOrdinal(BigInteger ordinal) {
        return ordinal.longValueExact();
    }

    @Override
    public int compare(Object a, Object b) {
        return Long.compare((Long) a, (Long) b);
    }
}
