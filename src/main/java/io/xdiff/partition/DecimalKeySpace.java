package io.xdiff.partition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import io.xdiff.model.KeyType;

/**
 * Decimal keys. The representable values between two keys are taken at the scale of the key column
 * when it is known, or else at the larger scale of the two keys, so keys stored with two fraction
 * digits are split on hundredths. Coerced keys have their trailing zeros stripped, so the key column
 * scale matters whenever a range's bounds happen to be whole numbers.
 */
public class DecimalKeySpace extends KeySpace {

    private final int keyScale;

    public DecimalKeySpace() {
        this(0);
    }

    /**
     * @param keyScale fraction digits of the key column, 0 when unknown
     */
    public DecimalKeySpace(int keyScale) {
        this.keyScale = Math.max(0, keyScale);
    }

    public int getKeyScale() {
        return keyScale;
    }

    @Override
    public KeyType getKeyType() {
        return KeyType.DECIMAL;
    }

    @Override
    public Object coerce(Object raw) {
        BigDecimal d;
        if (raw instanceof BigDecimal) {
            d = (BigDecimal) raw;
        } else if (raw instanceof BigInteger) {
            d = new BigDecimal((BigInteger) raw);
        } else if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            d = BigDecimal.valueOf(((Number) raw).longValue());
        } else if (raw instanceof Double || raw instanceof Float) {
            d = BigDecimal.valueOf(((Number) raw).doubleValue());
        } else if (raw instanceof String) {
            try {
                d = new BigDecimal(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a decimal key: " + raw, e);
            }
        } else {
            throw new IllegalArgumentException("Not a decimal key: " + raw);
        }
        d = d.stripTrailingZeros();
        return d.scale() < 0 ? d.setScale(0) : d;
    }

    @Override
    public int compare(Object a, Object b) {
        return ((BigDecimal) a).compareTo((BigDecimal) b);
    }

    @Override
    public List<Object> splitPoints(Object lo, Object hi, int parts) {
        BigDecimal l = (BigDecimal) lo;
        BigDecimal h = (BigDecimal) hi;
        int scale = Math.max(keyScale, Math.max(l.scale(), h.scale()));
        List<Object> points = new ArrayList<>();
        ScaledOrdinals ordinals = new ScaledOrdinals(scale);
        for (Object p : ordinals.interpolate(l.setScale(scale).unscaledValue(), h.setScale(scale).unscaledValue(), parts)) {
            points.add(coerce(p));
        }
        return points;
    }

    private static class ScaledOrdinals extends OrdinalKeySpace {
        private final int scale;

        ScaledOrdinals(int scale) {
            this.scale = scale;
        }

        @Override
        public KeyType getKeyType() {
            return KeyType.DECIMAL;
        }

        @Override
        public Object coerce(Object raw) {
            return raw;
        }

        @Override
        protected BigInteger toOrdinal(Object key) {
            return ((BigDecimal) key).setScale(scale).unscaledValue();
        }

        @Override
        protected Object fromOrdinal(BigInteger ordinal) {
            return new BigDecimal(ordinal, scale);
        }
    }
}
