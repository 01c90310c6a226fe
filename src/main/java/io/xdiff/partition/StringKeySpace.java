package io.xdiff.partition;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import io.xdiff.model.KeyType;

/**
 * String keys in {@link String#compareTo(String)} order. JDBC backends are made to compare the key in
 * binary order to match, see {@link io.xdiff.accessor.jdbc.SqlDialect#keyExpression}.
 * <p>
 * The characters following the common prefix of the two bounds are read as a fixed-width numeral over
 * printable ASCII and interpolated. Characters outside that alphabet are clamped, so a computed point
 * can fall outside the bounds; such points are dropped, which at worst leaves a range unsplittable.
 */
public class StringKeySpace extends KeySpace {

    static final int WIDTH = 8;
    private static final char LOW = ' ';
    private static final char HIGH = '~';
    private static final int RADIX = HIGH - LOW + 1;

    @Override
    public KeyType getKeyType() {
        return KeyType.STRING;
    }

    @Override
    public Object coerce(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Not a string key: null");
        }
        return raw.toString();
    }

    @Override
    public int compare(Object a, Object b) {
        return ((String) a).compareTo((String) b);
    }

    @Override
    public List<Object> splitPoints(Object lo, Object hi, int parts) {
        String l = (String) lo;
        String h = (String) hi;
        List<Object> points = new ArrayList<>();
        if (parts < 2 || l.compareTo(h) >= 0) {
            return points;
        }
        String prefix = StringUtils.getCommonPrefix(l, h);
        BigInteger a = toOrdinal(l, prefix.length());
        BigInteger b = toOrdinal(h, prefix.length());
        BigInteger span = b.subtract(a);
        if (span.signum() <= 0) {
            return points;
        }
        BigInteger p = BigInteger.valueOf(parts);
        List<BigInteger> ordinals = new ArrayList<>();
        if (span.compareTo(p) <= 0) {
            for (BigInteger v = a.add(BigInteger.ONE); v.compareTo(b) < 0; v = v.add(BigInteger.ONE)) {
                ordinals.add(v);
            }
        } else {
            for (int i = 1; i < parts; i++) {
                ordinals.add(a.add(span.multiply(BigInteger.valueOf(i)).divide(p)));
            }
        }
        String last = l;
        for (BigInteger ord : ordinals) {
            String candidate = prefix + fromOrdinal(ord);
            if (candidate.compareTo(last) > 0 && candidate.compareTo(h) < 0) {
                points.add(candidate);
                last = candidate;
            }
        }
        return points;
    }

    private static BigInteger toOrdinal(String s, int offset) {
        BigInteger radix = BigInteger.valueOf(RADIX);
        BigInteger ord = BigInteger.ZERO;
        for (int i = 0; i < WIDTH; i++) {
            int idx = offset + i;
            int digit = 0;
            if (idx < s.length()) {
                char c = s.charAt(idx);
                digit = c < LOW ? 0 : c > HIGH ? RADIX - 1 : c - LOW;
            }
            ord = ord.multiply(radix).add(BigInteger.valueOf(digit));
        }
        return ord;
    }

    private static String fromOrdinal(BigInteger ord) {
        BigInteger radix = BigInteger.valueOf(RADIX);
        char[] chars = new char[WIDTH];
        for (int i = WIDTH - 1; i >= 0; i--) {
            BigInteger[] qr = ord.divideAndRemainder(radix);
            chars[i] = (char) (LOW + qr[1].intValue());
            ord = qr[0];
        }
        // trailing blanks are the padding digit
        return StringUtils.stripEnd(new String(chars), " ");
    }
}
