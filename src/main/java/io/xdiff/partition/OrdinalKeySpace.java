package io.xdiff.partition;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Key space whose keys map one-to-one onto integers; splitting is linear interpolation over those
 * integers.
 */
public abstract class OrdinalKeySpace extends KeySpace {

    protected abstract BigInteger toOrdinal(Object key);

    protected abstract Object fromOrdinal(BigInteger ordinal);

    @Override
    public int compare(Object a, Object b) {
        return toOrdinal(a).compareTo(toOrdinal(b));
    }

    @Override
    public List<Object> splitPoints(Object lo, Object hi, int parts) {
        return interpolate(toOrdinal(lo), toOrdinal(hi), parts);
    }

    protected List<Object> interpolate(BigInteger lo, BigInteger hi, int parts) {
        List<Object> points = new ArrayList<>();
        BigInteger span = hi.subtract(lo);
        if (parts < 2 || span.compareTo(BigInteger.ONE) <= 0) {
            return points;
        }
        BigInteger p = BigInteger.valueOf(parts);
        if (span.compareTo(p) <= 0) {
            for (BigInteger v = lo.add(BigInteger.ONE); v.compareTo(hi) < 0; v = v.add(BigInteger.ONE)) {
                points.add(fromOrdinal(v));
            }
            return points;
        }
        for (int i = 1; i < parts; i++) {
            BigInteger offset = span.multiply(BigInteger.valueOf(i)).divide(p);
            points.add(fromOrdinal(lo.add(offset)));
        }
        return points;
    }
}
