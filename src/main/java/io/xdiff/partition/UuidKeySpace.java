package io.xdiff.partition;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.UUID;

import io.xdiff.model.KeyType;

/**
 * UUID keys ordered as unsigned 128-bit big-endian numbers, which is also the order of their
 * lower-case text form. {@link UUID#compareTo(UUID)} compares signed halves and is not used.
 */
public class UuidKeySpace extends OrdinalKeySpace {

    private static final BigInteger TWO_64 = BigInteger.ONE.shiftLeft(64);

    @Override
    public KeyType getKeyType() {
        return KeyType.UUID;
    }

    @Override
    public Object coerce(Object raw) {
        if (raw instanceof UUID) {
            return raw;
        }
        if (raw instanceof String) {
            try {
                return UUID.fromString(((String) raw).trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Not a uuid key: " + raw, e);
            }
        }
        if (raw instanceof byte[] && ((byte[]) raw).length == 16) {
            ByteBuffer bb = ByteBuffer.wrap((byte[]) raw);
            return new UUID(bb.getLong(), bb.getLong());
        }
        throw new IllegalArgumentException("Not a uuid key: " + raw);
    }

    @Override
    protected BigInteger toOrdinal(Object key) {
        UUID u = (UUID) key;
        BigInteger hi = unsigned(u.getMostSignificantBits());
        BigInteger lo = unsigned(u.getLeastSignificantBits());
        return hi.shiftLeft(64).or(lo);
    }

    @Override
    protected Object fromOrdinal(BigInteger ordinal) {
        BigInteger[] qr = ordinal.divideAndRemainder(TWO_64);
        return new UUID(qr[0].longValue(), qr[1].longValue());
    }

    @Override
    public int compare(Object a, Object b) {
        UUID x = (UUID) a;
        UUID y = (UUID) b;
        int c = Long.compareUnsigned(x.getMostSignificantBits(), y.getMostSignificantBits());
        return c != 0 ? c : Long.compareUnsigned(x.getLeastSignificantBits(), y.getLeastSignificantBits());
    }

    private static BigInteger unsigned(long v) {
        BigInteger b = BigInteger.valueOf(v);
        return v < 0 ? b.add(TWO_64) : b;
    }
}
