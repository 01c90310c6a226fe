package io.xdiff.partition;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

import io.xdiff.model.KeyType;

/**
 * MongoDB ObjectId keys, held as their 24 digit lower-case hex text. ObjectIds sort as unsigned 96-bit
 * big-endian numbers, which is the order of that text; splitting interpolates over the number.
 */
public class ObjectIdKeySpace extends OrdinalKeySpace {

    private static final Pattern HEX_24 = Pattern.compile("[0-9a-f]{24}");

    @Override
    public KeyType getKeyType() {
        return KeyType.OBJECTID;
    }

    /**
     * Accepts the hex text, or anything whose {@code toString()} is the hex text, such as
     * {@code org.bson.types.ObjectId}.
     */
    @Override
    public Object coerce(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Not an ObjectId key: null");
        }
        String hex = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (!HEX_24.matcher(hex).matches()) {
            throw new IllegalArgumentException("Not an ObjectId key: " + raw);
        }
        return hex;
    }

    @Override
    protected BigInteger toOrdinal(Object key) {
        return new BigInteger((String) key, 16);
    }

    @Override
    protected Object fromOrdinal(BigInteger ordinal) {
        String hex = ordinal.toString(16);
        StringBuilder sb = new StringBuilder(24);
        for (int i = hex.length(); i < 24; i++) {
            sb.append('0');
        }
        return sb.append(hex).toString();
    }

    @Override
    public int compare(Object a, Object b) {
        return ((String) a).compareTo((String) b);
    }
}
