package io.xdiff.accessor;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import org.apache.commons.codec.binary.Hex;

/**
 * Row hashing shared by every backend. A row hashes to the low 60 bits of the MD5 of its normalized
 * text, shifted to be centred on zero; a range checksum is the plain sum of its row hashes. SQL
 * dialects render the same function server side.
 */
public final class Checksums {

    public static final int MD5_HEXDIGITS = 32;
    public static final int CHECKSUM_HEXDIGITS = 15;
    public static final long CHECKSUM_OFFSET = (1L << (CHECKSUM_HEXDIGITS * 4 - 1)) - 1;
    public static final String NULL_TEXT = "<null>";
    public static final String SEPARATOR = "|";

    private static final String MD5_DIGEST = "MD5";

    private Checksums() {
    }

    /**
     * 1-based position of the first hex digit kept from an MD5 hex digest.
     */
    public static int checksumHexStart() {
        return 1 + MD5_HEXDIGITS - CHECKSUM_HEXDIGITS;
    }

    public static String md5Hex(final String pV) {
        final MessageDigest d = sCache.get();
        d.update(pV.getBytes(StandardCharsets.UTF_8));
        return Hex.encodeHexString(d.digest());
    }

    /**
     * Hash of one row's normalized text.
     */
    public static long md5AsLong(final String pV) {
        String hex = md5Hex(pV);
        return Long.parseLong(hex.substring(MD5_HEXDIGITS - CHECKSUM_HEXDIGITS), 16) - CHECKSUM_OFFSET;
    }

    /**
     * Joins a normalized key and normalized column values into the text a row is hashed from.
     */
    public static String rowText(String key, List<String> values) {
        StringBuilder sb = new StringBuilder(key == null ? NULL_TEXT : key);
        for (String v : values) {
            sb.append(SEPARATOR).append(v == null ? NULL_TEXT : v);
        }
        return sb.toString();
    }

    public static BigInteger sum(Iterable<Long> hashes) {
        BigInteger total = BigInteger.ZERO;
        for (Long h : hashes) {
            total = total.add(BigInteger.valueOf(h));
        }
        return total;
    }

    private static ThreadLocal<MessageDigest> sCache =
            new ThreadLocal<MessageDigest>() {
                @Override
                public final MessageDigest initialValue() {
                    try {
                        return MessageDigest.getInstance(MD5_DIGEST);
                    } catch (final Throwable t) {
                        throw new IllegalStateException(t);
                    }
                }

                @Override
                public final MessageDigest get() {
                    final MessageDigest d = super.get();
                    d.reset();
                    return d;
                }
            };
}
