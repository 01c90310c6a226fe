package io.xdiff.accessor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class ChecksumsTest {

    @Test
    public void testMd5Hex() {
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", Checksums.md5Hex(""));
        assertEquals("900150983cd24fb0d6963f7d28e17f72", Checksums.md5Hex("abc"));
        assertEquals("be50e8478cf24ff3595bc7307fb91b50", Checksums.md5Hex("héllo"));
    }

    @Test
    public void testMd5AsLong() {
        // low 15 hex digits of the digest minus 2^59 - 1
        assertEquals(108096943472263807L, Checksums.md5AsLong(""));
        assertEquals(-101824134779928717L, Checksums.md5AsLong("abc"));
        assertEquals(45821967246203858L, Checksums.md5AsLong("1|500"));
        assertEquals(-301968745931972337L, Checksums.md5AsLong("1|<null>"));
        assertEquals(97890828033792849L, Checksums.md5AsLong("héllo"));
    }

    @Test
    public void testRange() {
        for (int i = 0; i < 1000; i++) {
            long h = Checksums.md5AsLong(Integer.toString(i));
            assertTrue(h >= -Checksums.CHECKSUM_OFFSET && h <= Checksums.CHECKSUM_OFFSET + 1, Long.toString(h));
        }
    }

    @Test
    public void testRowText() {
        assertEquals("1|500", Checksums.rowText("1", Arrays.asList("500")));
        assertEquals("1|<null>|", Checksums.rowText("1", Arrays.asList(null, "")));
        assertEquals(18, Checksums.checksumHexStart());
    }

    @Test
    public void testSum() {
        BigInteger sum = Checksums.sum(Arrays.asList(Checksums.md5AsLong("1|500"), Checksums.md5AsLong("abc")));
        assertEquals(BigInteger.valueOf(-56002167533724859L), sum);
        assertEquals(BigInteger.ZERO, Checksums.sum(Arrays.<Long>asList()));

        // sums past the long range do not overflow
        BigInteger big = Checksums.sum(Arrays.asList(Long.MAX_VALUE, Long.MAX_VALUE));
        assertEquals(BigInteger.valueOf(Long.MAX_VALUE).shiftLeft(1), big);
    }
}
