package io.xdiff.accessor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import io.xdiff.model.ColumnSpec;
import io.xdiff.model.ColumnType;

public class ValueNormalizerTest {

    private final ValueNormalizer normalizer = new ValueNormalizer();

    private static ColumnSpec col(ColumnType type, int scale, int precision) {
        return new ColumnSpec("c", type, scale, precision);
    }

    @Test
    public void testNull() {
        assertNull(normalizer.normalize(null, col(ColumnType.STRING, 0, 0)));
    }

    @Test
    public void testNumbers() {
        assertEquals("42", normalizer.normalize(42, col(ColumnType.INTEGER, 0, 0)));
        assertEquals("42", normalizer.normalize(42L, col(ColumnType.INTEGER, 0, 0)));
        assertEquals("1.23", normalizer.normalize(new BigDecimal("1.2300"), col(ColumnType.DECIMAL, 2, 0)));
        assertEquals("1.24", normalizer.normalize(new BigDecimal("1.235"), col(ColumnType.DECIMAL, 2, 0)));
        assertEquals("10.00", normalizer.normalize(10, col(ColumnType.DECIMAL, 2, 0)));
        assertEquals("0.100000", normalizer.normalize(0.1d, col(ColumnType.FLOAT, 6, 0)));
        assertEquals("-3.5", normalizer.normalize("-3.50", col(ColumnType.DECIMAL, 1, 0)));
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize("abc", col(ColumnType.DECIMAL, 1, 0)));
    }

    @Test
    public void testTimestamps() {
        LocalDateTime t = LocalDateTime.of(2024, 3, 1, 8, 5, 9, 123456789);
        assertEquals("2024-03-01 08:05:09.123456", normalizer.normalize(t, col(ColumnType.TIMESTAMP, 0, 6)));
        assertEquals("2024-03-01 08:05:09.123000", normalizer.normalize(t, col(ColumnType.TIMESTAMP, 0, 3)));
        assertEquals("2024-03-01 08:05:09.000000", normalizer.normalize(t, col(ColumnType.TIMESTAMP, 0, 0)));
        assertEquals("2024-03-01 08:05:09.100000",
                normalizer.normalize(Timestamp.valueOf("2024-03-01 08:05:09.1"), col(ColumnType.TIMESTAMP, 0, 6)));
    }

    @Test
    public void testBooleans() {
        ColumnSpec bool = col(ColumnType.BOOLEAN, 0, 0);
        assertEquals("1", normalizer.normalize(true, bool));
        assertEquals("0", normalizer.normalize(false, bool));
        assertEquals("1", normalizer.normalize(1, bool));
        assertEquals("0", normalizer.normalize("f", bool));
    }

    @Test
    public void testUuidsAndStrings() {
        UUID u = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        assertEquals(u.toString(), normalizer.normalize("123E4567-E89B-12D3-A456-426614174000 ",
                col(ColumnType.UUID, 0, 0)));
        assertEquals(u.toString(), normalizer.normalize(u, col(ColumnType.UUID, 0, 0)));
        assertEquals(" as is ", normalizer.normalize(" as is ", col(ColumnType.STRING, 0, 0)));
        assertEquals("00ff", normalizer.normalize(new byte[] {0, (byte) 0xff}, col(ColumnType.UNKNOWN, 0, 0)));
    }

    @Test
    public void testNormalizeList() {
        assertEquals(Arrays.asList("1", null),
                normalizer.normalize(Arrays.asList((Object) 1, null),
                        Arrays.asList(col(ColumnType.INTEGER, 0, 0), col(ColumnType.STRING, 0, 0))));
        assertThrows(IllegalArgumentException.class,
                () -> normalizer.normalize(Arrays.asList((Object) 1), Arrays.<ColumnSpec>asList()));
    }
}
