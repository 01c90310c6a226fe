package io.xdiff.partition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import io.xdiff.model.ColumnSpec;
import io.xdiff.model.ColumnType;
import io.xdiff.model.KeyType;

public class KeySpaceTest {

    private static void assertStrictlyBetween(KeySpace keySpace, Object lo, Object hi, List<Object> points) {
        Object previous = lo;
        for (Object p : points) {
            assertTrue(keySpace.compare(previous, p) < 0, previous + " !< " + p);
            previous = p;
        }
        assertTrue(points.isEmpty() || keySpace.compare(previous, hi) < 0, previous + " !< " + hi);
    }

    @Test
    public void testForType() {
        for (KeyType t : KeyType.values()) {
            assertEquals(t, KeySpace.forType(t).getKeyType());
        }
    }

    @Test
    public void testIntegerCoerce() {
        KeySpace keys = new IntegerKeySpace();
        assertEquals(5L, keys.coerce(5));
        assertEquals(7L, keys.coerce(" 7 "));
        assertEquals(3L, keys.coerce(new BigDecimal("3")));
        assertThrows(IllegalArgumentException.class, () -> keys.coerce("x"));
        assertThrows(IllegalArgumentException.class, () -> keys.coerce(new BigDecimal("3.5")));
    }

    @Test
    public void testIntegerSplitPoints() {
        KeySpace keys = new IntegerKeySpace();
        assertEquals(Arrays.asList(25L, 50L, 75L), keys.splitPoints(0L, 100L, 4));
        assertEquals(Arrays.asList(1L, 2L), keys.splitPoints(0L, 3L, 10));
        assertTrue(keys.splitPoints(0L, 1L, 10).isEmpty());
        assertEquals(Arrays.asList(-50L, 0L, 50L), keys.splitPoints(-100L, 100L, 4));
    }

    @Test
    public void testIntegerSplitPointsNearLongLimits() {
        KeySpace keys = new IntegerKeySpace();
        List<Object> points = keys.splitPoints(Long.MIN_VALUE, Long.MAX_VALUE, 8);
        assertEquals(7, points.size());
        assertStrictlyBetween(keys, Long.MIN_VALUE, Long.MAX_VALUE, points);
    }

    @Test
    public void testDecimal() {
        KeySpace keys = new DecimalKeySpace();
        assertEquals(new BigDecimal("1"), keys.coerce("1.000"));
        assertEquals(0, keys.compare(keys.coerce(2), keys.coerce("2.0")));

        Object lo = keys.coerce("0.5");
        Object hi = keys.coerce("1.0");
        assertEquals(Arrays.asList(new BigDecimal("0.6"), new BigDecimal("0.7"), new BigDecimal("0.8"),
                new BigDecimal("0.9")), keys.splitPoints(lo, hi, 10));

        List<Object> points = keys.splitPoints(keys.coerce("1.25"), keys.coerce("1000"), 10);
        assertEquals(9, points.size());
        assertStrictlyBetween(keys, keys.coerce("1.25"), keys.coerce("1000"), points);
    }

    @Test
    public void testUuidUnsignedOrder() {
        KeySpace keys = new UuidKeySpace();
        UUID low = UUID.fromString("7fffffff-ffff-ffff-ffff-ffffffffffff");
        UUID high = UUID.fromString("80000000-0000-0000-0000-000000000000");
        assertTrue(keys.compare(low, high) < 0);
        assertTrue(low.compareTo(high) > 0);

        // agrees with the lower-case text form
        Random random = new Random(42);
        List<UUID> uuids = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            uuids.add(new UUID(random.nextLong(), random.nextLong()));
        }
        List<UUID> byKeySpace = new ArrayList<>(uuids);
        byKeySpace.sort(keys);
        List<UUID> byText = new ArrayList<>(uuids);
        byText.sort(Comparator.comparing(UUID::toString));
        assertEquals(byText, byKeySpace);
    }

    @Test
    public void testUuidSplitPoints() {
        KeySpace keys = new UuidKeySpace();
        Object lo = keys.coerce("00000000-0000-0000-0000-000000000000");
        Object hi = keys.coerce("00000000-0000-0000-0000-000000000010");
        assertEquals(Arrays.asList(UUID.fromString("00000000-0000-0000-0000-000000000004"),
                UUID.fromString("00000000-0000-0000-0000-000000000008"),
                UUID.fromString("00000000-0000-0000-0000-00000000000c")), keys.splitPoints(lo, hi, 4));

        Object min = keys.coerce("00000000-0000-0000-0000-000000000000");
        Object max = keys.coerce("ffffffff-ffff-ffff-ffff-ffffffffffff");
        List<Object> points = keys.splitPoints(min, max, 16);
        assertEquals(15, points.size());
        assertStrictlyBetween(keys, min, max, points);
        assertEquals(UUID.fromString("0fffffff-ffff-ffff-ffff-ffffffffffff"), points.get(0));
    }

    @Test
    public void testUuidCoerceBytes() {
        KeySpace keys = new UuidKeySpace();
        byte[] bytes = new byte[16];
        bytes[15] = 1;
        assertEquals(new UUID(0, 1), keys.coerce(bytes));
        assertThrows(IllegalArgumentException.class, () -> keys.coerce("not-a-uuid"));
    }

    @Test
    public void testTimestampCoerce() {
        KeySpace keys = new TimestampKeySpace();
        LocalDateTime t = LocalDateTime.of(2024, 1, 1, 12, 30, 0, 123456789);
        assertEquals(LocalDateTime.of(2024, 1, 1, 12, 30, 0, 123456000), keys.coerce(t));
        assertEquals(LocalDateTime.of(2024, 1, 1, 12, 30), keys.coerce("2024-01-01 12:30:00"));
        assertEquals(LocalDateTime.of(2024, 1, 1, 12, 30), keys.coerce(Timestamp.valueOf("2024-01-01 12:30:00")));
        assertEquals(LocalDateTime.of(2024, 1, 1, 10, 30),
                keys.coerce(OffsetDateTime.of(2024, 1, 1, 12, 30, 0, 0, ZoneOffset.ofHours(2))));
    }

    @Test
    public void testTimestampSplitPoints() {
        KeySpace keys = new TimestampKeySpace();
        Object lo = LocalDateTime.of(2024, 1, 1, 0, 0);
        Object hi = LocalDateTime.of(2024, 1, 2, 0, 0);
        assertEquals(Arrays.asList(LocalDateTime.of(2024, 1, 1, 6, 0), LocalDateTime.of(2024, 1, 1, 12, 0),
                LocalDateTime.of(2024, 1, 1, 18, 0)), keys.splitPoints(lo, hi, 4));

        Object before1970 = LocalDateTime.of(1960, 6, 1, 0, 0, 0, 500000000);
        List<Object> points = keys.splitPoints(before1970, hi, 10);
        assertEquals(9, points.size());
        assertStrictlyBetween(keys, before1970, hi, points);
    }

    @Test
    public void testStringSplitPoints() {
        KeySpace keys = new StringKeySpace();
        List<Object> points = keys.splitPoints("a", "b", 4);
        assertEquals(3, points.size());
        assertStrictlyBetween(keys, "a", "b", points);

        points = keys.splitPoints("customer-0001", "customer-9999", 10);
        assertEquals(9, points.size());
        assertStrictlyBetween(keys, "customer-0001", "customer-9999", points);
        for (Object p : points) {
            assertTrue(((String) p).startsWith("customer-"), p.toString());
        }

        points = keys.splitPoints("", "zzz", 10);
        assertEquals(9, points.size());
        assertStrictlyBetween(keys, "", "zzz", points);
    }

    @Test
    public void testStringAdjacentKeysCannotSplit() {
        KeySpace keys = new StringKeySpace();
        assertEquals(Collections.emptyList(), keys.splitPoints("a", "a ", 10));
        assertEquals(Collections.emptyList(), keys.splitPoints("b", "a", 10));
    }

    @Test
    public void testMinMax() {
        KeySpace keys = new IntegerKeySpace();
        assertEquals(1L, keys.min(1L, 2L));
        assertEquals(2L, keys.max(1L, 2L));
    }

    @Test
    public void testObjectIdOrderAndSplitPoints() {
        KeySpace keys = new ObjectIdKeySpace();
        String lo = "000000000000000000000000";
        String hi = "000000000000000000000100";
        assertEquals(Arrays.asList("000000000000000000000040", "000000000000000000000080",
                "0000000000000000000000c0"), keys.splitPoints(lo, hi, 4));
        assertTrue(keys.compare("00000000000000000000000f", "000000000000000000000010") < 0);
        assertEquals("65a1b2c3d4e5f60718293a4b", keys.coerce(" 65A1B2C3D4E5F60718293A4B "));

        String a = "65a1b2c3d4e5f60718293a4b";
        String b = "ffffffffffffffffffffffff";
        List<Object> points = keys.splitPoints(a, b, 16);
        assertEquals(15, points.size());
        assertStrictlyBetween(keys, a, b, points);
    }

    @Test
    public void testDecimalSplitsAtKeyColumnScale() {
        KeySpace keys = KeySpace.forKeyColumns(KeyType.DECIMAL, Arrays.asList(
                new ColumnSpec("id", ColumnType.DECIMAL, 2, 0), new ColumnSpec("id", ColumnType.DECIMAL, 3, 0)));
        assertEquals(3, ((DecimalKeySpace) keys).getKeyScale());
        Object lo = keys.coerce("1.000");
        Object hi = keys.coerce("2.000");
        assertEquals(Arrays.asList(new BigDecimal("1.25"), new BigDecimal("1.5"), new BigDecimal("1.75")),
                keys.splitPoints(lo, hi, 4));
        assertTrue(new DecimalKeySpace().splitPoints(lo, hi, 4).isEmpty());

        KeySpace undescribed = KeySpace.forKeyColumns(KeyType.DECIMAL, Arrays.<ColumnSpec>asList(null, null));
        assertEquals(0, ((DecimalKeySpace) undescribed).getKeyScale());
        assertEquals(KeyType.STRING, KeySpace.forKeyColumns(KeyType.STRING, Collections.emptyList()).getKeyType());
    }
}
