package io.xdiff.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.xdiff.model.DiffRecord;

public class DiffTextFormatterTest {

    private final DiffTextFormatter formatter = new DiffTextFormatter();

    private static Map<String, String> values(String... nameValuePairs) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            values.put(nameValuePairs[i], nameValuePairs[i + 1]);
        }
        return values;
    }

    @Test
    public void testFormatAddedAndRemoved() {
        assertEquals("- (5, item-5, 7.50)", formatter.format(DiffRecord.removed(5L, values("name", "item-5",
                "price", "7.50"))));
        assertEquals("+ (201, item-201, <null>)", formatter.format(DiffRecord.added(201L, values("name",
                "item-201", "price", null))));
        assertEquals("+ (abc)", formatter.format(DiffRecord.added("abc", Collections.emptyMap())));
    }

    @Test
    public void testFormatChanged() {
        String text = formatter.format(DiffRecord.changed(77L, values("price", "115.50"), values("price", "99.00")));
        assertEquals("- (77, 115.50)" + System.lineSeparator() + "+ (77, 99.00)", text);
    }

    @Test
    public void testKeyText() {
        assertEquals("2024-01-01 00:00:01.000000", DiffTextFormatter.keyText(LocalDateTime.of(2024, 1, 1, 0, 0, 1)));
        assertEquals("10000000", DiffTextFormatter.keyText(new BigDecimal("1E+7")));
        assertEquals("42", DiffTextFormatter.keyText(42L));
    }

    @Test
    public void testWriteHonoursLimit() {
        List<DiffRecord> records = Arrays.asList(
                DiffRecord.removed(1L, values("v", "a")),
                DiffRecord.added(2L, values("v", "b")),
                DiffRecord.added(3L, values("v", "c")));

        StringWriter all = new StringWriter();
        assertEquals(3, formatter.write(records.iterator(), new PrintWriter(all), 0));
        assertEquals(Arrays.asList("- (1, a)", "+ (2, b)", "+ (3, c)"), Arrays.asList(all.toString().split("\\R")));

        StringWriter limited = new StringWriter();
        assertEquals(2, formatter.write(records.iterator(), new PrintWriter(limited), 2));
        assertEquals(2, limited.toString().split("\\R").length);
    }
}
