package io.xdiff.format;

import java.io.PrintWriter;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import io.xdiff.accessor.Checksums;
import io.xdiff.model.DiffRecord;

/**
 * One line per row: {@code - key values} for rows only on the left, {@code + key values} for rows only
 * on the right. A changed row prints its left line followed by its right line.
 */
public class DiffTextFormatter {

    private static final DateTimeFormatter KEY_TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS", Locale.ROOT);

    /**
     * Writes up to {@code limit} records, all of them when {@code limit} is not positive.
     *
     * @return number of records written
     */
    public long write(Iterator<DiffRecord> records, PrintWriter out, long limit) {
        long written = 0;
        while ((limit <= 0 || written < limit) && records.hasNext()) {
            out.println(format(records.next()));
            written++;
        }
        out.flush();
        return written;
    }

    public String format(DiffRecord record) {
        switch (record.getKind()) {
            case REMOVED:
                return line("-", record.getKey(), record.getLeftValues());
            case ADDED:
                return line("+", record.getKey(), record.getRightValues());
            default:
                return line("-", record.getKey(), record.getLeftValues()) + System.lineSeparator()
                        + line("+", record.getKey(), record.getRightValues());
        }
    }

    private static String line(String symbol, Object key, Map<String, String> values) {
        String columns = values.values().stream()
                .map(v -> v == null ? Checksums.NULL_TEXT : v)
                .collect(Collectors.joining(", "));
        return symbol + " (" + keyText(key) + (columns.isEmpty() ? "" : ", " + columns) + ")";
    }

    /**
     * Key as printed in reports.
     */
    public static String keyText(Object key) {
        if (key instanceof LocalDateTime) {
            return KEY_TIMESTAMP_FORMAT.format((LocalDateTime) key);
        }
        if (key instanceof BigDecimal) {
            return ((BigDecimal) key).toPlainString();
        }
        return String.valueOf(key);
    }
}
