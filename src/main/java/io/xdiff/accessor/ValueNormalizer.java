package io.xdiff.accessor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.StringUtils;

import io.xdiff.model.ColumnSpec;
import io.xdiff.partition.TimestampKeySpace;

/**
 * Renders column values as the canonical text that is hashed and compared. Backends that normalize in
 * SQL must produce exactly the same text:
 * <ul>
 * <li>integers: plain decimal digits</li>
 * <li>decimals and floats: rounded half-up to the column scale, exactly that many fraction digits</li>
 * <li>timestamps: {@code yyyy-MM-dd HH:mm:ss.ffffff}, truncated to the column precision, zero padded</li>
 * <li>booleans: {@code 1} or {@code 0}</li>
 * <li>uuids: lower case</li>
 * <li>strings and anything else: as is</li>
 * </ul>
 * {@code null} stays {@code null}.
 */
public class ValueNormalizer {

    /**
     * Length of {@code yyyy-MM-dd HH:mm:ss.}; fraction digits follow.
     */
    public static final int TIMESTAMP_PRECISION_POS = 20;
    public static final int TIMESTAMP_TEXT_LENGTH = TIMESTAMP_PRECISION_POS + ColumnSpec.MAX_TIMESTAMP_PRECISION;

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS", Locale.ROOT);

    private final TimestampKeySpace timestamps = new TimestampKeySpace();

    public List<String> normalize(List<Object> raw, List<ColumnSpec> columns) {
        if (raw.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " values, got " + raw.size());
        }
        List<String> output = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            output.add(normalize(raw.get(i), columns.get(i)));
        }
        return output;
    }

    public String normalize(Object value, ColumnSpec column) {
        if (value == null) {
            return null;
        }
        switch (column.getType()) {
            case INTEGER:
                return toBigDecimal(value).setScale(0, RoundingMode.HALF_UP).toPlainString();
            case DECIMAL:
            case FLOAT:
                return toBigDecimal(value).setScale(column.getScale(), RoundingMode.HALF_UP).toPlainString();
            case TIMESTAMP:
                return timestamp(value, column.getPrecision());
            case BOOLEAN:
                return bool(value);
            case UUID:
                return value.toString().trim().toLowerCase(Locale.ROOT);
            default:
                if (value instanceof byte[]) {
                    return Hex.encodeHexString((byte[]) value);
                }
                if (value instanceof UUID) {
                    return value.toString();
                }
                return value.toString();
        }
    }

    private BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + value, e);
        }
    }

    private String timestamp(Object value, int precision) {
        LocalDateTime t = (LocalDateTime) timestamps.coerce(value);
        String full = TIMESTAMP_FORMAT.format(t);
        return StringUtils.rightPad(full.substring(0, TIMESTAMP_PRECISION_POS + precision),
                TIMESTAMP_TEXT_LENGTH, '0');
    }

    private String bool(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        }
        if (value instanceof Number) {
            return ((Number) value).longValue() != 0 ? "1" : "0";
        }
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        return s.equals("true") || s.equals("t") || s.equals("1") || s.equals("y") || s.equals("yes") ? "1" : "0";
    }
}
