package io.xdiff.partition;

import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import io.xdiff.model.KeyType;

/**
 * Timestamp keys, canonically a UTC {@link LocalDateTime} truncated to microseconds. Splitting is even
 * by duration.
 */
public class TimestampKeySpace extends OrdinalKeySpace {

    private static final BigInteger MICROS_PER_SECOND = BigInteger.valueOf(1_000_000L);

    @Override
    public KeyType getKeyType() {
        return KeyType.TIMESTAMP;
    }

    @Override
    public Object coerce(Object raw) {
        LocalDateTime t;
        if (raw instanceof LocalDateTime) {
            t = (LocalDateTime) raw;
        } else if (raw instanceof Timestamp) {
            t = ((Timestamp) raw).toLocalDateTime();
        } else if (raw instanceof OffsetDateTime) {
            t = ((OffsetDateTime) raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } else if (raw instanceof ZonedDateTime) {
            t = ((ZonedDateTime) raw).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } else if (raw instanceof Instant) {
            t = LocalDateTime.ofInstant((Instant) raw, ZoneOffset.UTC);
        } else if (raw instanceof Date) {
            t = LocalDateTime.ofInstant(((Date) raw).toInstant(), ZoneOffset.UTC);
        } else if (raw instanceof String) {
            try {
                t = LocalDateTime.parse(((String) raw).trim().replace(' ', 'T'));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Not a timestamp key: " + raw, e);
            }
        } else {
            throw new IllegalArgumentException("Not a timestamp key: " + raw);
        }
        return t.truncatedTo(ChronoUnit.MICROS);
    }

    @Override
    protected BigInteger toOrdinal(Object key) {
        LocalDateTime t = (LocalDateTime) key;
        long seconds = t.toEpochSecond(ZoneOffset.UTC);
        long micros = t.getNano() / 1_000L;
        return BigInteger.valueOf(seconds).multiply(MICROS_PER_SECOND).add(BigInteger.valueOf(micros));
    }

    @Override
    protected Object fromOrdinal(BigInteger ordinal) {
        BigInteger[] qr = ordinal.divideAndRemainder(MICROS_PER_SECOND);
        long seconds = qr[0].longValueExact();
        long micros = qr[1].longValueExact();
        if (micros < 0) {
            seconds -= 1;
            micros += 1_000_000L;
        }
        return LocalDateTime.ofEpochSecond(seconds, (int) (micros * 1_000L), ZoneOffset.UTC);
    }

    @Override
    public int compare(Object a, Object b) {
        return ((LocalDateTime) a).compareTo((LocalDateTime) b);
    }
}
