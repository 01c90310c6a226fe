package io.xdiff.accessor;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.xdiff.model.ColumnSpec;
import io.xdiff.model.KeyRange;
import io.xdiff.model.Segment;
import io.xdiff.model.TableRef;

/**
 * Range-scoped read access to one side's table. Implementations are shared by all concurrent
 * comparisons and must be thread safe. Every call reflects a consistent snapshot on its own; nothing
 * is promised across calls.
 * <p>
 * Failures are reported as {@link TableAccessException}; transient ones are retried by the caller.
 */
public interface TableAccessor extends AutoCloseable {

    /**
     * Smallest and largest key in the table, empty when the table has no rows.
     */
    Optional<KeyBounds> bounds(TableRef table);

    long count(TableRef table, KeyRange range);

    /**
     * Sum of the per-row hashes of the key and the given columns, normalized per their
     * {@link ColumnSpec}, over the rows in {@code range}. Zero for an empty range.
     */
    BigInteger checksum(TableRef table, KeyRange range, List<ColumnSpec> columns);

    /**
     * Rows in {@code range}, strictly increasing by key, with values normalized per {@code columns}.
     */
    RowCursor rows(TableRef table, KeyRange range, List<ColumnSpec> columns);

    /**
     * Count and checksum together. Backends that can answer both in one round trip override this.
     */
    default Segment segment(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        long count = count(table, range);
        BigInteger checksum = count == 0 ? BigInteger.ZERO : checksum(table, range, columns);
        return new Segment(table.getSide(), range, count, checksum);
    }

    /**
     * Column types as known to the backend, keyed by column name. Empty when the backend has no
     * schema to report.
     */
    default Map<String, ColumnSpec> describe(TableRef table) {
        return Collections.emptyMap();
    }

    @Override
    default void close() {
    }
}
