package io.xdiff.diff;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import io.xdiff.accessor.KeyBounds;
import io.xdiff.accessor.RowCursor;
import io.xdiff.accessor.TableAccessor;
import io.xdiff.model.ColumnSpec;
import io.xdiff.model.KeyRange;
import io.xdiff.model.Row;
import io.xdiff.model.Segment;
import io.xdiff.model.TableRef;

/**
 * Caps the number of queries outstanding against one side. A row cursor holds its permit until it is
 * closed.
 */
public class ThrottledTableAccessor implements TableAccessor {

    private final TableAccessor delegate;
    private final Semaphore permits;
    private final Runnable queryCounter;

    public ThrottledTableAccessor(TableAccessor delegate, int maxQueries, Runnable queryCounter) {
        this.delegate = delegate;
        this.permits = new Semaphore(maxQueries, true);
        this.queryCounter = queryCounter;
    }

    @Override
    public Optional<KeyBounds> bounds(TableRef table) {
        return throttle(() -> delegate.bounds(table));
    }

    @Override
    public long count(TableRef table, KeyRange range) {
        return throttle(() -> delegate.count(table, range));
    }

    @Override
    public BigInteger checksum(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        return throttle(() -> delegate.checksum(table, range, columns));
    }

    @Override
    public Segment segment(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        return throttle(() -> delegate.segment(table, range, columns));
    }

    @Override
    public Map<String, ColumnSpec> describe(TableRef table) {
        return throttle(() -> delegate.describe(table));
    }

    @Override
    public RowCursor rows(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        acquire();
        RowCursor cursor;
        try {
            queryCounter.run();
            cursor = delegate.rows(table, range, columns);
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
        AtomicBoolean closed = new AtomicBoolean();
        return new RowCursor() {
            @Override
            public boolean hasNext() {
                return cursor.hasNext();
            }

            @Override
            public Row next() {
                return cursor.next();
            }

            @Override
            public void close() {
                if (closed.compareAndSet(false, true)) {
                    try {
                        cursor.close();
                    } finally {
                        permits.release();
                    }
                }
            }
        };
    }

    // the delegate is owned and closed by whoever created it
    @Override
    public void close() {
    }

    private <T> T throttle(Supplier<T> call) {
        acquire();
        try {
            queryCounter.run();
            return call.get();
        } finally {
            permits.release();
        }
    }

    private void acquire() {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted waiting for a query slot");
        }
    }
}
