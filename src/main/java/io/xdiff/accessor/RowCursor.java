package io.xdiff.accessor;

import java.util.Iterator;
import java.util.List;

import io.xdiff.model.Row;

/**
 * Forward-only iterator over fetched rows that holds backend resources until closed.
 */
public interface RowCursor extends Iterator<Row>, AutoCloseable {

    @Override
    void close();

    static RowCursor of(List<Row> rows) {
        Iterator<Row> it = rows.iterator();
        return new RowCursor() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Row next() {
                return it.next();
            }

            @Override
            public void close() {
            }
        };
    }
}
