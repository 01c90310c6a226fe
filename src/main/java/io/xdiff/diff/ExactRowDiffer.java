package io.xdiff.diff;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.xdiff.accessor.RowCursor;
import io.xdiff.accessor.TableAccessException;
import io.xdiff.accessor.TableAccessor;
import io.xdiff.model.DiffRecord;
import io.xdiff.model.KeyRange;
import io.xdiff.model.Row;
import io.xdiff.model.Side;
import io.xdiff.model.TableRef;
import io.xdiff.partition.KeySpace;

/**
 * Fetches the rows of a range from both sides and merge-compares them by key, handing each difference
 * to a sink as soon as it is found. Nothing but the current row of each side is held, so a one-sided
 * range or a range diffed at the maximum depth costs no more memory than a small one.
 * <p>
 * A retried fetch resumes after the last key that was fully merged, so no record is produced twice.
 */
public class ExactRowDiffer {

    private static final Logger logger = LoggerFactory.getLogger(ExactRowDiffer.class);

    private final TableAccessor left;
    private final TableAccessor right;
    private final TableRef leftTable;
    private final TableRef rightTable;
    private final KeySpace keySpace;
    private final Retryer retryer;

    public ExactRowDiffer(TableAccessor left, TableAccessor right, TableRef leftTable, TableRef rightTable,
                          KeySpace keySpace, Retryer retryer) {
        this.left = left;
        this.right = right;
        this.leftTable = leftTable;
        this.rightTable = rightTable;
        this.keySpace = keySpace;
        this.retryer = retryer;
    }

    /**
     * Diffs one range. A side that is known to be empty is not queried. Exceptions thrown by the sink
     * are not retried.
     */
    public Result diff(KeyRange range, boolean readLeft, boolean readRight, Consumer<DiffRecord> sink) {
        Progress progress = new Progress();
        retryer.call("exact diff", range, () -> {
            KeyRange remaining = progress.remaining(range);
            if (remaining != range) {
                logger.debug("resuming exact diff of {} after {}", range, progress.lastKey);
            }
            try (RowCursor l = readLeft ? left.rows(leftTable, remaining, leftTable.getColumns())
                    : RowCursor.of(Collections.emptyList());
                 RowCursor r = readRight ? right.rows(rightTable, remaining, rightTable.getColumns())
                         : RowCursor.of(Collections.emptyList())) {
                merge(remaining, l, r, sink, progress);
            }
            return progress;
        });
        Result result = progress.toResult();
        logger.debug("exact diff of {}: {} left rows, {} right rows, {} differences", range,
                result.getLeftRows(), result.getRightRows(), result.getDifferences());
        return result;
    }

    /**
     * Merges two key-ordered row streams. Keys must be strictly increasing on each side and inside
     * {@code range}; anything else is reported as a backend failure.
     */
    public Result merge(KeyRange range, Iterator<Row> leftRows, Iterator<Row> rightRows, Consumer<DiffRecord> sink) {
        Progress progress = new Progress();
        merge(range, leftRows, rightRows, sink, progress);
        return progress.toResult();
    }

    private void merge(KeyRange range, Iterator<Row> leftRows, Iterator<Row> rightRows, Consumer<DiffRecord> sink,
                       Progress progress) {
        RowReader l = new RowReader(Side.LEFT, leftRows, range, progress.lastKey);
        RowReader r = new RowReader(Side.RIGHT, rightRows, range, progress.lastKey);
        List<String> leftNames = leftTable.getColumnNames();
        List<String> rightNames = rightTable.getColumnNames();

        // every key below the smaller current key has been merged
        Row lr = l.next();
        Row rr = r.next();
        while (lr != null || rr != null) {
            int cmp;
            if (lr == null) {
                cmp = 1;
            } else if (rr == null) {
                cmp = -1;
            } else {
                cmp = keySpace.compare(lr.getKey(), rr.getKey());
            }
            if (cmp < 0) {
                progress.emit(sink, DiffRecord.removed(lr.getKey(), values(leftNames, lr)));
                progress.merged(lr.getKey(), 1, 0);
                lr = l.next();
            } else if (cmp > 0) {
                progress.emit(sink, DiffRecord.added(rr.getKey(), values(rightNames, rr)));
                progress.merged(rr.getKey(), 0, 1);
                rr = r.next();
            } else {
                if (!lr.getValues().equals(rr.getValues())) {
                    progress.emit(sink, DiffRecord.changed(lr.getKey(), values(leftNames, lr),
                            values(rightNames, rr)));
                }
                progress.merged(lr.getKey(), 1, 1);
                lr = l.next();
                rr = r.next();
            }
        }
    }

    private static Map<String, String> values(List<String> names, Row row) {
        Map<String, String> output = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            output.put(names.get(i), row.getValues().get(i));
        }
        return output;
    }

    private class RowReader {
        private final Side side;
        private final Iterator<Row> rows;
        private final KeyRange range;
        private final Object mergedUpTo;
        private Object previousKey;

        RowReader(Side side, Iterator<Row> rows, KeyRange range, Object mergedUpTo) {
            this.side = side;
            this.rows = rows;
            this.range = range;
            this.mergedUpTo = mergedUpTo;
        }

        Row next() {
            while (rows.hasNext()) {
                Row row = rows.next();
                if (previousKey != null && keySpace.compare(previousKey, row.getKey()) >= 0) {
                    throw new TableAccessException(side.getName() + " rows out of order in " + range + ": "
                            + row.getKey() + " after " + previousKey, false);
                }
                if (!range.contains(row.getKey(), keySpace)) {
                    throw new TableAccessException(side.getName() + " row " + row.getKey() + " outside " + range,
                            false);
                }
                previousKey = row.getKey();
                if (mergedUpTo == null || keySpace.compare(row.getKey(), mergedUpTo) > 0) {
                    return row;
                }
            }
            return null;
        }
    }

    /**
     * What has been merged so far, across retries of one range.
     */
    private class Progress {
        private Object lastKey;
        private long leftRows;
        private long rightRows;
        private long differences;

        void emit(Consumer<DiffRecord> sink, DiffRecord record) {
            sink.accept(record);
            differences++;
        }

        void merged(Object key, int leftCount, int rightCount) {
            lastKey = key;
            leftRows += leftCount;
            rightRows += rightCount;
        }

        KeyRange remaining(KeyRange range) {
            if (lastKey == null) {
                return range;
            }
            if (range.isUnboundedEnd()) {
                return KeyRange.unbounded(lastKey, keySpace.max(lastKey, range.getEnd()), keySpace);
            }
            return KeyRange.bounded(lastKey, range.getEnd(), keySpace);
        }

        Result toResult() {
            return new Result(leftRows, rightRows, differences);
        }
    }

    public static class Result {
        private final long leftRows;
        private final long rightRows;
        private final long differences;

        public Result(long leftRows, long rightRows, long differences) {
            this.leftRows = leftRows;
            this.rightRows = rightRows;
            this.differences = differences;
        }

        public long getLeftRows() {
            return leftRows;
        }

        public long getRightRows() {
            return rightRows;
        }

        public long getDifferences() {
            return differences;
        }
    }
}
