package io.xdiff.diff;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.xdiff.model.DiffRecord;
import io.xdiff.model.TableRef;

/**
 * Differences of one run as they are found. Records of one range come out in key order; ranges come
 * out in no particular order. The stream is finite and can be read once.
 * <p>
 * A bounded buffer sits between the workers and the reader; workers wait while it is full. Closing
 * the stream before the end cancels the run. A run that fails rethrows its failure from
 * {@link #hasNext()} once the records produced before it have been read.
 */
public class DiffStream implements Iterator<DiffRecord>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DiffStream.class);

    private final BlockingQueue<Object> buffer;
    private final DiffSummary summary;
    private final TableRef leftTable;
    private final TableRef rightTable;
    private volatile Runnable canceller;
    private volatile boolean closed;

    private DiffRecord next;
    private boolean finished;

    DiffStream(int bufferSize, DiffSummary summary, TableRef leftTable, TableRef rightTable) {
        this.buffer = new ArrayBlockingQueue<>(bufferSize);
        this.summary = summary;
        this.leftTable = leftTable;
        this.rightTable = rightTable;
    }

    static DiffStream empty(DiffSummary summary, TableRef leftTable, TableRef rightTable) {
        DiffStream stream = new DiffStream(1, summary, leftTable, rightTable);
        stream.buffer.add(new End(null));
        return stream;
    }

    void onCancel(Runnable canceller) {
        this.canceller = canceller;
    }

    void emit(DiffRecord record) {
        try {
            buffer.put(record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while emitting");
        }
    }

    void complete() {
        end(new End(null));
    }

    void fail(RuntimeException error) {
        end(new End(error));
    }

    private void end(End end) {
        if (closed) {
            return;
        }
        try {
            buffer.put(end);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished || closed) {
            return false;
        }
        Object item;
        try {
            item = buffer.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            return false;
        }
        if (item instanceof End) {
            finished = true;
            RuntimeException error = ((End) item).error;
            if (error != null) {
                throw error;
            }
            return false;
        }
        next = (DiffRecord) item;
        return true;
    }

    @Override
    public DiffRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        DiffRecord r = next;
        next = null;
        return r;
    }

    /**
     * Stops the run if it is still going. Records already buffered are dropped.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!finished) {
            logger.info("Diff stream closed before the end, cancelling");
        }
        Runnable c = canceller;
        if (c != null) {
            c.run();
        }
        buffer.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    public DiffSummary getSummary() {
        return summary;
    }

    /**
     * Left table with its compared columns resolved.
     */
    public TableRef getLeftTable() {
        return leftTable;
    }

    public TableRef getRightTable() {
        return rightTable;
    }

    private static final class End {
        private final RuntimeException error;

        End(RuntimeException error) {
            this.error = error;
        }
    }
}
