package io.xdiff.diff;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.xdiff.accessor.TableAccessor;
import io.xdiff.model.KeyRange;
import io.xdiff.model.Segment;
import io.xdiff.model.TableRef;

/**
 * Obtains count and checksum of one key range from both sides, the two queries running concurrently,
 * and classifies the range.
 */
public class SegmentComparator {

    private static final Logger logger = LoggerFactory.getLogger(SegmentComparator.class);

    private final TableAccessor left;
    private final TableAccessor right;
    private final TableRef leftTable;
    private final TableRef rightTable;
    private final long exactDiffThreshold;
    private final Retryer retryer;
    private final ExecutorService queryPool;

    public SegmentComparator(TableAccessor left, TableAccessor right, TableRef leftTable, TableRef rightTable,
                             long exactDiffThreshold, Retryer retryer, ExecutorService queryPool) {
        this.left = left;
        this.right = right;
        this.leftTable = leftTable;
        this.rightTable = rightTable;
        this.exactDiffThreshold = exactDiffThreshold;
        this.retryer = retryer;
        this.queryPool = queryPool;
    }

    public SegmentComparison compare(KeyRange range) {
        long start = System.currentTimeMillis();
        Future<Segment> leftFuture = queryPool.submit(() ->
                retryer.call("left segment", range, () -> left.segment(leftTable, range, leftTable.getColumns())));
        Segment rightSegment;
        try {
            rightSegment = retryer.call("right segment", range,
                    () -> right.segment(rightTable, range, rightTable.getColumns()));
        } catch (RuntimeException e) {
            leftFuture.cancel(true);
            throw e;
        }
        Segment leftSegment = await(leftFuture);
        SegmentComparison comparison = new SegmentComparison(range, leftSegment, rightSegment, exactDiffThreshold);
        if (logger.isTraceEnabled()) {
            logger.trace("compared {} in {} ms: {}", range, System.currentTimeMillis() - start, comparison);
        }
        return comparison;
    }

    private static Segment await(Future<Segment> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted waiting for left segment");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new DiffRunException("left segment", null, cause);
        }
    }
}
