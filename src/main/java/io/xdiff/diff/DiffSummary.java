package io.xdiff.diff;

import java.util.Date;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.xdiff.model.DiffRecord;

/**
 * Running statistics of one diff run, updated concurrently by the workers.
 */
public class DiffSummary {
	private static Logger logger = LoggerFactory.getLogger(DiffSummary.class);

	public enum DiffStatus {
		UNSTARTED, RUNNING, SUCCEEDED, CANCELLED, FAILED
	}

	private final LongAdder totalSegments = new LongAdder();
	private final LongAdder totalMatchedSegments = new LongAdder();
	private final LongAdder totalSplitSegments = new LongAdder();
	private final LongAdder totalExactDiffs = new LongAdder();
	private final LongAdder totalFailedSegments = new LongAdder();
	private final LongAdder totalLeftRowsFetched = new LongAdder();
	private final LongAdder totalRightRowsFetched = new LongAdder();
	private final LongAdder totalAdded = new LongAdder();
	private final LongAdder totalRemoved = new LongAdder();
	private final LongAdder totalChanged = new LongAdder();
	private final LongAdder totalRetries = new LongAdder();
	private final LongAdder totalLeftQueries = new LongAdder();
	private final LongAdder totalRightQueries = new LongAdder();

	private volatile long leftRowCount = -1;
	private volatile long rightRowCount = -1;
	private volatile int maxDepthReached;
	private volatile DiffStatus status = DiffStatus.UNSTARTED;
	private volatile long startTime;
	private volatile long endTime;

	public void start() {
		startTime = new Date().getTime();
		status = DiffStatus.RUNNING;
	}

	public void finish(DiffStatus finalStatus) {
		endTime = new Date().getTime();
		status = finalStatus;
	}

	public void segmentCompared(SegmentComparison comparison, int depth) {
		totalSegments.increment();
		if (comparison.getClassification() == SegmentComparison.Classification.MATCH) {
			totalMatchedSegments.increment();
		}
		if (depth == 0) {
			leftRowCount = comparison.getLeft().getCount();
			rightRowCount = comparison.getRight().getCount();
		}
		synchronized (this) {
			maxDepthReached = Math.max(maxDepthReached, depth);
		}
	}

	public void segmentSplit() {
		totalSplitSegments.increment();
	}

	public void exactDiff(long leftRows, long rightRows) {
		totalExactDiffs.increment();
		totalLeftRowsFetched.add(leftRows);
		totalRightRowsFetched.add(rightRows);
	}

	public void segmentFailed() {
		totalFailedSegments.increment();
	}

	public void retried() {
		totalRetries.increment();
	}

	public void leftQuery() {
		totalLeftQueries.increment();
	}

	public void rightQuery() {
		totalRightQueries.increment();
	}

	public void recordEmitted(DiffRecord record) {
		switch (record.getKind()) {
			case ADDED:
				totalAdded.increment();
				break;
			case REMOVED:
				totalRemoved.increment();
				break;
			default:
				totalChanged.increment();
		}
	}

	public String getSummary(boolean done) {
		long millsElapsed = getTimeElapsed();
		int secondsElapsed = (int) (millsElapsed / 1000.);
		String firstLine = done ? String.format("[Status] %s in %s seconds.  ", status, secondsElapsed)
				: String.format("[Status] %s seconds have elapsed.  ", secondsElapsed);
		return String.format("%s%d segments compared (%d matched, %d split, %d diffed exactly, %d failed), "
						+ "max depth %d.  %d/%d rows fetched (left/right).  "
						+ "%d removed, %d added, %d changed.  %d retries.",
				firstLine, totalSegments.longValue(), totalMatchedSegments.longValue(),
				totalSplitSegments.longValue(), totalExactDiffs.longValue(), totalFailedSegments.longValue(),
				maxDepthReached, totalLeftRowsFetched.longValue(), totalRightRowsFetched.longValue(),
				totalRemoved.longValue(), totalAdded.longValue(), totalChanged.longValue(), totalRetries.longValue());
	}

	public void logStatus() {
		logger.info(getSummary(false));
	}

	public long getTimeElapsed() {
		if (startTime == 0) {
			return 0;
		}
		long end = endTime == 0 ? new Date().getTime() : endTime;
		return end - startTime;
	}

	public DiffStatus getStatus() {
		return status;
	}

	/**
	 * Row count of the left table over the compared key range, -1 before it is known.
	 */
	public long getLeftRowCount() {
		return leftRowCount;
	}

	public long getRightRowCount() {
		return rightRowCount;
	}

	public long getSegments() {
		return totalSegments.longValue();
	}

	public long getMatchedSegments() {
		return totalMatchedSegments.longValue();
	}

	public long getSplitSegments() {
		return totalSplitSegments.longValue();
	}

	public long getExactDiffs() {
		return totalExactDiffs.longValue();
	}

	public long getFailedSegments() {
		return totalFailedSegments.longValue();
	}

	public long getLeftRowsFetched() {
		return totalLeftRowsFetched.longValue();
	}

	public long getRightRowsFetched() {
		return totalRightRowsFetched.longValue();
	}

	public long getAdded() {
		return totalAdded.longValue();
	}

	public long getRemoved() {
		return totalRemoved.longValue();
	}

	public long getChanged() {
		return totalChanged.longValue();
	}

	public long getDifferences() {
		return getAdded() + getRemoved() + getChanged();
	}

	public long getRetries() {
		return totalRetries.longValue();
	}

	public long getLeftQueries() {
		return totalLeftQueries.longValue();
	}

	public long getRightQueries() {
		return totalRightQueries.longValue();
	}

	public int getMaxDepthReached() {
		return maxDepthReached;
	}
}
