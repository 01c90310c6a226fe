package io.xdiff.diff;

/**
 * Tuning of one diff run. Immutable; built once through {@link Builder} and shared by every component
 * of the run.
 */
public class DiffConfiguration {

    public static final int DEFAULT_BISECTION_FACTOR = 10;
    public static final long DEFAULT_EXACT_DIFF_THRESHOLD = 16 * 1024;
    public static final int DEFAULT_MAX_DEPTH = 16;
    public static final int DEFAULT_THREADS = 8;
    public static final int DEFAULT_MAX_QUERIES = 4;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_BACKOFF_MILLIS = 1000;
    public static final long DEFAULT_MAX_BACKOFF_MILLIS = 30000;
    public static final int DEFAULT_STREAM_BUFFER_SIZE = 1000;
    public static final int DEFAULT_STATUS_INTERVAL_SECONDS = 5;

    private final int bisectionFactor;
    private final long exactDiffThreshold;
    private final int maxDepth;
    private final int threads;
    private final int leftMaxQueries;
    private final int rightMaxQueries;
    private final int maxRetries;
    private final long retryBackoffMillis;
    private final long maxBackoffMillis;
    private final boolean skipFailedRanges;
    private final int streamBufferSize;
    private final int statusIntervalSeconds;
    private final Object minKey;
    private final Object maxKey;

    private DiffConfiguration(Builder b) {
        this.bisectionFactor = b.bisectionFactor;
        this.exactDiffThreshold = b.exactDiffThreshold;
        this.maxDepth = b.maxDepth;
        this.threads = b.threads;
        this.leftMaxQueries = b.leftMaxQueries;
        this.rightMaxQueries = b.rightMaxQueries;
        this.maxRetries = b.maxRetries;
        this.retryBackoffMillis = b.retryBackoffMillis;
        this.maxBackoffMillis = b.maxBackoffMillis;
        this.skipFailedRanges = b.skipFailedRanges;
        this.streamBufferSize = b.streamBufferSize;
        this.statusIntervalSeconds = b.statusIntervalSeconds;
        this.minKey = b.minKey;
        this.maxKey = b.maxKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DiffConfiguration defaults() {
        return builder().build();
    }

    public int getBisectionFactor() {
        return bisectionFactor;
    }

    /**
     * Largest row count, on either side, for which a mismatching range is diffed row by row instead
     * of being split further.
     */
    public long getExactDiffThreshold() {
        return exactDiffThreshold;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getThreads() {
        return threads;
    }

    public int getLeftMaxQueries() {
        return leftMaxQueries;
    }

    public int getRightMaxQueries() {
        return rightMaxQueries;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getRetryBackoffMillis() {
        return retryBackoffMillis;
    }

    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public boolean isSkipFailedRanges() {
        return skipFailedRanges;
    }

    public int getStreamBufferSize() {
        return streamBufferSize;
    }

    /**
     * Seconds between status lines, 0 to disable.
     */
    public int getStatusIntervalSeconds() {
        return statusIntervalSeconds;
    }

    /**
     * Inclusive lower key bound replacing the observed minimum, or {@code null}.
     */
    public Object getMinKey() {
        return minKey;
    }

    /**
     * Exclusive upper key bound replacing the observed maximum, or {@code null}.
     */
    public Object getMaxKey() {
        return maxKey;
    }

    public Builder toBuilder() {
        return new Builder()
                .bisectionFactor(bisectionFactor)
                .exactDiffThreshold(exactDiffThreshold)
                .maxDepth(maxDepth)
                .threads(threads)
                .leftMaxQueries(leftMaxQueries)
                .rightMaxQueries(rightMaxQueries)
                .maxRetries(maxRetries)
                .retryBackoffMillis(retryBackoffMillis)
                .maxBackoffMillis(maxBackoffMillis)
                .skipFailedRanges(skipFailedRanges)
                .streamBufferSize(streamBufferSize)
                .statusIntervalSeconds(statusIntervalSeconds)
                .minKey(minKey)
                .maxKey(maxKey);
    }

    @Override
    public String toString() {
        return "DiffConfiguration[bisectionFactor=" + bisectionFactor + ", exactDiffThreshold=" + exactDiffThreshold
                + ", maxDepth=" + maxDepth + ", threads=" + threads + ", leftMaxQueries=" + leftMaxQueries
                + ", rightMaxQueries=" + rightMaxQueries + ", maxRetries=" + maxRetries
                + ", skipFailedRanges=" + skipFailedRanges + ", minKey=" + minKey + ", maxKey=" + maxKey + "]";
    }

    public static class Builder {
        private int bisectionFactor = DEFAULT_BISECTION_FACTOR;
        private long exactDiffThreshold = DEFAULT_EXACT_DIFF_THRESHOLD;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int threads = DEFAULT_THREADS;
        private int leftMaxQueries = DEFAULT_MAX_QUERIES;
        private int rightMaxQueries = DEFAULT_MAX_QUERIES;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryBackoffMillis = DEFAULT_RETRY_BACKOFF_MILLIS;
        private long maxBackoffMillis = DEFAULT_MAX_BACKOFF_MILLIS;
        private boolean skipFailedRanges;
        private int streamBufferSize = DEFAULT_STREAM_BUFFER_SIZE;
        private int statusIntervalSeconds = DEFAULT_STATUS_INTERVAL_SECONDS;
        private Object minKey;
        private Object maxKey;

        private Builder() {
        }

        public Builder bisectionFactor(int bisectionFactor) {
            this.bisectionFactor = bisectionFactor;
            return this;
        }

        public Builder exactDiffThreshold(long exactDiffThreshold) {
            this.exactDiffThreshold = exactDiffThreshold;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder leftMaxQueries(int leftMaxQueries) {
            this.leftMaxQueries = leftMaxQueries;
            return this;
        }

        public Builder rightMaxQueries(int rightMaxQueries) {
            this.rightMaxQueries = rightMaxQueries;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBackoffMillis(long retryBackoffMillis) {
            this.retryBackoffMillis = retryBackoffMillis;
            return this;
        }

        public Builder maxBackoffMillis(long maxBackoffMillis) {
            this.maxBackoffMillis = maxBackoffMillis;
            return this;
        }

        public Builder skipFailedRanges(boolean skipFailedRanges) {
            this.skipFailedRanges = skipFailedRanges;
            return this;
        }

        public Builder streamBufferSize(int streamBufferSize) {
            this.streamBufferSize = streamBufferSize;
            return this;
        }

        public Builder statusIntervalSeconds(int statusIntervalSeconds) {
            this.statusIntervalSeconds = statusIntervalSeconds;
            return this;
        }

        public Builder minKey(Object minKey) {
            this.minKey = minKey;
            return this;
        }

        public Builder maxKey(Object maxKey) {
            this.maxKey = maxKey;
            return this;
        }

        public DiffConfiguration build() {
            check(bisectionFactor >= 2, "bisectionFactor must be at least 2");
            check(exactDiffThreshold >= 1, "exactDiffThreshold must be positive");
            check(maxDepth >= 1, "maxDepth must be at least 1");
            check(threads >= 1, "threads must be at least 1");
            check(leftMaxQueries >= 1 && rightMaxQueries >= 1, "maxQueries must be at least 1 per side");
            check(maxRetries >= 0, "maxRetries must not be negative");
            check(retryBackoffMillis >= 0 && maxBackoffMillis >= 0, "retry backoff must not be negative");
            check(streamBufferSize >= 1, "streamBufferSize must be at least 1");
            check(statusIntervalSeconds >= 0, "statusIntervalSeconds must not be negative");
            return new DiffConfiguration(this);
        }

        private static void check(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }
}
