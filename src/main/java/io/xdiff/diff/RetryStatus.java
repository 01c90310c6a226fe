package io.xdiff.diff;

/**
 * Attempt bookkeeping for one retried call: exponential backoff of {@code 2^attempt * backoff}
 * milliseconds after the previous attempt, capped.
 */
public class RetryStatus {
    private final int attempt;
    private final long prevAttempt;
    private final int maxAttempts;
    private final long backoffMillis;
    private final long maxBackoffMillis;
    private final long nextAttemptThreshold;

    public RetryStatus(int attempt, long prevAttempt, int maxAttempts, long backoffMillis, long maxBackoffMillis) {
        this.attempt = attempt;
        this.prevAttempt = prevAttempt;
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
        nextAttemptThreshold = assignNextThreshold();
    }

    public static RetryStatus first(int maxRetries, long backoffMillis, long maxBackoffMillis) {
        return new RetryStatus(0, System.currentTimeMillis(), maxRetries + 1, backoffMillis, maxBackoffMillis);
    }

    private long assignNextThreshold() {
        long interval = Math.min((long) (Math.pow(2, attempt) * backoffMillis), maxBackoffMillis);
        return prevAttempt + interval;
    }

    public long getNextAttemptThreshold() {
        return nextAttemptThreshold;
    }

    public boolean canRetry() {
        return System.currentTimeMillis() >= nextAttemptThreshold;
    }

    /**
     * Status of the next attempt, or {@code null} when the attempts are used up.
     */
    public RetryStatus increment() {
        int newAttempt = attempt + 1;
        if (newAttempt >= maxAttempts) {
            return null;
        }
        return new RetryStatus(newAttempt, System.currentTimeMillis(), maxAttempts, backoffMillis, maxBackoffMillis);
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
