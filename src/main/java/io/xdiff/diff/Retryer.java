package io.xdiff.diff;

import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.xdiff.accessor.TableAccessException;
import io.xdiff.model.KeyRange;

/**
 * Runs backend calls, retrying transient {@link TableAccessException}s with exponential backoff. A
 * non-transient failure, or a transient one once the retries are used up, becomes a
 * {@link DiffRunException} naming the operation and range.
 */
public class Retryer {

    private static final Logger logger = LoggerFactory.getLogger(Retryer.class);

    private final int maxRetries;
    private final long backoffMillis;
    private final long maxBackoffMillis;
    private final DiffSummary summary;

    public Retryer(DiffConfiguration config, DiffSummary summary) {
        this.maxRetries = config.getMaxRetries();
        this.backoffMillis = config.getRetryBackoffMillis();
        this.maxBackoffMillis = config.getMaxBackoffMillis();
        this.summary = summary;
    }

    public <T> T call(String operation, KeyRange range, Supplier<T> call) {
        RetryStatus status = RetryStatus.first(maxRetries, backoffMillis, maxBackoffMillis);
        while (true) {
            try {
                return call.get();
            } catch (TableAccessException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException(operation + " interrupted");
                }
                if (!e.isTransient()) {
                    throw new DiffRunException(operation, range, e);
                }
                RetryStatus next = status.increment();
                if (next == null) {
                    logger.error("{} for range {} failed after {} attempts", operation, range,
                            status.getMaxAttempts(), e);
                    throw new DiffRunException(operation, range, e);
                }
                status = next;
                summary.retried();
                logger.warn("{} for range {} failed, retry {}/{}: {}", operation, range, status.getAttempt(),
                        maxRetries, e.getMessage());
                awaitRetry(status, operation);
            }
        }
    }

    private void awaitRetry(RetryStatus status, String operation) {
        while (!status.canRetry()) {
            long wait = status.getNextAttemptThreshold() - System.currentTimeMillis();
            try {
                Thread.sleep(Math.max(1, wait));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException(operation + " interrupted while waiting to retry");
            }
        }
    }
}
