package io.xdiff.diff;

import io.xdiff.model.KeyRange;

/**
 * A failure that ends a diff run, or with skipping enabled one range of it.
 */
public class DiffRunException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient KeyRange range;
    private final String operation;

    public DiffRunException(String operation, KeyRange range, Throwable cause) {
        super(operation + " failed" + (range == null ? "" : " for range " + range)
                + (cause == null ? "" : ": " + cause.getMessage()), cause);
        this.operation = operation;
        this.range = range;
    }

    protected DiffRunException(String message, String operation) {
        super(message);
        this.operation = operation;
        this.range = null;
    }

    /**
     * Key range being processed, {@code null} for failures outside any range.
     */
    public KeyRange getRange() {
        return range;
    }

    public String getOperation() {
        return operation;
    }
}
