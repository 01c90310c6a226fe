package io.xdiff.accessor;

/**
 * A failed backend call. {@link #isTransient()} tells callers whether retrying may help (network blip,
 * timeout, lost connection) or not (bad SQL, missing table, permissions).
 */
public class TableAccessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean transientFailure;

    public TableAccessException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public TableAccessException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
