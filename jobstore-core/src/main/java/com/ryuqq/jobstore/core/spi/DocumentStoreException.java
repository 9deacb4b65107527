package com.ryuqq.jobstore.core.spi;

/**
 * Failure reported by a {@link DocumentStore}.
 *
 * <p>{@link #isTransient()} tells retrying decorators whether the same call may succeed
 * if repeated. Subclasses describe outcomes of a healthy store (conflict, not found,
 * precondition failed) and are never transient.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class DocumentStoreException extends RuntimeException {

    private final boolean transientFailure;

    public DocumentStoreException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public DocumentStoreException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Whether this failure indicates an unhealthy store, as opposed to an expected outcome
     * such as a conflict.
     *
     * @return true for store health failures
     */
    public boolean indicatesStoreFailure() {
        return true;
    }
}
