package com.ryuqq.jobstore.core.spi;

/**
 * A store call did not complete within its per-call timeout. Transient.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class DocumentStoreTimeoutException extends DocumentStoreException {

    private final String operationName;
    private final long timeoutMs;

    public DocumentStoreTimeoutException(String operationName, long timeoutMs, Throwable cause) {
        super(String.format("Operation '%s' timed out after %d ms", operationName, timeoutMs), cause, true);
        this.operationName = operationName;
        this.timeoutMs = timeoutMs;
    }

    public String getOperationName() {
        return operationName;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
