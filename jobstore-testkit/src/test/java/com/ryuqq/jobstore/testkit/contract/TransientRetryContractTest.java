package com.ryuqq.jobstore.testkit.contract;

import com.ryuqq.jobstore.core.config.JobStoreOptions;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: transient store failures are retried with backoff.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class TransientRetryContractTest extends AbstractContractTest {

    @Override
    protected JobStoreOptions options() {
        return super.options().withMaxRetryAttempts(3);
    }

    @Test
    void transientFailures_retriedUntilSuccess() {
        // Given: two throttled responses
        faultyStore.failWith(new DocumentStoreException("429 Too Many Requests", true), 2);

        // When
        long value = connection.getCounter("stats:succeeded");

        // Then
        assertEquals(0, value);
        assertEquals(3, faultyStore.callCount());
    }

    @Test
    void transientFailures_exhaustRetries() {
        // Given
        faultyStore.failWith(new DocumentStoreException("503 Service Unavailable", true));

        // When / Then
        assertThrows(DocumentStoreException.class, () -> connection.getCounter("stats:succeeded"));
        assertEquals(4, faultyStore.callCount(), "One call plus three retries");
    }

    @Test
    void permanentFailure_notRetried() {
        // Given
        faultyStore.failWith(new DocumentStoreException("400 Bad Request", false));

        // When / Then
        assertThrows(DocumentStoreException.class, () -> connection.getCounter("stats:succeeded"));
        assertEquals(1, faultyStore.callCount());
    }
}
