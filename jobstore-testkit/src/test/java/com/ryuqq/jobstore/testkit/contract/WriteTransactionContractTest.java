package com.ryuqq.jobstore.testkit.contract;

import com.ryuqq.jobstore.application.lifecycle.StateChange;
import com.ryuqq.jobstore.application.transaction.WriteTransaction;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;
import com.ryuqq.jobstore.core.statemachine.JobState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: write transactions apply in order and stop at the first failure.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class WriteTransactionContractTest extends AbstractContractTest {

    @Test
    void nothingAppliedBeforeCommit() {
        // Given
        WriteTransaction transaction = connection.createWriteTransaction();
        transaction.incrementCounter("stats:succeeded");
        transaction.addToSet("s", "v");

        // Then
        assertEquals(2, transaction.operationCount());
        assertEquals(0, connection.getCounter("stats:succeeded"));
        assertEquals(0, connection.getSetCount("s"));

        // When
        transaction.commit();

        // Then
        assertEquals(1, connection.getCounter("stats:succeeded"));
        assertEquals(1, connection.getSetCount("s"));
    }

    @Test
    void closeWithoutCommit_discardsOperations() {
        try (WriteTransaction transaction = connection.createWriteTransaction()) {
            transaction.incrementCounter("stats:succeeded");
        }

        assertEquals(0, connection.getCounter("stats:succeeded"));
    }

    @Test
    void useAfterCommitOrClose_throws() {
        WriteTransaction committed = connection.createWriteTransaction();
        committed.commit();
        assertThrows(IllegalStateException.class, committed::commit);
        assertThrows(IllegalStateException.class, () -> committed.incrementCounter("x"));

        WriteTransaction closed = connection.createWriteTransaction();
        closed.close();
        assertThrows(IllegalStateException.class, () -> closed.addToSet("s", "v"));
    }

    @Test
    void failure_keepsEarlierOperations_andSkipsLaterOnes() {
        // Given: third operation is rejected when it runs
        WriteTransaction transaction = connection.createWriteTransaction();
        transaction.incrementCounter("first");
        transaction.insertToList("log", "second");
        transaction.trimList("log", -1, 0);
        transaction.incrementCounter("fourth");

        // When
        assertThrows(IllegalArgumentException.class, transaction::commit);

        // Then
        assertEquals(1, connection.getCounter("first"));
        assertEquals(1, connection.getListCount("log"));
        assertEquals(0, connection.getCounter("fourth"));
    }

    @Test
    void stateChange_onMissingJob_isIgnored() {
        try (WriteTransaction transaction = connection.createWriteTransaction()) {
            transaction.setJobState("missing-job", StateChange.of(JobState.SUCCEEDED.getValue(), "Done"));
            transaction.incrementCounter("after");
            transaction.commit();
        }

        assertTrue(connection.getStateData("missing-job").isEmpty());
        assertEquals(1, connection.getCounter("after"));
    }

    @Test
    void storeFailure_propagatesFromCommit() {
        // Given
        WriteTransaction transaction = connection.createWriteTransaction();
        transaction.incrementCounter("stats:succeeded");
        faultyStore.failWith(new DocumentStoreException("forbidden", false), 1);

        // When / Then
        assertThrows(DocumentStoreException.class, transaction::commit);
        assertEquals(0, connection.getCounter("stats:succeeded"));
    }

    @Test
    void stateChange_andCounters_inOneTransaction() {
        // Given
        String jobId = createEnqueuedJob("default");

        // When
        try (WriteTransaction transaction = connection.createWriteTransaction()) {
            transaction.setJobState(jobId, StateChange.of(JobState.SUCCEEDED.getValue(), "Completed"));
            transaction.expireJob(jobId, Duration.ofDays(1));
            transaction.incrementCounter("stats:succeeded");
            transaction.incrementCounter("stats:succeeded:2024-01-01", Duration.ofDays(30));
            transaction.commit();
        }

        // Then
        assertJobState(jobId, JobState.SUCCEEDED);
        assertEquals(1, connection.getCounter("stats:succeeded"));
        assertEquals(1L, storage.getMonitoringApi().succeededByDatesCount()
            .get(LocalDate.of(2024, 1, 1)));
    }
}
