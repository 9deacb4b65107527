package com.ryuqq.jobstore.testkit.contract;

import com.ryuqq.jobstore.application.job.Job;
import com.ryuqq.jobstore.application.job.JobData;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.InvocationData;
import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.layout.CollectionResolver;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: a stored job loads back as the same invocation.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class InvocationRoundTripContractTest extends AbstractContractTest {

    @Test
    void genericArguments_loadBackEqual() {
        // Given
        Job job = Job.of(SampleJobs.class, "processOrders",
            List.of("A-1", "A-2"), Map.of("A-1", 3, "A-2", 1)).onQueue("orders");

        // When
        String jobId = connection.createExpiredJob(job, null, null, Duration.ofHours(1));
        JobData data = connection.getJobData(jobId).orElseThrow();

        // Then
        assertTrue(data.isLoaded());
        assertEquals(job, data.job());
        assertEquals("created", data.state());
        assertEquals("orders", data.queueName());
    }

    @Test
    void recordArgument_loadsBackEqual() {
        // Given
        Job job = Job.of(SampleJobs.class, "processReport", new SampleJobs.Report("monthly", 12));

        // When
        String jobId = connection.createExpiredJob(job, Map.of(), null, Duration.ofHours(1));

        // Then
        assertEquals(job, connection.getJobData(jobId).orElseThrow().requireJob());
    }

    @Test
    void nullAndPrimitiveArguments_loadBackEqual() {
        // Given
        Job job = Job.of(SampleJobs.class, "sendEmail", null, 5);

        // When
        String jobId = connection.createExpiredJob(job, null, null, Duration.ofHours(1));

        // Then
        Job loaded = connection.getJobData(jobId).orElseThrow().requireJob();
        assertNull(loaded.getArgs().get(0));
        assertEquals(5, loaded.getArgs().get(1));
    }

    @Test
    void staticMethod_loadsBack() {
        Job job = Job.of(SampleJobs.class, "cleanup");

        String jobId = connection.createExpiredJob(job, null, null, Duration.ofHours(1));

        Job loaded = connection.getJobData(jobId).orElseThrow().requireJob();
        assertTrue(loaded.isStatic());
        assertEquals("SampleJobs.cleanup", loaded.displayName());
    }

    @Test
    void missingType_reportedAsLoadException() {
        // Given: invocation refers to a type that no longer exists
        String jobId = connection.createExpiredJob(Job.of(SampleJobs.class, "cleanup"), null, null,
            Duration.ofHours(1));
        CollectionResolver resolver = options().createResolver();
        String collection = resolver.collectionFor(DocumentKind.JOB);
        JobDocument stored = rawStore.get(collection, JobDocument.idFor(jobId),
            resolver.partitionKeyFor(DocumentKind.JOB, "default"), JobDocument.class).orElseThrow();
        stored.setInvocationData(new InvocationData("com.example.RemovedJobs", "run", List.of(), List.of(), null));
        rawStore.replace(collection, stored);

        // When
        JobData data = connection.getJobData(jobId).orElseThrow();

        // Then
        assertFalse(data.isLoaded());
        assertNotNull(data.loadException());
        assertTrue(data.loadException().getMessage().contains("com.example.RemovedJobs"));
        assertEquals("com.example.RemovedJobs", data.invocationData().getType());
    }
}
