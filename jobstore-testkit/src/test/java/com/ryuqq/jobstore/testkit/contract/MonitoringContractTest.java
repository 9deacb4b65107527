package com.ryuqq.jobstore.testkit.contract;

import com.ryuqq.jobstore.application.fetch.FetchedJob;
import com.ryuqq.jobstore.application.lifecycle.StateChange;
import com.ryuqq.jobstore.application.monitoring.JobSummaryDto;
import com.ryuqq.jobstore.application.monitoring.MonitoringApi;
import com.ryuqq.jobstore.application.monitoring.QueueSummaryDto;
import com.ryuqq.jobstore.application.monitoring.StatisticsDto;
import com.ryuqq.jobstore.application.server.ServerContext;
import com.ryuqq.jobstore.application.transaction.WriteTransaction;
import com.ryuqq.jobstore.core.model.CancellationToken;
import com.ryuqq.jobstore.core.statemachine.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: dashboard queries reflect the stored jobs.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class MonitoringContractTest extends AbstractContractTest {

    private MonitoringApi monitoring;

    @BeforeEach
    void setUpMonitoring() {
        monitoring = storage.getMonitoringApi();
    }

    private void succeed(String jobId) {
        try (WriteTransaction transaction = connection.createWriteTransaction()) {
            transaction.setJobState(jobId, StateChange.of(JobState.SUCCEEDED.getValue(), "Completed"));
            transaction.incrementCounter("stats:succeeded:2024-01-01", Duration.ofDays(30));
            transaction.incrementCounter("stats:succeeded:2024-01-01-00", Duration.ofDays(1));
            transaction.commit();
        }
    }

    @Test
    void statistics_countJobsByState() {
        // Given
        createEnqueuedJob("default");
        createEnqueuedJob("default");
        String processing = createEnqueuedJob("critical");
        connection.fetchNextJob(List.of("critical"), CancellationToken.NONE).orElseThrow();
        succeed(createEnqueuedJob("low"));
        connection.announceServer("worker-1", new ServerContext(2, List.of("default")));
        try (WriteTransaction transaction = connection.createWriteTransaction()) {
            transaction.addToSet("recurring-jobs", "daily-report");
            transaction.commit();
        }

        // When
        StatisticsDto statistics = monitoring.getStatistics();

        // Then
        assertEquals(2, statistics.enqueued());
        assertEquals(1, statistics.processing());
        assertEquals(1, statistics.succeeded());
        assertEquals(0, statistics.failed());
        assertEquals(1, statistics.servers());
        assertEquals(3, statistics.queues());
        assertEquals(1, statistics.recurring());
        assertJobState(processing, JobState.PROCESSING);
    }

    @Test
    void queues_listedByName_withFirstJobs() {
        // Given
        String first = createEnqueuedJob("default");
        advance(Duration.ofSeconds(1));
        createEnqueuedJob("default");
        createEnqueuedJob("critical");

        // When
        List<QueueSummaryDto> queues = monitoring.queues(1);

        // Then
        assertEquals(List.of("critical", "default"), queues.stream().map(QueueSummaryDto::name).toList());
        QueueSummaryDto defaultQueue = queues.get(1);
        assertEquals(2, defaultQueue.length());
        assertEquals(0, defaultQueue.fetched());
        assertEquals(first, defaultQueue.firstJobs().get(0).jobId());
    }

    @Test
    void enqueuedAndFetchedJobs_paged() {
        // Given
        for (int i = 0; i < 5; i++) {
            createEnqueuedJob("default");
            advance(Duration.ofSeconds(1));
        }
        FetchedJob fetched = connection.fetchNextJob(List.of("default"), CancellationToken.NONE).orElseThrow();

        // When
        List<JobSummaryDto> page = monitoring.enqueuedJobs("default", 2, 10);

        // Then
        assertEquals(2, page.size());
        assertEquals(4, monitoring.enqueuedCount("default"));
        assertEquals(1, monitoring.fetchedCount("default"));
        JobSummaryDto processing = monitoring.fetchedJobs("default", 0, 10).get(0);
        assertEquals(fetched.getJobId(), processing.jobId());
        assertEquals("SampleJobs.sendEmail", processing.jobName());
        assertEquals("processing", processing.state());
    }

    @Test
    void succeededJobs_newestFirst() {
        // Given
        String older = createEnqueuedJob("default");
        advance(Duration.ofMinutes(1));
        String newer = createEnqueuedJob("default");
        succeed(older);
        succeed(newer);

        // When
        List<JobSummaryDto> succeeded = monitoring.succeededJobs(0, 10);

        // Then
        assertEquals(List.of(newer, older), succeeded.stream().map(JobSummaryDto::jobId).toList());
        assertEquals("Completed", succeeded.get(0).reason());
    }

    @Test
    void dailyAndHourlyStats_readCounters() {
        // Given
        succeed(createEnqueuedJob("default"));
        succeed(createEnqueuedJob("default"));

        // When
        Map<LocalDate, Long> daily = monitoring.succeededByDatesCount();
        Map<Instant, Long> hourly = monitoring.hourlySucceededJobs();

        // Then
        assertEquals(MonitoringApi.DAILY_STATS_DAYS, daily.size());
        assertEquals(2L, daily.get(LocalDate.of(2024, 1, 1)));
        assertEquals(0L, daily.get(LocalDate.of(2023, 12, 31)));
        assertEquals(MonitoringApi.HOURLY_STATS_HOURS, hourly.size());
        assertEquals(2L, hourly.get(Instant.parse("2024-01-01T00:00:00Z")));
        assertEquals(0L, monitoring.failedByDatesCount().get(LocalDate.of(2024, 1, 1)));
    }

    @Test
    void jobDetails_unknownJob_isEmpty() {
        assertTrue(monitoring.jobDetails("missing").isEmpty());
    }
}
