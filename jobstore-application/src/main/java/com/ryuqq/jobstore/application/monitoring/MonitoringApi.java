package com.ryuqq.jobstore.application.monitoring;

import com.ryuqq.jobstore.application.collections.KeyedCollections;
import com.ryuqq.jobstore.application.lifecycle.JobRepository;
import com.ryuqq.jobstore.application.server.ServerRegistry;
import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.InvocationData;
import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.document.QueueDocument;
import com.ryuqq.jobstore.core.document.ServerData;
import com.ryuqq.jobstore.core.document.ServerDocument;
import com.ryuqq.jobstore.core.document.StateHistoryEntry;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.statemachine.JobState;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 대시보드 조회 API.
 *
 * <p>읽기 전용이며 대부분 파티션 전체 쿼리를 사용하므로 워커 경로에서 호출하지 않아야 합니다.
 * 일별/시간별 통계는 {@code stats:succeeded:yyyy-MM-dd[-HH]} 형태의 카운터를 읽습니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class MonitoringApi {

    /** 일별 통계 일수. */
    public static final int DAILY_STATS_DAYS = 7;

    /** 시간별 통계 시간 수. */
    public static final int HOURLY_STATS_HOURS = 24;

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter HOUR_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH");

    private final StorageContext context;
    private final JobRepository jobs;
    private final KeyedCollections collections;
    private final ServerRegistry servers;

    public MonitoringApi(StorageContext context) {
        this.context = context;
        this.jobs = new JobRepository(context);
        this.collections = new KeyedCollections(context);
        this.servers = new ServerRegistry(context);
    }

    public StatisticsDto getStatistics() {
        return new StatisticsDto(
            countByState(JobState.ENQUEUED),
            countByState(JobState.SCHEDULED),
            countByState(JobState.PROCESSING),
            countByState(JobState.SUCCEEDED),
            countByState(JobState.FAILED),
            countByState(JobState.DELETED),
            servers.findAll().size(),
            findQueueDocuments().size(),
            collections.getSetCount("recurring-jobs"),
            collections.getSetCount("retries")
        );
    }

    /**
     * 큐 목록 (이름 순).
     *
     * @param firstJobsCount 큐마다 포함할 맨 앞 Job 수
     * @return 큐 요약
     */
    public List<QueueSummaryDto> queues(int firstJobsCount) {
        List<QueueSummaryDto> result = new ArrayList<>();
        for (QueueDocument queue : findQueueDocuments()) {
            String name = queue.getQueueName();
            result.add(new QueueSummaryDto(name,
                jobs.countInQueue(name, JobState.ENQUEUED),
                jobs.countInQueue(name, JobState.PROCESSING),
                firstJobsCount > 0 ? enqueuedJobs(name, 0, firstJobsCount) : List.of()));
        }
        return result;
    }

    public List<ServerSummaryDto> servers() {
        List<ServerSummaryDto> result = new ArrayList<>();
        for (ServerDocument server : servers.findAll()) {
            ServerData data = server.getData();
            result.add(new ServerSummaryDto(server.getServerId(),
                data == null ? null : data.getName(),
                data == null ? 0 : data.getWorkerCount(),
                data == null || data.getQueues() == null ? List.of() : List.copyOf(data.getQueues()),
                server.getStartedAt(),
                server.getLastHeartbeat()));
        }
        return result;
    }

    public Optional<JobDetailsDto> jobDetails(String jobId) {
        return jobs.find(jobId).map(job -> {
            List<StateHistoryDto> history = new ArrayList<>();
            List<StateHistoryEntry> entries = job.getStateHistory();
            for (int i = entries.size() - 1; i >= 0; i--) {
                StateHistoryEntry entry = entries.get(i);
                history.add(new StateHistoryDto(entry.getState(), entry.getReason(), entry.getCreatedAt(),
                    entry.getData()));
            }
            return new JobDetailsDto(job.getJobId(), jobName(job.getInvocationData()), job.getQueueName(),
                job.getCreatedAt(), job.getExpireAt(), job.getParameters(), job.getInvocationData(), history);
        });
    }

    /**
     * 큐의 enqueued Job (fetch 순서).
     */
    public List<JobSummaryDto> enqueuedJobs(String queue, int from, int perPage) {
        return queueJobs(queue, JobState.ENQUEUED, from, perPage);
    }

    /**
     * 큐의 processing Job (생성 순서).
     */
    public List<JobSummaryDto> fetchedJobs(String queue, int from, int perPage) {
        return queueJobs(queue, JobState.PROCESSING, from, perPage);
    }

    public List<JobSummaryDto> processingJobs(int from, int count) {
        return jobsByState(JobState.PROCESSING, from, count);
    }

    public List<JobSummaryDto> scheduledJobs(int from, int count) {
        return jobsByState(JobState.SCHEDULED, from, count);
    }

    public List<JobSummaryDto> succeededJobs(int from, int count) {
        return jobsByState(JobState.SUCCEEDED, from, count);
    }

    public List<JobSummaryDto> failedJobs(int from, int count) {
        return jobsByState(JobState.FAILED, from, count);
    }

    public List<JobSummaryDto> deletedJobs(int from, int count) {
        return jobsByState(JobState.DELETED, from, count);
    }

    public long enqueuedCount(String queue) {
        return jobs.countInQueue(queue, JobState.ENQUEUED);
    }

    public long fetchedCount(String queue) {
        return jobs.countInQueue(queue, JobState.PROCESSING);
    }

    public long countByState(JobState state) {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
            .whereEquals("state", state.getValue())
            .build();
        return context.queryAcrossPartitions(DocumentKind.JOB, JobDocument.class, query).stream().count();
    }

    /**
     * 최근 7일 일별 성공 수 (오늘 포함, 오래된 날부터).
     */
    public Map<LocalDate, Long> succeededByDatesCount() {
        return dailyCounts("stats:succeeded");
    }

    public Map<LocalDate, Long> failedByDatesCount() {
        return dailyCounts("stats:failed");
    }

    /**
     * 최근 24시간 시간별 성공 수 (현재 시간 포함, 오래된 시간부터). 키는 UTC 정각입니다.
     */
    public Map<Instant, Long> hourlySucceededJobs() {
        return hourlyCounts("stats:succeeded");
    }

    public Map<Instant, Long> hourlyFailedJobs() {
        return hourlyCounts("stats:failed");
    }

    private Map<LocalDate, Long> dailyCounts(String prefix) {
        LocalDate today = LocalDate.ofInstant(context.now(), ZoneOffset.UTC);
        Map<LocalDate, Long> counts = new LinkedHashMap<>();
        for (int i = DAILY_STATS_DAYS - 1; i >= 0; i--) {
            LocalDate day = today.minusDays(i);
            counts.put(day, collections.getCounter(prefix + ":" + DAY_FORMAT.format(day)));
        }
        return counts;
    }

    private Map<Instant, Long> hourlyCounts(String prefix) {
        Instant currentHour = context.now().truncatedTo(ChronoUnit.HOURS);
        Map<Instant, Long> counts = new LinkedHashMap<>();
        for (int i = HOURLY_STATS_HOURS - 1; i >= 0; i--) {
            Instant hour = currentHour.minus(i, ChronoUnit.HOURS);
            String suffix = HOUR_FORMAT.format(hour.atOffset(ZoneOffset.UTC));
            counts.put(hour, collections.getCounter(prefix + ":" + suffix));
        }
        return counts;
    }

    private List<JobSummaryDto> queueJobs(String queue, JobState state, int from, int perPage) {
        requirePage(from, perPage);
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
            .whereEquals("state", state.getValue())
            .orderBy("createdAt")
            .offset(from)
            .limit(perPage)
            .build();
        List<JobSummaryDto> result = new ArrayList<>();
        for (JobDocument job : context.queryPartition(DocumentKind.JOB, JobDocument.class, queue, query)) {
            result.add(summarize(job));
        }
        return result;
    }

    private List<JobSummaryDto> jobsByState(JobState state, int from, int count) {
        requirePage(from, count);
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
            .whereEquals("state", state.getValue())
            .orderByDescending("createdAt")
            .offset(from)
            .limit(count)
            .build();
        List<JobSummaryDto> result = new ArrayList<>();
        for (JobDocument job : context.queryAcrossPartitions(DocumentKind.JOB, JobDocument.class, query)) {
            result.add(summarize(job));
        }
        return result;
    }

    private List<QueueDocument> findQueueDocuments() {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.QUEUE).orderBy("queueName").build();
        return context.queryPartition(DocumentKind.QUEUE, QueueDocument.class, null, query).toList();
    }

    private static JobSummaryDto summarize(JobDocument job) {
        StateHistoryEntry last = job.getLastHistoryEntry();
        return new JobSummaryDto(job.getJobId(), jobName(job.getInvocationData()), job.getQueueName(),
            job.getState(), last == null ? null : last.getReason(), job.getCreatedAt(),
            last == null ? null : last.getCreatedAt(), job.getStateData());
    }

    private static String jobName(InvocationData data) {
        if (data == null || data.getType() == null) {
            return null;
        }
        String type = data.getType();
        return type.substring(type.lastIndexOf('.') + 1) + "." + data.getMethod();
    }

    private static void requirePage(int from, int count) {
        if (from < 0) {
            throw new IllegalArgumentException("from must be >= 0 (current: " + from + ")");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
    }
}
