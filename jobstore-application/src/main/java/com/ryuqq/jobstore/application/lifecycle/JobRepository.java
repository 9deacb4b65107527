package com.ryuqq.jobstore.application.lifecycle;

import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.document.JobIndexDocument;
import com.ryuqq.jobstore.core.model.JobIds;
import com.ryuqq.jobstore.core.spi.DocumentConflictException;
import com.ryuqq.jobstore.core.spi.DocumentNotFoundException;
import com.ryuqq.jobstore.core.spi.DocumentPreconditionFailedException;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.spi.DocumentQuery.Operator;
import com.ryuqq.jobstore.core.statemachine.JobState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Job 문서 저장소.
 *
 * <p>Job은 큐별 파티션에 저장되므로 ID만으로는 위치를 알 수 없습니다.
 * 보조 인덱스({@code jobIndex:{jobId}})로 파티션을 찾고, 인덱스가 없거나 낡았으면
 * 파티션 전체 쿼리로 대체한 뒤 인덱스를 복구합니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>모든 수정은 읽은 etag로 조건부 교체합니다.</li>
 *   <li>etag 불일치 시 다시 읽고 변경을 재적용합니다 (최대 {@code concurrencyRetryAttempts}회).</li>
 *   <li>한도를 넘으면 {@link JobUpdateConflictException}이 발생합니다.</li>
 *   <li>큐 이동도 이전 사본의 etag를 확인한 뒤에만 이전 사본을 지웁니다.</li>
 * </ul>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JobRepository.class);

    private final StorageContext context;

    public JobRepository(StorageContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    /**
     * Job 생성. 인덱스를 먼저 기록해 Job이 항상 ID로 찾아지게 합니다.
     *
     * @param job 새 Job (jobId, queueName 필수)
     * @return 저장된 Job
     */
    public JobDocument create(JobDocument job) {
        JobIds.require(job.getJobId());
        if (context.options().jobIndexEnabled()) {
            context.upsert(indexFor(job));
        }
        JobDocument created = context.create(job);
        log.debug("Created job {} in queue {}", job.getJobId(), job.getQueueName());
        return created;
    }

    /**
     * ID로 Job 조회.
     *
     * @param jobId Job ID
     * @return Job, 없으면 empty
     */
    public Optional<JobDocument> find(String jobId) {
        JobIds.require(jobId);
        boolean indexEnabled = context.options().jobIndexEnabled();

        if (indexEnabled) {
            Optional<JobIndexDocument> index = context.read(DocumentKind.JOB_INDEX, JobIndexDocument.class,
                JobIndexDocument.idFor(jobId), null);
            if (index.isPresent()) {
                Optional<JobDocument> job = context.store().get(context.resolver().collectionFor(DocumentKind.JOB),
                    JobDocument.idFor(jobId), index.get().getJobPartitionKey(), JobDocument.class);
                if (job.isPresent()) {
                    return job;
                }
                log.debug("Job index for {} points to {} but the job is not there", jobId,
                    index.get().getJobPartitionKey());
            }
        }

        Optional<JobDocument> found = findAcrossQueues(jobId);
        if (found.isPresent() && indexEnabled) {
            context.upsert(indexFor(found.get()));
            log.debug("Repaired job index for {} (queue: {})", jobId, found.get().getQueueName());
        }
        return found;
    }

    /**
     * Job 수정 (etag 조건부, 충돌 시 재적용).
     *
     * <p>변경 함수는 재시도마다 새로 읽은 문서에 다시 호출되므로 부수효과가 없어야 합니다.
     * 큐 이동은 {@link #moveToQueue(String, String, Consumer)}를 사용해야 합니다.</p>
     *
     * @param jobId Job ID
     * @param mutation 변경 함수
     * @return 수정된 Job, Job이 없으면 empty
     * @throws JobUpdateConflictException 재시도 한도 초과
     * @throws IllegalStateException 변경 함수가 큐를 바꾼 경우
     */
    public Optional<JobDocument> mutate(String jobId, Consumer<JobDocument> mutation) {
        return mutateIf(jobId, job -> true, mutation);
    }

    /**
     * 조건을 만족할 때만 Job 수정.
     *
     * <p>조건은 재시도마다 새로 읽은 문서로 다시 평가되며, 거짓이면 쓰지 않고 empty를 반환합니다.</p>
     *
     * @param jobId Job ID
     * @param condition 수정 조건
     * @param mutation 변경 함수
     * @return 수정된 Job, Job이 없거나 조건이 거짓이면 empty
     * @throws JobUpdateConflictException 재시도 한도 초과
     */
    public Optional<JobDocument> mutateIf(String jobId, Predicate<JobDocument> condition,
                                          Consumer<JobDocument> mutation) {
        int maxAttempts = context.options().concurrencyRetryAttempts();
        RuntimeException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<JobDocument> current = find(jobId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            JobDocument job = current.get();
            if (!condition.test(job)) {
                return Optional.empty();
            }
            String queue = job.getQueueName();

            mutation.accept(job);
            if (!Objects.equals(queue, job.getQueueName())) {
                throw new IllegalStateException("Queue of job " + jobId + " must be changed through moveToQueue");
            }
            job.setUpdatedAt(context.now());

            try {
                return Optional.of(context.replace(job));
            } catch (DocumentPreconditionFailedException | DocumentNotFoundException e) {
                lastConflict = e;
                log.debug("Job {} changed concurrently, re-reading (attempt {}/{})", jobId, attempt, maxAttempts);
            }
        }
        throw new JobUpdateConflictException(jobId, maxAttempts, lastConflict);
    }

    /**
     * Job을 다른 큐로 옮기며 수정.
     *
     * <p>같은 큐이면 {@link #mutate(String, Consumer)}와 같습니다. 다른 큐이면:</p>
     * <ol>
     *   <li>새 파티션에 사본을 생성 (이미 있으면 충돌)</li>
     *   <li>이전 사본을 읽은 etag로 조건부 교체한 뒤 그 etag로 삭제</li>
     *   <li>인덱스를 새 위치로 갱신</li>
     * </ol>
     *
     * <p>2단계에서 이전 사본이 바뀌었거나 사라졌으면 새 사본을 지우고 다시 읽어 재시도하므로,
     * 동시에 일어난 수정이 덮어써지거나 두 큐에 사본이 남지 않습니다. 대상 파티션에 이전 사본보다
     * 오래된 사본이 남아 있으면 중단된 이동의 잔여물로 보고 지웁니다.</p>
     *
     * @param jobId Job ID
     * @param queue 대상 큐
     * @param mutation 변경 함수 (큐 변경 후 호출됨, 재시도마다 다시 호출됨)
     * @return 수정된 Job, Job이 없으면 empty
     * @throws JobUpdateConflictException 재시도 한도 초과
     */
    public Optional<JobDocument> moveToQueue(String jobId, String queue, Consumer<JobDocument> mutation) {
        String targetQueue = queue == null || queue.isBlank() ? JobDocument.DEFAULT_QUEUE : queue;
        int maxAttempts = context.options().concurrencyRetryAttempts();
        RuntimeException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<JobDocument> current = find(jobId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            if (targetQueue.equals(current.get().getQueueName())) {
                return mutate(jobId, mutation);
            }

            JobDocument job = current.get();
            String previousQueue = job.getQueueName();
            String sourceEtag = job.getEtag();
            Instant sourceUpdatedAt = job.getUpdatedAt();

            job.setQueueName(targetQueue);
            mutation.accept(job);
            job.setUpdatedAt(context.now());
            job.setEtag(null);

            JobDocument moved;
            try {
                moved = context.create(job);
            } catch (DocumentConflictException e) {
                lastConflict = e;
                discardLeftoverCopy(jobId, targetQueue, sourceUpdatedAt);
                log.debug("Job {} already has a copy in queue {} (attempt {}/{})", jobId, targetQueue, attempt,
                    maxAttempts);
                continue;
            }

            try {
                retireSource(jobId, previousQueue, sourceEtag);
            } catch (DocumentPreconditionFailedException | DocumentNotFoundException e) {
                lastConflict = e;
                rollBackCopy(moved);
                log.debug("Job {} changed while moving to queue {}, re-reading (attempt {}/{})", jobId, targetQueue,
                    attempt, maxAttempts);
                continue;
            }

            if (context.options().jobIndexEnabled()) {
                context.upsert(indexFor(moved));
            }
            log.debug("Moved job {} from queue {} to {}", jobId, previousQueue, targetQueue);
            return Optional.of(moved);
        }
        throw new JobUpdateConflictException(jobId, maxAttempts, lastConflict);
    }

    private void retireSource(String jobId, String queue, String sourceEtag) {
        JobDocument source = context.read(DocumentKind.JOB, JobDocument.class, JobDocument.idFor(jobId), queue)
            .orElseThrow(() -> new DocumentNotFoundException(context.resolver().collectionFor(DocumentKind.JOB),
                JobDocument.idFor(jobId), queue));
        if (sourceEtag == null || !sourceEtag.equals(source.getEtag())) {
            throw new DocumentPreconditionFailedException(context.resolver().collectionFor(DocumentKind.JOB),
                source.getId(), source.getPartitionKey());
        }
        // 조건부 교체로 먼저 점유해야 사라진 문서를 성공으로 지우지 않음
        JobDocument retired = context.replace(source);
        context.deleteIfMatch(retired);
    }

    private void rollBackCopy(JobDocument moved) {
        try {
            context.deleteIfMatch(moved);
        } catch (DocumentPreconditionFailedException e) {
            log.warn("Copy of job {} in queue {} changed before it could be rolled back", moved.getJobId(),
                moved.getQueueName());
        }
    }

    private void discardLeftoverCopy(String jobId, String queue, Instant sourceUpdatedAt) {
        Optional<JobDocument> copy = context.read(DocumentKind.JOB, JobDocument.class, JobDocument.idFor(jobId),
            queue);
        if (copy.isEmpty() || sourceUpdatedAt == null || copy.get().getUpdatedAt() == null
                || !copy.get().getUpdatedAt().isBefore(sourceUpdatedAt)) {
            return;
        }
        try {
            context.deleteIfMatch(copy.get());
            log.info("Removed leftover copy of job {} in queue {} from an interrupted move", jobId, queue);
        } catch (DocumentPreconditionFailedException e) {
            log.debug("Copy of job {} in queue {} changed before cleanup", jobId, queue);
        }
    }

    /**
     * 만료 시각 설정. 인덱스도 같은 시각에 만료됩니다.
     *
     * @param jobId Job ID
     * @param expireAt 만료 시각 (null이면 영구)
     * @return 수정된 Job, 없으면 empty
     */
    public Optional<JobDocument> setExpiration(String jobId, Instant expireAt) {
        Optional<JobDocument> updated = mutate(jobId, job -> job.setExpireAt(expireAt));
        if (updated.isPresent() && context.options().jobIndexEnabled()) {
            context.upsert(indexFor(updated.get()));
        }
        return updated;
    }

    /**
     * 큐에서 가장 오래된 enqueued Job들 (생성 시각 순, 지연 실행).
     *
     * @param queue 큐 이름
     * @return 후보 Job
     */
    public Iterable<JobDocument> enqueuedCandidates(String queue) {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
            .whereEquals("state", JobState.ENQUEUED.getValue())
            .orderBy("createdAt")
            .build();
        return context.queryPartition(DocumentKind.JOB, JobDocument.class, queue, query);
    }

    /**
     * 조건부 교체만 수행 (재시도 없음). fetch 경합에 사용합니다.
     *
     * @param job 읽은 etag를 가진 Job
     * @return 저장된 Job
     * @throws DocumentPreconditionFailedException 다른 쓰기가 먼저 일어난 경우
     */
    public JobDocument replaceIfUnchanged(JobDocument job) {
        if (job.getEtag() == null) {
            throw new IllegalArgumentException("Conditional replace requires an etag (job: " + job.getJobId() + ")");
        }
        job.setUpdatedAt(context.now());
        return context.replace(job);
    }

    /**
     * 큐의 특정 상태 Job 수.
     *
     * @param queue 큐 이름
     * @param state 상태
     * @return Job 수
     */
    public long countInQueue(String queue, JobState state) {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
            .whereEquals("state", state.getValue())
            .build();
        return context.queryPartition(DocumentKind.JOB, JobDocument.class, queue, query).stream().count();
    }

    /**
     * 지정 시간보다 오래 processing 상태인 Job (갱신 시각 순).
     *
     * @param olderThan 기준 경과 시간
     * @param limit 최대 개수
     * @return Job 목록
     */
    public List<JobDocument> findStaleProcessing(Duration olderThan, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        Instant cutoff = context.now().minus(olderThan);
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
            .whereEquals("state", JobState.PROCESSING.getValue())
            .where("updatedAt", Operator.LT, cutoff.toString())
            .orderBy("updatedAt")
            .limit(limit)
            .build();
        return context.queryAcrossPartitions(DocumentKind.JOB, JobDocument.class, query).toList();
    }

    private Optional<JobDocument> findAcrossQueues(String jobId) {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
            .whereEquals("jobId", jobId)
            .build();
        // 큐 이동 도중 실패로 사본이 둘 이상이면 가장 최근 것
        return context.queryAcrossPartitions(DocumentKind.JOB, JobDocument.class, query).stream()
            .max(Comparator.comparing(JobDocument::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
    }

    private JobIndexDocument indexFor(JobDocument job) {
        String partitionKey = context.resolver().partitionKeyFor(DocumentKind.JOB, job.getQueueName());
        JobIndexDocument index = new JobIndexDocument(job.getJobId(), job.getQueueName(), partitionKey);
        index.setExpireAt(job.getExpireAt());
        return index;
    }
}
