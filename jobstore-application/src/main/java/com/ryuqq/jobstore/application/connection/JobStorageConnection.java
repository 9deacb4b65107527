package com.ryuqq.jobstore.application.connection;

import com.ryuqq.jobstore.application.collections.KeyedCollections;
import com.ryuqq.jobstore.application.fetch.FetchedJob;
import com.ryuqq.jobstore.application.fetch.QueueFetcher;
import com.ryuqq.jobstore.application.job.InvocationDataException;
import com.ryuqq.jobstore.application.job.InvocationSerializer;
import com.ryuqq.jobstore.application.job.Job;
import com.ryuqq.jobstore.application.job.JobData;
import com.ryuqq.jobstore.application.job.StateData;
import com.ryuqq.jobstore.application.lifecycle.JobRepository;
import com.ryuqq.jobstore.application.lifecycle.JobTransitions;
import com.ryuqq.jobstore.application.lifecycle.StateChange;
import com.ryuqq.jobstore.application.lock.DistributedLock;
import com.ryuqq.jobstore.application.server.ServerContext;
import com.ryuqq.jobstore.application.server.ServerRegistry;
import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.application.transaction.WriteTransaction;
import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.document.StateHistoryEntry;
import com.ryuqq.jobstore.core.model.CancellationToken;
import com.ryuqq.jobstore.core.model.JobIds;
import com.ryuqq.jobstore.core.statemachine.JobState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;

/**
 * 작업 저장소 연결.
 *
 * <p>외부 작업 처리 프레임워크가 사용하는 진입 API입니다. Job 생성과 조회, fetch, 서버 등록,
 * 분산 락, 쓰기 묶음 생성, 키 기반 컬렉션 조회를 제공합니다.</p>
 *
 * <p>내부 상태가 없으므로 여러 스레드에서 공유할 수 있습니다.
 * 조회 결과가 없으면 예외 대신 empty/null/0을 반환합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class JobStorageConnection {

    private static final Logger log = LoggerFactory.getLogger(JobStorageConnection.class);

    private final StorageContext context;
    private final JobRepository jobs;
    private final KeyedCollections collections;
    private final ServerRegistry servers;
    private final QueueFetcher fetcher;
    private final InvocationSerializer serializer;
    private final ScheduledExecutorService lockRenewalScheduler;

    public JobStorageConnection(StorageContext context, ScheduledExecutorService lockRenewalScheduler) {
        this.context = context;
        this.jobs = new JobRepository(context);
        this.collections = new KeyedCollections(context);
        this.servers = new ServerRegistry(context);
        this.fetcher = new QueueFetcher(context, jobs);
        this.serializer = new InvocationSerializer(context.objectMapper());
        this.lockRenewalScheduler = lockRenewalScheduler;
    }

    // ===== 1. Job 생성/조회 =====

    /**
     * 만료 시각을 가진 Job 생성 (상태 created).
     *
     * @param job 실행할 호출
     * @param parameters 초기 파라미터 (nullable)
     * @param createdAt 생성 시각 (null이면 현재)
     * @param expireIn 만료까지 시간
     * @return 새 Job ID
     */
    public String createExpiredJob(Job job, Map<String, String> parameters, Instant createdAt, Duration expireIn) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (expireIn == null || expireIn.isZero() || expireIn.isNegative()) {
            throw new IllegalArgumentException("expireIn must be positive (current: " + expireIn + ")");
        }
        Instant now = context.now();
        Instant created = createdAt == null ? now : createdAt;

        JobDocument document = new JobDocument(JobIds.newJobId(), job.getQueue());
        document.setInvocationData(serializer.serialize(job));
        if (parameters != null) {
            document.setParameters(new LinkedHashMap<>(parameters));
        }
        document.setCreatedAt(created);
        document.setUpdatedAt(created);
        document.setExpireAt(now.plus(expireIn));
        JobTransitions.apply(document, StateChange.of(JobState.CREATED.getValue(), "Job created"), created);

        jobs.create(document);
        log.debug("Created job {} ({}) in queue {}", document.getJobId(), job.displayName(), job.getQueue());
        return document.getJobId();
    }

    /**
     * 기본 Job 만료 시간으로 Job 생성.
     *
     * @param job 실행할 호출
     * @param parameters 초기 파라미터 (nullable)
     * @return 새 Job ID
     */
    public String createJob(Job job, Map<String, String> parameters) {
        return createExpiredJob(job, parameters, null, context.options().defaultJobExpiration());
    }

    /**
     * Job 조회. 호출 정보 복원에 실패해도 결과를 반환합니다.
     *
     * @param jobId Job ID
     * @return Job 정보, 없으면 empty
     */
    public Optional<JobData> getJobData(String jobId) {
        return jobs.find(jobId).map(this::toJobData);
    }

    public Optional<StateData> getStateData(String jobId) {
        return jobs.find(jobId).map(job -> {
            StateHistoryEntry last = job.getLastHistoryEntry();
            return new StateData(job.getState(), last == null ? null : last.getReason(), job.getStateData());
        });
    }

    /**
     * Job 파라미터 설정.
     *
     * @param jobId Job ID
     * @param name 파라미터 이름
     * @param value 값 (null이면 제거)
     * @return Job이 있었으면 true
     */
    public boolean setJobParameter(String jobId, String name, String value) {
        requireName(name);
        return jobs.mutate(jobId, job -> {
            if (value == null) {
                job.getParameters().remove(name);
            } else {
                job.getParameters().put(name, value);
            }
        }).isPresent();
    }

    public String getJobParameter(String jobId, String name) {
        requireName(name);
        return jobs.find(jobId).map(job -> job.getParameters().get(name)).orElse(null);
    }

    // ===== 2. Fetch =====

    /**
     * 큐 목록에서 다음 Job 가져오기.
     *
     * @param queues 우선순위 순 큐 이름
     * @param cancellationToken 취소 토큰
     * @return 가져온 Job, 없으면 empty
     */
    public Optional<FetchedJob> fetchNextJob(List<String> queues, CancellationToken cancellationToken) {
        return fetcher.fetchNext(queues, cancellationToken);
    }

    /**
     * 오래 processing 상태로 남은 Job ID (정리 작업용).
     *
     * @param olderThan 기준 경과 시간
     * @param limit 최대 개수
     * @return Job ID 목록 (오래된 순)
     */
    public List<String> findStaleProcessingJobs(Duration olderThan, int limit) {
        return jobs.findStaleProcessing(olderThan, limit).stream().map(JobDocument::getJobId).toList();
    }

    /**
     * 오래 processing 상태인 Job을 다시 큐에 넣음.
     *
     * <p>그 사이 Job이 진행되었거나(갱신 시각 변경) 다른 상태가 되었으면 아무것도 하지 않습니다.</p>
     *
     * @param jobId Job ID
     * @param olderThan 기준 경과 시간
     * @param reason 이력에 남길 사유
     * @return 다시 큐에 넣었으면 true
     */
    public boolean requeueStaleJob(String jobId, Duration olderThan, String reason) {
        return changeIfStale(jobId, olderThan,
            job -> StateChange.enqueued(job.getQueueName(), context.now(), reason));
    }

    /**
     * 오래 processing 상태인 Job을 실패 처리.
     *
     * @param jobId Job ID
     * @param olderThan 기준 경과 시간
     * @param reason 이력에 남길 사유
     * @return 실패 처리했으면 true
     */
    public boolean failStaleJob(String jobId, Duration olderThan, String reason) {
        return changeIfStale(jobId, olderThan, job -> StateChange.of(JobState.FAILED.getValue(), reason));
    }

    private boolean changeIfStale(String jobId, Duration olderThan, Function<JobDocument, StateChange> change) {
        if (olderThan == null || olderThan.isNegative()) {
            throw new IllegalArgumentException("olderThan must be >= 0 (current: " + olderThan + ")");
        }
        Instant cutoff = context.now().minus(olderThan);
        return jobs.mutateIf(jobId,
            job -> JobState.PROCESSING.getValue().equals(job.getState())
                && job.getUpdatedAt() != null && job.getUpdatedAt().isBefore(cutoff),
            job -> JobTransitions.apply(job, change.apply(job), context.now())
        ).isPresent();
    }

    // ===== 3. 쓰기/락 =====

    public WriteTransaction createWriteTransaction() {
        return new WriteTransaction(context, jobs, collections);
    }

    /**
     * 분산 락 획득.
     *
     * @param resource 리소스 이름
     * @param timeout 락 유효 시간
     * @return 락 (close 시 해제)
     * @throws com.ryuqq.jobstore.application.lock.LockUnavailableException 이미 잠긴 경우
     */
    public DistributedLock acquireDistributedLock(String resource, Duration timeout) {
        return DistributedLock.acquire(context, resource, timeout, lockRenewalScheduler,
            context.options().lockRenewalInterval());
    }

    public DistributedLock acquireDistributedLock(String resource) {
        return acquireDistributedLock(resource, context.options().lockTimeout());
    }

    // ===== 4. 서버 =====

    public void announceServer(String serverId, ServerContext serverContext) {
        servers.announce(serverId, serverContext);
    }

    public void heartbeat(String serverId) {
        servers.heartbeat(serverId);
    }

    public void removeServer(String serverId) {
        servers.remove(serverId);
    }

    public int removeTimedOutServers(Duration timeout) {
        return servers.removeTimedOutServers(timeout);
    }

    // ===== 5. 컬렉션 조회 =====

    public long getCounter(String key) {
        return collections.getCounter(key);
    }

    public Set<String> getAllItemsFromSet(String key) {
        return collections.getAllItemsFromSet(key);
    }

    public String getFirstByLowestScoreFromSet(String key, double fromScore, double toScore) {
        return collections.getFirstByLowestScoreFromSet(key, fromScore, toScore);
    }

    public List<String> getFirstByLowestScoreFromSet(String key, double fromScore, double toScore, int count) {
        return collections.getFirstByLowestScoreFromSet(key, fromScore, toScore, count);
    }

    public List<String> getRangeFromSet(String key, int startingFrom, int endingAt) {
        return collections.getRangeFromSet(key, startingFrom, endingAt);
    }

    public long getSetCount(String key) {
        return collections.getSetCount(key);
    }

    public Duration getSetTtl(String key) {
        return collections.getSetTtl(key);
    }

    public List<String> getAllItemsFromList(String key) {
        return collections.getAllItemsFromList(key);
    }

    public List<String> getRangeFromList(String key, int startingFrom, int endingAt) {
        return collections.getRangeFromList(key, startingFrom, endingAt);
    }

    public long getListCount(String key) {
        return collections.getListCount(key);
    }

    public Duration getListTtl(String key) {
        return collections.getListTtl(key);
    }

    public Map<String, String> getAllEntriesFromHash(String key) {
        return collections.getAllEntriesFromHash(key);
    }

    public String getValueFromHash(String key, String name) {
        return collections.getValueFromHash(key, name);
    }

    public long getHashCount(String key) {
        return collections.getHashCount(key);
    }

    public Duration getHashTtl(String key) {
        return collections.getHashTtl(key);
    }

    private JobData toJobData(JobDocument document) {
        Job job = null;
        InvocationDataException loadException = null;
        try {
            job = serializer.deserialize(document.getInvocationData()).onQueue(document.getQueueName());
        } catch (InvocationDataException e) {
            loadException = e;
            log.debug("Job {} cannot be loaded: {}", document.getJobId(), e.getMessage());
        }
        return new JobData(document.getJobId(), job, document.getInvocationData(), document.getState(),
            document.getQueueName(), document.getCreatedAt(), document.getParameters(), loadException);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
