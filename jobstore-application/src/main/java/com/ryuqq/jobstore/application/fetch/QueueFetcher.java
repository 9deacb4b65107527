package com.ryuqq.jobstore.application.fetch;

import com.ryuqq.jobstore.application.lifecycle.JobRepository;
import com.ryuqq.jobstore.application.lifecycle.JobTransitions;
import com.ryuqq.jobstore.application.lifecycle.StateChange;
import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.model.CancellationToken;
import com.ryuqq.jobstore.core.spi.DocumentNotFoundException;
import com.ryuqq.jobstore.core.spi.DocumentPreconditionFailedException;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;
import com.ryuqq.jobstore.core.statemachine.JobState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 큐에서 다음 Job을 가져오는 컴포넌트.
 *
 * <p><strong>Claim 프로토콜:</strong></p>
 * <ol>
 *   <li>큐 순서대로 enqueued Job을 생성 시각 순으로 조회</li>
 *   <li>후보를 processing으로 바꿔 읽은 etag로 조건부 교체</li>
 *   <li>etag 불일치(다른 워커가 먼저 가져감)면 다음 후보로 진행</li>
 * </ol>
 *
 * <p>교체가 저장소에 반영된 뒤 응답만 타임아웃되면 재시도된 교체는 etag 불일치로 실패합니다.
 * 그래서 불일치나 일시 장애 후에는 Job을 다시 읽어, 이번 시도의 {@link #FETCH_TOKEN_KEY}를 가진
 * processing 상태면 가져온 것으로 처리합니다.</p>
 *
 * <p>같은 Job을 두 워커가 동시에 가져가는 일은 없습니다 (etag 조건부 교체로 보장).</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class QueueFetcher {

    private static final Logger log = LoggerFactory.getLogger(QueueFetcher.class);

    /** processing 상태 데이터의 fetch 인스턴스 키. */
    public static final String FETCHED_BY_KEY = "FetchedBy";

    /** processing 상태 데이터의 fetch 시각 키. */
    public static final String FETCHED_AT_KEY = "FetchedAt";

    /** processing 상태 데이터의 claim 시도 식별자. */
    public static final String FETCH_TOKEN_KEY = "FetchToken";

    private final StorageContext context;
    private final JobRepository jobs;

    public QueueFetcher(StorageContext context, JobRepository jobs) {
        this.context = context;
        this.jobs = jobs;
    }

    /**
     * 다음 Job 가져오기.
     *
     * @param queues 우선순위 순서의 큐 이름 목록
     * @param cancellationToken 취소 토큰 (저장소 호출 전마다 확인)
     * @return 가져온 Job, 모든 큐가 비었으면 empty
     * @throws IllegalArgumentException queues가 null이거나 비어 있는 경우
     * @throws java.util.concurrent.CancellationException 취소가 요청된 경우
     */
    public Optional<FetchedJob> fetchNext(List<String> queues, CancellationToken cancellationToken) {
        if (queues == null || queues.isEmpty()) {
            throw new IllegalArgumentException("queues cannot be null or empty");
        }
        CancellationToken token = cancellationToken == null ? CancellationToken.NONE : cancellationToken;

        for (String queue : queues) {
            token.throwIfCancellationRequested();
            for (JobDocument candidate : jobs.enqueuedCandidates(queue)) {
                token.throwIfCancellationRequested();
                Optional<FetchedJob> claimed = tryClaim(candidate, queue);
                if (claimed.isPresent()) {
                    return claimed;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<FetchedJob> tryClaim(JobDocument candidate, String queue) {
        Instant now = context.now();
        String instanceName = context.options().instanceName();
        String fetchToken = UUID.randomUUID().toString();

        Map<String, String> data = new LinkedHashMap<>();
        data.put(FETCHED_BY_KEY, instanceName);
        data.put(FETCHED_AT_KEY, now.toString());
        data.put(FETCH_TOKEN_KEY, fetchToken);
        JobTransitions.apply(candidate,
            new StateChange(JobState.PROCESSING.getValue(), "Fetched by " + instanceName, data), now);

        try {
            jobs.replaceIfUnchanged(candidate);
        } catch (DocumentPreconditionFailedException | DocumentNotFoundException e) {
            if (!claimLanded(candidate.getJobId(), fetchToken)) {
                log.debug("Job {} in queue {} was claimed by another worker", candidate.getJobId(), queue);
                return Optional.empty();
            }
            log.info("Claim of job {} was applied before its response failed, keeping it", candidate.getJobId());
        } catch (DocumentStoreException e) {
            if (!e.isTransient() || !claimLanded(candidate.getJobId(), fetchToken)) {
                throw e;
            }
            log.info("Claim of job {} was applied before its response failed, keeping it", candidate.getJobId());
        }
        log.debug("Fetched job {} from queue {}", candidate.getJobId(), queue);
        return Optional.of(new FetchedJob(candidate.getJobId(), queue, jobs, context));
    }

    private boolean claimLanded(String jobId, String fetchToken) {
        return jobs.find(jobId)
            .filter(job -> JobState.PROCESSING.getValue().equals(job.getState()))
            .filter(job -> fetchToken.equals(job.getStateData().get(FETCH_TOKEN_KEY)))
            .isPresent();
    }
}
