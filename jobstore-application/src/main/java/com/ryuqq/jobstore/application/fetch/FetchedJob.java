package com.ryuqq.jobstore.application.fetch;

import com.ryuqq.jobstore.application.lifecycle.JobRepository;
import com.ryuqq.jobstore.application.lifecycle.JobTransitions;
import com.ryuqq.jobstore.application.lifecycle.StateChange;
import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.core.statemachine.JobState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 워커가 가져간 Job의 핸들.
 *
 * <p>정확히 한 번 {@link #acknowledge()} 또는 {@link #requeue()}로 마무리해야 합니다.
 * 둘 다 하지 않고 {@link #close()}하면 자동으로 다시 큐에 넣습니다.
 * 마무리 이후의 호출은 무시됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (FetchedJob fetched = connection.fetchNextJob(queues, token).orElseThrow()) {
 *     perform(fetched.getJobId());
 *     fetched.acknowledge();
 * } // 예외 발생 시 자동 requeue
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class FetchedJob implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetchedJob.class);

    private final String jobId;
    private final String queue;
    private final JobRepository jobs;
    private final StorageContext context;

    private boolean acknowledged;
    private boolean requeued;
    private boolean closed;

    FetchedJob(String jobId, String queue, JobRepository jobs, StorageContext context) {
        this.jobId = jobId;
        this.queue = queue;
        this.jobs = jobs;
        this.context = context;
    }

    public String getJobId() {
        return jobId;
    }

    public String getQueue() {
        return queue;
    }

    /**
     * 처리 완료 확인.
     *
     * <p>Job이 그 사이 다시 큐에 들어갔다면(enqueued) processing으로 되돌려 재실행을 막습니다.
     * 이미 다른 상태(성공, 실패 등)로 바뀌었으면 그대로 둡니다.</p>
     */
    public synchronized void acknowledge() {
        if (acknowledged || requeued) {
            return;
        }
        jobs.mutate(jobId, job -> {
            if (JobState.ENQUEUED.getValue().equals(job.getState())) {
                JobTransitions.apply(job, StateChange.of(JobState.PROCESSING.getValue(), "Acknowledged"),
                    context.now());
            }
        });
        acknowledged = true;
        log.debug("Acknowledged job {}", jobId);
    }

    /**
     * 다시 큐에 넣기.
     */
    public synchronized void requeue() {
        if (acknowledged || requeued) {
            return;
        }
        jobs.mutate(jobId, job -> JobTransitions.apply(job,
            StateChange.enqueued(job.getQueueName(), context.now(), "Requeued"), context.now()));
        requeued = true;
        log.debug("Requeued job {} to queue {}", jobId, queue);
    }

    public synchronized boolean isAcknowledged() {
        return acknowledged;
    }

    public synchronized boolean isRequeued() {
        return requeued;
    }

    /**
     * 마무리되지 않았으면 자동 requeue. 실패는 로그만 남깁니다.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (acknowledged || requeued) {
            return;
        }
        try {
            requeue();
            log.info("Job {} was neither acknowledged nor requeued, returned to queue {}", jobId, queue);
        } catch (RuntimeException e) {
            log.warn("Auto-requeue of job {} failed, it stays processing until reclaimed", jobId, e);
        }
    }
}
