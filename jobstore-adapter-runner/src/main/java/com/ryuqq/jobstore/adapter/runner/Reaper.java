package com.ryuqq.jobstore.adapter.runner;

import com.ryuqq.jobstore.application.connection.JobStorageConnection;
import com.ryuqq.jobstore.application.lock.DistributedLock;
import com.ryuqq.jobstore.application.lock.LockUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Reaper 컴포넌트.
 *
 * <p>워커가 핸들을 마무리하지 못해 오래 processing 상태로 남은 Job과
 * heartbeat가 끊긴 서버를 정리합니다.</p>
 *
 * <p><strong>리컨실 시나리오:</strong></p>
 * <pre>
 * 1. 워커가 Job fetch → processing
 * 2. 워커 프로세스 비정상 종료 → acknowledge/requeue 없음
 * 3. Reaper가 주기적 스캔 (예: 5분마다)
 * 4. timeoutThreshold 동안 갱신되지 않은 processing Job 발견
 * 5. 리컨실 전략 적용:
 *    - RETRY: enqueued로 되돌림 (재실행)
 *    - FAIL: failed로 종결
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>{@value ReaperConfig#LOCK_RESOURCE} 락을 얻은 인스턴스만 스캔합니다.</li>
 *   <li>스캔 후 Job이 진행되었으면 리컨실하지 않습니다 (조건부 수정).</li>
 *   <li>개별 Job 실패는 로그만 남기고 다음 Job을 계속 처리합니다.</li>
 * </ul>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class Reaper {

    private static final Logger log = LoggerFactory.getLogger(Reaper.class);
    private final JobStorageConnection connection;
    private final ReaperConfig config;

    /**
     * 생성자.
     *
     * @param connection 저장소 연결
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Reaper(JobStorageConnection connection, ReaperConfig config) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.connection = connection;
        this.config = config;
    }

    /**
     * 한 번 스캔하고 리컨실.
     *
     * <p>주기적으로 호출되어야 합니다 (예: ScheduledExecutorService).</p>
     *
     * @return 리컨실한 Job 수 (다른 인스턴스가 스캔 중이면 0)
     */
    public int scan() {
        DistributedLock lock = tryAcquireScanLock();
        if (lock == null) {
            return 0;
        }

        try (lock) {
            log.info("Reaper scan started");

            int removedServers = connection.removeTimedOutServers(config.serverTimeout());

            List<String> staleJobIds = connection.findStaleProcessingJobs(config.timeoutThreshold(),
                config.batchSize());

            int reconciled = 0;
            for (String jobId : staleJobIds) {
                if (tryReconcile(jobId)) {
                    reconciled++;
                }
            }

            log.info("Reaper scan completed: {} reconciled out of {} stale, {} servers removed",
                reconciled, staleJobIds.size(), removedServers);
            return reconciled;
        }
    }

    private DistributedLock tryAcquireScanLock() {
        try {
            return connection.acquireDistributedLock(ReaperConfig.LOCK_RESOURCE,
                Duration.ofMillis(config.scanIntervalMs()));
        } catch (LockUnavailableException e) {
            log.debug("Reaper scan skipped, another instance holds {} (owner: {})",
                ReaperConfig.LOCK_RESOURCE, e.getOwner());
            return null;
        }
    }

    /**
     * 개별 Job 리컨실 시도.
     *
     * @param jobId Job ID
     * @return 리컨실 여부
     */
    private boolean tryReconcile(String jobId) {
        ReconcileStrategy strategy = config.defaultStrategy();
        try {
            boolean changed = switch (strategy) {
                case RETRY -> connection.requeueStaleJob(jobId, config.timeoutThreshold(),
                    "Requeued by reaper after " + config.timeoutThreshold());
                case FAIL -> connection.failStaleJob(jobId, config.timeoutThreshold(),
                    "Failed by reaper after " + config.timeoutThreshold());
            };
            if (changed) {
                log.info("Reaper reconciled job {} with strategy: {}", jobId, strategy);
            } else {
                log.debug("Job {} progressed since scan, skipping", jobId);
            }
            return changed;
        } catch (RuntimeException e) {
            log.error("Failed to reconcile job {} in Reaper scan", jobId, e);
            return false;
        }
    }
}
