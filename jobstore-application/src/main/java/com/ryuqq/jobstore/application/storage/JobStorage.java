package com.ryuqq.jobstore.application.storage;

import com.ryuqq.jobstore.application.connection.JobStorageConnection;
import com.ryuqq.jobstore.application.monitoring.MonitoringApi;
import com.ryuqq.jobstore.core.config.JobStoreOptions;
import com.ryuqq.jobstore.core.spi.DocumentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 작업 저장소 진입점.
 *
 * <p>{@link DocumentStore}와 설정으로 생성하며, 연결과 모니터링 API를 제공합니다.
 * 보호 계층(재시도, circuit breaker)은 전달받은 저장소에 이미 적용되어 있어야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * DocumentStoreProtection protection = DocumentStoreProtection.create(rawStore, options, clock);
 * try (JobStorage storage = new JobStorage(protection.store(), options, clock)) {
 *     JobStorageConnection connection = storage.getConnection();
 *     ...
 * }
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class JobStorage implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobStorage.class);

    private final StorageContext context;
    private final ScheduledExecutorService lockRenewalScheduler;
    private final JobStorageConnection connection;
    private final MonitoringApi monitoringApi;

    public JobStorage(DocumentStore store, JobStoreOptions options) {
        this(store, options, Clock.systemUTC());
    }

    public JobStorage(DocumentStore store, JobStoreOptions options, Clock clock) {
        this.context = new StorageContext(store, options, clock);
        this.lockRenewalScheduler = options.lockRenewalEnabled() ? newRenewalScheduler() : null;
        this.connection = new JobStorageConnection(context, lockRenewalScheduler);
        this.monitoringApi = new MonitoringApi(context);
        log.info("JobStorage initialized (layout: {}, collections: {}, instance: {})",
            options.collectionLayout(), context.resolver().requiredCollections(), options.instanceName());
    }

    /**
     * 연결 조회. 연결은 상태가 없어 공유됩니다.
     *
     * @return 연결
     */
    public JobStorageConnection getConnection() {
        return connection;
    }

    public MonitoringApi getMonitoringApi() {
        return monitoringApi;
    }

    public JobStoreOptions getOptions() {
        return context.options();
    }

    /**
     * 락 갱신 스케줄러 종료.
     */
    @Override
    public void close() {
        if (lockRenewalScheduler == null) {
            return;
        }
        lockRenewalScheduler.shutdown();
        try {
            if (!lockRenewalScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                lockRenewalScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            lockRenewalScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "JobStorage{layout=" + context.options().collectionLayout()
            + ", collections=" + context.resolver().requiredCollections() + "}";
    }

    private static ScheduledExecutorService newRenewalScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "jobstore-lock-renewal");
            thread.setDaemon(true);
            return thread;
        });
    }
}
