package com.ryuqq.jobstore.adapter.protection;

import com.ryuqq.jobstore.core.config.JobStoreOptions;
import com.ryuqq.jobstore.core.protection.CircuitBreaker;
import com.ryuqq.jobstore.core.protection.BackoffCalculator;
import com.ryuqq.jobstore.core.protection.CircuitBreakerConfig;
import com.ryuqq.jobstore.core.protection.TimeoutPolicy;
import com.ryuqq.jobstore.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.jobstore.core.protection.noop.NoOpTimeoutPolicy;
import com.ryuqq.jobstore.core.spi.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 저장소 보호 체인 조립.
 *
 * <pre>
 * RetryingDocumentStore → ResilientDocumentStore → 원본 DocumentStore
 * </pre>
 *
 * <p>{@code circuitBreaker.enabled()}가 false이면 NoOp Circuit Breaker와 NoOp Timeout Policy를 사용합니다.
 * 재시도는 항상 적용됩니다 ({@code maxRetryAttempts}가 0이면 재시도 없음).</p>
 *
 * <pre>{@code
 * try (DocumentStoreProtection protection = DocumentStoreProtection.create(rawStore, options, clock)) {
 *     JobStorage storage = new JobStorage(protection.store(), options, clock);
 *     ...
 * }
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class DocumentStoreProtection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DocumentStoreProtection.class);

    private final ResilientDocumentStore resilientStore;
    private final DocumentStore store;

    private DocumentStoreProtection(ResilientDocumentStore resilientStore, DocumentStore store) {
        this.resilientStore = resilientStore;
        this.store = store;
    }

    /**
     * 옵션에 따라 보호 체인 생성.
     *
     * @param rawStore 원본 저장소
     * @param options JobStore 설정
     * @param clock Circuit Breaker 시간 기준
     * @return 보호 체인
     */
    public static DocumentStoreProtection create(DocumentStore rawStore, JobStoreOptions options, Clock clock) {
        if (rawStore == null) {
            throw new IllegalArgumentException("rawStore cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        CircuitBreakerConfig config = options.circuitBreaker();
        CircuitBreaker circuitBreaker;
        TimeoutPolicy timeoutPolicy;
        if (config.enabled()) {
            circuitBreaker = new ConsecutiveFailureCircuitBreaker(config, clock);
            timeoutPolicy = new FixedTimeoutPolicy(config.operationTimeout());
        } else {
            circuitBreaker = new NoOpCircuitBreaker();
            timeoutPolicy = new NoOpTimeoutPolicy();
        }

        ResilientDocumentStore resilient = new ResilientDocumentStore(rawStore, circuitBreaker, timeoutPolicy);
        BackoffCalculator backoff = BackoffCalculator.forRetryDelay(options.retryDelay());
        DocumentStore retrying = new RetryingDocumentStore(resilient, options.maxRetryAttempts(), backoff);

        log.info("Document store protection created (circuitBreaker: {}, failureThreshold: {}, maxRetryAttempts: {})",
            config.enabled() ? "enabled" : "disabled", config.failureThreshold(), options.maxRetryAttempts());
        return new DocumentStoreProtection(resilient, retrying);
    }

    /**
     * 보호가 적용된 저장소.
     *
     * @return 재시도와 Circuit Breaker가 적용된 저장소
     */
    public DocumentStore store() {
        return store;
    }

    public CircuitBreaker circuitBreaker() {
        return resilientStore.getCircuitBreaker();
    }

    @Override
    public void close() {
        resilientStore.close();
    }
}
