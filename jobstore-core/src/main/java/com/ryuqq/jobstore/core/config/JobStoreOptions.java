package com.ryuqq.jobstore.core.config;

import com.ryuqq.jobstore.core.layout.CollectionLayout;
import com.ryuqq.jobstore.core.layout.CollectionNames;
import com.ryuqq.jobstore.core.layout.CollectionResolver;
import com.ryuqq.jobstore.core.model.HostNames;
import com.ryuqq.jobstore.core.protection.CircuitBreakerConfig;

import java.time.Duration;

/**
 * JobStore 설정.
 *
 * <p>생성 시점에 한 번 전달되는 불변 설정값입니다. 설정 파일 로딩은 이 모듈의 책임이 아닙니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>collectionLayout: DEDICATED</li>
 *   <li>defaultJobExpiration: 7일</li>
 *   <li>serverTimeout: 5분</li>
 *   <li>lockTimeout: 1분</li>
 *   <li>maxRetryAttempts: 5, retryDelay: 100ms (일시적 저장소 오류 재시도)</li>
 *   <li>queryPageSize: 100</li>
 *   <li>concurrencyRetryAttempts: 5 (etag 충돌 시 재적용 횟수)</li>
 *   <li>lockRenewalInterval: 0 (갱신 안 함)</li>
 *   <li>jobIndexEnabled: true</li>
 *   <li>instanceName: 로컬 호스트 이름</li>
 * </ul>
 *
 * @param collectionLayout 컬렉션 배치 방식
 * @param collectionNames 컬렉션 이름
 * @param defaultJobExpiration 만료 처리된 Job의 기본 보관 기간
 * @param serverTimeout heartbeat 없이 서버를 유지하는 시간
 * @param lockTimeout 분산 락 기본 유효 시간
 * @param maxRetryAttempts 일시적 오류 최대 재시도 횟수 (0이면 재시도 안 함)
 * @param retryDelay 첫 재시도 대기 시간
 * @param queryPageSize 쿼리 페이지 크기
 * @param documentTtl 문서 종류별 기본 TTL
 * @param circuitBreaker Circuit Breaker 설정
 * @param concurrencyRetryAttempts etag 충돌 시 재읽기/재적용 최대 횟수
 * @param lockRenewalInterval 락 자동 갱신 주기 (0이면 비활성)
 * @param jobIndexEnabled Job ID 보조 인덱스 사용 여부
 * @param instanceName 락 소유자 및 서버 이름으로 기록되는 인스턴스 이름
 * @author JobStore Team
 * @since 1.0.0
 */
public record JobStoreOptions(
    CollectionLayout collectionLayout,
    CollectionNames collectionNames,
    Duration defaultJobExpiration,
    Duration serverTimeout,
    Duration lockTimeout,
    int maxRetryAttempts,
    Duration retryDelay,
    int queryPageSize,
    DocumentTtl documentTtl,
    CircuitBreakerConfig circuitBreaker,
    int concurrencyRetryAttempts,
    Duration lockRenewalInterval,
    boolean jobIndexEnabled,
    String instanceName
) {

    /**
     * Compact Constructor (검증 로직).
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우 (필드 이름 포함)
     */
    public JobStoreOptions {
        if (collectionLayout == null) {
            throw new IllegalArgumentException("collectionLayout cannot be null");
        }
        if (collectionNames == null) {
            throw new IllegalArgumentException("collectionNames cannot be null");
        }
        collectionNames.validateFor(collectionLayout);
        requirePositive("defaultJobExpiration", defaultJobExpiration);
        requirePositive("serverTimeout", serverTimeout);
        requirePositive("lockTimeout", lockTimeout);
        if (maxRetryAttempts < 0) {
            throw new IllegalArgumentException("maxRetryAttempts cannot be negative: " + maxRetryAttempts);
        }
        requirePositive("retryDelay", retryDelay);
        if (queryPageSize <= 0) {
            throw new IllegalArgumentException("queryPageSize must be positive: " + queryPageSize);
        }
        if (documentTtl == null) {
            throw new IllegalArgumentException("documentTtl cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (concurrencyRetryAttempts <= 0) {
            throw new IllegalArgumentException("concurrencyRetryAttempts must be positive: " + concurrencyRetryAttempts);
        }
        if (lockRenewalInterval == null || lockRenewalInterval.isNegative()) {
            throw new IllegalArgumentException("lockRenewalInterval cannot be null or negative: " + lockRenewalInterval);
        }
        if (instanceName == null || instanceName.isBlank()) {
            throw new IllegalArgumentException("instanceName cannot be null or blank");
        }
    }

    /**
     * 기본 설정.
     */
    public JobStoreOptions() {
        this(
            CollectionLayout.DEDICATED,
            new CollectionNames(),
            Duration.ofDays(7),
            Duration.ofMinutes(5),
            Duration.ofMinutes(1),
            5,
            Duration.ofMillis(100),
            100,
            new DocumentTtl(),
            new CircuitBreakerConfig(),
            5,
            Duration.ZERO,
            true,
            HostNames.local()
        );
    }

    /**
     * 현재 배치 방식의 컬렉션 Resolver 생성.
     *
     * @return Resolver
     */
    public CollectionResolver createResolver() {
        return new CollectionResolver(collectionLayout, collectionNames);
    }

    /**
     * 락 자동 갱신 활성 여부.
     *
     * @return lockRenewalInterval이 0보다 크면 true
     */
    public boolean lockRenewalEnabled() {
        return !lockRenewalInterval.isZero();
    }

    public JobStoreOptions withCollectionLayout(CollectionLayout collectionLayout) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withCollectionNames(CollectionNames collectionNames) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withDefaultJobExpiration(Duration defaultJobExpiration) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withServerTimeout(Duration serverTimeout) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withLockTimeout(Duration lockTimeout) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withMaxRetryAttempts(int maxRetryAttempts) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withRetryDelay(Duration retryDelay) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withQueryPageSize(int queryPageSize) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withDocumentTtl(DocumentTtl documentTtl) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withConcurrencyRetryAttempts(int concurrencyRetryAttempts) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withLockRenewalInterval(Duration lockRenewalInterval) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withJobIndexEnabled(boolean jobIndexEnabled) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    public JobStoreOptions withInstanceName(String instanceName) {
        return new JobStoreOptions(collectionLayout, collectionNames, defaultJobExpiration, serverTimeout, lockTimeout,
            maxRetryAttempts, retryDelay, queryPageSize, documentTtl, circuitBreaker,
            concurrencyRetryAttempts, lockRenewalInterval, jobIndexEnabled, instanceName);
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(field + " must be positive: " + value);
        }
    }
}
