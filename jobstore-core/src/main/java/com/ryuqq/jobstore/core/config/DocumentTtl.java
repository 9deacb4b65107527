package com.ryuqq.jobstore.core.config;

import com.ryuqq.jobstore.core.document.DocumentKind;

import java.time.Duration;
import java.util.Optional;

/**
 * 문서 종류별 기본 만료 시간.
 *
 * <p>{@code expireAt}이 없는 문서에 저장소가 적용하는 기본 TTL이며, 마지막 쓰기 시각부터 계산됩니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>job (job index 포함): 30일</li>
 *   <li>server: 10분</li>
 *   <li>lock: 5분</li>
 *   <li>counter: 7일</li>
 *   <li>queue, set, hash, list: 없음</li>
 * </ul>
 *
 * @param job job 문서 TTL
 * @param server server 문서 TTL
 * @param lock lock 문서 TTL
 * @param counter counter 문서 TTL
 * @author JobStore Team
 * @since 1.0.0
 */
public record DocumentTtl(
    Duration job,
    Duration server,
    Duration lock,
    Duration counter
) {

    /**
     * Compact Constructor (검증 로직).
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public DocumentTtl {
        requirePositive("job", job);
        requirePositive("server", server);
        requirePositive("lock", lock);
        requirePositive("counter", counter);
    }

    /**
     * 기본 설정.
     */
    public DocumentTtl() {
        this(Duration.ofDays(30), Duration.ofMinutes(10), Duration.ofMinutes(5), Duration.ofDays(7));
    }

    /**
     * 문서 종류별 기본 TTL 조회.
     *
     * @param kind 문서 종류
     * @return 기본 TTL, 만료되지 않는 종류이면 empty
     */
    public Optional<Duration> forKind(DocumentKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return switch (kind) {
            case JOB, JOB_INDEX -> Optional.of(job);
            case SERVER -> Optional.of(server);
            case LOCK -> Optional.of(lock);
            case COUNTER -> Optional.of(counter);
            case QUEUE, SET, HASH, LIST -> Optional.empty();
        };
    }

    public DocumentTtl withJob(Duration job) {
        return new DocumentTtl(job, server, lock, counter);
    }

    public DocumentTtl withServer(Duration server) {
        return new DocumentTtl(job, server, lock, counter);
    }

    public DocumentTtl withLock(Duration lock) {
        return new DocumentTtl(job, server, lock, counter);
    }

    public DocumentTtl withCounter(Duration counter) {
        return new DocumentTtl(job, server, lock, counter);
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException("Default TTL for '" + field + "' must be positive: " + value);
        }
    }
}
