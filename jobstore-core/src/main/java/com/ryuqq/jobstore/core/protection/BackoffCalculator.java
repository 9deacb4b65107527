package com.ryuqq.jobstore.core.protection;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 저장소 재시도 대기 시간 계산기.
 *
 * <p>n번째 재시도 대기 = {@code min(retryDelay * 2^(n-1) * (1 + r), maxDelay)},
 * r은 [0, jitterFactor) 구간의 난수입니다. 같은 순간 실패한 여러 연결이
 * 한꺼번에 다시 요청하지 않도록 흩어 놓습니다.</p>
 *
 * <p>{@link #forRetryDelay(Duration)}는 상한을 기본 지연의 32배로 둡니다
 * (100ms 기준 약 3.2초).</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    /** 상한 배수: 기본 지연 * 2^5. */
    static final int MAX_DELAY_MULTIPLIER = 32;

    private static final double DEFAULT_JITTER = 0.1;
    private static final int MAX_DOUBLINGS = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * JobStoreOptions 기본 retryDelay(100ms) 기준.
     */
    public BackoffCalculator() {
        this(100, 100L * MAX_DELAY_MULTIPLIER, DEFAULT_JITTER);
    }

    /**
     * @param baseDelayMs 첫 재시도 대기 (밀리초, 양수)
     * @param maxDelayMs 대기 상한 (밀리초, baseDelayMs 이상)
     * @param jitterFactor 흩뿌림 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 설정의 retryDelay로 계산기 생성.
     *
     * @param retryDelay 첫 재시도 대기 (1ms 미만은 1ms로 올림)
     * @return 상한이 retryDelay의 32배인 계산기
     */
    public static BackoffCalculator forRetryDelay(Duration retryDelay) {
        if (retryDelay == null) {
            throw new IllegalArgumentException("retryDelay cannot be null");
        }
        long base = Math.max(1, retryDelay.toMillis());
        return new BackoffCalculator(base, base * MAX_DELAY_MULTIPLIER, DEFAULT_JITTER);
    }

    /**
     * @param retryNumber 몇 번째 재시도인지 (1부터)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryNumber가 1 미만인 경우
     */
    public long calculate(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + retryNumber + ")");
        }
        long doubled = baseDelayMs << Math.min(retryNumber - 1, MAX_DOUBLINGS);
        if (doubled <= 0 || doubled >= maxDelayMs) {
            return maxDelayMs;
        }
        double spread = jitterFactor == 0.0 ? 0.0 : ThreadLocalRandom.current().nextDouble(jitterFactor);
        return Math.min(doubled + (long) (doubled * spread), maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
