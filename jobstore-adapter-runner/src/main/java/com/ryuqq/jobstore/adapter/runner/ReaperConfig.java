package com.ryuqq.jobstore.adapter.runner;

import java.time.Duration;

/**
 * Reaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 300000ms = 5분)</li>
 *   <li>timeoutThresholdMs: processing 상태 허용 시간 (기본 1800000ms = 30분)</li>
 *   <li>batchSize: 한 번에 처리할 Job 수 (기본 50)</li>
 *   <li>defaultStrategy: 리컨실 전략 (기본 RETRY)</li>
 *   <li>serverTimeoutMs: heartbeat 없는 서버 제거 기준 (기본 300000ms = 5분)</li>
 * </ul>
 *
 * <p>timeoutThresholdMs는 가장 긴 Job의 실행 시간보다 커야 합니다.
 * 그렇지 않으면 실행 중인 Job이 재실행되거나 실패 처리됩니다.</p>
 *
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param timeoutThresholdMs 타임아웃 임계값 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param defaultStrategy 리컨실 전략 (null이 아니어야 함)
 * @param serverTimeoutMs 서버 타임아웃 (밀리초, 양수여야 함)
 * @author JobStore Team
 * @since 1.0.0
 */
public record ReaperConfig(
    long scanIntervalMs,
    long timeoutThresholdMs,
    int batchSize,
    ReconcileStrategy defaultStrategy,
    long serverTimeoutMs
) {

    /** 동시에 한 인스턴스만 스캔하도록 잡는 락 리소스. */
    public static final String LOCK_RESOURCE = "jobstore:reaper";

    /**
     * 기본 설정 생성자.
     */
    public ReaperConfig() {
        this(300000, 1800000, 50, ReconcileStrategy.RETRY, 300000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (timeoutThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutThresholdMs must be positive (current: " + timeoutThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (defaultStrategy == null) {
            throw new IllegalArgumentException("defaultStrategy cannot be null");
        }
        if (serverTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "serverTimeoutMs must be positive (current: " + serverTimeoutMs + ")"
            );
        }
    }

    public Duration timeoutThreshold() {
        return Duration.ofMillis(timeoutThresholdMs);
    }

    public Duration serverTimeout() {
        return Duration.ofMillis(serverTimeoutMs);
    }

    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize, defaultStrategy, serverTimeoutMs);
    }

    public ReaperConfig withTimeoutThresholdMs(long timeoutThresholdMs) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize, defaultStrategy, serverTimeoutMs);
    }

    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize, defaultStrategy, serverTimeoutMs);
    }

    public ReaperConfig withDefaultStrategy(ReconcileStrategy defaultStrategy) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize, defaultStrategy, serverTimeoutMs);
    }

    public ReaperConfig withServerTimeoutMs(long serverTimeoutMs) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize, defaultStrategy, serverTimeoutMs);
    }
}
