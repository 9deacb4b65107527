package com.ryuqq.jobstore.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>enabled: true</li>
 *   <li>failureThreshold: 5 (연속 실패 5회 시 OPEN)</li>
 *   <li>openTimeout: 1분</li>
 *   <li>successThreshold: 3 (HALF_OPEN에서 연속 성공 3회 시 CLOSED)</li>
 *   <li>operationTimeout: 30초 (호출당 타임아웃)</li>
 * </ul>
 *
 * @param enabled false이면 NoOp Circuit Breaker 사용
 * @param failureThreshold OPEN 전이 연속 실패 횟수
 * @param openTimeout OPEN 유지 시간
 * @param successThreshold CLOSED 복귀 연속 성공 횟수
 * @param operationTimeout 호출당 타임아웃
 * @author JobStore Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    boolean enabled,
    int failureThreshold,
    Duration openTimeout,
    int successThreshold,
    Duration operationTimeout
) {

    /**
     * Compact Constructor (검증 로직).
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        if (openTimeout == null || openTimeout.isNegative() || openTimeout.isZero()) {
            throw new IllegalArgumentException("openTimeout must be positive: " + openTimeout);
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive: " + successThreshold);
        }
        if (operationTimeout == null || operationTimeout.isNegative() || operationTimeout.isZero()) {
            throw new IllegalArgumentException("operationTimeout must be positive: " + operationTimeout);
        }
    }

    /**
     * 기본 설정.
     */
    public CircuitBreakerConfig() {
        this(true, 5, Duration.ofMinutes(1), 3, Duration.ofSeconds(30));
    }

    public CircuitBreakerConfig withEnabled(boolean enabled) {
        return new CircuitBreakerConfig(enabled, failureThreshold, openTimeout, successThreshold, operationTimeout);
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(enabled, failureThreshold, openTimeout, successThreshold, operationTimeout);
    }

    public CircuitBreakerConfig withOpenTimeout(Duration openTimeout) {
        return new CircuitBreakerConfig(enabled, failureThreshold, openTimeout, successThreshold, operationTimeout);
    }

    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(enabled, failureThreshold, openTimeout, successThreshold, operationTimeout);
    }

    public CircuitBreakerConfig withOperationTimeout(Duration operationTimeout) {
        return new CircuitBreakerConfig(enabled, failureThreshold, openTimeout, successThreshold, operationTimeout);
    }
}
