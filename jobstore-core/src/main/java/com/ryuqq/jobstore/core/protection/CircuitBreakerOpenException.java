package com.ryuqq.jobstore.core.protection;

import java.time.Instant;

/**
 * Circuit Breaker가 OPEN 상태라 호출이 저장소에 도달하지 않았음을 알리는 예외.
 *
 * <p>호출자는 {@link #getRetryAfter()} 이후에 재시도해야 하며, 즉시 반복 호출하지 않아야 합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String operationName;
    private final Instant retryAfter;

    public CircuitBreakerOpenException(String operationName, Instant retryAfter) {
        super(String.format("Circuit breaker is OPEN for operation '%s'. Retry after %s", operationName, retryAfter));
        this.operationName = operationName;
        this.retryAfter = retryAfter;
    }

    public String getOperationName() {
        return operationName;
    }

    public Instant getRetryAfter() {
        return retryAfter;
    }
}
