package com.ryuqq.jobstore.core.protection.noop;

import com.ryuqq.jobstore.core.protection.CircuitBreaker;
import com.ryuqq.jobstore.core.protection.CircuitBreakerState;

import java.time.Instant;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * {@code CircuitBreakerConfig.enabled()}가 false일 때 사용됩니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    @Override
    public boolean tryAcquire(String operationName) {
        return true;
    }

    @Override
    public void recordSuccess(String operationName) {
        // NoOp
    }

    @Override
    public void recordFailure(String operationName, Throwable throwable) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public Instant retryAfter() {
        return null;
    }

    @Override
    public void reset() {
        // NoOp
    }
}
