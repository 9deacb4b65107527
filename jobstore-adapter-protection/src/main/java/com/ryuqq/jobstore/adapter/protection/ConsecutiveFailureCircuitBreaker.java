package com.ryuqq.jobstore.adapter.protection;

import com.ryuqq.jobstore.core.protection.CircuitBreaker;
import com.ryuqq.jobstore.core.protection.CircuitBreakerConfig;
import com.ryuqq.jobstore.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>CLOSED: 연속 실패가 failureThreshold에 도달하면 OPEN</li>
 *   <li>OPEN: 마지막 실패 후 openTimeout이 지나면 다음 {@link #tryAcquire(String)}에서 HALF_OPEN</li>
 *   <li>HALF_OPEN: 연속 성공 successThreshold회면 CLOSED, 실패 1회면 즉시 OPEN</li>
 * </ul>
 *
 * <p>성공은 연속 실패 횟수와 해당 작업의 실패 횟수를 초기화합니다.
 * 작업별 실패 횟수는 진단용이며 전이에는 전역 횟수만 사용합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 모든 상태 변경은 하나의 모니터로 보호됩니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final Object monitor = new Object();
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Map<String, Integer> failuresByOperation = new HashMap<>();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;

    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String operationName) {
        synchronized (monitor) {
            if (state != CircuitBreakerState.OPEN) {
                return true;
            }
            Duration sinceLastFailure = Duration.between(lastFailureTime, clock.instant());
            if (sinceLastFailure.compareTo(config.openTimeout()) >= 0) {
                transitionTo(CircuitBreakerState.HALF_OPEN, operationName);
                successCount = 0;
                return true;
            }
            return false;
        }
    }

    @Override
    public void recordSuccess(String operationName) {
        synchronized (monitor) {
            failureCount = 0;
            failuresByOperation.remove(operationName);
            if (state == CircuitBreakerState.HALF_OPEN) {
                successCount++;
                if (successCount >= config.successThreshold()) {
                    transitionTo(CircuitBreakerState.CLOSED, operationName);
                    successCount = 0;
                }
            }
        }
    }

    @Override
    public void recordFailure(String operationName, Throwable throwable) {
        synchronized (monitor) {
            failureCount++;
            lastFailureTime = clock.instant();
            failuresByOperation.merge(operationName, 1, Integer::sum);
            log.debug("Failure recorded for '{}' ({} consecutive): {}",
                operationName, failureCount, throwable == null ? null : throwable.toString());

            if (state == CircuitBreakerState.HALF_OPEN
                || (state == CircuitBreakerState.CLOSED && failureCount >= config.failureThreshold())) {
                transitionTo(CircuitBreakerState.OPEN, operationName);
                successCount = 0;
            }
        }
    }

    @Override
    public CircuitBreakerState getState() {
        synchronized (monitor) {
            return state;
        }
    }

    @Override
    public Instant retryAfter() {
        synchronized (monitor) {
            if (state != CircuitBreakerState.OPEN || lastFailureTime == null) {
                return null;
            }
            return lastFailureTime.plus(config.openTimeout());
        }
    }

    @Override
    public void reset() {
        synchronized (monitor) {
            state = CircuitBreakerState.CLOSED;
            failureCount = 0;
            successCount = 0;
            lastFailureTime = null;
            failuresByOperation.clear();
        }
        log.info("Circuit breaker reset to CLOSED");
    }

    /**
     * 현재 연속 실패 횟수.
     *
     * @return 연속 실패 횟수
     */
    public int getFailureCount() {
        synchronized (monitor) {
            return failureCount;
        }
    }

    /**
     * 작업별 실패 횟수 (진단용).
     *
     * @return 작업 이름 → 마지막 성공 이후 실패 횟수의 복사본
     */
    public Map<String, Integer> getFailureCountsByOperation() {
        synchronized (monitor) {
            return Map.copyOf(failuresByOperation);
        }
    }

    private void transitionTo(CircuitBreakerState next, String operationName) {
        CircuitBreakerState previous = state;
        state = next;
        if (next == CircuitBreakerState.OPEN) {
            log.warn("Circuit breaker {} -> OPEN after {} consecutive failures (last operation: '{}'), retry after {}",
                previous, failureCount, operationName, lastFailureTime.plus(config.openTimeout()));
        } else {
            log.info("Circuit breaker {} -> {} (operation: '{}')", previous, next, operationName);
        }
    }
}
